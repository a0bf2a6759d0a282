package ai.callgraph.analyzer;

import ai.callgraph.ast.SourceModule;

/** Turns the text of one source module into its normalized syntax tree. */
public interface SourceParser {

    /**
     * Parses a whole module.
     *
     * @param source the module text
     * @param displayId identifier used in diagnostics only, typically the file path
     * @throws ParseException if the text is not a syntactically valid module
     */
    SourceModule parse(String source, String displayId) throws ParseException;
}
