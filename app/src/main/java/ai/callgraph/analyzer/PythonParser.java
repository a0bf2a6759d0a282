package ai.callgraph.analyzer;

import static ai.callgraph.analyzer.PythonTreeSitterNodeTypes.ERROR;

import ai.callgraph.ast.SourceModule;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TreeSitterPython;

/**
 * Python {@link SourceParser} backed by tree-sitter.
 *
 * <p>Tree-sitter recovers from syntax errors by inserting {@code ERROR} and missing nodes. Recovery is not wanted
 * here: any such node fails the whole parse with the location of the first one.
 *
 * <p>Stateless; every call creates its own native parser, so instances may be shared between threads.
 */
public final class PythonParser implements SourceParser {
    private static final Logger log = LogManager.getLogger(PythonParser.class);

    private static final int MAX_SNIPPET_LENGTH = 40;

    @Override
    public SourceModule parse(String source, String displayId) throws ParseException {
        var text = stripUtf8Bom(source);
        var content = SourceContent.of(text);
        long start = System.nanoTime();

        var parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        var tree = parser.parseString(null, text);
        if (tree == null) {
            throw new ParseException(displayId, "parser produced no tree", null);
        }
        var root = tree.getRootNode();
        if (root.hasError()) {
            throw syntaxError(root, content, displayId);
        }

        var module = new PythonAstLowering(content, displayId).lowerModule(root);
        log.debug(
                "Parsed {} ({} bytes, {} top-level statements) in {} ms",
                displayId,
                content.byteLength(),
                module.body().size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        return module;
    }

    private static ParseException syntaxError(TSNode root, SourceContent content, String displayId) {
        var offending = ASTTraversalUtils.findNodeRecursive(
                root, node -> ERROR.equals(node.getType()) || node.isMissing());
        if (offending == null) {
            return new ParseException(displayId, "invalid syntax", null);
        }
        var location = content.locationOf(offending.getStartByte());
        if (offending.isMissing()) {
            return new ParseException(displayId, "missing '%s'".formatted(offending.getType()), location);
        }
        return new ParseException(
                displayId, "invalid syntax near '%s'".formatted(snippet(content.substringFrom(offending))), location);
    }

    private static String snippet(String text) {
        var firstLine = text.strip().lines().findFirst().orElse("");
        return firstLine.length() <= MAX_SNIPPET_LENGTH ? firstLine : firstLine.substring(0, MAX_SNIPPET_LENGTH) + "...";
    }

    private static String stripUtf8Bom(String source) {
        return source.startsWith("\uFEFF") ? source.substring(1) : source;
    }
}
