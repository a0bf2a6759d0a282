package ai.callgraph.graph;

import ai.callgraph.analyzer.ParseException;
import ai.callgraph.analyzer.PythonParser;
import ai.callgraph.analyzer.SourceParser;
import java.util.Objects;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Source text in, call graph out. Every call is a full, independent rebuild; nothing is cached between calls, so a
 * caller that reloads a file simply calls {@link #build} again and drops the previous graph.
 */
public final class CallGraphExtractor {
    private static final Logger log = LogManager.getLogger(CallGraphExtractor.class);

    private final SourceParser parser;

    public CallGraphExtractor() {
        this(new PythonParser());
    }

    public CallGraphExtractor(SourceParser parser) {
        this.parser = Objects.requireNonNull(parser);
    }

    /**
     * Parses {@code source} and builds its call graph.
     *
     * @throws ParseException unchanged from the parser when the source is not valid
     */
    public CallGraph build(String source, String displayId) throws ParseException {
        var module = parser.parse(source, displayId);
        var graph = CallGraphBuilder.build(module);
        log.debug("Call graph for {}: {} nodes, {} edges", displayId, graph.nodeCount(), graph.edgeCount());
        return graph;
    }
}
