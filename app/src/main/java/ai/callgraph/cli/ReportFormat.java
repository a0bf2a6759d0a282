package ai.callgraph.cli;

import ai.callgraph.graph.analysis.CallGraphReport;
import ai.callgraph.graph.analysis.GraphAnalysis;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import org.jetbrains.annotations.Nullable;

/** How a {@link CallGraphReport} is written out. */
public enum ReportFormat {
    TEXT {
        @Override
        void write(CallGraphReport report, PrintWriter out) {
            out.println("# " + report.displayId());
            report.graph().forEach((node, callees) -> {
                if (callees.isEmpty()) {
                    out.println(node);
                } else {
                    out.println(node + " -> " + String.join(", ", callees));
                }
            });
            writeComponents(out, GraphAnalysis.COMPONENTS, report.weakComponents());
            writeComponents(out, GraphAnalysis.SCC, report.stronglyConnectedComponents());
            var inline = report.inlineCandidates();
            if (inline != null) {
                out.println();
                out.println("## " + GraphAnalysis.INLINE.title());
                inline.forEach(out::println);
            }
            var summary = report.summary();
            out.println();
            out.printf("%d nodes, %d edges, %d leaves%n", summary.nodes(), summary.edges(), summary.leaves());
        }
    },
    JSON {
        @Override
        void write(CallGraphReport report, PrintWriter out) throws IOException {
            out.println(MAPPER.writeValueAsString(report));
        }
    };

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    abstract void write(CallGraphReport report, PrintWriter out) throws IOException;

    /** Case-insensitive lookup by name. */
    public static ReportFormat parse(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown format '%s', expected text or json".formatted(name), e);
        }
    }

    private static void writeComponents(PrintWriter out, GraphAnalysis analysis, @Nullable List<List<String>> components) {
        if (components == null) {
            return;
        }
        out.println();
        out.println("## " + analysis.title());
        int index = 1;
        for (var component : components) {
            out.println(index++ + ": " + String.join(", ", component));
        }
    }
}
