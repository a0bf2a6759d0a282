package ai.callgraph.graph.analysis;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** The structural analyses that can run over a finished call graph. */
public enum GraphAnalysis {
    INLINE("inline", "Inline candidates"),
    COMPONENTS("components", "Weak components"),
    SCC("scc", "Strongly connected components");

    /** Selects every analysis when given as a name. */
    public static final String ALL = "all";

    private final String cliName;
    private final String title;

    GraphAnalysis(String cliName, String title) {
        this.cliName = cliName;
        this.title = title;
    }

    public String cliName() {
        return cliName;
    }

    public String title() {
        return title;
    }

    @Override
    public String toString() {
        return cliName;
    }

    /**
     * Parses a comma-separated list of analysis names, {@value #ALL} included. Blank entries are ignored.
     *
     * @throws IllegalArgumentException on an unknown name or when nothing is selected
     */
    public static Set<GraphAnalysis> parseList(String names) {
        var selected = EnumSet.noneOf(GraphAnalysis.class);
        for (var raw : names.split(",")) {
            var name = raw.strip().toLowerCase(Locale.ROOT);
            if (name.isEmpty()) {
                continue;
            }
            if (ALL.equals(name)) {
                selected.addAll(EnumSet.allOf(GraphAnalysis.class));
            } else {
                selected.add(fromCliName(name));
            }
        }
        if (selected.isEmpty()) {
            throw new IllegalArgumentException("No analysis selected");
        }
        return selected;
    }

    public static GraphAnalysis fromCliName(String name) {
        for (var analysis : values()) {
            if (analysis.cliName.equals(name)) {
                return analysis;
            }
        }
        throw new IllegalArgumentException("Unknown analysis '%s', expected one of %s or %s"
                .formatted(name, Arrays.stream(values()).map(GraphAnalysis::cliName).collect(Collectors.joining(", ")), ALL));
    }
}
