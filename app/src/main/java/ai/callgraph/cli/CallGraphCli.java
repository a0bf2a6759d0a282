package ai.callgraph.cli;

import ai.callgraph.analyzer.ParseException;
import ai.callgraph.graph.CallGraphExtractor;
import ai.callgraph.graph.analysis.CallGraphReport;
import ai.callgraph.graph.analysis.GraphAnalysis;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@SuppressWarnings("NullAway.Init") // picocli injects the annotated fields before call()
@CommandLine.Command(
        name = "callgraph",
        mixinStandardHelpOptions = true,
        version = "callgraph 0.1.0",
        description = "Builds the call graph of a Python module and reports components, recursion and inline candidates.")
public final class CallGraphCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CallGraphCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_ERROR = 1;
    static final int EXIT_IO_ERROR = 3;

    static final String STDIN = "-";
    static final String STDIN_DISPLAY_ID = "<stdin>";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Python source file, or - for stdin.")
    private String file;

    @CommandLine.Option(
            names = "--analysis",
            split = ",",
            paramLabel = "NAME",
            description = "Analysis to run: inline, components, scc or all. Can be repeated. Default: all.")
    private List<String> analysisNames = new ArrayList<>();

    @CommandLine.Option(names = "--format", paramLabel = "FORMAT", description = "Report format: text or json.")
    @Nullable
    private String format;

    @CommandLine.Option(names = "--output", paramLabel = "FILE", description = "Write the report here instead of stdout.")
    @Nullable
    private Path output;

    private final CallGraphSettings settings;
    private final InputStream stdin;

    public CallGraphCli() {
        this(CallGraphSettings.load(), System.in);
    }

    CallGraphCli(CallGraphSettings settings, InputStream stdin) {
        this.settings = settings;
        this.stdin = stdin;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CallGraphCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        var analyses = selectedAnalyses();
        var reportFormat = selectedFormat();
        var err = spec.commandLine().getErr();

        var displayId = STDIN.equals(file) ? STDIN_DISPLAY_ID : file;
        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            logger.error("Failed to read {}", displayId, e);
            err.println("Error reading " + displayId + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        CallGraphReport report;
        try {
            var graph = new CallGraphExtractor().build(source, displayId);
            report = CallGraphReport.of(displayId, graph, analyses);
        } catch (ParseException e) {
            logger.debug("Parse failed", e);
            err.println(e.getMessage());
            return EXIT_PARSE_ERROR;
        }

        try {
            writeReport(report, reportFormat);
        } catch (IOException e) {
            logger.error("Failed to write report", e);
            err.println("Error writing report: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        return EXIT_OK;
    }

    private Set<GraphAnalysis> selectedAnalyses() {
        if (analysisNames.isEmpty()) {
            return settings.analyses();
        }
        try {
            var selected = EnumSet.noneOf(GraphAnalysis.class);
            for (var name : analysisNames) {
                selected.addAll(GraphAnalysis.parseList(name));
            }
            return selected;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private ReportFormat selectedFormat() {
        if (format == null) {
            return settings.outputFormat();
        }
        try {
            return ReportFormat.parse(format);
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private String readSource() throws IOException {
        if (STDIN.equals(file)) {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(file), StandardCharsets.UTF_8);
    }

    private void writeReport(CallGraphReport report, ReportFormat reportFormat) throws IOException {
        var target = output;
        if (target == null) {
            var out = spec.commandLine().getOut();
            reportFormat.write(report, out);
            out.flush();
            return;
        }
        try (var out = new PrintWriter(Files.newBufferedWriter(target, StandardCharsets.UTF_8))) {
            reportFormat.write(report, out);
            if (out.checkError()) {
                throw new IOException("Failed to write " + target);
            }
        }
        logger.debug("Wrote {} report to {}", reportFormat, target);
    }
}
