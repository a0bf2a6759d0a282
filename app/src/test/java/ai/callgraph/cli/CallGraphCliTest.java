package ai.callgraph.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

public class CallGraphCliTest {
    private static final String SOURCE =
            """
            def main():
                helper()
                helper()
                report()

            def helper():
                helper()

            def report():
                format_line(1)

            main()
            """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(CallGraphSettings settings, InputStream stdin, String... args) {
        var commandLine = new CommandLine(new CallGraphCli(settings, stdin));
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private int run(String... args) {
        return run(defaults(), InputStream.nullInputStream(), args);
    }

    private static CallGraphSettings defaults() {
        return new CallGraphSettings(k -> null, k -> null, new Properties());
    }

    private Path writeSource(String text) throws IOException {
        var file = tempDir.resolve("module.py");
        Files.writeString(file, text, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void textReport_listsGraphAndAllAnalyses() throws IOException {
        var file = writeSource(SOURCE);

        int exitCode = run(file.toString());

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        var text = out.toString();
        assertTrue(text.contains("main -> helper, helper, report"), text);
        assertTrue(text.contains("helper -> helper"), text);
        assertTrue(text.contains("... -> main"), text);
        assertTrue(text.contains("## Weak components"), text);
        assertTrue(text.contains("## Strongly connected components"), text);
        assertTrue(text.contains("## Inline candidates"), text);
        assertTrue(text.contains("5 nodes, 6 edges, 1 leaves"), text);
    }

    @Test
    public void jsonReport_containsSelectedAnalysesOnly() throws IOException {
        var file = writeSource(SOURCE);

        int exitCode = run("--format=json", "--analysis=inline", file.toString());

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        var json = new ObjectMapper().readTree(out.toString());
        assertEquals(file.toString(), json.get("displayId").asText());
        assertEquals("helper", json.get("graph").get("main").get(0).asText());
        assertEquals(3, json.get("graph").get("main").size());
        // helper is called three times; main, report and format_line once each
        assertEquals("[\"main\",\"report\",\"format_line\"]", json.get("inlineCandidates").toString());
        assertFalse(json.has("weakComponents"));
        assertFalse(json.has("sccs"));
        assertEquals(5, json.get("summary").get("nodes").asInt());
    }

    @Test
    public void analysisOption_acceptsCommaSeparatedAndRepeatedValues() throws IOException {
        var file = writeSource(SOURCE);

        int exitCode = run("--format=json", "--analysis=scc,inline", "--analysis", "components", file.toString());

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        var json = new ObjectMapper().readTree(out.toString());
        assertTrue(json.has("weakComponents"));
        assertTrue(json.has("sccs"));
        assertTrue(json.has("inlineCandidates"));
    }

    @Test
    public void outputOption_writesReportToFile() throws IOException {
        var file = writeSource(SOURCE);
        var report = tempDir.resolve("report.txt");

        int exitCode = run("--output", report.toString(), file.toString());

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        assertEquals("", out.toString());
        assertTrue(Files.readString(report).contains("main -> helper, helper, report"));
    }

    @Test
    public void dash_readsStandardInput() {
        var stdin = new ByteArrayInputStream("def a():\n    b()\n".getBytes(StandardCharsets.UTF_8));

        int exitCode = run(defaults(), stdin, "--format=json", "-");

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        assertTrue(out.toString().contains("\"displayId\" : \"<stdin>\""), out.toString());
    }

    @Test
    public void syntaxError_exitsWithParseErrorAndLocation() throws IOException {
        var file = writeSource("def ok():\n    pass\n\ndef broken(:\n    pass\n");

        int exitCode = run(file.toString());

        assertEquals(CallGraphCli.EXIT_PARSE_ERROR, exitCode);
        assertTrue(err.toString().startsWith(file + ":4:"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void missingFile_exitsWithIoError() {
        int exitCode = run(tempDir.resolve("absent.py").toString());

        assertEquals(CallGraphCli.EXIT_IO_ERROR, exitCode);
        assertTrue(err.toString().contains("absent.py"), err.toString());
    }

    @Test
    public void unknownFormatOrAnalysis_isAUsageError() throws IOException {
        var file = writeSource(SOURCE);

        assertEquals(CommandLine.ExitCode.USAGE, run("--format=yaml", file.toString()));
        assertEquals(CommandLine.ExitCode.USAGE, run("--analysis=dead-code", file.toString()));
        assertEquals(CommandLine.ExitCode.USAGE, run());
    }

    @Test
    public void settings_supplyDefaultsForMissingOptions() throws IOException {
        var file = writeSource(SOURCE);
        var settings = new CallGraphSettings(
                key -> CallGraphSettings.OUTPUT_FORMAT_PROPERTY.equals(key) ? "json" : null,
                key -> "CALLGRAPH_ANALYSES".equals(key) ? "scc" : null,
                new Properties());

        int exitCode = run(settings, InputStream.nullInputStream(), file.toString());

        assertEquals(CallGraphCli.EXIT_OK, exitCode, err.toString());
        var json = new ObjectMapper().readTree(out.toString());
        assertTrue(json.has("sccs"));
        assertFalse(json.has("inlineCandidates"));
    }
}
