package ai.callgraph.cli;

import ai.callgraph.graph.analysis.GraphAnalysis;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Defaults for options left off the command line.
 *
 * <p>Each setting is looked up in order:
 *
 * <ol>
 *   <li>system property, e.g. {@code -Dcallgraph.output.format=json}
 *   <li>environment variable, e.g. {@code CALLGRAPH_OUTPUT_FORMAT=json}
 *   <li>the bundled {@code callgraph.properties}
 *   <li>the built-in default
 * </ol>
 *
 * An unusable value is logged and skipped in favour of the built-in default.
 */
public final class CallGraphSettings {
    private static final Logger log = LogManager.getLogger(CallGraphSettings.class);

    static final String OUTPUT_FORMAT_PROPERTY = "callgraph.output.format";
    static final String ANALYSES_PROPERTY = "callgraph.analyses";
    static final String BUNDLED_RESOURCE = "/callgraph.properties";

    private static final ReportFormat DEFAULT_FORMAT = ReportFormat.TEXT;

    private final Function<String, @Nullable String> systemProperties;
    private final Function<String, @Nullable String> environment;
    private final Properties bundled;

    /** Settings backed by the JVM's system properties, the process environment and the bundled defaults. */
    public static CallGraphSettings load() {
        return new CallGraphSettings(System::getProperty, System::getenv, loadBundled());
    }

    CallGraphSettings(
            Function<String, @Nullable String> systemProperties,
            Function<String, @Nullable String> environment,
            Properties bundled) {
        this.systemProperties = systemProperties;
        this.environment = environment;
        this.bundled = bundled;
    }

    public ReportFormat outputFormat() {
        var value = lookup(OUTPUT_FORMAT_PROPERTY);
        if (value == null) {
            return DEFAULT_FORMAT;
        }
        try {
            return ReportFormat.parse(value);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}={}: {}", OUTPUT_FORMAT_PROPERTY, value, e.getMessage());
            return DEFAULT_FORMAT;
        }
    }

    public Set<GraphAnalysis> analyses() {
        var value = lookup(ANALYSES_PROPERTY);
        if (value == null) {
            return GraphAnalysis.parseList(GraphAnalysis.ALL);
        }
        try {
            return GraphAnalysis.parseList(value);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring {}={}: {}", ANALYSES_PROPERTY, value, e.getMessage());
            return GraphAnalysis.parseList(GraphAnalysis.ALL);
        }
    }

    private @Nullable String lookup(String property) {
        var value = systemProperties.apply(property);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        value = environment.apply(environmentName(property));
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        value = bundled.getProperty(property);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return null;
    }

    /** {@code callgraph.output.format} becomes {@code CALLGRAPH_OUTPUT_FORMAT}. */
    static String environmentName(String property) {
        return property.replace('.', '_').toUpperCase(Locale.ROOT);
    }

    private static Properties loadBundled() {
        var properties = new Properties();
        try (InputStream in = CallGraphSettings.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                log.debug("No {} on the classpath", BUNDLED_RESOURCE);
                return properties;
            }
            properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + BUNDLED_RESOURCE, e);
        }
        return properties;
    }
}
