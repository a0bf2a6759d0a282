package ai.callgraph.analyzer;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Raised when a module cannot be parsed. The build for that module is abandoned; there is no partial graph.
 *
 * <p>{@link #getMessage()} renders {@code displayId:line:column: detail}, the form compilers use, so callers can
 * print it as is.
 */
public class ParseException extends Exception {
    private final String displayId;
    private final String detail;
    private final @Nullable SourceLocation location;

    public ParseException(String displayId, String detail, @Nullable SourceLocation location) {
        super(format(displayId, detail, location));
        this.displayId = displayId;
        this.detail = detail;
        this.location = location;
    }

    public ParseException(String displayId, String detail, @Nullable SourceLocation location, Throwable cause) {
        super(format(displayId, detail, location), cause);
        this.displayId = displayId;
        this.detail = detail;
        this.location = location;
    }

    public String displayId() {
        return displayId;
    }

    /** The human-readable reason without the location prefix. */
    public String detail() {
        return detail;
    }

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    private static String format(String displayId, String detail, @Nullable SourceLocation location) {
        return location == null ? displayId + ": " + detail : displayId + ":" + location + ": " + detail;
    }
}
