package ai.callgraph.analyzer;

import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.treesitter.TSNode;

/**
 * Wrapper for a source text and its UTF-8 bytes. Tree-sitter reports positions as UTF-8 byte offsets, so node text
 * and locations are derived from the byte array, never from {@link String#substring} on raw offsets.
 */
public final class SourceContent {
    private static final Logger log = LogManager.getLogger(SourceContent.class);

    private final String text;
    private final byte[] utf8Bytes;

    private SourceContent(String text, byte[] utf8Bytes) {
        this.text = text;
        this.utf8Bytes = utf8Bytes;
    }

    public static SourceContent of(String src) {
        return new SourceContent(src, src.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Extracts the text of the UTF-8 byte range [startByte, endByte).
     *
     * <p>Out-of-range requests yield the empty string (logged at warn); an end past the last byte is truncated.
     */
    public String substringFromBytes(int startByte, int endByte) {
        if (startByte < 0 || endByte < startByte || startByte > utf8Bytes.length) {
            log.warn(
                    "Requested bytes outside valid range for source text (length: {} bytes): startByte={}, endByte={}",
                    utf8Bytes.length,
                    startByte,
                    endByte);
            return "";
        }
        if (endByte > utf8Bytes.length) {
            log.debug("End byte offset {} exceeds source byte length {}, truncating", endByte, utf8Bytes.length);
            endByte = utf8Bytes.length;
        }
        return new String(utf8Bytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** The source text covered by {@code node}. */
    public String substringFrom(TSNode node) {
        if (node.isNull()) {
            return "";
        }
        return substringFromBytes(node.getStartByte(), node.getEndByte());
    }

    /** Converts a UTF-8 byte offset into a {@link String} index, clamped to the text. */
    public int byteOffsetToCharPosition(int byteOffset) {
        if (byteOffset <= 0) return 0;
        if (byteOffset >= utf8Bytes.length) return text.length();
        return new String(utf8Bytes, 0, byteOffset, StandardCharsets.UTF_8).length();
    }

    /** The 1-based line and column of a UTF-8 byte offset. */
    public SourceLocation locationOf(int byteOffset) {
        int charPosition = byteOffsetToCharPosition(byteOffset);
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < charPosition; i++) {
            if (text.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        return new SourceLocation(line, charPosition - lineStart + 1);
    }

    public String text() {
        return text;
    }

    public int byteLength() {
        return utf8Bytes.length;
    }

    @Override
    public String toString() {
        return "SourceContent[byteLength=" + utf8Bytes.length + ']';
    }
}
