package ai.callgraph.analyzer;

/** A 1-based line and column within a source module. Columns count UTF-16 code units, like {@link String}. */
public record SourceLocation(int line, int column) {
    public SourceLocation {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Line and column are 1-based, got %d:%d".formatted(line, column));
        }
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
