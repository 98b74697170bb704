package io.quantum.core.model;

/**
 * Position of a node in its source file. Lines and columns are 1-based; {@code 0} means unknown.
 *
 * @param source the file path or logical source name, may be {@code null} for inline text
 * @param line   1-based line number
 * @param column 1-based column number
 */
public record SourceLocation(String source, int line, int column) {

    /** Location used when nothing better is known. */
    public static final SourceLocation UNKNOWN = new SourceLocation(null, 0, 0);

    public static SourceLocation of(String source, int line, int column) {
        return new SourceLocation(source, line, column);
    }

    @Override
    public String toString() {
        String name = source != null ? source : "<inline>";
        return line > 0 ? name + ":" + line + ":" + column : name;
    }
}
