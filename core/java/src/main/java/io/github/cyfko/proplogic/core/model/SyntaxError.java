package io.github.cyfko.proplogic.core.model;

/**
 * A user-facing syntax error located on the half-open source range {@code [start, end)}.
 * <p>
 * The range is suitable for caret or underline diagnostics. An empty range ({@code start == end})
 * points between two characters, typically at the end of the input.
 * </p>
 *
 * @param description human-readable description of what went wrong
 * @param start       inclusive start offset
 * @param end         exclusive end offset
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SyntaxError(String description, int start, int end) {

    public SyntaxError {
        if (description == null) {
            throw new IllegalArgumentException("description is required");
        }
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid error range [" + start + ", " + end + ")");
        }
    }

    @Override
    public String toString() {
        return description + " [" + start + ", " + end + ")";
    }
}
