package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.model.ParseResult;
import io.github.cyfko.proplogic.core.model.SyntaxError;

/**
 * Exception carrying a located {@link SyntaxError} out of the scanner or the parser.
 * <p>
 * Inside the library this exception short-circuits a scan or parse at the point where the
 * malformed construct is detected. Public entry points such as {@link FormulaParser#parse(String)}
 * convert it into a {@link ParseResult#failure(SyntaxError)}, so most callers never see it.
 * It surfaces only from {@link ParseResult#orElseThrow()} and from a raw
 * {@link io.github.cyfko.proplogic.core.token.TokenSource#scan(String)} call.
 * </p>
 *
 * <p><strong>Error Examples:</strong></p>
 * <pre>{@code
 * parser.parse("").orElseThrow();
 * // → "The input is empty." at [0, 0)
 *
 * parser.parse("p)").orElseThrow();
 * // → "This close parenthesis doesn't match any open parenthesis." at [1, 2)
 *
 * parser.parse("(~)").orElseThrow();
 * // → "Nothing is negated by this operator." at [1, 2)
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     ParsedFormula formula = parser.parse(userInput).orElseThrow();
 * } catch (FormulaSyntaxException e) {
 *     SyntaxError error = e.getError();
 *     highlight(userInput, error.start(), error.end());
 * }
 * }</pre>
 *
 * <p>
 * Internal invariant violations of the parser are never reported through this type; they raise
 * {@link IllegalStateException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see SyntaxError
 */
public class FormulaSyntaxException extends RuntimeException {

    private final SyntaxError error;

    /**
     * Constructor from a located error.
     *
     * @param error the syntax error, must not be {@code null}
     */
    public FormulaSyntaxException(SyntaxError error) {
        this(error, null);
    }

    /**
     * Convenience constructor building the {@link SyntaxError} in place.
     *
     * @param description human-readable description
     * @param start       inclusive start offset
     * @param end         exclusive end offset
     */
    public FormulaSyntaxException(String description, int start, int end) {
        this(new SyntaxError(description, start, end));
    }

    /**
     * Constructor with an underlying cause.
     *
     * @param error the syntax error, must not be {@code null}
     * @param cause the original cause of this exception
     */
    public FormulaSyntaxException(SyntaxError error, Throwable cause) {
        super(error == null ? null : error.toString(), cause);
        if (error == null) {
            throw new IllegalArgumentException("Syntax error is required");
        }
        this.error = error;
    }

    /**
     * @return the located syntax error
     */
    public SyntaxError getError() {
        return error;
    }

    public String getDescription() {
        return error.description();
    }

    public int getStart() {
        return error.start();
    }

    public int getEnd() {
        return error.end();
    }
}
