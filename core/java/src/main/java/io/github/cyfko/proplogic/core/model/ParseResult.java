package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;

import java.util.Objects;

/**
 * Result of parsing a formula: either a {@link ParsedFormula} or a located {@link SyntaxError}.
 * <p>
 * Instances are immutable and created via the static methods
 * {@link #success(ParsedFormula)} and {@link #failure(SyntaxError)}.
 * </p>
 *
 * <p>Usage example:</p>
 * <pre>{@code
 * ParseResult result = parser.parse("p -> q");
 * if (result.isSuccess()) {
 *     Node ast = result.getFormula().ast();
 * } else {
 *     SyntaxError error = result.getError();
 *     System.out.println(error.description() + " at " + error.start());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ParseResult {

    private final ParsedFormula formula;
    private final SyntaxError error;

    private ParseResult(ParsedFormula formula, SyntaxError error) {
        this.formula = formula;
        this.error = error;
    }

    /**
     * @param formula the parsed formula
     * @return a successful result
     */
    public static ParseResult success(ParsedFormula formula) {
        return new ParseResult(Objects.requireNonNull(formula, "formula"), null);
    }

    /**
     * @param error the syntax error
     * @return a failed result
     */
    public static ParseResult failure(SyntaxError error) {
        return new ParseResult(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return the parsed formula
     * @throws IllegalStateException if this result is a failure
     */
    public ParsedFormula getFormula() {
        if (formula == null) {
            throw new IllegalStateException("No formula on a failed parse result: " + error);
        }
        return formula;
    }

    /**
     * @return the syntax error
     * @throws IllegalStateException if this result is a success
     */
    public SyntaxError getError() {
        if (error == null) {
            throw new IllegalStateException("No syntax error on a successful parse result");
        }
        return error;
    }

    /**
     * Returns the formula, or raises the syntax error as an exception.
     *
     * @return the parsed formula
     * @throws FormulaSyntaxException if this result is a failure
     */
    public ParsedFormula orElseThrow() {
        if (formula == null) {
            throw new FormulaSyntaxException(error);
        }
        return formula;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ParseResult[success=true, ast=" + formula.ast() + "]"
                : "ParseResult[success=false, error=" + error + "]";
    }
}
