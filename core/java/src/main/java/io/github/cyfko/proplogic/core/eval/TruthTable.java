package io.github.cyfko.proplogic.core.eval;

import io.github.cyfko.proplogic.core.model.ParsedFormula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Full truth table of a parsed formula.
 * <p>
 * Rows enumerate every assignment in binary counting order: the variable with index 0 is the most
 * significant bit and the all-false row comes first.
 * </p>
 *
 * <pre>{@code
 * ParsedFormula formula = new BasicFormulaParser().parse("p -> q").orElseThrow();
 * TruthTable table = TruthTable.of(formula);
 * // p q | p -> q
 * // F F | T
 * // F T | T
 * // T F | F
 * // T T | T
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class TruthTable {

    private static final Logger logger = Logger.getLogger(TruthTable.class.getName());

    public static final int DEFAULT_MAX_VARIABLES = 16;

    /** Largest accepted cap: 2^30 rows still fits in an {@code int} row count. */
    public static final int MAX_VARIABLES_LIMIT = 30;

    private final List<String> variables;
    private final List<Row> rows;

    private TruthTable(List<String> variables, List<Row> rows) {
        this.variables = variables;
        this.rows = rows;
    }

    public static TruthTable of(ParsedFormula formula) {
        return of(formula, DEFAULT_MAX_VARIABLES);
    }

    /**
     * @param formula      the formula to tabulate
     * @param maxVariables upper bound on the number of variables (the table has 2^n rows)
     * @return the truth table
     * @throws IllegalArgumentException if {@code maxVariables} is outside [0, {@value #MAX_VARIABLES_LIMIT}],
     *                                  or the formula has more than {@code maxVariables} variables
     */
    public static TruthTable of(ParsedFormula formula, int maxVariables) {
        Objects.requireNonNull(formula, "formula");
        if (maxVariables < 0 || maxVariables > MAX_VARIABLES_LIMIT) {
            throw new IllegalArgumentException(String.format(
                    "maxVariables must be between 0 and %d, got: %d", MAX_VARIABLES_LIMIT, maxVariables));
        }

        int n = formula.variableCount();
        if (n > maxVariables) {
            throw new IllegalArgumentException(String.format(
                    "Too many variables for a truth table (%d, max: %d)", n, maxVariables));
        }

        List<String> names = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            names.add(formula.variableName(i));
        }

        int rowCount = 1 << n;
        List<Row> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            boolean[] assignment = new boolean[n];
            for (int i = 0; i < n; i++) {
                assignment[i] = ((r >> (n - 1 - i)) & 1) == 1;
            }
            rows.add(new Row(assignment, FormulaEvaluator.evaluate(formula.ast(), assignment)));
        }

        logger.fine(() -> String.format("Built truth table: %d variables, %d rows", n, rowCount));
        return new TruthTable(Collections.unmodifiableList(names), Collections.unmodifiableList(rows));
    }

    /**
     * @return variable names, ordered by index
     */
    public List<String> getVariables() {
        return variables;
    }

    public List<Row> getRows() {
        return rows;
    }

    public boolean isTautology() {
        return rows.stream().allMatch(Row::value);
    }

    public boolean isContradiction() {
        return rows.stream().noneMatch(Row::value);
    }

    public boolean isSatisfiable() {
        return !isContradiction();
    }

    /**
     * One assignment and the formula's value under it.
     *
     * @param assignment truth value per variable index
     * @param value      the formula's value
     */
    public record Row(boolean[] assignment, boolean value) {

        public Row {
            assignment = assignment.clone();
        }

        @Override
        public boolean[] assignment() {
            return assignment.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Row other && value == other.value && Arrays.equals(assignment, other.assignment);
        }

        @Override
        public int hashCode() {
            return 31 * Arrays.hashCode(assignment) + Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return "Row[assignment=" + Arrays.toString(assignment) + ", value=" + value + "]";
        }
    }
}
