package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.ast.Node;

import java.util.Map;
import java.util.Objects;

/**
 * Successful outcome of a parse: the AST root and the variable table passed through from the scanner.
 *
 * @param ast       root of the formula's syntax tree
 * @param variables variable index to source name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParsedFormula(Node ast, Map<Integer, String> variables) {

    public ParsedFormula {
        Objects.requireNonNull(ast, "ast");
        variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }

    /**
     * @param index variable index
     * @return the source name of the variable
     * @throws IllegalArgumentException if no variable has this index
     */
    public String variableName(int index) {
        String name = variables.get(index);
        if (name == null) {
            throw new IllegalArgumentException("Unknown variable index: " + index);
        }
        return name;
    }

    public int variableCount() {
        return variables.size();
    }
}
