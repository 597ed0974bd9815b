package io.github.cyfko.proplogic.core.ast;

/**
 * Reference to a propositional variable by its index in the variable table.
 *
 * @param index the variable index, non-negative
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Variable(int index) implements Node {

    public Variable {
        if (index < 0) {
            throw new IllegalArgumentException("Variable index must be non-negative, got: " + index);
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }
}
