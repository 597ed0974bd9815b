package io.github.cyfko.proplogic.core.ast;

/**
 * The constant {@code T} or {@code F}.
 *
 * @param value the truth value
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Constant(boolean value) implements Node {

    @Override
    public NodeKind kind() {
        return NodeKind.CONSTANT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitConstant(this);
    }
}
