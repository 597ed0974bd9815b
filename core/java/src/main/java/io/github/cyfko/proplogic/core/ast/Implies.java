package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Logical implication, {@code left -> right}.
 *
 * @param left  left operand
 * @param right right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Implies(Node left, Node right) implements Node {

    public Implies {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPLIES;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitImplies(this);
    }
}
