package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Logical disjunction.
 *
 * @param left  left operand
 * @param right right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Or(Node left, Node right) implements Node {

    public Or {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OR;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOr(this);
    }
}
