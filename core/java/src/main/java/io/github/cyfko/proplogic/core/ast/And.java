package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Logical conjunction.
 *
 * @param left  left operand
 * @param right right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record And(Node left, Node right) implements Node {

    public And {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.AND;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAnd(this);
    }
}
