package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Logical biconditional, {@code left <-> right}.
 *
 * @param left  left operand
 * @param right right operand
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Iff(Node left, Node right) implements Node {

    public Iff {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IFF;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIff(this);
    }
}
