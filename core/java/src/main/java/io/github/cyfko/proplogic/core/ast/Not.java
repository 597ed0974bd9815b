package io.github.cyfko.proplogic.core.ast;

import java.util.Objects;

/**
 * Logical negation of its operand.
 *
 * @param operand the negated subtree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Not(Node operand) implements Node {

    public Not {
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NOT;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNot(this);
    }
}
