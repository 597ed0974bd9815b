package io.github.cyfko.proplogic.core.ast;

/**
 * Variant tag of a {@link Node}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum NodeKind {
    CONSTANT,
    VARIABLE,
    NOT,
    AND,
    OR,
    IMPLIES,
    IFF;

    public boolean isBinary() {
        return this == AND || this == OR || this == IMPLIES || this == IFF;
    }
}
