package io.github.cyfko.proplogic.core.ast;

/**
 * Visitor over the closed set of {@link Node} variants.
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface NodeVisitor<R> {

    R visitConstant(Constant node);

    R visitVariable(Variable node);

    R visitNot(Not node);

    R visitAnd(And node);

    R visitOr(Or node);

    R visitImplies(Implies node);

    R visitIff(Iff node);
}
