package io.github.cyfko.proplogic.core.eval;

import io.github.cyfko.proplogic.core.ast.*;

import java.util.Objects;

/**
 * Evaluates a formula AST under a truth assignment.
 * <p>
 * The assignment is indexed by variable index: variable {@code i} takes the value
 * {@code assignment[i]}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaEvaluator implements NodeVisitor<Boolean> {

    private final boolean[] assignment;

    private FormulaEvaluator(boolean[] assignment) {
        this.assignment = assignment;
    }

    /**
     * @param node       the formula
     * @param assignment truth value per variable index
     * @return the formula's value
     * @throws IllegalArgumentException if the formula references an index outside the assignment
     */
    public static boolean evaluate(Node node, boolean[] assignment) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(assignment, "assignment");
        return node.accept(new FormulaEvaluator(assignment));
    }

    @Override
    public Boolean visitConstant(Constant node) {
        return node.value();
    }

    @Override
    public Boolean visitVariable(Variable node) {
        if (node.index() >= assignment.length) {
            throw new IllegalArgumentException(String.format(
                    "Variable index %d outside assignment of size %d", node.index(), assignment.length));
        }
        return assignment[node.index()];
    }

    @Override
    public Boolean visitNot(Not node) {
        return !node.operand().accept(this);
    }

    @Override
    public Boolean visitAnd(And node) {
        return node.left().accept(this) && node.right().accept(this);
    }

    @Override
    public Boolean visitOr(Or node) {
        return node.left().accept(this) || node.right().accept(this);
    }

    @Override
    public Boolean visitImplies(Implies node) {
        return !node.left().accept(this) || node.right().accept(this);
    }

    @Override
    public Boolean visitIff(Iff node) {
        return node.left().accept(this).equals(node.right().accept(this));
    }
}
