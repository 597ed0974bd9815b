package io.github.cyfko.proplogic.core.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Factory of {@link Node} instances, one pure constructor per variant.
 * <p>
 * The two constants are shared instances; every other call returns a new immutable node that takes
 * ownership of its children.
 * </p>
 *
 * <pre>{@code
 * // ~(p /\ q) with p = 0, q = 1
 * Node node = Nodes.not(Nodes.and(Nodes.variable(0), Nodes.variable(1)));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Nodes {

    private static final Constant TRUE = new Constant(true);
    private static final Constant FALSE = new Constant(false);

    private Nodes() {}

    public static Constant trueNode() {
        return TRUE;
    }

    public static Constant falseNode() {
        return FALSE;
    }

    public static Variable variable(int index) {
        return new Variable(index);
    }

    public static Not not(Node operand) {
        return new Not(operand);
    }

    public static And and(Node left, Node right) {
        return new And(left, right);
    }

    public static Or or(Node left, Node right) {
        return new Or(left, right);
    }

    public static Implies implies(Node left, Node right) {
        return new Implies(left, right);
    }

    public static Iff iff(Node left, Node right) {
        return new Iff(left, right);
    }

    /**
     * Depth of a tree: the largest number of connectives on any path from the root to a leaf.
     * Constants and variables have depth 0.
     * <p>
     * Walks the tree with an explicit stack, so it is safe on trees too deep for the recursive
     * visitors.
     * </p>
     *
     * @param root the tree
     * @return its depth
     */
    public static int depth(Node root) {
        Objects.requireNonNull(root, "root");

        Deque<Level> pending = new ArrayDeque<>();
        pending.push(new Level(root, 0));
        int max = 0;

        while (!pending.isEmpty()) {
            Level level = pending.pop();
            max = Math.max(max, level.depth());

            Node node = level.node();
            int below = level.depth() + 1;
            if (node instanceof Not not) {
                pending.push(new Level(not.operand(), below));
            } else if (node instanceof And and) {
                pending.push(new Level(and.left(), below));
                pending.push(new Level(and.right(), below));
            } else if (node instanceof Or or) {
                pending.push(new Level(or.left(), below));
                pending.push(new Level(or.right(), below));
            } else if (node instanceof Implies implies) {
                pending.push(new Level(implies.left(), below));
                pending.push(new Level(implies.right(), below));
            } else if (node instanceof Iff iff) {
                pending.push(new Level(iff.left(), below));
                pending.push(new Level(iff.right(), below));
            }
        }
        return max;
    }

    private record Level(Node node, int depth) {}
}
