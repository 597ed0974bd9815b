package io.github.cyfko.proplogic.core.ast;

/**
 * Immutable node of a propositional formula's abstract syntax tree.
 * <p>
 * The set of variants is closed. Binary variants always hold exactly two children and
 * {@link Not} exactly one; children are owned by their parent and never shared, so trees are acyclic.
 * Structural equality is provided by the record implementations.
 * </p>
 *
 * <h2>Variants</h2>
 * <ul>
 *   <li>{@link Constant} - {@code T} or {@code F}</li>
 *   <li>{@link Variable} - reference to the variable table by index</li>
 *   <li>{@link Not} - negation</li>
 *   <li>{@link And}, {@link Or}, {@link Implies}, {@link Iff} - binary connectives</li>
 * </ul>
 *
 * <p>Instances are created through {@link Nodes}. Consumers dispatch over variants with a
 * {@link NodeVisitor} rather than {@code instanceof} chains.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public sealed interface Node permits Constant, Variable, Not, And, Or, Implies, Iff {

    /**
     * @return the variant tag of this node
     */
    NodeKind kind();

    /**
     * Dispatches to the visitor method matching this variant.
     *
     * @param visitor the visitor
     * @param <R>     result type
     * @return the visitor's result
     */
    <R> R accept(NodeVisitor<R> visitor);
}
