package io.github.cyfko.proplogic.core.print;

import io.github.cyfko.proplogic.core.ast.*;
import io.github.cyfko.proplogic.core.model.ParsedFormula;
import io.github.cyfko.proplogic.core.token.TokenType;

import java.util.Map;
import java.util.Objects;

/**
 * Renders a formula AST back to text that the scanner accepts.
 * <p>
 * The printer emits only the parentheses needed for a reparse to produce a structurally identical
 * tree. Since connectives of equal priority group to the right, a left child of equal priority is
 * parenthesised while a right child of equal priority is not:
 * </p>
 * <pre>{@code
 * Implies(Implies(p, q), r)  →  (p -> q) -> r
 * Implies(p, Implies(q, r))  →  p -> q -> r
 * Not(And(p, q))             →  ~(p /\ q)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaPrinter {

    private static final FormulaPrinter ASCII = new FormulaPrinter(
            TokenType.TRUE.symbol(), TokenType.FALSE.symbol(), TokenType.NOT.symbol(), TokenType.AND.symbol(),
            TokenType.OR.symbol(), TokenType.IMPLIES.symbol(), TokenType.IFF.symbol());
    private static final FormulaPrinter UNICODE = new FormulaPrinter("⊤", "⊥", "¬", "∧", "∨", "→", "↔");

    private final String trueSymbol;
    private final String falseSymbol;
    private final String notSymbol;
    private final String andSymbol;
    private final String orSymbol;
    private final String impliesSymbol;
    private final String iffSymbol;

    private FormulaPrinter(String trueSymbol, String falseSymbol, String notSymbol, String andSymbol,
                           String orSymbol, String impliesSymbol, String iffSymbol) {
        this.trueSymbol = trueSymbol;
        this.falseSymbol = falseSymbol;
        this.notSymbol = notSymbol;
        this.andSymbol = andSymbol;
        this.orSymbol = orSymbol;
        this.impliesSymbol = impliesSymbol;
        this.iffSymbol = iffSymbol;
    }

    /**
     * @return printer using {@code T F ~ /\ \/ -> <->}
     */
    public static FormulaPrinter ascii() {
        return ASCII;
    }

    /**
     * @return printer using {@code ⊤ ⊥ ¬ ∧ ∨ → ↔}
     */
    public static FormulaPrinter unicode() {
        return UNICODE;
    }

    public String print(ParsedFormula formula) {
        Objects.requireNonNull(formula, "formula");
        return print(formula.ast(), formula.variables());
    }

    /**
     * @param node      the root to render
     * @param variables variable index to name
     * @return the formula text
     * @throws IllegalArgumentException if a variable index has no name
     */
    public String print(Node node, Map<Integer, String> variables) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(variables, "variables");

        StringBuilder out = new StringBuilder();
        node.accept(new Renderer(out, variables));
        return out.toString();
    }

    /**
     * Binding strength of a node as the parser sees it. Atoms and negations bind tighter than any
     * binary connective.
     */
    private static int priorityOf(Node node) {
        return switch (node.kind()) {
            case IFF -> 0;
            case IMPLIES -> 1;
            case OR -> 2;
            case AND -> 3;
            default -> Integer.MAX_VALUE;
        };
    }

    private final class Renderer implements NodeVisitor<Void> {
        private final StringBuilder out;
        private final Map<Integer, String> variables;

        Renderer(StringBuilder out, Map<Integer, String> variables) {
            this.out = out;
            this.variables = variables;
        }

        @Override
        public Void visitConstant(Constant node) {
            out.append(node.value() ? trueSymbol : falseSymbol);
            return null;
        }

        @Override
        public Void visitVariable(Variable node) {
            String name = variables.get(node.index());
            if (name == null) {
                throw new IllegalArgumentException("No name for variable index " + node.index());
            }
            out.append(name);
            return null;
        }

        @Override
        public Void visitNot(Not node) {
            out.append(notSymbol);
            child(node.operand(), node.operand().kind().isBinary());
            return null;
        }

        @Override
        public Void visitAnd(And node) {
            return binary(node, node.left(), andSymbol, node.right());
        }

        @Override
        public Void visitOr(Or node) {
            return binary(node, node.left(), orSymbol, node.right());
        }

        @Override
        public Void visitImplies(Implies node) {
            return binary(node, node.left(), impliesSymbol, node.right());
        }

        @Override
        public Void visitIff(Iff node) {
            return binary(node, node.left(), iffSymbol, node.right());
        }

        private Void binary(Node parent, Node left, String symbol, Node right) {
            int priority = priorityOf(parent);
            child(left, priorityOf(left) <= priority);
            out.append(' ').append(symbol).append(' ');
            child(right, priorityOf(right) < priority);
            return null;
        }

        private void child(Node node, boolean parenthesize) {
            if (parenthesize) out.append('(');
            node.accept(this);
            if (parenthesize) out.append(')');
        }
    }
}
