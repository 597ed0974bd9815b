package io.github.cyfko.proplogic.core.token;

/**
 * Closed set of lexical token kinds produced by a {@link TokenSource}.
 * <p>
 * Besides naming each kind, this enum carries the classification used by the parser:
 * whether a kind starts an operand, whether it is a binary connective, and its priority.
 * </p>
 *
 * <h2>Priority Table</h2>
 * <table border="1">
 * <caption>Binary connective priorities (higher binds tighter)</caption>
 * <thead>
 * <tr><th>Kind</th><th>Symbol</th><th>Priority</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link #AND}</td><td>/\</td><td>3</td></tr>
 * <tr><td>{@link #OR}</td><td>\/</td><td>2</td></tr>
 * <tr><td>{@link #IMPLIES}</td><td>-&gt;</td><td>1</td></tr>
 * <tr><td>{@link #IFF}</td><td>&lt;-&gt;</td><td>0</td></tr>
 * <tr><td>{@link #EOF}</td><td></td><td>-1</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    TRUE("T"),
    FALSE("F"),
    VARIABLE("variable"),
    OPEN_PAREN("("),
    CLOSE_PAREN(")"),
    NOT("~"),
    AND("/\\"),
    OR("\\/"),
    IMPLIES("->"),
    IFF("<->"),
    EOF("end of input");

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Canonical ASCII spelling of this kind, as written by {@code FormulaPrinter.ascii()}.
     *
     * @return the symbol
     */
    public String symbol() {
        return symbol;
    }

    /**
     * @return {@code true} for constants and variables
     */
    public boolean isOperand() {
        return this == TRUE || this == FALSE || this == VARIABLE;
    }

    /**
     * @return {@code true} for the four binary connectives
     */
    public boolean isBinaryConnective() {
        return this == AND || this == OR || this == IMPLIES || this == IFF;
    }

    /**
     * Returns the priority of this kind when it sits on, or is compared against, the operator stack.
     * <p>
     * {@link #EOF} is treated as an operator of minimal priority so that reaching the end of input
     * forces every pending reduction.
     * </p>
     *
     * @return the priority
     * @throws IllegalStateException if this kind is not a binary connective or {@link #EOF}
     */
    public int priority() {
        return switch (this) {
            case EOF -> -1;
            case IFF -> 0;
            case IMPLIES -> 1;
            case OR -> 2;
            case AND -> 3;
            default -> throw new IllegalStateException(
                    "Should never need the priority of " + this + " (logic error in parser?)");
        };
    }
}
