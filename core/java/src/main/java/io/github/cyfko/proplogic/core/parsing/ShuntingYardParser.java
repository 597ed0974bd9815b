package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.ast.Nodes;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.proplogic.core.model.ParseResult;
import io.github.cyfko.proplogic.core.model.ParsedFormula;
import io.github.cyfko.proplogic.core.token.ScanResult;
import io.github.cyfko.proplogic.core.token.Token;
import io.github.cyfko.proplogic.core.token.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Single-pass operator-precedence parser turning a token sequence into a formula AST.
 * <p>
 * This is Dijkstra's shunting-yard algorithm, building the tree as it goes instead of emitting
 * postfix output. Two stacks are kept for the duration of one call:
 * </p>
 * <ul>
 *   <li><strong>operators</strong>: pending open parentheses, negations and binary connectives,
 *       innermost-pending on top</li>
 *   <li><strong>operands</strong>: completed subtrees</li>
 * </ul>
 *
 * <h2>Algorithm</h2>
 * <pre>
 * state NEED_OPERAND:
 *   T, F, variable      → complete operand, go to NEED_OPERATOR
 *   ( or ~              → push on operators
 *   EOF                 → error (empty input / unmatched '(' / operator missing operand)
 * state NEED_OPERATOR:
 *   connective or EOF   → reduce while top has strictly higher priority, push, go to NEED_OPERAND
 *                         (EOF stops the scan)
 *   )                   → reduce down to the matching '(', complete the result as an operand
 * </pre>
 *
 * <p>
 * Negation is a prefix operator that applies to something not yet seen. It therefore waits on the
 * operator stack, and every completed operand (a leaf or a closed parenthesised group) first absorbs
 * all negations sitting on top of the stack. This makes {@code ~~p} a double negation and
 * {@code ~(p /\ q)} the negation of the conjunction.
 * </p>
 *
 * <h2>Associativity</h2>
 * <p>
 * A stacked connective is reduced only when its priority is <em>strictly</em> greater than the
 * incoming one. Connectives of equal priority therefore group to the right:
 * {@code p -> q -> r} is {@code p -> (q -> r)} and {@code p /\ q /\ r} is {@code p /\ (q /\ r)}.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * Malformed input stops the parse at the first offending token and yields a
 * {@link ParseResult#failure} with the token's range. A broken token-source contract (no EOF
 * sentinel) or any other impossible stack state is a defect and raises {@link IllegalStateException}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ShuntingYardParser {

    private static final Logger logger = Logger.getLogger(ShuntingYardParser.class.getName());

    static final String EMPTY_INPUT = "The input is empty.";
    static final String UNMATCHED_OPEN_AT_EOF = "This open parenthesis has no matching close parenthesis.";
    static final String MISSING_OPERAND = "This operator is missing an operand.";
    static final String EXPECTED_OPERAND = "We were expecting a variable, constant, or open parenthesis here.";
    static final String EXPECTED_OPERATOR = "We were expecting a close parenthesis or a binary connective here.";
    static final String UNMATCHED_CLOSE = "This close parenthesis doesn't match any open parenthesis.";
    static final String NOTHING_NEGATED = "Nothing is negated by this operator.";
    static final String NO_MATCHING_CLOSE = "No matching close parenthesis for this open parenthesis.";

    private enum State {
        NEED_OPERAND,
        NEED_OPERATOR
    }

    private ShuntingYardParser() {}

    /**
     * Parses a scanned formula.
     *
     * @param scanResult tokens (terminated by EOF) and variable table
     * @return the AST with the variable table, or the first syntax error
     * @throws IllegalStateException if the parser reaches an impossible state, for instance because
     *                               the token sequence carries no EOF token
     */
    public static ParseResult parse(ScanResult scanResult) {
        Objects.requireNonNull(scanResult, "scanResult");
        try {
            Node ast = buildTree(scanResult.tokens());
            return ParseResult.success(new ParsedFormula(ast, scanResult.variables()));
        } catch (FormulaSyntaxException e) {
            logger.fine(() -> "Parse rejected: " + e.getError());
            return ParseResult.failure(e.getError());
        }
    }

    /**
     * Runs the state machine over the tokens and returns the AST root.
     *
     * @param tokens the token sequence
     * @return the AST root
     * @throws FormulaSyntaxException on the first malformed construct
     */
    static Node buildTree(List<Token> tokens) throws FormulaSyntaxException {
        Deque<Token> operators = new ArrayDeque<>();
        Deque<Node> operands = new ArrayDeque<>();
        State state = State.NEED_OPERAND;

        for (Token token : tokens) {
            TokenType type = token.type();

            if (state == State.NEED_OPERAND) {
                if (type.isOperand()) {
                    addOperand(wrapOperand(token), operands, operators);
                    state = State.NEED_OPERATOR;
                } else if (type == TokenType.OPEN_PAREN || type == TokenType.NOT) {
                    operators.push(token);
                } else if (type == TokenType.EOF) {
                    throw endOfInputWithoutOperand(token, operators);
                } else if (type == TokenType.CLOSE_PAREN && isTopOf(operators, TokenType.NOT)) {
                    // "(~)": blame the dangling negation rather than the parenthesis
                    throw syntaxError(NOTHING_NEGATED, operators.peek());
                } else {
                    throw syntaxError(EXPECTED_OPERAND, token);
                }
            } else {
                if (type.isBinaryConnective() || type == TokenType.EOF) {
                    reduceHigherPriority(token, operators, operands);
                    operators.push(token);
                    state = State.NEED_OPERAND;

                    if (type == TokenType.EOF) break;
                } else if (type == TokenType.CLOSE_PAREN) {
                    closeParenthesis(token, operators, operands);
                } else {
                    throw syntaxError(EXPECTED_OPERATOR, token);
                }
            }
        }

        return finish(operators, operands);
    }

    /**
     * Reduces stacked connectives that bind tighter than the incoming one. Stops at an open
     * parenthesis or at a connective of lower or equal priority.
     */
    private static void reduceHigherPriority(Token incoming, Deque<Token> operators, Deque<Node> operands) {
        while (!operators.isEmpty()) {
            Token top = operators.peek();
            if (top.type() == TokenType.OPEN_PAREN) break;
            if (top.type().priority() <= incoming.type().priority()) break;

            reduce(operators.pop(), operands, operators);
        }
    }

    /**
     * Reduces everything down to the matching open parenthesis, then lets the enclosed expression
     * absorb the negations stacked before that parenthesis.
     */
    private static void closeParenthesis(Token close, Deque<Token> operators, Deque<Node> operands) {
        while (true) {
            if (operators.isEmpty()) {
                throw syntaxError(UNMATCHED_CLOSE, close);
            }

            Token op = operators.pop();
            if (op.type() == TokenType.OPEN_PAREN) break;
            if (op.type() == TokenType.NOT) {
                throw syntaxError(NOTHING_NEGATED, op);
            }

            reduce(op, operands, operators);
        }

        addOperand(popOperand(operands), operands, operators);
    }

    private static void reduce(Token operator, Deque<Node> operands, Deque<Token> operators) {
        Node rhs = popOperand(operands);
        Node lhs = popOperand(operands);
        addOperand(createOperatorNode(lhs, operator, rhs), operands, operators);
    }

    /**
     * Operand completion: applies every negation waiting on top of the operator stack, then pushes
     * the result on the operand stack.
     */
    private static void addOperand(Node node, Deque<Node> operands, Deque<Token> operators) {
        while (isTopOf(operators, TokenType.NOT)) {
            operators.pop();
            node = Nodes.not(node);
        }
        operands.push(node);
    }

    private static FormulaSyntaxException endOfInputWithoutOperand(Token eof, Deque<Token> operators) {
        if (operators.isEmpty()) {
            return new FormulaSyntaxException(EMPTY_INPUT, 0, eof.end());
        }

        Token top = operators.peek();
        if (top.type() == TokenType.OPEN_PAREN) {
            return syntaxError(UNMATCHED_OPEN_AT_EOF, top);
        }
        return syntaxError(MISSING_OPERAND, top);
    }

    private static Node finish(Deque<Token> operators, Deque<Node> operands) {
        // Only reachable after EOF was pushed in the operator state.
        if (operators.isEmpty()) {
            throw new IllegalStateException("No operators on the operator stack (logic error in parser?)");
        }
        if (operators.pop().type() != TokenType.EOF) {
            throw new IllegalStateException("Stack top is not EOF (logic error in parser?)");
        }

        if (!operators.isEmpty()) {
            // EOF reduced every connective, so only an open parenthesis can stop it.
            Token mismatched = operators.pop();
            if (mismatched.type() != TokenType.OPEN_PAREN) {
                throw new IllegalStateException(
                        "Somehow missed an operator factoring in EOF: " + mismatched + " (logic error in parser?)");
            }
            throw syntaxError(NO_MATCHING_CLOSE, mismatched);
        }

        if (operands.size() != 1) {
            throw new IllegalStateException(
                    "Expected exactly one operand at end of parse, found " + operands.size() + " (logic error in parser?)");
        }
        return operands.pop();
    }

    private static boolean isTopOf(Deque<Token> operators, TokenType type) {
        return !operators.isEmpty() && operators.peek().type() == type;
    }

    private static Node popOperand(Deque<Node> operands) {
        if (operands.isEmpty()) {
            throw new IllegalStateException("Operand stack underflow (logic error in parser?)");
        }
        return operands.pop();
    }

    private static Node wrapOperand(Token token) {
        return switch (token.type()) {
            case TRUE -> Nodes.trueNode();
            case FALSE -> Nodes.falseNode();
            case VARIABLE -> Nodes.variable(token.index());
            default -> throw new IllegalStateException(
                    "Token " + token.type() + " isn't an operand (logic error in parser?)");
        };
    }

    private static Node createOperatorNode(Node lhs, Token operator, Node rhs) {
        return switch (operator.type()) {
            case IFF -> Nodes.iff(lhs, rhs);
            case IMPLIES -> Nodes.implies(lhs, rhs);
            case OR -> Nodes.or(lhs, rhs);
            case AND -> Nodes.and(lhs, rhs);
            default -> throw new IllegalStateException(
                    "Should never need to create an operator node from " + operator.type() + " (logic error in parser?)");
        };
    }

    private static FormulaSyntaxException syntaxError(String description, Token token) {
        return new FormulaSyntaxException(description, token.start(), token.end());
    }
}
