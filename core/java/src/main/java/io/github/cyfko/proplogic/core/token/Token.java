package io.github.cyfko.proplogic.core.token;

import java.util.Objects;

/**
 * Immutable lexical token with its half-open source range {@code [start, end)}.
 * <p>
 * Only {@link TokenType#VARIABLE} tokens carry a meaningful {@code index} into the variable table;
 * every other token uses {@link #NO_INDEX}.
 * </p>
 *
 * @param type  the token kind
 * @param start inclusive start offset in the source text
 * @param end   exclusive end offset in the source text
 * @param index variable index, or {@link #NO_INDEX}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, int start, int end, int index) {

    public static final int NO_INDEX = -1;

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the range is invalid or a variable has no index
     */
    public Token {
        Objects.requireNonNull(type, "type");
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid token range [" + start + ", " + end + ")");
        }
        if (type == TokenType.VARIABLE && index < 0) {
            throw new IllegalArgumentException("Variable token requires a non-negative index, got: " + index);
        }
        if (type != TokenType.VARIABLE) {
            index = NO_INDEX;
        }
    }

    public static Token of(TokenType type, int start, int end) {
        return new Token(type, start, end, NO_INDEX);
    }

    public static Token variable(int index, int start, int end) {
        return new Token(TokenType.VARIABLE, start, end, index);
    }

    public static Token eof(int position) {
        return new Token(TokenType.EOF, position, position, NO_INDEX);
    }
}
