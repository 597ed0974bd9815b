package io.github.cyfko.proplogic.core.token;

import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;

/**
 * Contract of the component that turns raw formula text into tokens.
 * <p>
 * Implementations own all character-level lexing and the assignment of variable indices.
 * The parser never inspects characters, only token kinds, ranges and indices.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The returned sequence is terminated by exactly one {@link TokenType#EOF} token</li>
 *   <li>Every {@link TokenType#VARIABLE} token's index is a key of the variable table</li>
 *   <li>Equal variable names map to the same index</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see FormulaScanner
 */
@FunctionalInterface
public interface TokenSource {

    /**
     * Scans the given text.
     *
     * @param input the formula text, never {@code null}
     * @return the tokens and variable table
     * @throws FormulaSyntaxException if the text contains a character sequence that is not a token
     */
    ScanResult scan(String input) throws FormulaSyntaxException;
}
