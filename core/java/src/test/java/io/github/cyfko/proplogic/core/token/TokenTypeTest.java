package io.github.cyfko.proplogic.core.token;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TokenTypeTest {

    @Test
    @DisplayName("Priority table orders connectives and places EOF below all of them")
    void shouldOrderPriorities() {
        assertEquals(-1, TokenType.EOF.priority());
        assertEquals(0, TokenType.IFF.priority());
        assertEquals(1, TokenType.IMPLIES.priority());
        assertEquals(2, TokenType.OR.priority());
        assertEquals(3, TokenType.AND.priority());
    }

    @ParameterizedTest
    @DisplayName("Non-operators have no priority")
    @EnumSource(value = TokenType.class, names = {"TRUE", "FALSE", "VARIABLE", "OPEN_PAREN", "CLOSE_PAREN", "NOT"})
    void shouldRejectPriorityOfNonOperator(TokenType type) {
        assertThrows(IllegalStateException.class, type::priority);
    }

    @ParameterizedTest
    @DisplayName("Classification is exclusive")
    @EnumSource(TokenType.class)
    void shouldClassifyExclusively(TokenType type) {
        assertFalse(type.isOperand() && type.isBinaryConnective());
    }

    @Test
    @DisplayName("Operands are constants and variables")
    void shouldClassifyOperands() {
        assertTrue(TokenType.TRUE.isOperand());
        assertTrue(TokenType.FALSE.isOperand());
        assertTrue(TokenType.VARIABLE.isOperand());
        assertFalse(TokenType.NOT.isOperand());
        assertFalse(TokenType.NOT.isBinaryConnective());
        assertFalse(TokenType.EOF.isBinaryConnective());
    }

    @Test
    @DisplayName("Token rejects invalid ranges and index-less variables")
    void shouldValidateTokens() {
        assertThrows(IllegalArgumentException.class, () -> Token.of(TokenType.AND, 3, 2));
        assertThrows(IllegalArgumentException.class, () -> Token.of(TokenType.AND, -1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Token(TokenType.VARIABLE, 0, 1, -1));
        assertEquals(Token.NO_INDEX, new Token(TokenType.AND, 0, 2, 7).index());
    }
}
