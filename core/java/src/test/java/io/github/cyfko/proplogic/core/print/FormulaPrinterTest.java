package io.github.cyfko.proplogic.core.print;

import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.ast.Node;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.impl.BasicFormulaParser;
import io.github.cyfko.proplogic.core.model.ParsedFormula;
import io.github.cyfko.proplogic.core.token.TokenType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static io.github.cyfko.proplogic.core.ast.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormulaPrinter Tests")
class FormulaPrinterTest {

    private static final Map<Integer, String> PQR = Map.of(0, "p", 1, "q", 2, "r");
    private static final Node P = variable(0);
    private static final Node Q = variable(1);
    private static final Node R = variable(2);

    private final FormulaParser parser = new BasicFormulaParser(ParserPolicy.defaults(), CachePolicy.none());

    @Nested
    @DisplayName("Parenthesisation")
    class ParenthesisationTests {

        @Test
        @DisplayName("Right-nested chain needs no parentheses")
        void testRightChain() {
            assertEquals("p -> q -> r", FormulaPrinter.ascii().print(implies(P, implies(Q, R)), PQR));
        }

        @Test
        @DisplayName("Left-nested chain keeps its parentheses")
        void testLeftChain() {
            assertEquals("(p -> q) -> r", FormulaPrinter.ascii().print(implies(implies(P, Q), R), PQR));
        }

        @Test
        @DisplayName("Tighter child needs no parentheses")
        void testTighterChild() {
            assertEquals("p /\\ q \\/ r", FormulaPrinter.ascii().print(or(and(P, Q), R), PQR));
        }

        @Test
        @DisplayName("Looser child is parenthesised")
        void testLooserChild() {
            assertEquals("(p \\/ q) /\\ r", FormulaPrinter.ascii().print(and(or(P, Q), R), PQR));
            assertEquals("p /\\ (q \\/ r)", FormulaPrinter.ascii().print(and(P, or(Q, R)), PQR));
        }

        @Test
        @DisplayName("Negated group and stacked negations")
        void testNegations() {
            assertEquals("~(p /\\ q)", FormulaPrinter.ascii().print(not(and(P, Q)), PQR));
            assertEquals("~~p", FormulaPrinter.ascii().print(not(not(P)), PQR));
            assertEquals("~p /\\ q", FormulaPrinter.ascii().print(and(not(P), Q), PQR));
        }

        @Test
        @DisplayName("Unicode symbols")
        void testUnicode() {
            assertEquals("⊤ ↔ ¬p ∨ ⊥", FormulaPrinter.unicode().print(iff(trueNode(), or(not(P), falseNode())), PQR));
        }

        @Test
        @DisplayName("Unknown variable index is rejected")
        void testUnknownVariable() {
            assertThrows(IllegalArgumentException.class, () -> FormulaPrinter.ascii().print(variable(7), PQR));
        }
    }

    @Nested
    @DisplayName("Reparsing printed output")
    class IdempotenceTests {

        @ParameterizedTest
        @DisplayName("Reparsing the printed form yields the same tree")
        @ValueSource(strings = {
            "p -> q -> r",
            "(p -> q) -> r",
            "p <-> q <-> r",
            "~(p /\\ q) \\/ ~~r",
            "((p \\/ q) /\\ (q \\/ r)) -> p <-> T",
            "not (a or b) implies (c iff ~F)",
            "¬(x ∧ y) ↔ ¬x ∨ ¬y"
        })
        void testReparse(String input) {
            ParsedFormula formula = parser.parse(input).orElseThrow();

            for (FormulaPrinter printer : new FormulaPrinter[]{FormulaPrinter.ascii(), FormulaPrinter.unicode()}) {
                String printed = printer.print(formula);
                ParsedFormula reparsed = parser.parse(printed).orElseThrow();

                assertEquals(formula.ast(), reparsed.ast(), () -> "Printed form: " + printed);
                assertEquals(formula.variables(), reparsed.variables());
                assertEquals(printed, printer.print(reparsed));
            }
        }
    }

    @Test
    @DisplayName("ASCII output spells every kind with its canonical token symbol")
    void testAsciiUsesTokenSymbols() {
        FormulaPrinter ascii = FormulaPrinter.ascii();
        assertEquals("p " + TokenType.AND.symbol() + " q", ascii.print(and(P, Q), PQR));
        assertEquals("p " + TokenType.OR.symbol() + " q", ascii.print(or(P, Q), PQR));
        assertEquals("p " + TokenType.IMPLIES.symbol() + " q", ascii.print(implies(P, Q), PQR));
        assertEquals("p " + TokenType.IFF.symbol() + " q", ascii.print(iff(P, Q), PQR));
        assertEquals(TokenType.NOT.symbol() + TokenType.TRUE.symbol(), ascii.print(not(trueNode()), PQR));
        assertEquals(TokenType.FALSE.symbol(), ascii.print(falseNode(), PQR));
    }
}
