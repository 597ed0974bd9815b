package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.ast.Nodes;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.proplogic.core.model.ParseResult;
import io.github.cyfko.proplogic.core.model.SyntaxError;
import io.github.cyfko.proplogic.core.print.FormulaPrinter;
import io.github.cyfko.proplogic.core.token.ScanResult;
import io.github.cyfko.proplogic.core.token.Token;
import io.github.cyfko.proplogic.core.token.TokenSource;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link BasicFormulaParser}: the scan-then-parse pipeline, input limits and caching.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
class BasicFormulaParserTest {

    private BasicFormulaParser parser;

    @BeforeEach
    void setUp() {
        parser = new BasicFormulaParser();
    }

    @Nested
    @DisplayName("Valid Formulas - Integration Tests")
    class ValidFormulaTests {

        @Test
        @DisplayName("Should parse a formula with every connective")
        void shouldParseEveryConnective() {
            ParseResult result = parser.parse("~(p /\\ q) \\/ r -> T <-> F");

            assertTrue(result.isSuccess());
            assertEquals(
                    Nodes.iff(
                            Nodes.implies(
                                    Nodes.or(Nodes.not(Nodes.and(Nodes.variable(0), Nodes.variable(1))), Nodes.variable(2)),
                                    Nodes.trueNode()),
                            Nodes.falseNode()),
                    result.getFormula().ast());
            assertEquals(Map.of(0, "p", 1, "q", 2, "r"), result.getFormula().variables());
        }

        @Test
        @DisplayName("Should accept alternative spellings")
        void shouldAcceptAlternativeSpellings() {
            ParseResult ascii = parser.parse("~p /\\ q -> r");
            ParseResult words = parser.parse("not p and q implies r");
            ParseResult unicode = parser.parse("¬p ∧ q → r");

            assertEquals(ascii.getFormula(), words.getFormula());
            assertEquals(ascii.getFormula(), unicode.getFormula());
        }
    }

    @Nested
    @DisplayName("Invalid Formulas")
    class InvalidFormulaTests {

        @ParameterizedTest
        @DisplayName("Should report the located syntax error")
        @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "\"\"     | The input is empty.                                                | 0 | 0",
            "(      | This open parenthesis has no matching close parenthesis.          | 0 | 1",
            "p)     | This close parenthesis doesn't match any open parenthesis.        | 1 | 2",
            "~      | This operator is missing an operand.                              | 0 | 1",
            "()     | We were expecting a variable, constant, or open parenthesis here. | 1 | 2",
            "(~)    | Nothing is negated by this operator.                              | 1 | 2",
            "(p     | No matching close parenthesis for this open parenthesis.          | 0 | 1",
            "p # q  | Unexpected character.                                             | 2 | 3"
        })
        void shouldReportSyntaxError(String input, String description, int start, int end) {
            ParseResult result = parser.parse(input);

            assertFalse(result.isSuccess());
            assertEquals(new SyntaxError(description, start, end), result.getError());
        }

        @Test
        @DisplayName("Should raise the error through orElseThrow")
        void shouldThrowOnDemand() {
            FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                    () -> parser.parse("p /\\").orElseThrow());
            assertEquals(2, e.getStart());
            assertEquals(4, e.getEnd());
        }

        @Test
        @DisplayName("Should reject null input")
        void shouldRejectNull() {
            assertThrows(NullPointerException.class, () -> parser.parse(null));
        }
    }

    @Nested
    @DisplayName("Input Limits")
    class InputLimitTests {

        @Test
        @DisplayName("Should reject formulas longer than the policy allows")
        void shouldRejectTooLongFormula() {
            BasicFormulaParser limited = new BasicFormulaParser(
                    ParserPolicy.builder().maxExpressionLength(5).build(), CachePolicy.none());

            ParseResult result = limited.parse("p /\\ q /\\ r");

            assertFalse(result.isSuccess());
            assertEquals(5, result.getError().start());
            assertEquals(11, result.getError().end());
            assertTrue(result.getError().description().startsWith("Expression too long (11 characters, max: 5)"));
        }

        @Test
        @DisplayName("Should accept a formula exactly at the limit")
        void shouldAcceptFormulaAtLimit() {
            BasicFormulaParser limited = new BasicFormulaParser(
                    ParserPolicy.builder().maxExpressionLength(6).build(), CachePolicy.none());

            assertTrue(limited.parse("p -> q").isSuccess());
        }

        @Test
        @DisplayName("Should reject negation stacks deeper than the policy allows")
        void shouldRejectTooDeepFormula() {
            BasicFormulaParser relaxed = new BasicFormulaParser(ParserPolicy.relaxed(), CachePolicy.none());
            String input = "~".repeat(9999) + "p";

            ParseResult result = relaxed.parse(input);

            assertFalse(result.isSuccess());
            assertEquals(new SyntaxError("Formula nested too deeply (9999 levels, max: 1000).", 0, 10000),
                    result.getError());
        }

        @Test
        @DisplayName("Should print and reparse a formula at the depth limit")
        void shouldHandleFormulaAtDepthLimit() {
            BasicFormulaParser relaxed = new BasicFormulaParser(ParserPolicy.relaxed(), CachePolicy.none());
            String input = "~".repeat(1000) + "p";

            ParseResult result = relaxed.parse(input);
            assertTrue(result.isSuccess());

            String printed = FormulaPrinter.ascii().print(result.getFormula());
            assertEquals(input, printed);
            assertEquals(result.getFormula().ast(), relaxed.parse(printed).getFormula().ast());
        }

        @Test
        @DisplayName("Should apply the depth limit to connective chains too")
        void shouldRejectDeepChain() {
            BasicFormulaParser limited = new BasicFormulaParser(
                    ParserPolicy.builder().maxNestingDepth(2).build(), CachePolicy.none());

            assertTrue(limited.parse("p -> q -> r").isSuccess());
            ParseResult result = limited.parse("p -> q -> r -> s");
            assertFalse(result.isSuccess());
            assertTrue(result.getError().description().startsWith("Formula nested too deeply (3 levels, max: 2)"));
        }
    }

    @Nested
    @DisplayName("Caching")
    @ExtendWith(MockitoExtension.class)
    class CachingTests {

        @Mock
        private TokenSource tokenSource;

        private final ScanResult scanOfP = new ScanResult(List.of(Token.variable(0, 0, 1), Token.eof(1)), Map.of(0, "p"));

        @Test
        @DisplayName("Should scan a repeated formula only once")
        void shouldServeRepeatedFormulaFromCache() {
            when(tokenSource.scan("p")).thenReturn(scanOfP);
            BasicFormulaParser cached = new BasicFormulaParser(tokenSource, ParserPolicy.defaults(), CachePolicy.custom(8));

            ParseResult first = cached.parse("p");
            ParseResult second = cached.parse("p");

            assertSame(first, second);
            verify(tokenSource, times(1)).scan("p");
            assertEquals(Map.of("enabled", true, "size", 1, "maxSize", 8), cached.getCacheStats());
        }

        @Test
        @DisplayName("Should cache failures as well")
        void shouldCacheFailures() {
            when(tokenSource.scan("p #")).thenThrow(new FormulaSyntaxException("Unexpected character.", 2, 3));
            BasicFormulaParser cached = new BasicFormulaParser(tokenSource, ParserPolicy.defaults(), CachePolicy.defaults());

            assertFalse(cached.parse("p #").isSuccess());
            assertFalse(cached.parse("p #").isSuccess());
            verify(tokenSource, times(1)).scan("p #");
        }

        @Test
        @DisplayName("Should rescan after clearCache")
        void shouldRescanAfterClear() {
            when(tokenSource.scan("p")).thenReturn(scanOfP);
            BasicFormulaParser cached = new BasicFormulaParser(tokenSource, ParserPolicy.defaults(), CachePolicy.defaults());

            cached.parse("p");
            cached.clearCache();
            cached.parse("p");

            verify(tokenSource, times(2)).scan("p");
        }

        @Test
        @DisplayName("Should scan every time when caching is disabled")
        void shouldNotCacheWhenDisabled() {
            when(tokenSource.scan("p")).thenReturn(scanOfP);
            BasicFormulaParser uncached = new BasicFormulaParser(tokenSource, ParserPolicy.defaults(), CachePolicy.none());

            uncached.parse("p");
            uncached.parse("p");

            verify(tokenSource, times(2)).scan("p");
            assertEquals(Map.of("enabled", false), uncached.getCacheStats());
        }

        @Test
        @DisplayName("Should not scan input rejected by the length limit")
        void shouldNotScanTooLongInput() {
            BasicFormulaParser limited = new BasicFormulaParser(
                    tokenSource, ParserPolicy.builder().maxExpressionLength(1).build(), CachePolicy.none());

            assertFalse(limited.parse("p /\\ q").isSuccess());
            verifyNoInteractions(tokenSource);
        }
    }

    @Test
    @DisplayName("Should require every collaborator")
    void shouldRequireCollaborators() {
        TokenSource source = input -> null;
        assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(null, ParserPolicy.defaults(), CachePolicy.defaults()));
        assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(source, null, CachePolicy.defaults()));
        assertThrows(IllegalArgumentException.class, () -> new BasicFormulaParser(source, ParserPolicy.defaults(), null));
    }
}
