package io.github.cyfko.proplogic.core.token;

import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;

import java.util.*;
import java.util.logging.Logger;

/**
 * Default {@link TokenSource} for propositional formulas.
 * <p>
 * Accepts several spellings of every connective so that formulas can be typed in ASCII,
 * copied from a textbook in Unicode, or written out in words.
 * </p>
 *
 * <h2>Recognised Lexemes</h2>
 * <table border="1">
 * <caption>Token spellings</caption>
 * <thead>
 * <tr><th>Kind</th><th>Spellings</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>TRUE</td><td>T, true, ⊤</td></tr>
 * <tr><td>FALSE</td><td>F, false, ⊥</td></tr>
 * <tr><td>NOT</td><td>~, !, ¬, not</td></tr>
 * <tr><td>AND</td><td>/\, &amp;&amp;, &amp;, ∧, and</td></tr>
 * <tr><td>OR</td><td>\/, ||, |, ∨, or</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;, =&gt;, →, implies</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;, &lt;=&gt;, ↔, iff</td></tr>
 * <tr><td>VARIABLE</td><td>[A-Za-z_][A-Za-z0-9_]* other than the words above</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Variable indices are assigned after the whole input is read, in lexicographic order of the
 * variable names, so {@code "q /\ p"} maps {@code p} to 0 and {@code q} to 1.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ScanResult result = new FormulaScanner().scan("p -> (q \\/ ~r)");
 * result.tokens();     // VARIABLE, IMPLIES, OPEN_PAREN, VARIABLE, OR, NOT, VARIABLE, CLOSE_PAREN, EOF
 * result.variables();  // {0=p, 1=q, 2=r}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class FormulaScanner implements TokenSource {

    private static final Logger logger = Logger.getLogger(FormulaScanner.class.getName());

    private static final Map<String, TokenType> KEYWORDS = Map.of(
            "T", TokenType.TRUE,
            "F", TokenType.FALSE,
            "true", TokenType.TRUE,
            "false", TokenType.FALSE,
            "not", TokenType.NOT,
            "and", TokenType.AND,
            "or", TokenType.OR,
            "implies", TokenType.IMPLIES,
            "iff", TokenType.IFF
    );

    // Longest spellings first: "&&" must win over "&".
    private static final List<Map.Entry<String, TokenType>> SYMBOLS = List.of(
            Map.entry("<->", TokenType.IFF),
            Map.entry("<=>", TokenType.IFF),
            Map.entry("->", TokenType.IMPLIES),
            Map.entry("=>", TokenType.IMPLIES),
            Map.entry("/\\", TokenType.AND),
            Map.entry("\\/", TokenType.OR),
            Map.entry("&&", TokenType.AND),
            Map.entry("||", TokenType.OR),
            Map.entry("&", TokenType.AND),
            Map.entry("|", TokenType.OR),
            Map.entry("~", TokenType.NOT),
            Map.entry("!", TokenType.NOT),
            Map.entry("¬", TokenType.NOT),
            Map.entry("∧", TokenType.AND),
            Map.entry("∨", TokenType.OR),
            Map.entry("→", TokenType.IMPLIES),
            Map.entry("↔", TokenType.IFF),
            Map.entry("⊤", TokenType.TRUE),
            Map.entry("⊥", TokenType.FALSE),
            Map.entry("(", TokenType.OPEN_PAREN),
            Map.entry(")", TokenType.CLOSE_PAREN)
    );

    private static final String OPERATOR_CHARS = "<>-=/\\";

    @Override
    public ScanResult scan(String input) throws FormulaSyntaxException {
        Objects.requireNonNull(input, "input");

        List<Lexeme> lexemes = new ArrayList<>();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isIdentifierStart(c)) {
                int end = i + 1;
                while (end < input.length() && isIdentifierPart(input.charAt(end))) end++;
                String word = input.substring(i, end);
                TokenType keyword = KEYWORDS.get(word);
                lexemes.add(keyword != null
                        ? new Lexeme(keyword, i, end, null)
                        : new Lexeme(TokenType.VARIABLE, i, end, word));
                i = end;
                continue;
            }

            Map.Entry<String, TokenType> symbol = matchSymbol(input, i);
            if (symbol != null) {
                int end = i + symbol.getKey().length();
                lexemes.add(new Lexeme(symbol.getValue(), i, end, null));
                i = end;
                continue;
            }

            if (OPERATOR_CHARS.indexOf(c) >= 0) {
                int end = i + 1;
                while (end < input.length() && OPERATOR_CHARS.indexOf(input.charAt(end)) >= 0) end++;
                throw new FormulaSyntaxException("Unknown operator.", i, end);
            }

            throw new FormulaSyntaxException("Unexpected character.", i, i + 1);
        }

        return assignIndices(lexemes, input.length());
    }

    private static ScanResult assignIndices(List<Lexeme> lexemes, int length) {
        SortedSet<String> names = new TreeSet<>();
        for (Lexeme lexeme : lexemes) {
            if (lexeme.name() != null) names.add(lexeme.name());
        }

        Map<String, Integer> indexOf = new HashMap<>(names.size());
        Map<Integer, String> variables = new LinkedHashMap<>(names.size());
        for (String name : names) {
            indexOf.put(name, variables.size());
            variables.put(variables.size(), name);
        }

        List<Token> tokens = new ArrayList<>(lexemes.size() + 1);
        for (Lexeme lexeme : lexemes) {
            tokens.add(lexeme.type() == TokenType.VARIABLE
                    ? Token.variable(indexOf.get(lexeme.name()), lexeme.start(), lexeme.end())
                    : Token.of(lexeme.type(), lexeme.start(), lexeme.end()));
        }
        tokens.add(Token.eof(length));

        logger.fine(() -> String.format("Scanned %d tokens, %d variables", tokens.size(), variables.size()));
        return new ScanResult(tokens, variables);
    }

    private static Map.Entry<String, TokenType> matchSymbol(String input, int position) {
        for (Map.Entry<String, TokenType> symbol : SYMBOLS) {
            if (input.startsWith(symbol.getKey(), position)) {
                return symbol;
            }
        }
        return null;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private record Lexeme(TokenType type, int start, int end, String name) {}
}
