package io.github.cyfko.proplogic.core.token;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a {@link TokenSource}: the ordered token sequence and the variable table.
 * <p>
 * A well-formed scan result ends with exactly one {@link TokenType#EOF} token. The parser relies on
 * it; a sequence without it is treated as an internal fault rather than a syntax error.
 * </p>
 *
 * @param tokens    ordered tokens, terminated by EOF
 * @param variables variable index to source name
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ScanResult(List<Token> tokens, Map<Integer, String> variables) {

    public ScanResult {
        tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
        variables = Map.copyOf(Objects.requireNonNull(variables, "variables"));
    }
}
