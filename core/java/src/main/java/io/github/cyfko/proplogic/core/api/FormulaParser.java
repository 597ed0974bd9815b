package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.model.ParseResult;

/**
 * Parser transforming propositional-logic formula text into an AST and variable table.
 *
 * <h2>Grammar</h2>
 * <table border="1">
 * <caption>Connective Reference</caption>
 * <thead>
 * <tr><th>Connective</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(p \/ q)</td></tr>
 * <tr><td>NOT</td><td>~</td><td>Prefix</td><td>Right</td><td>~p</td></tr>
 * <tr><td>AND</td><td>/\</td><td>3</td><td>Right</td><td>p /\ q</td></tr>
 * <tr><td>OR</td><td>\/</td><td>2</td><td>Right</td><td>p \/ q</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>1</td><td>Right</td><td>p -&gt; q</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;</td><td>0</td><td>Right</td><td>p &lt;-&gt; q</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * Binary connectives of equal precedence group to the right, so {@code p -> q -> r} reads as
 * {@code p -> (q -> r)}.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * FormulaParser parser = new BasicFormulaParser();
 *
 * ParseResult ok = parser.parse("~(p /\\ q) -> r");
 * ok.getFormula().ast();        // Implies(Not(And(p, q)), r)
 * ok.getFormula().variables();  // {0=p, 1=q, 2=r}
 *
 * ParseResult ko = parser.parse("p)");
 * ko.getError();                // "This close parenthesis doesn't match any open parenthesis." [1, 2)
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ParseResult
 */
@FunctionalInterface
public interface FormulaParser {

    /**
     * Parses formula text.
     * <p>
     * Malformed input never throws: the first syntax error is returned inside the result.
     * </p>
     *
     * @param input the formula text
     * @return the parsed formula, or the located syntax error
     * @throws NullPointerException if input is null
     */
    ParseResult parse(String input);
}
