package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.FormulaParser;
import io.github.cyfko.proplogic.core.ast.Nodes;
import io.github.cyfko.proplogic.core.cache.BoundedLRUCache;
import io.github.cyfko.proplogic.core.config.CachePolicy;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.FormulaSyntaxException;
import io.github.cyfko.proplogic.core.model.ParseResult;
import io.github.cyfko.proplogic.core.model.SyntaxError;
import io.github.cyfko.proplogic.core.parsing.ShuntingYardParser;
import io.github.cyfko.proplogic.core.token.FormulaScanner;
import io.github.cyfko.proplogic.core.token.ScanResult;
import io.github.cyfko.proplogic.core.token.TokenSource;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Default {@link FormulaParser}: scans the text, then runs the {@link ShuntingYardParser}.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><strong>Limits</strong>: rejects text longer than {@link ParserPolicy#maxExpressionLength()}</li>
 *   <li><strong>Scan</strong>: {@link TokenSource#scan(String)} produces tokens and the variable table</li>
 *   <li><strong>Parse</strong>: {@link ShuntingYardParser#parse(ScanResult)} builds the AST</li>
 *   <li><strong>Depth</strong>: rejects trees deeper than {@link ParserPolicy#maxNestingDepth()}</li>
 * </ol>
 *
 * <h2>Caching</h2>
 * <p>
 * Results, including failures, are immutable and depend only on the input text, so they are kept in
 * a {@link BoundedLRUCache} keyed by that text when {@link CachePolicy#cacheEnabled()} is set.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Each call owns its own parser stacks; the cache is the only shared state and is lock-guarded.
 * Instances may be shared between threads provided the {@link TokenSource} is stateless, which
 * {@link FormulaScanner} is.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * // Default configuration
 * FormulaParser parser = new BasicFormulaParser();
 *
 * // Strict limits, no cache
 * FormulaParser strict = new BasicFormulaParser(ParserPolicy.strict(), CachePolicy.none());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicFormulaParser implements FormulaParser {

    private static final Logger logger = Logger.getLogger(BasicFormulaParser.class.getName());

    private final TokenSource tokenSource;
    private final ParserPolicy parserPolicy;
    private final CachePolicy cachePolicy;
    protected final BoundedLRUCache<String, ParseResult> cache;

    /**
     * Default constructor using {@link FormulaScanner}, {@link ParserPolicy#defaults()} and
     * {@link CachePolicy#defaults()}.
     */
    public BasicFormulaParser() {
        this(new FormulaScanner(), ParserPolicy.defaults(), CachePolicy.defaults());
    }

    /**
     * Constructor with custom limits and caching, using {@link FormulaScanner}.
     *
     * @param parserPolicy the input limits
     * @param cachePolicy  the cache settings
     * @throws IllegalArgumentException if a policy is null
     */
    public BasicFormulaParser(ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        this(new FormulaScanner(), parserPolicy, cachePolicy);
    }

    /**
     * Constructor with a custom token source.
     *
     * @param tokenSource  the scanner producing tokens and the variable table
     * @param parserPolicy the input limits
     * @param cachePolicy  the cache settings
     * @throws IllegalArgumentException if any argument is null
     */
    public BasicFormulaParser(TokenSource tokenSource, ParserPolicy parserPolicy, CachePolicy cachePolicy) {
        if (tokenSource == null) {
            throw new IllegalArgumentException("Token source is required");
        }

        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }

        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy is required");
        }

        this.tokenSource = tokenSource;
        this.parserPolicy = parserPolicy;
        this.cachePolicy = cachePolicy;
        this.cache = cachePolicy.cacheEnabled()
            ? new BoundedLRUCache<>(cachePolicy.cacheSize())
            : null;
    }

    @Override
    public ParseResult parse(String input) {
        Objects.requireNonNull(input, "input");

        if (cache == null) {
            return parseUncached(input);
        }

        ParseResult cached = cache.get(input);
        if (cached != null) {
            logger.fine(() -> "Cache hit for formula: " + input);
            return cached;
        }
        return cache.computeIfAbsent(input, this::parseUncached);
    }

    /**
     * Clears the result cache (if enabled).
     */
    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    /**
     * Returns cache statistics (if caching is enabled).
     *
     * @return map containing cache statistics, or {@code enabled=false} if the cache is disabled
     */
    public Map<String, Object> getCacheStats() {
        if (cache == null) {
            return Map.of("enabled", false);
        }

        return Map.of(
            "enabled", true,
            "size", cache.size(),
            "maxSize", cachePolicy.cacheSize()
        );
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    private ParseResult parseUncached(String input) {
        int max = parserPolicy.maxExpressionLength();
        if (input.length() > max) {
            logger.fine(() -> String.format("Formula rejected by %s: %d characters", parserPolicy.policyName(), input.length()));
            return ParseResult.failure(new SyntaxError(
                    String.format("Expression too long (%d characters, max: %d).", input.length(), max),
                    max, input.length()));
        }

        ScanResult scanResult;
        try {
            scanResult = tokenSource.scan(input);
        } catch (FormulaSyntaxException e) {
            logger.fine(() -> "Scan rejected: " + e.getError());
            return ParseResult.failure(e.getError());
        }

        ParseResult result = ShuntingYardParser.parse(scanResult);
        if (!result.isSuccess()) {
            return result;
        }

        int depth = Nodes.depth(result.getFormula().ast());
        int maxDepth = parserPolicy.maxNestingDepth();
        if (depth > maxDepth) {
            logger.fine(() -> String.format("Formula rejected by %s: depth %d", parserPolicy.policyName(), depth));
            return ParseResult.failure(new SyntaxError(
                    String.format("Formula nested too deeply (%d levels, max: %d).", depth, maxDepth),
                    0, input.length()));
        }

        logger.fine(() -> String.format("Parsed formula with %d variables: %s",
                scanResult.variables().size(), input));
        return result;
    }
}
