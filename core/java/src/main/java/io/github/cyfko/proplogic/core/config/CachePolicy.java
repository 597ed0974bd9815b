package io.github.cyfko.proplogic.core.config;

/**
 * Configuration of the parse-result cache of {@link io.github.cyfko.proplogic.core.impl.BasicFormulaParser}.
 * <p>
 * Parse results are immutable, so a formula typed repeatedly (a truth-table UI re-parsing on every
 * keystroke, for instance) can be answered from the cache without scanning again.
 * </p>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * CachePolicy.defaults();   // enabled, 1000 entries
 * CachePolicy.strict();     // enabled, 500 entries
 * CachePolicy.relaxed();    // enabled, 2000 entries
 * CachePolicy.none();       // disabled
 * CachePolicy.custom(64);   // enabled, 64 entries
 * }</pre>
 *
 * @param cacheEnabled whether results are cached
 * @param cacheSize    maximum number of cached results
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record CachePolicy(
        boolean cacheEnabled,
        int cacheSize
) {

    public CachePolicy {
        if (cacheSize <= 0) {
            throw new IllegalArgumentException("cacheSize must be positive, got: " + cacheSize);
        }
    }

    /**
     * Pairs with {@link ParserPolicy#defaults()}: room for the formulas of a typical exercise set,
     * each up to 5000 characters.
     *
     * @return the default cache configuration
     */
    public static CachePolicy defaults() {
        return new CachePolicy(true, 1000);
    }

    /**
     * Pairs with {@link ParserPolicy#strict()}. Input comes from untrusted users who can submit many
     * distinct formulas, so fewer entries are kept to bound memory.
     *
     * @return the strict cache configuration
     */
    public static CachePolicy strict() {
        return new CachePolicy(true, 500);
    }

    /**
     * Pairs with {@link ParserPolicy#relaxed()}. Generated formulas tend to repeat, for instance when
     * a checker re-parses the same candidate against many truth tables.
     *
     * @return the relaxed cache configuration
     */
    public static CachePolicy relaxed() {
        return new CachePolicy(true, 2000);
    }

    /**
     * Disables caching: every call scans and parses again. Useful when each formula is seen once.
     *
     * @return a CachePolicy with caching disabled
     */
    public static CachePolicy none() {
        return new CachePolicy(false, 1);
    }

    /**
     * @param cacheSize maximum number of cached parse results
     * @return an enabled cache of the given size
     * @throws IllegalArgumentException if {@code cacheSize} is not positive
     */
    public static CachePolicy custom(int cacheSize) {
        return new CachePolicy(true, cacheSize);
    }
}
