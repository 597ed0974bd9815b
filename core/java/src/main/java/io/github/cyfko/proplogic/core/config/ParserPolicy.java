package io.github.cyfko.proplogic.core.config;

/**
 * Input limits applied by {@link io.github.cyfko.proplogic.core.impl.BasicFormulaParser}.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the formula (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum number of connectives on any root-to-leaf path
 *       of the parsed tree (default: 500)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * ParserPolicy policy = ParserPolicy.defaults();
 *
 * // Strict (for formulas typed by untrusted users)
 * ParserPolicy policy = ParserPolicy.strict();
 *
 * // Relaxed (for generated formulas)
 * ParserPolicy policy = ParserPolicy.relaxed();
 *
 * // Custom
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxExpressionLength(20000)
 *     .maxNestingDepth(800)
 *     .build();
 * }</pre>
 *
 * <p>
 * The depth limit exists because printing, evaluating and hashing a tree recurse once per level,
 * while the parser itself does not. A short formula such as {@code ~~~~...p} can be arbitrarily
 * deep.
 * </p>
 *
 * @param policyName          name reported in diagnostics
 * @param maxExpressionLength maximum character length of the formula text
 * @param maxNestingDepth     maximum depth of the parsed tree
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration: 5000 characters, depth 500.
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 500);
    }

    /**
     * Strict configuration for untrusted input: 1000 characters, depth 100.
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 100);
    }

    /**
     * Relaxed configuration for trusted or machine-generated input: 10000 characters, depth 1000.
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 1000);
    }

    /**
     * Creates a custom configuration.
     * <p>
     * Builder parameters are initialized exactly as in {@link #defaults()}, except for the name.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 500;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
