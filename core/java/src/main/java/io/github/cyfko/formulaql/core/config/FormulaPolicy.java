package io.github.cyfko.formulaql.core.config;

/**
 * Limits and leniency settings applied when parsing formula text.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: maximum character length of formula text</li>
 *   <li><strong>maxNestingDepth</strong>: maximum depth of nested parentheses and function calls</li>
 *   <li><strong>rejectUnrecognizedInput</strong>: when {@code true}, input the tokenizer cannot
 *       recognize fails the parse instead of being dropped with a diagnostic</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (lenient, suited to live editing)
 * FormulaPolicy policy = FormulaPolicy.defaults();
 *
 * // Strict (for formulas submitted through public APIs)
 * FormulaPolicy policy = FormulaPolicy.strict();
 *
 * // Relaxed (for internal trusted systems)
 * FormulaPolicy policy = FormulaPolicy.relaxed();
 *
 * // Custom
 * FormulaPolicy policy = FormulaPolicy.builder()
 *     .maxNestingDepth(16)
 *     .build();
 * }</pre>
 *
 * @param policyName              name reported in limit violation messages
 * @param maxExpressionLength     maximum character length of formula text
 * @param maxNestingDepth         maximum nesting depth of groups and function calls
 * @param rejectUnrecognizedInput fail instead of dropping unrecognized input
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FormulaPolicy(
        String policyName,
        int maxExpressionLength,
        int maxNestingDepth,
        boolean rejectUnrecognizedInput
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public FormulaPolicy {
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
     * Default configuration.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 64</li>
     *   <li>Unrecognized Input: dropped, reported as a diagnostic</li>
     * </ul>
     *
     * @return default configuration
     */
    public static FormulaPolicy defaults() {
        return new FormulaPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 64, false);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 32</li>
     *   <li>Unrecognized Input: rejected</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static FormulaPolicy strict() {
        return new FormulaPolicy(PolicyName.STRICT_POLICY.name(), 1000, 32, true);
    }

    /**
     * Relaxed configuration for trusted batch processing.
     * <ul>
     *   <li>Max Expression Length: 20000 characters</li>
     *   <li>Max Nesting Depth: 128</li>
     *   <li>Unrecognized Input: dropped, reported as a diagnostic</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static FormulaPolicy relaxed() {
        return new FormulaPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 128, false);
    }

    /**
     * Creates a custom configuration. Builder values start from {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 64;
        private boolean _rejectUnrecognizedInput = false;

        private Builder() {}

        public FormulaPolicy build() {
            return new FormulaPolicy(_policyName, _maxExpressionLength, _maxNestingDepth, _rejectUnrecognizedInput);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
        public Builder rejectUnrecognizedInput(boolean reject) { this._rejectUnrecognizedInput = reject; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
