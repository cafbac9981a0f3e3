package io.github.cyfko.keyflat.core.config;

/**
 * Operational limits and modes for flattening and unflattening.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>maxDepth</strong>: Maximum nesting depth walked or rebuilt (default: 512)</li>
 *   <li><strong>conflictPolicy</strong>: Handling of leaf/container disagreements (default: OVERWRITE)</li>
 *   <li><strong>listRestoreMode</strong>: Whether unflattening rebuilds lists (default: RESTORE_LISTS)</li>
 *   <li><strong>inferListsFromKeys</strong>: Treat maps keyed {@code 0..n-1} as lists when flattening (default: false)</li>
 *   <li><strong>startKeyMatching</strong>: How the start key is removed when unflattening (default: CHARACTER_SET)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (matches the historical behaviour, plus list restoration)
 * FlatPolicy policy = FlatPolicy.defaults();
 *
 * // Strict (untrusted flat input)
 * FlatPolicy policy = FlatPolicy.strict();
 *
 * // Relaxed (deep trusted documents, untyped sources)
 * FlatPolicy policy = FlatPolicy.relaxed();
 *
 * // Custom
 * FlatPolicy policy = FlatPolicy.builder()
 *     .maxDepth(100)
 *     .conflictPolicy(ConflictPolicy.STRICT)
 *     .build();
 * }</pre>
 *
 * @param policyName         name of the policy, reported in limit errors
 * @param maxDepth           maximum nesting depth, must be positive
 * @param conflictPolicy     leaf/container disagreement handling
 * @param listRestoreMode    container type produced for index-keyed levels
 * @param inferListsFromKeys whether maps keyed {@code 0..n-1} are flattened as lists
 * @param startKeyMatching   start key removal strategy
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FlatPolicy(
        String policyName,
        int maxDepth,
        ConflictPolicy conflictPolicy,
        ListRestoreMode listRestoreMode,
        boolean inferListsFromKeys,
        StartKeyMatching startKeyMatching
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is invalid
     */
    public FlatPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive, got: " + maxDepth);
        }
        if (conflictPolicy == null) {
            throw new IllegalArgumentException("conflictPolicy is required");
        }
        if (listRestoreMode == null) {
            throw new IllegalArgumentException("listRestoreMode is required");
        }
        if (startKeyMatching == null) {
            throw new IllegalArgumentException("startKeyMatching is required");
        }
    }

    /**
     * Default policy.
     * <ul>
     *   <li>Max Depth: 512</li>
     *   <li>Conflicts: OVERWRITE</li>
     *   <li>Lists: RESTORE_LISTS</li>
     *   <li>List inference: disabled</li>
     *   <li>Start key: CHARACTER_SET</li>
     * </ul>
     *
     * @return default policy
     */
    public static FlatPolicy defaults() {
        return new FlatPolicy(PolicyName.DEFAULT_POLICY.name(), 512,
                ConflictPolicy.OVERWRITE, ListRestoreMode.RESTORE_LISTS, false, StartKeyMatching.CHARACTER_SET);
    }

    /**
     * Strict policy for flat input coming from untrusted sources.
     * <ul>
     *   <li>Max Depth: 64</li>
     *   <li>Conflicts: STRICT</li>
     *   <li>Lists: RESTORE_LISTS</li>
     *   <li>List inference: disabled</li>
     *   <li>Start key: LITERAL_PREFIX</li>
     * </ul>
     *
     * @return strict policy
     */
    public static FlatPolicy strict() {
        return new FlatPolicy(PolicyName.STRICT_POLICY.name(), 64,
                ConflictPolicy.STRICT, ListRestoreMode.RESTORE_LISTS, false, StartKeyMatching.LITERAL_PREFIX);
    }

    /**
     * Relaxed policy for deep, trusted documents from untyped sources.
     * <ul>
     *   <li>Max Depth: 2048</li>
     *   <li>Conflicts: OVERWRITE</li>
     *   <li>Lists: RESTORE_LISTS</li>
     *   <li>List inference: enabled</li>
     *   <li>Start key: CHARACTER_SET</li>
     * </ul>
     *
     * @return relaxed policy
     */
    public static FlatPolicy relaxed() {
        return new FlatPolicy(PolicyName.RELAXED_POLICY.name(), 2048,
                ConflictPolicy.OVERWRITE, ListRestoreMode.RESTORE_LISTS, true, StartKeyMatching.CHARACTER_SET);
    }

    /**
     * Creates a custom policy. Builder settings start from the values of {@link #defaults()}.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxDepth = 512;
        private ConflictPolicy _conflictPolicy = ConflictPolicy.OVERWRITE;
        private ListRestoreMode _listRestoreMode = ListRestoreMode.RESTORE_LISTS;
        private boolean _inferListsFromKeys = false;
        private StartKeyMatching _startKeyMatching = StartKeyMatching.CHARACTER_SET;

        private Builder() {}

        public FlatPolicy build() {
            return new FlatPolicy(_policyName, _maxDepth, _conflictPolicy, _listRestoreMode,
                    _inferListsFromKeys, _startKeyMatching);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxDepth(int maxDepth) { this._maxDepth = maxDepth; return this; }
        public Builder conflictPolicy(ConflictPolicy conflictPolicy) { this._conflictPolicy = conflictPolicy; return this; }
        public Builder listRestoreMode(ListRestoreMode listRestoreMode) { this._listRestoreMode = listRestoreMode; return this; }
        public Builder inferListsFromKeys(boolean infer) { this._inferListsFromKeys = infer; return this; }
        public Builder startKeyMatching(StartKeyMatching startKeyMatching) { this._startKeyMatching = startKeyMatching; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
