package io.forkline.core.analysis;

/// Configuration options for partition analysis.
///
/// ### Default Values
/// - `maxDepth`: `10000` (longest dependency chain a reduction will follow)
/// - `includeMarkersInNonReplicableSet`: `false` (only a marker's predecessors are recorded)
///
/// @implNote **Not thread-safe**. This is a mutable configuration object intended to be
/// configured before passing to {@link PartitionAnalyzer.Builder#config(AnalysisConfig)}.
/// The analyzer copies the values it needs at build time.
///
/// @see Builder
public class AnalysisConfig {

    public static final int DEFAULT_MAX_DEPTH = 10_000;

    private int maxDepth = DEFAULT_MAX_DEPTH;
    private boolean includeMarkersInNonReplicableSet = false;

    /// Creates a configuration with default values.
    public AnalysisConfig() {}

    /// Returns the maximum number of stages a reduction may hold on its work stack.
    ///
    /// @return positive depth limit
    public int getMaxDepth() {
        return maxDepth;
    }

    /// Sets the maximum number of stages a reduction may hold on its work stack.
    ///
    /// ### Contracts
    /// - **Precondition**: `maxDepth` must be positive
    ///
    /// @param maxDepth the depth limit
    /// @throws IllegalArgumentException if `maxDepth` is not positive
    public void setMaxDepth(int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /// Returns whether non-replicable markers are themselves added to the non-replicable set.
    ///
    /// @return `true` if markers are recorded alongside their predecessors
    public boolean isIncludeMarkersInNonReplicableSet() {
        return includeMarkersInNonReplicableSet;
    }

    /// Controls whether non-replicable markers are added to the non-replicable set.
    ///
    /// When enabled, a marker with no shared ancestry becomes the cut point itself
    /// instead of its direct input.
    ///
    /// @param includeMarkersInNonReplicableSet `true` to record markers too
    public void setIncludeMarkersInNonReplicableSet(boolean includeMarkersInNonReplicableSet) {
        this.includeMarkersInNonReplicableSet = includeMarkersInNonReplicableSet;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for constructing {@link AnalysisConfig} instances.
    public static class Builder {
        private final AnalysisConfig config = new AnalysisConfig();

        public Builder maxDepth(int maxDepth) {
            config.setMaxDepth(maxDepth);
            return this;
        }

        public Builder includeMarkersInNonReplicableSet(boolean include) {
            config.includeMarkersInNonReplicableSet = include;
            return this;
        }

        public AnalysisConfig build() {
            return config;
        }
    }
}
