package io.forkline.core.analysis;

import io.forkline.core.stage.Stage;

/// Decides which stages carry replication semantics.
///
/// These are the only two questions the analysis asks about a stage. Everything
/// else about a stage is opaque to it.
///
/// @see DefaultStageClassifier for the type-based implementation
public interface StageClassifier {

    /// Returns whether the stage forces everything upstream of it into a single process.
    ///
    /// @param stage the stage to classify, not null
    /// @return `true` for non-replicable markers such as round-robin dispatchers
    boolean isNonReplicableMarker(Stage stage);

    /// Returns whether the stage stands in for a branch that is not replicable.
    ///
    /// @param stage the stage to classify, not null
    /// @return `true` for placeholder stages
    boolean isPlaceholder(Stage stage);
}
