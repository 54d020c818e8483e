package io.forkline.core.analysis;

import io.forkline.core.stage.Stage;

/// Listener for per-stage progress of a partition analysis.
///
/// All methods have default no-op implementations, allowing listeners to override
/// only the events they care about.
///
/// @implNote Callbacks arrive on the thread running the analysis.
public interface AnalysisListener {

    /// No-op listener.
    AnalysisListener NONE = new AnalysisListener() {};

    /// Called once per stage when a reduction records that stage's final result.
    ///
    /// Memo hits do not trigger a callback, so a stage shared by several downstream
    /// stages is reported once per reduction.
    ///
    /// @param reduction the reduction that computed the result, not null
    /// @param stage the stage whose result was recorded, not null
    default void onStageReduced(Reduction reduction, Stage stage) {}

    /// Called when the non-replicable set has been computed.
    ///
    /// @param markerCount number of non-replicable markers found
    /// @param nonReplicableCount size of the resulting non-replicable set
    default void onNonReplicableScanned(int markerCount, int nonReplicableCount) {}
}
