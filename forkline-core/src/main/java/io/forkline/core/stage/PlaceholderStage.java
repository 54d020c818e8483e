package io.forkline.core.stage;

import java.util.List;

/// Stand-in for a branch that has been moved out of the replicated workers.
///
/// The loader substitutes a placeholder for the non-replicable part of a pipeline,
/// to be connected later to the queue fed by the dispatching process. Branch
/// extraction treats a placeholder as non-replicable and never reports it as a
/// branch root.
///
/// @see io.forkline.core.analysis.ReplicableBranchFinder
public final class PlaceholderStage extends Stage {

    public PlaceholderStage(String id) {
        super(id, List.of());
    }

    @Override
    public StageType getStageType() {
        return StageType.PLACEHOLDER;
    }
}
