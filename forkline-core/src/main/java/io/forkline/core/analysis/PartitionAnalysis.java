package io.forkline.core.analysis;

import io.forkline.core.stage.Stage;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Combined result of analysing one pipeline snapshot.
///
/// @param cutPoint lowest common ancestor of all non-replicable stages, empty when there are none
/// @param replicableBranches roots of the maximal replicable sub-graphs, never null
/// @param nonReplicableStages stages that must run in a single process, never null
///
/// @see PartitionAnalyzer#analyze(io.forkline.core.graph.StageGraph)
public record PartitionAnalysis(
        Optional<Stage> cutPoint, List<Stage> replicableBranches, Set<Stage> nonReplicableStages) {

    public PartitionAnalysis {
        replicableBranches = List.copyOf(replicableBranches);
        nonReplicableStages = Set.copyOf(nonReplicableStages);
    }

    /// Returns whether the pipeline can be copied to every worker unchanged.
    ///
    /// @return `true` if there is no cut point
    public boolean isFullyReplicable() {
        return cutPoint.isEmpty();
    }
}
