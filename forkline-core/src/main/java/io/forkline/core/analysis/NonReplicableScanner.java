package io.forkline.core.analysis;

import io.forkline.core.graph.StageGraph;
import io.forkline.core.graph.StageGraphs;
import io.forkline.core.stage.Stage;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Collects the stages that must not be replicated.
///
/// Every stage upstream of a non-replicable marker has to run in the dispatching
/// process. The scanner flattens the graph once and, for each marker, adds the full
/// predecessor closure of that marker to the result. Markers already recorded as
/// the predecessor of another marker are skipped, since their closure is already
/// part of the set.
///
/// @implNote Stateless and thread-safe. Each call builds a new set.
public final class NonReplicableScanner {

    private final StageClassifier classifier;
    private final boolean includeMarkers;

    /// Creates a scanner.
    ///
    /// @param classifier decides which stages are markers, not null
    /// @param includeMarkers whether markers are themselves added to the result
    public NonReplicableScanner(StageClassifier classifier, boolean includeMarkers) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.includeMarkers = includeMarkers;
    }

    /// Computes the non-replicable set of a rooted graph.
    ///
    /// @param graph the rooted graph to scan, not null
    /// @return new mutable set of non-replicable stages, never null (empty without markers)
    public Set<Stage> scan(StageGraph graph) {
        return scan(graph, AnalysisListener.NONE);
    }

    Set<Stage> scan(StageGraph graph, AnalysisListener listener) {
        graph.root(); // rejects graphs without a single output stage

        Set<Stage> nonReplicable = new HashSet<>();
        int markers = 0;
        for (Map.Entry<Stage, StageGraph> entry : StageGraphs.index(graph).entrySet()) {
            Stage stage = entry.getKey();
            if (nonReplicable.contains(stage) || !classifier.isNonReplicableMarker(stage)) {
                continue;
            }
            markers++;
            nonReplicable.addAll(StageGraphs.flatten(entry.getValue()));
            if (includeMarkers) {
                nonReplicable.add(stage);
            }
        }
        listener.onNonReplicableScanned(markers, nonReplicable.size());
        return nonReplicable;
    }
}
