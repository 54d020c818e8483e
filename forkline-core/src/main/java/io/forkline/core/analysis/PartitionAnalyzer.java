package io.forkline.core.analysis;

import io.forkline.core.exception.InvalidGraphShapeException;
import io.forkline.core.graph.StageGraph;
import io.forkline.core.stage.Stage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Entry point for deciding how a pipeline is split between a dispatching process
/// and replicated workers.
///
/// The analyzer answers two independent questions over one graph snapshot:
/// - {@link #computeCutPoint(StageGraph)}: where replication has to stop, as the lowest
///   common ancestor of every stage upstream of a non-replicable marker.
/// - {@link #computeReplicableBranches(StageGraph)}: which sub-graphs contain no
///   placeholder and can be instantiated once per worker.
///
/// ### Usage
/// {@snippet :
/// var analyzer = PartitionAnalyzer.builder()
///     .config(AnalysisConfig.builder().maxDepth(500).build())
///     .build();
/// Optional<Stage> cut = analyzer.computeCutPoint(StageGraphs.traverse(output));
/// }
///
/// @implNote Thread-safe. The analyzer holds only immutable collaborators and every
/// call allocates its own memo tables. It never mutates stages or graphs.
///
/// @see NonReplicableScanner
/// @see CutPointFinder
/// @see ReplicableBranchFinder
public final class PartitionAnalyzer {

    private static final Logger logger = Logger.getLogger(PartitionAnalyzer.class.getName());

    private final StageClassifier classifier;
    private final int maxDepth;
    private final boolean includeMarkers;
    private final AnalysisListener listener;

    private PartitionAnalyzer(Builder builder) {
        this.classifier = builder.classifier;
        this.maxDepth = builder.config.getMaxDepth();
        this.includeMarkers = builder.config.isIncludeMarkersInNonReplicableSet();
        this.listener = builder.listener;
    }

    /// Creates an analyzer with default configuration and type-based classification.
    ///
    /// @return new analyzer, never null
    public static PartitionAnalyzer create() {
        return builder().build();
    }

    /// Computes the stages that must run in a single process.
    ///
    /// @param graph rooted graph of the pipeline, not null
    /// @return new set of non-replicable stages, never null
    /// @throws InvalidGraphShapeException if the graph does not have exactly one output stage
    public Set<Stage> findNonReplicableStages(StageGraph graph) {
        requireRooted(graph);
        return new NonReplicableScanner(classifier, includeMarkers).scan(graph, listener);
    }

    /// Computes the cut point of the pipeline.
    ///
    /// @param graph rooted graph of the pipeline, not null
    /// @return lowest common ancestor of all non-replicable stages, or empty if the pipeline
    ///     is fully replicable
    /// @throws InvalidGraphShapeException if the graph does not have exactly one output stage
    /// @throws io.forkline.core.exception.GraphDepthExceededException if the graph is too deep
    public Optional<Stage> computeCutPoint(StageGraph graph) {
        return cutPoint(graph, findNonReplicableStages(graph));
    }

    private Optional<Stage> cutPoint(StageGraph graph, Set<Stage> nonReplicable) {
        Optional<Stage> cutPoint = new CutPointFinder(maxDepth, listener).find(graph, nonReplicable);
        logger.fine(
                () ->
                        "Cut point for "
                                + graph
                                + ": "
                                + cutPoint.map(Stage::getId).orElse("none")
                                + " ("
                                + nonReplicable.size()
                                + " non-replicable stages)");
        return cutPoint;
    }

    /// Computes the roots of the maximal replicable sub-graphs.
    ///
    /// @param graph rooted graph of the pipeline, not null
    /// @return branch roots in discovery order, never null. Empty if nothing is replicable,
    ///     exactly the output stage if everything is
    /// @throws InvalidGraphShapeException if the graph does not have exactly one output stage
    /// @throws io.forkline.core.exception.GraphDepthExceededException if the graph is too deep
    public List<Stage> computeReplicableBranches(StageGraph graph) {
        requireRooted(graph);
        List<Stage> branches =
                new ReplicableBranchFinder(classifier, maxDepth, listener).find(graph);
        logger.fine(() -> "Found " + branches.size() + " replicable branches in " + graph);
        return branches;
    }

    /// Runs every analysis over the same snapshot.
    ///
    /// @param graph rooted graph of the pipeline, not null
    /// @return combined result, never null
    /// @throws InvalidGraphShapeException if the graph does not have exactly one output stage
    public PartitionAnalysis analyze(StageGraph graph) {
        Set<Stage> nonReplicable = findNonReplicableStages(graph);
        Optional<Stage> cutPoint = cutPoint(graph, nonReplicable);
        List<Stage> branches = computeReplicableBranches(graph);
        return new PartitionAnalysis(cutPoint, branches, nonReplicable);
    }

    private static void requireRooted(StageGraph graph) {
        Objects.requireNonNull(graph, "graph");
        if (graph.size() != 1) {
            logger.warning("Rejecting stage graph with " + graph.size() + " output stages");
            throw new InvalidGraphShapeException(graph.size());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link PartitionAnalyzer}.
    public static final class Builder {
        private AnalysisConfig config = new AnalysisConfig();
        private StageClassifier classifier = new DefaultStageClassifier();
        private AnalysisListener listener = AnalysisListener.NONE;

        private Builder() {}

        public Builder config(AnalysisConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /// Replaces the type-based classifier, for pipelines that mark stages differently.
        public Builder classifier(StageClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier");
            return this;
        }

        public Builder listener(AnalysisListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener");
            return this;
        }

        public PartitionAnalyzer build() {
            return new PartitionAnalyzer(this);
        }
    }
}
