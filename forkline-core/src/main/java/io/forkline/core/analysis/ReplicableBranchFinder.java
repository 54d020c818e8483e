package io.forkline.core.analysis;

import io.forkline.core.exception.GraphDepthExceededException;
import io.forkline.core.graph.StageGraph;
import io.forkline.core.stage.Stage;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Partitions a stage graph into maximal replicable branches.
///
/// A stage is replicable when no placeholder is reachable upstream of it. The finder
/// folds the graph from the output stage, recording for each stage whether its whole
/// closure is replicable:
///
/// - A placeholder is non-replicable and is never reported.
/// - Any other stage is recorded replicable before its inputs are visited, and is
///   downgraded as soon as one input turns out non-replicable.
/// - Once a non-replicable stage has visited all inputs, each direct input that is
///   still replicable is reported as a branch root.
///
/// If the output stage itself is replicable the whole graph is one branch and the
/// result is exactly the output stage.
///
/// @implNote Uses an explicit work stack bounded by the configured depth. The memo
/// table lives for one call of {@link #find(StageGraph)} and is never shared with
/// {@link CutPointFinder}.
public final class ReplicableBranchFinder {

    private final StageClassifier classifier;
    private final int maxDepth;
    private final AnalysisListener listener;

    public ReplicableBranchFinder(
            StageClassifier classifier, int maxDepth, AnalysisListener listener) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.maxDepth = maxDepth;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /// Finds the roots of all maximal replicable sub-graphs.
    ///
    /// @param graph the rooted graph, not null
    /// @return branch roots in discovery order, each at most once, never null. Empty when
    ///     nothing is replicable, `[output]` when everything is
    /// @throws io.forkline.core.exception.InvalidGraphShapeException if the graph is not rooted
    /// @throws GraphDepthExceededException if a dependency chain exceeds the depth limit
    public List<Stage> find(StageGraph graph) {
        Map.Entry<Stage, StageGraph> root = graph.root();

        Map<Stage, Boolean> replicable = new HashMap<>();
        Set<Stage> branches = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        descend(root.getKey(), root.getValue(), null, replicable, stack);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.pending.hasNext()) {
                Map.Entry<Stage, StageGraph> input = frame.pending.next();
                descend(input.getKey(), input.getValue(), frame, replicable, stack);
                continue;
            }
            stack.pop();
            boolean result = replicable.get(frame.stage);
            if (!result) {
                for (Stage input : frame.inputs.stages()) {
                    if (replicable.get(input)) {
                        branches.add(input);
                    }
                }
                downgrade(frame.parent, replicable);
            }
            listener.onStageReduced(Reduction.REPLICABLE_BRANCHES, frame.stage);
        }

        if (replicable.get(root.getKey())) {
            branches.add(root.getKey());
        }
        // An input still on the stack of a cycle can be reported before it is downgraded.
        branches.removeIf(stage -> !replicable.get(stage));
        return List.copyOf(branches);
    }

    private void descend(
            Stage stage,
            StageGraph inputs,
            Frame parent,
            Map<Stage, Boolean> replicable,
            Deque<Frame> stack) {
        Boolean known = replicable.get(stage);
        if (known != null) {
            if (!known) {
                downgrade(parent, replicable);
            }
            return;
        }
        if (classifier.isPlaceholder(stage)) {
            replicable.put(stage, false);
            listener.onStageReduced(Reduction.REPLICABLE_BRANCHES, stage);
            downgrade(parent, replicable);
            return;
        }
        if (stack.size() >= maxDepth) {
            throw new GraphDepthExceededException(maxDepth, stage.getId());
        }
        replicable.put(stage, true);
        stack.push(new Frame(stage, inputs, parent));
    }

    private static void downgrade(Frame parent, Map<Stage, Boolean> replicable) {
        if (parent != null) {
            replicable.put(parent.stage, false);
        }
    }

    private static final class Frame {
        private final Stage stage;
        private final StageGraph inputs;
        private final Iterator<Map.Entry<Stage, StageGraph>> pending;
        private final Frame parent;

        private Frame(Stage stage, StageGraph inputs, Frame parent) {
            this.stage = stage;
            this.inputs = inputs;
            this.pending = inputs.entries().iterator();
            this.parent = parent;
        }
    }
}
