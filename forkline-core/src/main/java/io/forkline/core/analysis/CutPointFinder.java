package io.forkline.core.analysis;

import io.forkline.core.exception.GraphDepthExceededException;
import io.forkline.core.graph.StageGraph;
import io.forkline.core.stage.Stage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Reduces a non-replicable set to its lowest common ancestor in a stage graph.
///
/// The cut point is the stage at which replication must stop: everything at or
/// upstream of it runs once, in the dispatching process. It is computed by a
/// memoized post-order fold from the output stage:
///
/// 1. A stage in the non-replicable set resolves to itself.
/// 2. Any other stage first records an empty provisional result, then folds its
///    inputs. No non-empty input result leaves it empty. A single distinct input
///    result propagates unchanged. Two or more distinct input results make the stage
///    itself the merge point.
///
/// The provisional entry is written before any input is visited, so an input path
/// leading back to the stage reads the empty entry and stops there. Shared inputs
/// are folded once per call.
///
/// @implNote Uses an explicit work stack bounded by the configured depth. The memo
/// table lives for one call of {@link #find(StageGraph, Set)} and is never shared
/// with {@link ReplicableBranchFinder}.
public final class CutPointFinder {

    private final int maxDepth;
    private final AnalysisListener listener;

    public CutPointFinder(int maxDepth, AnalysisListener listener) {
        this.maxDepth = maxDepth;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /// Finds the lowest common ancestor of all non-replicable stages.
    ///
    /// @param graph the rooted graph, not null
    /// @param nonReplicable stages that must run in a single process, not null
    /// @return the cut point, or empty when no reachable stage is non-replicable
    /// @throws io.forkline.core.exception.InvalidGraphShapeException if the graph is not rooted
    /// @throws GraphDepthExceededException if a dependency chain exceeds the depth limit
    public Optional<Stage> find(StageGraph graph, Set<Stage> nonReplicable) {
        Map.Entry<Stage, StageGraph> root = graph.root();
        if (nonReplicable.isEmpty()) {
            return Optional.empty();
        }

        Map<Stage, Optional<Stage>> memo = new HashMap<>();
        Deque<Frame> stack = new ArrayDeque<>();
        List<Stage> rootResult = new ArrayList<>(1);

        descend(root.getKey(), root.getValue(), rootResult, nonReplicable, memo, stack);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.inputs.hasNext()) {
                Map.Entry<Stage, StageGraph> input = frame.inputs.next();
                descend(
                        input.getKey(),
                        input.getValue(),
                        frame.outcomes,
                        nonReplicable,
                        memo,
                        stack);
            } else {
                stack.pop();
                Optional<Stage> result = merge(frame);
                memo.put(frame.stage, result);
                listener.onStageReduced(Reduction.CUT_POINT, frame.stage);
                result.ifPresent(frame.sink::add);
            }
        }
        return rootResult.stream().findFirst();
    }

    private void descend(
            Stage stage,
            StageGraph inputs,
            List<Stage> sink,
            Set<Stage> nonReplicable,
            Map<Stage, Optional<Stage>> memo,
            Deque<Frame> stack) {
        Optional<Stage> known = memo.get(stage);
        if (known != null) {
            known.ifPresent(sink::add);
            return;
        }
        if (nonReplicable.contains(stage)) {
            memo.put(stage, Optional.of(stage));
            listener.onStageReduced(Reduction.CUT_POINT, stage);
            sink.add(stage);
            return;
        }
        if (stack.size() >= maxDepth) {
            throw new GraphDepthExceededException(maxDepth, stage.getId());
        }
        // Provisional entry, read by any input path that cycles back here.
        memo.put(stage, Optional.empty());
        stack.push(new Frame(stage, inputs.entries().iterator(), sink));
    }

    private static Optional<Stage> merge(Frame frame) {
        List<Stage> outcomes = frame.outcomes;
        if (outcomes.isEmpty()) {
            return Optional.empty();
        }
        Stage first = outcomes.get(0);
        for (Stage outcome : outcomes) {
            if (outcome != first) {
                return Optional.of(frame.stage);
            }
        }
        return Optional.of(first);
    }

    private static final class Frame {
        private final Stage stage;
        private final Iterator<Map.Entry<Stage, StageGraph>> inputs;
        private final List<Stage> sink;
        private final List<Stage> outcomes = new ArrayList<>();

        private Frame(
                Stage stage, Iterator<Map.Entry<Stage, StageGraph>> inputs, List<Stage> sink) {
            this.stage = stage;
            this.inputs = inputs;
            this.sink = sink;
        }
    }
}
