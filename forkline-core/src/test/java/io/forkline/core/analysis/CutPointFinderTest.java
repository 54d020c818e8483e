package io.forkline.core.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.forkline.core.exception.GraphDepthExceededException;
import io.forkline.core.exception.InvalidGraphShapeException;
import io.forkline.core.graph.StageGraph;
import io.forkline.core.graph.StageGraphs;
import io.forkline.core.stage.RoundRobinDispatchStage;
import io.forkline.core.stage.Stage;
import io.forkline.core.stage.StandardStage;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CutPointFinderTest {

    private final CutPointFinder finder = new CutPointFinder(1_000, AnalysisListener.NONE);
    private final NonReplicableScanner scanner =
            new NonReplicableScanner(new DefaultStageClassifier(), false);

    // -------------------------------------------------------------------------
    // Explicit non-replicable sets
    // -------------------------------------------------------------------------

    @Nested
    class ExplicitSetTest {

        @Test
        void shouldReturnEmptyWhenNothingIsNonReplicable() {
            var output = stage("output", stage("source"));

            assertThat(finder.find(StageGraphs.traverse(output), Set.of())).isEmpty();
        }

        @Test
        void shouldReturnMergePointOfTwoIndependentChains() {
            var a = stage("a");
            var b = stage("b");
            var c = stage("c", a, b);

            assertThat(finder.find(StageGraphs.traverse(c), Set.of(a, b))).containsSame(c);
        }

        @Test
        void shouldPropagateSingleNonReplicableStageUnchanged() {
            var a = stage("a");
            var map = stage("map", a);
            var output = stage("output", map, stage("other"));

            assertThat(finder.find(StageGraphs.traverse(output), Set.of(a))).containsSame(a);
        }

        @Test
        void shouldStopAtNonReplicableStageWithoutLookingUpstream() {
            var upstream = stage("upstream");
            var a = stage("a", upstream);
            var output = stage("output", a);

            assertThat(finder.find(StageGraphs.traverse(output), Set.of(a, upstream)))
                    .containsSame(a);
        }

        @Test
        void shouldReturnOutputStageWhenItIsNonReplicable() {
            var output = stage("output", stage("source"));

            assertThat(finder.find(StageGraphs.traverse(output), Set.of(output)))
                    .containsSame(output);
        }

        @Test
        void shouldIgnoreNonReplicableStagesOutsideGraph() {
            var output = stage("output", stage("source"));

            assertThat(finder.find(StageGraphs.traverse(output), Set.of(stage("elsewhere"))))
                    .isEmpty();
        }
    }

    // -------------------------------------------------------------------------
    // Pipelines with dispatchers
    // -------------------------------------------------------------------------

    @Nested
    class DispatcherTest {

        @Test
        void shouldCutAtDirectInputOfSingleDispatcher() {
            var source = stage("source");
            var map = stage("map", source);
            var worker = stage("worker", new RoundRobinDispatchStage("dispatch", map));

            assertThat(cutPoint(worker)).containsSame(map);
        }

        @Test
        void shouldCutAtMergeOfTwoDispatchedChains() {
            var zip =
                    stage(
                            "zip",
                            new RoundRobinDispatchStage("dispatch-a", stage("source-a")),
                            new RoundRobinDispatchStage("dispatch-b", stage("source-b")));

            assertThat(cutPoint(zip)).containsSame(zip);
        }

        @Test
        void shouldKeepSharedSourceWhenAllPathsConverge() {
            var source = stage("source");
            var dispatch = new RoundRobinDispatchStage("dispatch", source);
            var side = stage("side", source);
            var output = stage("output", dispatch, side);

            assertThat(cutPoint(output)).containsSame(source);
        }

        @Test
        void shouldMoveCutDownstreamWhenReplicablePathReadsNonReplicableStage() {
            var source = stage("source");
            var map = stage("map", source);
            var dispatch = new RoundRobinDispatchStage("dispatch", map);
            var side = stage("side", source);
            var output = stage("output", dispatch, side);

            assertThat(cutPoint(output)).containsSame(output);
        }
    }

    // -------------------------------------------------------------------------
    // Cycles and limits
    // -------------------------------------------------------------------------

    @Nested
    class CycleTest {

        @Test
        void shouldTerminateOnCycleWithoutNonReplicableStages() {
            var a = stage("a");
            var b = stage("b", a);
            a.addInput(b);

            assertThat(cutPoint(stage("output", b))).isEmpty();
        }

        @Test
        void shouldLookPastCycleToNonReplicableSource() {
            var source = stage("source");
            var dispatch = new RoundRobinDispatchStage("dispatch", source);
            var a = stage("a", dispatch);
            var b = stage("b", a);
            a.addInput(b);

            assertThat(cutPoint(stage("output", b))).containsSame(source);
        }

        @Test
        void shouldReturnDispatcherCaughtInItsOwnCycle() {
            var loop = stage("loop", stage("source"));
            var dispatch = new RoundRobinDispatchStage("dispatch", loop);
            loop.addInput(dispatch);

            assertThat(cutPoint(stage("output", dispatch))).containsSame(dispatch);
        }

        @Test
        void shouldFailWhenChainExceedsMaxDepth() {
            Stage tail = new RoundRobinDispatchStage("dispatch", stage("source"));
            for (int i = 0; i < 5; i++) {
                tail = stage("map-" + i, tail);
            }
            var graph = StageGraphs.traverse(tail);
            Set<Stage> nonReplicable = scanner.scan(graph);

            var shallow = new CutPointFinder(3, AnalysisListener.NONE);

            assertThatThrownBy(() -> shallow.find(graph, nonReplicable))
                    .isInstanceOf(GraphDepthExceededException.class)
                    .hasMessageContaining("deeper than 3");
        }

        @Test
        void shouldRejectGraphWithoutSingleOutput() {
            assertThatThrownBy(() -> finder.find(StageGraph.empty(), Set.of()))
                    .isInstanceOf(InvalidGraphShapeException.class);
        }
    }

    private Optional<Stage> cutPoint(Stage output) {
        StageGraph graph = StageGraphs.traverse(output);
        return finder.find(graph, scanner.scan(graph));
    }

    private static StandardStage stage(String id, Stage... inputs) {
        return StandardStage.builder(id).inputs(inputs).build();
    }
}
