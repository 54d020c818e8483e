package io.forkline.core.graph;

import io.forkline.core.stage.Stage;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Traversal and query helpers over {@link StageGraph}.
///
/// All walks keep their own visited table keyed by stage identity and use an
/// explicit work stack, so they terminate on cyclic graphs and do not depend on
/// the call stack depth. Stages are reported in pre-order, first input first.
public final class StageGraphs {

    private StageGraphs() {}

    /// Builds the rooted graph of a pipeline by following live stage inputs.
    ///
    /// Every distinct stage gets exactly one predecessor graph instance. A stage
    /// reached through several downstream stages shares that instance, and an input
    /// that leads back to a stage already being expanded closes a reference cycle.
    ///
    /// @param output the pipeline's output stage, not null
    /// @return rooted graph with `output` as its only entry, never null
    public static StageGraph traverse(Stage output) {
        Objects.requireNonNull(output, "output");
        Map<Stage, StageGraph> expanded = new HashMap<>();
        Deque<Stage> pending = new ArrayDeque<>();

        StageGraph rooted = new StageGraph();
        rooted.put(output, graphFor(output, expanded, pending));

        while (!pending.isEmpty()) {
            Stage stage = pending.pop();
            StageGraph predecessors = expanded.get(stage);
            for (Stage input : stage.getInputs()) {
                predecessors.put(input, graphFor(input, expanded, pending));
            }
        }
        return rooted;
    }

    private static StageGraph graphFor(
            Stage stage, Map<Stage, StageGraph> expanded, Deque<Stage> pending) {
        StageGraph existing = expanded.get(stage);
        if (existing != null) {
            return existing;
        }
        StageGraph created = new StageGraph();
        expanded.put(stage, created);
        pending.push(stage);
        return created;
    }

    /// Lists every stage reachable in the graph, each exactly once.
    ///
    /// @param graph the graph to flatten, not null
    /// @return stages in discovery order, never null (empty for an empty graph)
    public static List<Stage> flatten(StageGraph graph) {
        return flatten(graph, List.of());
    }

    /// Lists every reachable stage except the excluded ones.
    ///
    /// Excluded stages are not descended into. Their predecessors are still listed
    /// when another path reaches them.
    ///
    /// @param graph the graph to flatten, not null
    /// @param excluded stages to skip along with their prior graph, not null
    /// @return stages in discovery order, never null
    public static List<Stage> flatten(StageGraph graph, Collection<Stage> excluded) {
        return new ArrayList<>(walk(graph, new HashSet<>(excluded)).keySet());
    }

    /// Maps every reachable stage to its own predecessor graph.
    ///
    /// When a stage appears under several parents with different predecessor graph
    /// instances, the first one discovered wins.
    ///
    /// @param graph the graph to index, not null
    /// @return unmodifiable map in discovery order, never null
    public static Map<Stage, StageGraph> index(StageGraph graph) {
        return Collections.unmodifiableMap(walk(graph, Set.of()));
    }

    /// Returns the predecessor graph of any stage reachable in the graph.
    ///
    /// @param graph the graph to search, not null
    /// @param stage the stage to look up, not null
    /// @return everything `stage` depends on, never null
    /// @throws IllegalArgumentException if `stage` is not reachable in `graph`
    public static StageGraph predecessorsOf(StageGraph graph, Stage stage) {
        StageGraph predecessors = walk(graph, Set.of()).get(stage);
        if (predecessors == null) {
            throw new IllegalArgumentException("Stage not in graph: " + stage);
        }
        return predecessors;
    }

    /// Finds every reachable stage whose runtime class is exactly `type`.
    ///
    /// Subclasses of `type` do not match.
    ///
    /// @param graph the graph to search, not null
    /// @param type the stage class to match, not null
    /// @param <T> the stage class
    /// @return matching stages in discovery order, never null
    public static <T extends Stage> List<T> find(StageGraph graph, Class<T> type) {
        List<T> found = new ArrayList<>();
        for (Stage stage : walk(graph, Set.of()).keySet()) {
            if (stage.getClass() == type) {
                found.add(type.cast(stage));
            }
        }
        return found;
    }

    private static Map<Stage, StageGraph> walk(StageGraph graph, Set<Stage> excluded) {
        Objects.requireNonNull(graph, "graph");
        Map<Stage, StageGraph> visited = new LinkedHashMap<>();
        Deque<Map.Entry<Stage, StageGraph>> pending = new ArrayDeque<>();
        pushInOrder(graph, pending);

        while (!pending.isEmpty()) {
            Map.Entry<Stage, StageGraph> entry = pending.pop();
            Stage stage = entry.getKey();
            if (visited.containsKey(stage) || excluded.contains(stage)) {
                continue;
            }
            visited.put(stage, entry.getValue());
            pushInOrder(entry.getValue(), pending);
        }
        return visited;
    }

    // Reversed so the first input is popped first.
    private static void pushInOrder(
            StageGraph graph, Deque<Map.Entry<Stage, StageGraph>> pending) {
        List<Map.Entry<Stage, StageGraph>> entries = new ArrayList<>(graph.entries());
        for (int i = entries.size() - 1; i >= 0; i--) {
            pending.push(entries.get(i));
        }
    }
}
