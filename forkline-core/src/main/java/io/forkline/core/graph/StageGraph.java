package io.forkline.core.graph;

import io.forkline.core.exception.InvalidGraphShapeException;
import io.forkline.core.stage.Stage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/// Snapshot of the stages a pipeline depends on, keyed by stage identity.
///
/// Each entry maps a stage to its own predecessor graph, so the structure is
/// recursive. The same `StageGraph` instance may be reachable from several parents
/// (diamonds) and may be reachable from itself (reference cycles). A graph with
/// exactly one entry is a *rooted* graph: the entry is the pipeline's output stage.
///
/// ### Construction
/// - {@link StageGraphs#traverse(Stage)} follows live stage inputs, sharing one
///   instance per stage and closing cycles.
/// - {@link #builder()} assembles acyclic graphs by hand.
///
/// Entries keep insertion order, which is the input declaration order for
/// traversed graphs. Every algorithm over the graph visits inputs in that order.
///
/// @implNote Effectively immutable once returned by a builder or traversal. Uses
/// reference equality; {@link #toString()} only renders the top level so that
/// cyclic graphs can be printed.
///
/// @see StageGraphs for traversal and query helpers
public final class StageGraph {

    private final Map<Stage, StageGraph> entries = new LinkedHashMap<>();

    StageGraph() {}

    /// Returns a graph with no entries.
    ///
    /// @return new empty graph, never null
    public static StageGraph empty() {
        return new StageGraph();
    }

    void put(Stage stage, StageGraph predecessors) {
        entries.putIfAbsent(stage, predecessors);
    }

    /// Returns the number of top-level entries.
    ///
    /// @return entry count, always non-negative
    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Returns the top-level stages in insertion order.
    ///
    /// @return unmodifiable set of stages, never null
    public Set<Stage> stages() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    /// Returns the top-level entries, each pairing a stage with its predecessor graph.
    ///
    /// @return unmodifiable entry set in insertion order, never null
    public Set<Map.Entry<Stage, StageGraph>> entries() {
        return Collections.unmodifiableMap(entries).entrySet();
    }

    /// Looks up the predecessor graph of a top-level stage.
    ///
    /// @param stage the stage to look up, not null
    /// @return the stage's predecessor graph, or empty if the stage is not a top-level entry
    public Optional<StageGraph> predecessorsOf(Stage stage) {
        return Optional.ofNullable(entries.get(stage));
    }

    /// Returns the single output entry of a rooted graph.
    ///
    /// @return the output stage paired with its predecessor graph, never null
    /// @throws InvalidGraphShapeException if the graph has zero or several entries
    public Map.Entry<Stage, StageGraph> root() {
        if (entries.size() != 1) {
            throw new InvalidGraphShapeException(entries.size());
        }
        return entries.entrySet().iterator().next();
    }

    @Override
    public String toString() {
        return entries.keySet().stream()
                .map(Stage::getId)
                .collect(Collectors.joining(", ", "StageGraph[", "]"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for hand-assembled graphs.
    ///
    /// Adding the same stage twice keeps the first entry.
    public static final class Builder {
        private final StageGraph graph = new StageGraph();

        private Builder() {}

        /// Adds a stage without predecessors.
        ///
        /// @param stage the stage, not null
        /// @return this builder for chaining, never null
        public Builder add(Stage stage) {
            return add(stage, new StageGraph());
        }

        /// Adds a stage together with its predecessor graph.
        ///
        /// @param stage the stage, not null
        /// @param predecessors graph of everything the stage depends on, not null
        /// @return this builder for chaining, never null
        public Builder add(Stage stage, StageGraph predecessors) {
            graph.put(
                    Objects.requireNonNull(stage, "stage"),
                    Objects.requireNonNull(predecessors, "predecessors"));
            return this;
        }

        public StageGraph build() {
            return graph;
        }
    }
}
