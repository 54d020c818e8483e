package io.forkline.core.stage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Base class for all pipeline stage types.
///
/// A stage is one unit of a data-processing pipeline. It reads from zero or more
/// input stages and is referenced in turn by the stages downstream of it. The
/// analysis in {@link io.forkline.core.analysis} treats stages as opaque vertices
/// and only asks for their {@link StageType}.
///
/// ### Stage Types
/// - {@link StandardStage} - Replicable source or transform
/// - {@link RoundRobinDispatchStage} - Single-instance fan-out to worker processes
/// - {@link PlaceholderStage} - Stand-in for a branch that is not replicable
///
/// ### Identity
/// Equality is reference identity. Two stages with the same id and the same inputs
/// are distinct vertices unless they are the same object. Subclasses cannot
/// override this.
///
/// @implNote Not thread-safe while inputs are being wired. Input lists only grow,
/// and the graph snapshot taken by {@link io.forkline.core.graph.StageGraphs#traverse(Stage)}
/// does not observe later changes.
///
/// @see StageType for the enumeration of stage types
public abstract class Stage {

    protected final String id;
    private final List<Stage> inputs;

    /// Creates a stage with the specified identifier and inputs.
    ///
    /// @param id display identifier, not null. Not required to be unique
    /// @param inputs upstream stages in declaration order, not null (may be empty)
    protected Stage(String id, List<Stage> inputs) {
        this.id = Objects.requireNonNull(id, "Stage ID required");
        this.inputs = new ArrayList<>(inputs);
    }

    /// Returns the display identifier of this stage.
    ///
    /// @return stage ID used for logging and diagnostics, never null
    public String getId() {
        return id;
    }

    /// Returns the stage type used by stage classifiers.
    ///
    /// @return the stage type enum value, never null
    public abstract StageType getStageType();

    /// Returns the upstream stages this stage reads from.
    ///
    /// @return unmodifiable view of the inputs in declaration order, never null
    public List<Stage> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    /// Appends an input after construction.
    ///
    /// Used to wire late-bound references, such as a feedback edge back to a
    /// downstream stage.
    ///
    /// @param input the upstream stage, not null
    public void addInput(Stage input) {
        inputs.add(Objects.requireNonNull(input, "input"));
    }

    @Override
    public final boolean equals(Object other) {
        return this == other;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + "]";
    }
}
