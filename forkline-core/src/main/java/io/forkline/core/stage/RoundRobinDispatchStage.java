package io.forkline.core.stage;

import java.util.List;
import java.util.Objects;

/// Stage that hands items from its input to worker processes in round-robin order.
///
/// A dispatcher runs exactly once, in the dispatching process. Everything upstream of
/// it is therefore non-replicable, which makes this stage the non-replicable marker
/// recognised by {@link io.forkline.core.analysis.DefaultStageClassifier}.
///
/// @see io.forkline.core.analysis.NonReplicableScanner
public final class RoundRobinDispatchStage extends Stage {

    /// Creates a dispatcher reading from a single upstream stage.
    ///
    /// @param id display identifier, not null
    /// @param input the stage whose output is dispatched, not null
    public RoundRobinDispatchStage(String id, Stage input) {
        super(id, List.of(Objects.requireNonNull(input, "input")));
    }

    @Override
    public StageType getStageType() {
        return StageType.ROUND_ROBIN_DISPATCH;
    }
}
