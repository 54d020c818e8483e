package io.forkline.core.analysis;

import io.forkline.core.stage.Stage;
import io.forkline.core.stage.StageType;

/// Classifies stages by their {@link StageType}.
public final class DefaultStageClassifier implements StageClassifier {

    @Override
    public boolean isNonReplicableMarker(Stage stage) {
        return stage.getStageType() == StageType.ROUND_ROBIN_DISPATCH;
    }

    @Override
    public boolean isPlaceholder(Stage stage) {
        return stage.getStageType() == StageType.PLACEHOLDER;
    }
}
