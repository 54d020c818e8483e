package io.forkline.core.stage;

public enum StageType {
    STANDARD,
    ROUND_ROBIN_DISPATCH,
    PLACEHOLDER
}
