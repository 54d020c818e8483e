package io.forkline.core.exception;

import java.io.Serial;

/// Thrown when a traversal descends further than the configured maximum depth.
///
/// Signals a pathologically deep pipeline. Raised instead of letting the work stack
/// grow without bound.
///
/// @see io.forkline.core.analysis.AnalysisConfig#getMaxDepth()
public class GraphDepthExceededException extends RuntimeException {
    @Serial private static final long serialVersionUID = -1180453398226140957L;

    private final int maxDepth;

    public GraphDepthExceededException(int maxDepth, String stageId) {
        super("Stage graph deeper than " + maxDepth + " stages at '" + stageId + "'");
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
