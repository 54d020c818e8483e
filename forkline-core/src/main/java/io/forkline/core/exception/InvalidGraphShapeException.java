package io.forkline.core.exception;

import java.io.Serial;

/// Thrown when a stage graph handed to the analysis is not a rooted graph.
///
/// A rooted graph has exactly one entry: the pipeline's output stage. There is no
/// degraded result for any other shape.
public class InvalidGraphShapeException extends IllegalArgumentException {
    @Serial private static final long serialVersionUID = 2907174416358021584L;

    private final int rootCount;

    public InvalidGraphShapeException(int rootCount) {
        super("Invalid graph shape: expected exactly one output stage, found " + rootCount);
        this.rootCount = rootCount;
    }

    /// Returns the number of top-level entries found in the rejected graph.
    ///
    /// @return observed root count, never 1
    public int getRootCount() {
        return rootCount;
    }
}
