package io.forkline.core.analysis;

/// The two memoized reductions run over a stage graph.
public enum Reduction {
    CUT_POINT,
    REPLICABLE_BRANCHES
}
