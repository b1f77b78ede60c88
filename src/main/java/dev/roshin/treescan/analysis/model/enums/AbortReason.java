package dev.roshin.treescan.analysis.model.enums;

/**
 * What flipped a run's abort flag.
 */
public enum AbortReason {
    SOFT_DEADLINE,
    HARD_DEADLINE,
    EXTERNAL
}
