package dev.roshin.treescan.analysis.model.enums;

/**
 * Terminal state of an analysis run.
 */
public enum RunStatus {
    /**
     * Every selected file was settled before the soft deadline
     */
    COMPLETED,

    /**
     * The soft deadline tripped; metrics cover the files finished by then
     */
    SOFT_TIMEOUT,

    /**
     * A caller cancelled the run through its abort signal
     */
    ABORTED,

    /**
     * The supervisor stopped the run at the hard deadline
     */
    HARD_TIMEOUT,

    /**
     * The pipeline itself failed; the report carries whatever was aggregated
     */
    FAILED
}
