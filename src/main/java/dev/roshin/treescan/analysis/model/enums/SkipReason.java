package dev.roshin.treescan.analysis.model.enums;

/**
 * Why a file contributed no metrics to the aggregate.
 */
public enum SkipReason {
    /**
     * File exceeded the configured size cap and was never read
     */
    TOO_LARGE("too_large"),

    /**
     * Per-file deadline passed before the analyzer returned
     */
    FILE_TIMEOUT("file_timeout"),

    /**
     * File could not be read (permissions, vanished, I/O failure)
     */
    READ_ERROR("read_error"),

    /**
     * The pluggable analyzer threw
     */
    ANALYZER_ERROR("analyzer_error");

    private final String label;

    SkipReason(String label) {
        this.label = label;
    }

    /**
     * Stable snake_case name used in serialized reports.
     */
    public String label() {
        return label;
    }
}
