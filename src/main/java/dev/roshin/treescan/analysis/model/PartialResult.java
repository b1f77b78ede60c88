package dev.roshin.treescan.analysis.model;

import dev.roshin.treescan.analysis.model.enums.SkipReason;

/**
 * The contribution of one file: its metrics, or the reason it has none.
 *
 * @param relativePath Path relative to the analysis root
 * @param category     Category of the file
 * @param metrics      Analyzer output, null when skipped
 * @param skipReason   Why the file was skipped, null when analyzed
 * @param detail       Human-readable detail for skipped files
 * @param <M>          Analyzer-specific metrics type
 */
public record PartialResult<M>(
        String relativePath,
        String category,
        M metrics,
        SkipReason skipReason,
        String detail
) {
    public PartialResult {
        if ((metrics == null) == (skipReason == null)) {
            throw new IllegalArgumentException(
                    "Exactly one of metrics or skipReason must be set for " + relativePath);
        }
    }

    public static <M> PartialResult<M> analyzed(CandidateFile file, M metrics) {
        return new PartialResult<>(file.relativePath(), file.category(), metrics, null, null);
    }

    public static <M> PartialResult<M> skipped(CandidateFile file, SkipReason reason, String detail) {
        return new PartialResult<>(file.relativePath(), file.category(), null, reason, detail);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }

    @Override
    public String toString() {
        return isSkipped()
                ? String.format("Skipped[%s: %s] %s", skipReason.label(), detail, relativePath)
                : String.format("Analyzed[%s] %s", category, relativePath);
    }
}
