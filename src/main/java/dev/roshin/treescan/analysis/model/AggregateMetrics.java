package dev.roshin.treescan.analysis.model;

import dev.roshin.treescan.analysis.model.enums.SkipReason;

import java.util.Map;

/**
 * Snapshot of everything merged so far in a run.
 *
 * @param metrics            Merged analyzer payload
 * @param filesAnalyzed      Files whose analyzer returned metrics
 * @param skipped            Skipped files per reason, never part of {@code filesAnalyzed}
 * @param analyzedByCategory Analyzed files per category
 * @param <M>                Analyzer-specific metrics type
 */
public record AggregateMetrics<M>(
        M metrics,
        int filesAnalyzed,
        Map<SkipReason, Integer> skipped,
        Map<String, Integer> analyzedByCategory
) {
    /**
     * Total number of skipped files across all reasons.
     */
    public int skippedCount() {
        return skipped.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }
}
