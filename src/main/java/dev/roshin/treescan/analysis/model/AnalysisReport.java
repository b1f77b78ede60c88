package dev.roshin.treescan.analysis.model;

import dev.roshin.treescan.analysis.model.enums.RunStatus;
import dev.roshin.treescan.analysis.model.enums.SkipReason;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The complete output of one analysis run. Produced once, never mutated.
 *
 * @param root            The analyzed directory
 * @param analyzer        Name of the analyzer that produced the metrics
 * @param metrics         Aggregated metrics and skip tallies
 * @param score           Score derived from {@code metrics}
 * @param status          Terminal state of the run
 * @param filesDiscovered Files found by the walk, including oversized ones
 * @param filesSelected   Files handed to the scheduler after sampling
 * @param filesNotStarted Selected files that were never dispatched or were abandoned
 * @param sampled         Whether the candidate set was reduced by sampling
 * @param earlyStopped    Whether the discovery walk stopped before covering the tree
 * @param wallClockMs     Duration of the run
 * @param warnings        Degradations worth surfacing (unreadable directories, abandoned workers)
 * @param <M>             Analyzer-specific metrics type
 */
public record AnalysisReport<M>(
        Path root,
        String analyzer,
        AggregateMetrics<M> metrics,
        ScoreBreakdown score,
        RunStatus status,
        int filesDiscovered,
        int filesSelected,
        int filesNotStarted,
        boolean sampled,
        boolean earlyStopped,
        long wallClockMs,
        List<String> warnings
) {
    public int filesAnalyzed() {
        return metrics.filesAnalyzed();
    }

    public int filesSkipped() {
        return metrics.skippedCount();
    }

    public int analyzerErrors() {
        return metrics.skipped(SkipReason.ANALYZER_ERROR);
    }

    /**
     * True when any deadline or abort signal cut the run short.
     */
    public boolean timedOut() {
        return status == RunStatus.SOFT_TIMEOUT || status == RunStatus.HARD_TIMEOUT;
    }

    public boolean hardTimedOut() {
        return status == RunStatus.HARD_TIMEOUT;
    }

    /**
     * Flattens the report to plain maps, lists and scalars for JSON output.
     * The analyzer payload is included as-is.
     */
    public Map<String, Object> toRecord() {
        Map<String, Integer> skipped = new LinkedHashMap<>();
        metrics.skipped().forEach((reason, count) -> skipped.put(reason.label(), count));

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("root", root.toString());
        record.put("analyzer", analyzer);
        record.put("status", status.name());
        record.put("score", score.total());
        record.put("scoreComponents", score.components());
        record.put("filesDiscovered", filesDiscovered);
        record.put("filesSelected", filesSelected);
        record.put("filesAnalyzed", filesAnalyzed());
        record.put("filesSkipped", filesSkipped());
        record.put("filesNotStarted", filesNotStarted);
        record.put("analyzerErrors", analyzerErrors());
        record.put("skipped", skipped);
        record.put("analyzedByCategory", metrics.analyzedByCategory());
        record.put("sampled", sampled);
        record.put("timedOut", timedOut());
        record.put("hardTimedOut", hardTimedOut());
        record.put("earlyStopped", earlyStopped);
        record.put("wallClockMs", wallClockMs);
        record.put("warnings", warnings);
        record.put("metrics", metrics.metrics());
        return record;
    }

    @Override
    public String toString() {
        return String.format(
                "AnalysisReport[root=%s, analyzer=%s, status=%s, score=%.1f, discovered=%d, selected=%d, " +
                        "analyzed=%d, skipped=%d, notStarted=%d, sampled=%s, earlyStopped=%s, %dms]",
                root.getFileName(), analyzer, status, score.total(), filesDiscovered, filesSelected,
                filesAnalyzed(), filesSkipped(), filesNotStarted, sampled, earlyStopped, wallClockMs
        );
    }
}
