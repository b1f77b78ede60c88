package dev.roshin.treescan.analysis.core;

import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;
import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;

import java.util.Map;

/**
 * Minimal metrics for engine tests: files seen and characters read.
 */
record CharCountMetrics(int files, long chars) implements MergeableMetrics<CharCountMetrics> {

    static final CharCountMetrics EMPTY = new CharCountMetrics(0, 0);

    @Override
    public CharCountMetrics merge(CharCountMetrics other) {
        return new CharCountMetrics(files + other.files, chars + other.chars);
    }

    static ScoreBreakdown score(AggregateMetrics<CharCountMetrics> aggregate) {
        if (aggregate.metrics().files() == 0) {
            return ScoreBreakdown.minimum();
        }
        return new ScoreBreakdown(100, Map.of("files", (double) aggregate.metrics().files()));
    }
}
