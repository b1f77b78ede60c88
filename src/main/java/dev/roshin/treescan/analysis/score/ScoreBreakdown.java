package dev.roshin.treescan.analysis.score;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * A 0-100 score and the named parts it was built from.
 *
 * @param total      Overall score, clamped to [0, 100] and rounded to one decimal
 * @param components Contribution of each part of the formula
 */
public record ScoreBreakdown(
        double total,
        Map<String, Double> components
) {
    public static final double MIN_SCORE = 0.0;
    public static final double MAX_SCORE = 100.0;

    public ScoreBreakdown {
        total = round(Math.max(MIN_SCORE, Math.min(MAX_SCORE, total)));
        components = components == null ? Map.of() : ImmutableMap.copyOf(components);
    }

    /**
     * Score of a run that analyzed nothing.
     */
    public static ScoreBreakdown minimum() {
        return new ScoreBreakdown(MIN_SCORE, Map.of());
    }

    static double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
