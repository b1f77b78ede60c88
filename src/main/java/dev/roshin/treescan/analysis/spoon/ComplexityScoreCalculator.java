package dev.roshin.treescan.analysis.spoon;

import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;
import dev.roshin.treescan.analysis.score.ScoreCalculator;

import java.util.Map;

/**
 * Banded by average complexity (90 below 6 down to 0 at 15 and above), minus up to
 * 40 points when very complex functions make up 5% or more of all functions.
 * Higher is better.
 */
public class ComplexityScoreCalculator implements ScoreCalculator<ComplexityMetrics> {

    @Override
    public ScoreBreakdown calculate(AggregateMetrics<ComplexityMetrics> aggregate) {
        ComplexityMetrics metrics = aggregate.metrics();
        if (metrics.functions() == 0) {
            return ScoreBreakdown.minimum();
        }

        double average = metrics.averageComplexity();
        double base;
        if (average >= 15) {
            base = 0;
        } else if (average >= 12) {
            base = 20;
        } else if (average >= 10) {
            base = 40;
        } else if (average >= 8) {
            base = 60;
        } else if (average >= 6) {
            base = 80;
        } else {
            base = 90;
        }

        double veryComplexShare = metrics.veryComplex() * 100.0 / metrics.functions();
        double penalty;
        if (veryComplexShare >= 20) {
            penalty = 40;
        } else if (veryComplexShare >= 10) {
            penalty = 20;
        } else if (veryComplexShare >= 5) {
            penalty = 10;
        } else {
            penalty = 0;
        }

        return new ScoreBreakdown(Math.max(0, base - penalty), Map.of(
                "averageComplexity", base,
                "veryComplexPenalty", -penalty
        ));
    }
}
