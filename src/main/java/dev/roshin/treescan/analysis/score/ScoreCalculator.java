package dev.roshin.treescan.analysis.score;

import dev.roshin.treescan.analysis.model.AggregateMetrics;

/**
 * Turns aggregated metrics into a score.
 * <p>
 * Implementations must be pure: no I/O, no clock, no state between calls, and the
 * input must not be modified. A run that analyzed no files must produce a defined
 * score (usually {@link ScoreBreakdown#minimum()}) rather than throw.
 *
 * @param <M> Analyzer-specific metrics type
 */
@FunctionalInterface
public interface ScoreCalculator<M> {

    ScoreBreakdown calculate(AggregateMetrics<M> metrics);
}
