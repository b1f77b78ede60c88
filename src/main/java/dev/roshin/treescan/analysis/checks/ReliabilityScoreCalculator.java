package dev.roshin.treescan.analysis.checks;

import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;
import dev.roshin.treescan.analysis.score.ScoreCalculator;

import java.util.Map;

/**
 * Starts from 100 and deducts for the estimated flakiness rate: 2 points per percent
 * up to 5%, then 4 per percent beyond. Flaky-test detection, a retry mechanism and
 * quarantining each earn 5 points back.
 */
public class ReliabilityScoreCalculator implements ScoreCalculator<ReliabilityMetrics> {

    private static final double MITIGATION_BONUS = 5;

    @Override
    public ScoreBreakdown calculate(AggregateMetrics<ReliabilityMetrics> aggregate) {
        ReliabilityMetrics metrics = aggregate.metrics();
        if (metrics.testFiles() == 0) {
            return ScoreBreakdown.minimum();
        }
        double flakiness = metrics.flakinessPercent();
        double deduction = flakiness <= 5 ? flakiness * 2 : 10 + (flakiness - 5) * 4;

        double mitigation = 0;
        if (metrics.flakyDetection()) {
            mitigation += MITIGATION_BONUS;
        }
        if (metrics.retryMechanism()) {
            mitigation += MITIGATION_BONUS;
        }
        if (metrics.quarantinedTests()) {
            mitigation += MITIGATION_BONUS;
        }
        return new ScoreBreakdown(100 - deduction + mitigation, Map.of(
                "flakiness", -deduction,
                "mitigation", mitigation
        ));
    }
}
