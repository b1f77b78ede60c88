package dev.roshin.treescan.analysis.checks;

import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;
import dev.roshin.treescan.analysis.score.ScoreCalculator;

import java.util.Map;

/**
 * 50 points for using a current SPDX identifier (30 if only deprecated ones), plus
 * up to 50 (30) for the share of analyzed files carrying a tag.
 */
public class SpdxScoreCalculator implements ScoreCalculator<SpdxMetrics> {

    @Override
    public ScoreBreakdown calculate(AggregateMetrics<SpdxMetrics> aggregate) {
        SpdxMetrics metrics = aggregate.metrics();
        if (metrics.filesChecked() == 0 || metrics.filesWithSpdx() == 0) {
            return ScoreBreakdown.minimum();
        }
        double coverage = (double) metrics.filesWithSpdx() / metrics.filesChecked();
        double base = metrics.hasValidIdentifier() ? 50 : 30;
        double coverageScore = (metrics.hasValidIdentifier() ? 50 : 30) * coverage;
        return new ScoreBreakdown(base + coverageScore, Map.of(
                "identifier", base,
                "coverage", coverageScore
        ));
    }
}
