package dev.roshin.treescan.analysis.checks;

import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;
import dev.roshin.treescan.analysis.score.ScoreCalculator;

import java.util.Map;

/**
 * Up to 30 points for the share of commented files, 40 for the comment ratio
 * (best around 15-20%), 30 for the share of files with doc comments.
 */
public class CommentScoreCalculator implements ScoreCalculator<CommentMetrics> {

    @Override
    public ScoreBreakdown calculate(AggregateMetrics<CommentMetrics> aggregate) {
        CommentMetrics metrics = aggregate.metrics();
        if (metrics.files() == 0) {
            return ScoreBreakdown.minimum();
        }

        double filesScore = Math.min(30.0 * metrics.filesWithComments() / metrics.files(), 30.0);

        double ratio = metrics.commentRatio();
        double ratioScore;
        if (ratio <= 0) {
            ratioScore = 0;
        } else if (ratio < 5) {
            ratioScore = ratio * 3;
        } else if (ratio < 20) {
            ratioScore = 15 + (ratio - 5) * 1.5;
        } else {
            ratioScore = 35 + Math.min((ratio - 20) * 0.25, 5);
        }

        double docScore = Math.min(30.0 * metrics.filesWithDocstrings() / metrics.files(), 30.0);

        return new ScoreBreakdown(filesScore + ratioScore + docScore, Map.of(
                "filesWithComments", filesScore,
                "commentRatio", ratioScore,
                "docstrings", docScore
        ));
    }
}
