package dev.roshin.treescan.analysis.checks;

import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;

/**
 * Comment density counters.
 *
 * @param files               Files analyzed
 * @param filesWithComments   Files with at least one comment line
 * @param codeLines           Non-blank lines
 * @param commentLines        Lines that are, or are inside, a comment
 * @param filesWithDocstrings Files with at least one docstring or doc comment
 */
public record CommentMetrics(
        int files,
        int filesWithComments,
        long codeLines,
        long commentLines,
        int filesWithDocstrings
) implements MergeableMetrics<CommentMetrics> {

    public static final CommentMetrics EMPTY = new CommentMetrics(0, 0, 0, 0, 0);

    public static CommentMetrics ofFile(long codeLines, long commentLines, boolean hasDocstring) {
        return new CommentMetrics(1, commentLines > 0 ? 1 : 0, codeLines, commentLines, hasDocstring ? 1 : 0);
    }

    @Override
    public CommentMetrics merge(CommentMetrics other) {
        return new CommentMetrics(
                files + other.files,
                filesWithComments + other.filesWithComments,
                codeLines + other.codeLines,
                commentLines + other.commentLines,
                filesWithDocstrings + other.filesWithDocstrings
        );
    }

    /**
     * Comment lines per code line, as a percentage.
     */
    public double commentRatio() {
        return commentLines * 100.0 / Math.max(codeLines, 1);
    }
}
