package dev.roshin.treescan.analysis.aggregate;

/**
 * Per-file metrics that can be folded into a running total.
 * <p>
 * {@link #merge} must be commutative and associative and must not modify either
 * operand, so the total is the same whatever order files complete in.
 *
 * @param <M> The implementing type
 */
public interface MergeableMetrics<M extends MergeableMetrics<M>> {

    M merge(M other);
}
