package dev.roshin.treescan.analysis.aggregate;

import com.google.common.collect.ImmutableMap;
import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.model.PartialResult;
import dev.roshin.treescan.analysis.model.enums.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Single owner of a run's running totals.
 * <p>
 * Workers hand over finished {@link PartialResult}s through {@link #accept}; the lock
 * is held only for the constant-time merge, never during file I/O or analysis.
 * Once {@link #close()} is called later deliveries are dropped, which is how results
 * from abandoned workers are kept out of a report that has already been built.
 */
public class Aggregator<M extends MergeableMetrics<M>> {
    private static final Logger log = LoggerFactory.getLogger(Aggregator.class);

    private final Object lock = new Object();

    private M total;
    private int filesAnalyzed;
    private final EnumMap<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    private final Map<String, Integer> analyzedByCategory = new TreeMap<>();
    private final Set<String> delivered = new HashSet<>();
    private boolean closed;

    /**
     * @param empty Identity element of the analyzer's merge
     */
    public Aggregator(M empty) {
        this.total = empty;
    }

    /**
     * Merges one file's result.
     *
     * @return false if the result was dropped because the path was already delivered
     * or the aggregator is closed
     */
    public boolean accept(PartialResult<M> result) {
        synchronized (lock) {
            if (closed) {
                log.debug("Dropping late result after close: {}", result);
                return false;
            }
            if (!delivered.add(result.relativePath())) {
                log.warn("Duplicate result ignored for {}", result.relativePath());
                return false;
            }
            if (result.isSkipped()) {
                skipped.merge(result.skipReason(), 1, Integer::sum);
            } else {
                total = total.merge(result.metrics());
                filesAnalyzed++;
                analyzedByCategory.merge(result.category(), 1, Integer::sum);
            }
            return true;
        }
    }

    /**
     * Returns the current totals without closing.
     */
    public AggregateMetrics<M> snapshot() {
        synchronized (lock) {
            return new AggregateMetrics<>(
                    total,
                    filesAnalyzed,
                    ImmutableMap.copyOf(skipped),
                    ImmutableMap.copyOf(analyzedByCategory)
            );
        }
    }

    /**
     * Stops accepting results and returns the final totals. Idempotent.
     */
    public AggregateMetrics<M> close() {
        synchronized (lock) {
            closed = true;
            return snapshot();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }
}
