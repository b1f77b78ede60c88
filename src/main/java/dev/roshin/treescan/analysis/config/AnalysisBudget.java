package dev.roshin.treescan.analysis.config;

import com.google.common.base.Ticker;
import dev.roshin.treescan.analysis.core.Deadline;

import java.time.Duration;

/**
 * The time and size budget of one analysis run, fixed when the run starts.
 *
 * @param softDeadline      Cooperative deadline polled by every component
 * @param hardDeadline      Preemptive deadline enforced by the supervisor
 * @param discoveryDeadline Sub-deadline of the discovery walk
 * @param maxFiles          Maximum number of files analyzed
 * @param maxFileSizeBytes  Size cap per file
 * @param maxDirDepth       Directory depth cap, -1 for unlimited
 * @param perFileCeiling    Upper bound of the derived per-file timeout
 * @param perFileFloor      Lower bound of the derived per-file timeout
 * @param drainGrace        Grace period for in-flight files after the soft deadline
 */
public record AnalysisBudget(
        Deadline softDeadline,
        Deadline hardDeadline,
        Deadline discoveryDeadline,
        int maxFiles,
        long maxFileSizeBytes,
        int maxDirDepth,
        Duration perFileCeiling,
        Duration perFileFloor,
        Duration drainGrace
) {
    /**
     * Starts the clock for a run described by {@code config}.
     */
    public static AnalysisBudget start(AnalysisConfig config, Ticker ticker) {
        long discoveryNanos = (long) (config.softTimeout().toNanos() * config.discoveryShare());
        return new AnalysisBudget(
                Deadline.after(config.softTimeout(), ticker),
                Deadline.after(config.hardTimeout(), ticker),
                Deadline.after(Duration.ofNanos(discoveryNanos), ticker),
                config.maxFiles(),
                config.maxFileSizeBytes(),
                config.maxDirDepth(),
                config.perFileCeiling(),
                config.perFileFloor(),
                config.drainGrace()
        );
    }

    /**
     * Timeout for the next file: the remaining soft budget split evenly over the
     * files still to dispatch, clamped to [floor, ceiling].
     *
     * @param remainingFiles files not yet dispatched, including the one being dispatched
     */
    public Duration perFileTimeout(int remainingFiles) {
        if (remainingFiles <= 0) {
            return perFileCeiling;
        }
        Duration share = softDeadline.remaining().dividedBy(remainingFiles);
        if (share.compareTo(perFileFloor) < 0) {
            return perFileFloor;
        }
        return share.compareTo(perFileCeiling) > 0 ? perFileCeiling : share;
    }

    /**
     * Latest moment the scheduler waits for in-flight files.
     */
    public Deadline drainDeadline() {
        return softDeadline.plus(drainGrace);
    }
}
