package dev.roshin.treescan.analysis.core;

import dev.roshin.treescan.analysis.model.enums.AbortReason;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The abort flag of one run, shared by reference with every component.
 * <p>
 * The flag only ever goes from clear to set, once; the reason recorded is the one of
 * the transition that won. Polling also compares the clock against the soft deadline
 * and checks the caller's {@link AbortSignal}, so a late timer never delays an abort.
 */
public final class AbortState {
    private final AtomicReference<AbortReason> reason = new AtomicReference<>();
    private final Deadline softDeadline;
    private final Deadline hardDeadline;
    private final AbortSignal signal;

    public AbortState(Deadline softDeadline, Deadline hardDeadline, AbortSignal signal) {
        this.softDeadline = softDeadline;
        this.hardDeadline = hardDeadline;
        this.signal = signal;
    }

    /**
     * Sets the flag if it is still clear.
     *
     * @return true if this call set it
     */
    public boolean trip(AbortReason abortReason) {
        return reason.compareAndSet(null, abortReason);
    }

    public boolean isAborted() {
        if (reason.get() != null) {
            return true;
        }
        if (signal != null && signal.isTriggered()) {
            trip(AbortReason.EXTERNAL);
            return true;
        }
        if (softDeadline.isExpired()) {
            trip(AbortReason.SOFT_DEADLINE);
            return true;
        }
        return false;
    }

    public Optional<AbortReason> reason() {
        return Optional.ofNullable(reason.get());
    }

    /**
     * True once a reason that requires in-flight work to stop at once has been recorded.
     */
    public boolean isStopRequested() {
        isAborted();
        AbortReason current = reason.get();
        return current == AbortReason.HARD_DEADLINE || current == AbortReason.EXTERNAL;
    }

    public Deadline softDeadline() {
        return softDeadline;
    }

    public Deadline hardDeadline() {
        return hardDeadline;
    }
}
