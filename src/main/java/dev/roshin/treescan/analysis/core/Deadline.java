package dev.roshin.treescan.analysis.core;

import com.google.common.base.Ticker;

import java.time.Duration;

/**
 * A fixed point in time on a {@link Ticker}'s time line.
 * Immutable and safe to share between threads.
 */
public final class Deadline {
    private final Ticker ticker;
    private final long deadlineNanos;

    private Deadline(Ticker ticker, long deadlineNanos) {
        this.ticker = ticker;
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration duration, Ticker ticker) {
        return new Deadline(ticker, ticker.read() + duration.toNanos());
    }

    /**
     * Returns this deadline moved later by the given amount.
     */
    public Deadline plus(Duration duration) {
        return new Deadline(ticker, deadlineNanos + duration.toNanos());
    }

    public long remainingNanos() {
        return Math.max(0L, deadlineNanos - ticker.read());
    }

    /**
     * Time left until the deadline, zero once expired.
     */
    public Duration remaining() {
        return Duration.ofNanos(remainingNanos());
    }

    public boolean isExpired() {
        return deadlineNanos - ticker.read() <= 0;
    }

    public Ticker ticker() {
        return ticker;
    }

    @Override
    public String toString() {
        return isExpired() ? "Deadline[expired]" : "Deadline[in " + remaining() + "]";
    }
}
