package dev.roshin.treescan.analysis.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets a caller cancel a running analysis from outside. The run notices the
 * signal the next time any component polls its abort state.
 */
public final class AbortSignal {
    private final AtomicBoolean triggered = new AtomicBoolean();

    public void trigger() {
        triggered.set(true);
    }

    public boolean isTriggered() {
        return triggered.get();
    }
}
