package dev.roshin.treescan.analysis.core;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.roshin.treescan.analysis.config.AnalysisBudget;
import dev.roshin.treescan.analysis.model.enums.AbortReason;
import dev.roshin.treescan.analysis.model.enums.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;

/**
 * Owns the time budget of one run.
 * <p>
 * The soft deadline is cooperative: a timer thread sets the shared abort flag when
 * it passes, and every component polls {@link #isAborted()}. The hard deadline is
 * enforced by {@link #superviseUntilHardDeadline}, which runs the pipeline on its own
 * thread and, if it has not returned in time, stops every registered worker pool and
 * returns a synthesized result instead. That path does not depend on any worker
 * cooperating, so it also covers regex backtracking and blocked reads.
 */
public class AbortCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AbortCoordinator.class);

    private final AbortState state;
    private final ScheduledExecutorService timer;
    private final List<Runnable> hardStopHooks = new CopyOnWriteArrayList<>();

    public AbortCoordinator(AnalysisBudget budget, AbortSignal signal) {
        this.state = new AbortState(budget.softDeadline(), budget.hardDeadline(), signal);
        this.timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("treescan-abort-%d")
                .setDaemon(true)
                .build());
        timer.schedule(this::softDeadlineReached, budget.softDeadline().remainingNanos(), TimeUnit.NANOSECONDS);
    }

    private void softDeadlineReached() {
        if (state.trip(AbortReason.SOFT_DEADLINE)) {
            log.info("Soft deadline reached, no new files will be dispatched");
        }
    }

    public boolean isAborted() {
        return state.isAborted();
    }

    /**
     * Aborts the run on behalf of a caller.
     */
    public void abort() {
        if (state.trip(AbortReason.EXTERNAL)) {
            log.info("Analysis aborted by caller");
        }
    }

    public AbortState state() {
        return state;
    }

    /**
     * Registers an action run when the hard deadline forces the run to stop,
     * typically {@code pool::shutdownNow}.
     */
    public void onHardStop(Runnable hook) {
        hardStopHooks.add(hook);
    }

    /**
     * Runs {@code pipeline} and waits for it no longer than the hard deadline.
     *
     * @param pipeline the whole analysis
     * @param fallback builds the result when the pipeline did not return normally,
     *                 from the terminal status and a reason
     * @return the pipeline's result, or the fallback's
     */
    public <T> T superviseUntilHardDeadline(Callable<T> pipeline, BiFunction<RunStatus, String, T> fallback) {
        ExecutorService runner = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("treescan-run-%d")
                .setDaemon(true)
                .build());
        Future<T> future = runner.submit(pipeline);
        try {
            return future.get(state.hardDeadline().remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            state.trip(AbortReason.HARD_DEADLINE);
            log.warn("Hard deadline reached, stopping worker pool");
            future.cancel(true);
            forceStop();
            return fallback.apply(RunStatus.HARD_TIMEOUT, "Hard deadline exceeded");
        } catch (ExecutionException e) {
            log.error("Analysis pipeline failed", e.getCause());
            state.trip(AbortReason.EXTERNAL);
            forceStop();
            return fallback.apply(RunStatus.FAILED, "Analysis failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state.trip(AbortReason.EXTERNAL);
            future.cancel(true);
            forceStop();
            return fallback.apply(RunStatus.ABORTED, "Supervising thread interrupted");
        } finally {
            runner.shutdownNow();
        }
    }

    private void forceStop() {
        for (Runnable hook : hardStopHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                log.warn("Hard stop hook failed: {}", e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        timer.shutdownNow();
    }
}
