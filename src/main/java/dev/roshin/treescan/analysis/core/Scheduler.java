package dev.roshin.treescan.analysis.core;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.roshin.treescan.analysis.aggregate.Aggregator;
import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;
import dev.roshin.treescan.analysis.config.AnalysisBudget;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.model.CandidateFile;
import dev.roshin.treescan.analysis.model.PartialResult;
import dev.roshin.treescan.analysis.model.enums.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a {@link FileAnalyzer} over the selected files on a bounded worker pool.
 * <p>
 * Workers pull files from a shared queue; a polled file belongs to that worker alone.
 * Each file gets its own deadline, {@link AnalysisBudget#perFileTimeout(int)} at the
 * moment it is dispatched, enforced by one watchdog thread for the whole run. Every
 * dispatched file is settled exactly once: by its worker, or by the watchdog as a
 * {@code FILE_TIMEOUT} if the deadline passes first. After the soft deadline no new
 * files are dispatched and queued files are counted as not started; in-flight files
 * get until the drain deadline, then whatever is still running is abandoned.
 */
public class Scheduler<M extends MergeableMetrics<M>> {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final AnalysisConfig config;
    private final AnalysisBudget budget;
    private final AbortCoordinator coordinator;
    private final Aggregator<M> aggregator;

    public Scheduler(AnalysisConfig config, AnalysisBudget budget,
                     AbortCoordinator coordinator, Aggregator<M> aggregator) {
        this.config = config;
        this.budget = budget;
        this.coordinator = coordinator;
        this.aggregator = aggregator;
    }

    /**
     * Analyzes {@code files} and returns once every file is settled or the drain
     * deadline has passed.
     */
    public Outcome run(List<CandidateFile> files, FileAnalyzer<M> analyzer) {
        if (files.isEmpty()) {
            log.debug("Nothing to schedule");
            return new Outcome(0, 0, true);
        }

        int workers = Math.min(Math.min(Runtime.getRuntime().availableProcessors(), files.size()),
                config.maxWorkers());
        ExecutorService pool = Executors.newFixedThreadPool(workers, new ThreadFactoryBuilder()
                .setNameFormat("treescan-worker-%d")
                .setDaemon(true)
                .build());
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("treescan-watchdog-%d")
                .setDaemon(true)
                .build());
        coordinator.onHardStop(pool::shutdownNow);
        coordinator.onHardStop(watchdog::shutdownNow);

        Dispatch dispatch = new Dispatch(files, analyzer, watchdog);
        log.info("Dispatching {} files to {} workers", files.size(), workers);
        for (int i = 0; i < workers; i++) {
            pool.execute(dispatch::work);
        }

        boolean drained = dispatch.awaitSettled(budget.softDeadline());
        if (!drained) {
            // workers may all be stuck; nothing queued starts after the soft deadline
            coordinator.isAborted();
            dispatch.dropUndispatched();
            drained = dispatch.awaitSettled(budget.drainDeadline());
        }

        if (!drained) {
            int abandoned = 0;
            for (FileTask task : dispatch.inFlight.values()) {
                if (dispatch.expire(task, "abandoned after drain grace")) {
                    abandoned++;
                }
            }
            log.warn("Drain deadline passed: {} in-flight files abandoned, {} never started",
                    abandoned, dispatch.notStarted.get());
        }

        pool.shutdownNow();
        watchdog.shutdownNow();

        // Workers still registered here are stuck inside an analyzer that ignores
        // deadlines and interrupts; their threads are daemons and are left behind.
        int stuck = dispatch.inFlight.size();
        if (stuck > 0) {
            log.warn("{} worker threads did not return and were left running", stuck);
        }
        return new Outcome(workers, stuck, drained);
    }

    /**
     * State of one {@link #run} call, shared by its workers and watchdog.
     */
    private final class Dispatch {
        private final Queue<CandidateFile> queue;
        private final AtomicInteger undispatched;
        private final AtomicInteger notStarted = new AtomicInteger();
        private final CountDownLatch settled;
        private final Map<CandidateFile, FileTask> inFlight = new ConcurrentHashMap<>();
        private final FileAnalyzer<M> analyzer;
        private final ScheduledExecutorService watchdog;
        private final Ticker ticker;

        private Dispatch(List<CandidateFile> files, FileAnalyzer<M> analyzer, ScheduledExecutorService watchdog) {
            this.queue = new ConcurrentLinkedQueue<>(files);
            this.undispatched = new AtomicInteger(files.size());
            this.settled = new CountDownLatch(files.size());
            this.analyzer = analyzer;
            this.watchdog = watchdog;
            this.ticker = budget.softDeadline().ticker();
        }

        private void work() {
            while (true) {
                if (coordinator.isAborted()) {
                    dropUndispatched();
                    return;
                }
                CandidateFile file = queue.poll();
                if (file == null) {
                    return;
                }

                Duration timeout = budget.perFileTimeout(undispatched.getAndDecrement());
                FileTask task = new FileTask(file, Thread.currentThread(), Deadline.after(timeout, ticker));
                inFlight.put(file, task);

                ScheduledFuture<?> timer;
                try {
                    timer = watchdog.schedule(
                            () -> expire(task, "no result within " + timeout.toMillis() + "ms"),
                            timeout.toNanos(), TimeUnit.NANOSECONDS);
                } catch (RejectedExecutionException e) {
                    log.debug("Watchdog stopped, worker exiting before {}", file.relativePath());
                    inFlight.remove(file);
                    return;
                }

                PartialResult<M> result = null;
                try {
                    result = analyze(task);
                } finally {
                    timer.cancel(false);
                    boolean completed;
                    synchronized (task) {
                        completed = task.complete();
                        if (!completed) {
                            // the watchdog interrupted us for this file; don't carry it to the next
                            Thread.interrupted();
                        }
                    }
                    inFlight.remove(file);
                    if (completed) {
                        settle(result != null ? result
                                : PartialResult.skipped(file, SkipReason.ANALYZER_ERROR, "worker failed"));
                    }
                }
            }
        }

        private boolean awaitSettled(Deadline deadline) {
            try {
                return settled.await(deadline.remainingNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }

        private PartialResult<M> analyze(FileTask task) {
            CandidateFile file = task.file;
            FileContext context = new FileContext(file, task.deadline, coordinator.state(), config.maxContentChars());
            try {
                M metrics = analyzer.analyze(context);
                if (metrics == null) {
                    return PartialResult.skipped(file, SkipReason.ANALYZER_ERROR, "analyzer returned no metrics");
                }
                log.debug("Analyzed {}", file.relativePath());
                return PartialResult.analyzed(file, metrics);
            } catch (FileTimeoutException e) {
                log.debug("Timed out: {}", e.getMessage());
                return PartialResult.skipped(file, SkipReason.FILE_TIMEOUT, e.getMessage());
            } catch (IOException e) {
                if (e instanceof ClosedByInterruptException || task.isExpired()) {
                    return PartialResult.skipped(file, SkipReason.FILE_TIMEOUT, "read interrupted");
                }
                log.warn("Could not read {}: {}", file.relativePath(), e.toString());
                return PartialResult.skipped(file, SkipReason.READ_ERROR, e.toString());
            } catch (Exception | StackOverflowError e) {
                return analyzerError(file, e);
            } catch (Error e) {
                if (e instanceof VirtualMachineError) {
                    throw e;
                }
                // assertion, linkage and initializer errors from plug-in code
                return analyzerError(file, e);
            }
        }

        private PartialResult<M> analyzerError(CandidateFile file, Throwable e) {
            log.warn("Analyzer {} failed on {}: {}", analyzer.name(), file.relativePath(), e.toString());
            return PartialResult.skipped(file, SkipReason.ANALYZER_ERROR, e.toString());
        }

        /**
         * Settles a running file as timed out and interrupts its worker.
         *
         * @return false if the file had already been settled
         */
        private boolean expire(FileTask task, String detail) {
            boolean expired;
            synchronized (task) {
                expired = task.expire();
                if (expired) {
                    task.worker.interrupt();
                }
            }
            if (expired) {
                log.warn("File {} timed out: {}", task.file.relativePath(), detail);
                settle(PartialResult.skipped(task.file, SkipReason.FILE_TIMEOUT, detail));
            }
            return expired;
        }

        private void settle(PartialResult<M> result) {
            aggregator.accept(result);
            settled.countDown();
        }

        private void dropUndispatched() {
            CandidateFile file;
            while ((file = queue.poll()) != null) {
                notStarted.incrementAndGet();
                settled.countDown();
            }
        }
    }

    /**
     * A dispatched file and the worker running it. State changes happen under the
     * task's monitor so the watchdog's interrupt cannot leak into the worker's next file.
     */
    private static final class FileTask {
        private enum State { RUNNING, DONE, TIMED_OUT }

        private final CandidateFile file;
        private final Thread worker;
        private final Deadline deadline;
        private State state = State.RUNNING;

        private FileTask(CandidateFile file, Thread worker, Deadline deadline) {
            this.file = file;
            this.worker = worker;
            this.deadline = deadline;
        }

        private synchronized boolean complete() {
            if (state != State.RUNNING) {
                return false;
            }
            state = State.DONE;
            return true;
        }

        private synchronized boolean expire() {
            if (state != State.RUNNING) {
                return false;
            }
            state = State.TIMED_OUT;
            return true;
        }

        private synchronized boolean isExpired() {
            return state == State.TIMED_OUT;
        }
    }

    /**
     * @param workers      Pool size used for the run
     * @param stuckWorkers Workers that never returned from an analyzer
     * @param drained      Whether every file was settled before the drain deadline
     */
    public record Outcome(int workers, int stuckWorkers, boolean drained) {
    }
}
