package dev.roshin.treescan.analysis.core;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import dev.roshin.treescan.analysis.aggregate.Aggregator;
import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;
import dev.roshin.treescan.analysis.config.AnalysisBudget;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.discovery.Discoverer;
import dev.roshin.treescan.analysis.discovery.DiscoveryResult;
import dev.roshin.treescan.analysis.discovery.Sampler;
import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.model.AnalysisReport;
import dev.roshin.treescan.analysis.model.CandidateFile;
import dev.roshin.treescan.analysis.model.PartialResult;
import dev.roshin.treescan.analysis.model.enums.AbortReason;
import dev.roshin.treescan.analysis.model.enums.RunStatus;
import dev.roshin.treescan.analysis.model.enums.SkipReason;
import dev.roshin.treescan.analysis.score.ScoreBreakdown;
import dev.roshin.treescan.analysis.score.ScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for bounded-time analysis of a directory tree.
 * <p>
 * A run discovers candidate files, samples them down to the configured maximum,
 * analyzes them in parallel with per-file deadlines and merges the results. Running
 * out of time is not an error: the report says how far the run got. Only an invalid
 * root directory is reported by exception.
 * <p>
 * Instances hold no per-run state and may run several analyses concurrently.
 */
public class TreeAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(TreeAnalyzer.class);

    private final AnalysisConfig config;
    private final Ticker ticker;
    private final Discoverer discoverer;
    private final Sampler sampler;

    public TreeAnalyzer() {
        this(AnalysisConfig.DEFAULT);
    }

    public TreeAnalyzer(AnalysisConfig config) {
        this(config, Ticker.systemTicker());
    }

    TreeAnalyzer(AnalysisConfig config, Ticker ticker) {
        this(config, ticker, new Discoverer(config));
    }

    TreeAnalyzer(AnalysisConfig config, Ticker ticker, Discoverer discoverer) {
        this.config = config;
        this.ticker = ticker;
        this.discoverer = discoverer;
        this.sampler = new Sampler();
    }

    public AnalysisConfig config() {
        return config;
    }

    /**
     * Analyzes the tree under {@code root}.
     *
     * @param root       Directory to analyze
     * @param analyzer   Per-file check
     * @param calculator Turns the merged metrics into a score
     * @return Report of the run, also when it timed out
     * @throws IllegalArgumentException if {@code root} does not exist or is not a directory
     */
    public <M extends MergeableMetrics<M>> AnalysisReport<M> analyze(
            Path root, FileAnalyzer<M> analyzer, ScoreCalculator<M> calculator) {
        return analyze(root, analyzer, calculator, new AbortSignal());
    }

    /**
     * Analyzes the tree under {@code root}; triggering {@code signal} ends the run early
     * with status {@link RunStatus#ABORTED}.
     *
     * @throws IllegalArgumentException if {@code root} does not exist or is not a directory
     */
    public <M extends MergeableMetrics<M>> AnalysisReport<M> analyze(
            Path root, FileAnalyzer<M> analyzer, ScoreCalculator<M> calculator, AbortSignal signal) {
        Path projectRoot = root.toAbsolutePath().normalize();
        validateRoot(projectRoot);

        log.info("Starting {} analysis of {} (soft {}, hard {})",
                analyzer.name(), projectRoot, config.softTimeout(), config.hardTimeout());
        Stopwatch stopwatch = Stopwatch.createStarted(ticker);
        AnalysisBudget budget = AnalysisBudget.start(config, ticker);
        Aggregator<M> aggregator = new Aggregator<>(analyzer.empty());
        RunProgress progress = new RunProgress();

        try (AbortCoordinator coordinator = new AbortCoordinator(budget, signal)) {
            AnalysisReport<M> report = coordinator.superviseUntilHardDeadline(
                    () -> runPipeline(projectRoot, analyzer, calculator, budget, coordinator,
                            aggregator, progress, stopwatch),
                    (status, reason) -> createStoppedReport(projectRoot, analyzer, calculator,
                            aggregator, progress, stopwatch, status, reason));
            log.info("Analysis completed: {}", report);
            return report;
        }
    }

    /**
     * Validates that the analysis root is an existing directory.
     */
    private void validateRoot(Path root) {
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Analysis root does not exist: " + root);
        }
        if (!Files.isDirectory(root)) {
            throw new IllegalArgumentException("Analysis root is not a directory: " + root);
        }
        log.debug("Analysis root validated: {}", root);
    }

    private <M extends MergeableMetrics<M>> AnalysisReport<M> runPipeline(
            Path root, FileAnalyzer<M> analyzer, ScoreCalculator<M> calculator, AnalysisBudget budget,
            AbortCoordinator coordinator, Aggregator<M> aggregator, RunProgress progress, Stopwatch stopwatch) {

        DiscoveryResult discovery = discoverer.discover(root, budget, coordinator.state());
        progress.discovered = discovery.filesDiscovered();
        progress.earlyStopped = discovery.earlyStopped();
        progress.discoveryWarnings = discovery.warnings();
        log.info("Discovered {} files ({} over the size limit) in {} directories",
                discovery.filesDiscovered(), discovery.oversized().size(), discovery.directoriesVisited());

        for (CandidateFile file : discovery.oversized()) {
            aggregator.accept(PartialResult.skipped(file, SkipReason.TOO_LARGE,
                    file.sizeBytes() + " bytes exceeds limit of " + config.maxFileSizeBytes()));
        }

        Sampler.Sample sample = sampler.sample(discovery.candidates(), config.maxFiles());
        progress.selected = sample.selected().size();
        progress.sampled = sample.sampled();

        Scheduler.Outcome outcome = new Scheduler<>(config, budget, coordinator, aggregator)
                .run(sample.selected(), analyzer);
        AggregateMetrics<M> metrics = aggregator.close();

        List<String> warnings = new ArrayList<>(discovery.warnings());
        if (!outcome.drained()) {
            warnings.add("In-flight files abandoned after drain grace of " + config.drainGrace());
        }
        if (outcome.stuckWorkers() > 0) {
            warnings.add(outcome.stuckWorkers() + " worker threads did not return from the analyzer");
        }
        ScoreBreakdown score = scoreOf(calculator, metrics, warnings);

        return new AnalysisReport<>(
                root,
                analyzer.name(),
                metrics,
                score,
                statusOf(coordinator.state().reason()),
                progress.discovered,
                progress.selected,
                notStarted(progress.selected, metrics),
                progress.sampled,
                progress.earlyStopped,
                stopwatch.elapsed(TimeUnit.MILLISECONDS),
                ImmutableList.copyOf(warnings)
        );
    }

    /**
     * Creates the report when the pipeline was stopped from outside, from whatever
     * was aggregated up to that moment.
     */
    private <M extends MergeableMetrics<M>> AnalysisReport<M> createStoppedReport(
            Path root, FileAnalyzer<M> analyzer, ScoreCalculator<M> calculator, Aggregator<M> aggregator,
            RunProgress progress, Stopwatch stopwatch, RunStatus status, String reason) {
        AggregateMetrics<M> metrics = aggregator.close();
        List<String> warnings = new ArrayList<>();
        warnings.add("CRITICAL: " + reason);
        warnings.addAll(progress.discoveryWarnings);
        ScoreBreakdown score = scoreOf(calculator, metrics, warnings);

        return new AnalysisReport<>(
                root,
                analyzer.name(),
                metrics,
                score,
                status,
                progress.discovered,
                progress.selected,
                notStarted(progress.selected, metrics),
                progress.sampled,
                progress.earlyStopped,
                stopwatch.elapsed(TimeUnit.MILLISECONDS),
                ImmutableList.copyOf(warnings)
        );
    }

    private static <M> ScoreBreakdown scoreOf(ScoreCalculator<M> calculator, AggregateMetrics<M> metrics,
                                              List<String> warnings) {
        try {
            return calculator.calculate(metrics);
        } catch (RuntimeException e) {
            log.warn("Score calculation failed, using minimum score", e);
            warnings.add("Score calculation failed: " + e.getMessage());
            return ScoreBreakdown.minimum();
        }
    }

    /**
     * Selected files that contributed neither metrics nor a skip: never dispatched,
     * or lost with an abandoned worker.
     */
    private static int notStarted(int selected, AggregateMetrics<?> metrics) {
        int settled = metrics.filesAnalyzed() + metrics.skippedCount() - metrics.skipped(SkipReason.TOO_LARGE);
        return Math.max(0, selected - settled);
    }

    private static RunStatus statusOf(Optional<AbortReason> reason) {
        if (reason.isEmpty()) {
            return RunStatus.COMPLETED;
        }
        switch (reason.get()) {
            case SOFT_DEADLINE:
                return RunStatus.SOFT_TIMEOUT;
            case EXTERNAL:
                return RunStatus.ABORTED;
            default:
                return RunStatus.HARD_TIMEOUT;
        }
    }

    /**
     * Discovery figures, readable by the supervising thread if the pipeline is stopped.
     */
    private static final class RunProgress {
        private volatile int discovered;
        private volatile int selected;
        private volatile boolean sampled;
        private volatile boolean earlyStopped;
        private volatile List<String> discoveryWarnings = List.of();
    }
}
