package dev.roshin.treescan.analysis.core;

import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;

import java.io.IOException;

/**
 * A pluggable per-file check run by the engine.
 * <p>
 * Called concurrently from several worker threads, so implementations must not keep
 * mutable state between calls. Anything thrown is contained by the engine:
 * {@link IOException} becomes a read error, {@link FileTimeoutException} a file
 * timeout, any other runtime exception an analyzer error.
 *
 * @param <M> Metrics produced per file and merged across files
 */
public interface FileAnalyzer<M extends MergeableMetrics<M>> {

    /**
     * Short identifier used in logs and reports.
     */
    String name();

    /**
     * Identity element of {@link MergeableMetrics#merge}: the total before any file.
     */
    M empty();

    M analyze(FileContext context) throws IOException;
}
