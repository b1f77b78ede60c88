package dev.roshin.treescan.analysis.core;

import dev.roshin.treescan.analysis.model.CandidateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * What an analyzer gets to work on one file: the file, bounded reads of its content,
 * and the means to stop in time.
 * <p>
 * Long-running analyzers call {@link #checkpoint()} between steps and run regexes over
 * {@link #guard(CharSequence)}; both throw {@link FileTimeoutException} once the file's
 * deadline passes or the run is stopped. One context per file, confined to the worker
 * thread that owns the file.
 */
public final class FileContext {
    private static final Logger log = LoggerFactory.getLogger(FileContext.class);

    private final CandidateFile file;
    private final Deadline deadline;
    private final AbortState abortState;
    private final int maxContentChars;
    private boolean truncated;

    public FileContext(CandidateFile file, Deadline deadline, AbortState abortState, int maxContentChars) {
        this.file = file;
        this.deadline = deadline;
        this.abortState = abortState;
        this.maxContentChars = maxContentChars;
    }

    public CandidateFile file() {
        return file;
    }

    public Deadline deadline() {
        return deadline;
    }

    /**
     * Reads the file as UTF-8, replacing malformed input, keeping at most the
     * configured number of characters.
     */
    public String readContent() throws IOException {
        checkpoint();
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        StringBuilder content = new StringBuilder((int) Math.min(file.sizeBytes(), maxContentChars));
        try (Reader reader = new InputStreamReader(Files.newInputStream(file.path()), decoder)) {
            char[] buffer = new char[8192];
            int read;
            while ((read = reader.read(buffer)) != -1) {
                int room = maxContentChars - content.length();
                if (read > room) {
                    content.append(buffer, 0, room);
                    truncated = true;
                    break;
                }
                content.append(buffer, 0, read);
                checkpoint();
            }
        }
        if (truncated) {
            log.debug("Truncated {} to {} characters", file.relativePath(), maxContentChars);
        }
        return content.toString();
    }

    /**
     * Whether the last read stopped at the content limit.
     */
    public boolean truncated() {
        return truncated;
    }

    /**
     * Returns a view of {@code text} that fails regex matching once time is up.
     */
    public CharSequence guard(CharSequence text) {
        return new DeadlineCharSequence(text, this);
    }

    /**
     * Throws {@link FileTimeoutException} if this file must stop: its deadline passed,
     * its worker was interrupted, or the run was stopped hard.
     * A soft-deadline abort alone does not stop in-flight files.
     */
    public void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new FileTimeoutException(file.relativePath() + ": worker interrupted");
        }
        if (deadline.isExpired()) {
            throw new FileTimeoutException(file.relativePath() + ": per-file deadline exceeded");
        }
        if (abortState.isStopRequested()) {
            throw new FileTimeoutException(file.relativePath() + ": run stopped");
        }
    }
}
