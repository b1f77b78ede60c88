package dev.roshin.treescan.analysis.core;

/**
 * Thrown from {@link FileContext#checkpoint()} when the current file has run out
 * of time. The scheduler turns it into a {@code FILE_TIMEOUT} skip; it never
 * leaves the engine.
 */
public class FileTimeoutException extends RuntimeException {

    public FileTimeoutException(String message) {
        super(message, null, false, false);
    }
}
