package dev.roshin.treescan.analysis.model;

import java.nio.file.Path;

/**
 * A file found by the discovery walk.
 *
 * @param path         Absolute path of the file
 * @param relativePath Path relative to the analysis root, '/'-separated
 * @param sizeBytes    File size at discovery time
 * @param category     Category derived from the extension or file name (e.g. "python")
 * @param eligible     False when the file was found but exceeds the size cap
 */
public record CandidateFile(
        Path path,
        String relativePath,
        long sizeBytes,
        String category,
        boolean eligible
) {
    @Override
    public String toString() {
        return String.format("%s [%s, %d bytes%s]",
                relativePath, category, sizeBytes, eligible ? "" : ", ineligible");
    }
}
