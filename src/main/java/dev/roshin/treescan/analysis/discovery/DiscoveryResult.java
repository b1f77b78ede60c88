package dev.roshin.treescan.analysis.discovery;

import dev.roshin.treescan.analysis.model.CandidateFile;

import java.util.List;

/**
 * Output of the discovery walk.
 *
 * @param candidates         Eligible files in walk order
 * @param oversized          Files of interest that exceed the size cap
 * @param directoriesVisited Directories listed during the walk
 * @param earlyStopped       Whether the walk stopped before covering the tree
 * @param warnings           Directories that could not be listed and similar
 */
public record DiscoveryResult(
        List<CandidateFile> candidates,
        List<CandidateFile> oversized,
        int directoriesVisited,
        boolean earlyStopped,
        List<String> warnings
) {
    /**
     * All files of interest found, eligible or not.
     */
    public int filesDiscovered() {
        return candidates.size() + oversized.size();
    }
}
