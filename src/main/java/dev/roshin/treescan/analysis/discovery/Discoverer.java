package dev.roshin.treescan.analysis.discovery;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import dev.roshin.treescan.analysis.config.AnalysisBudget;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.core.AbortState;
import dev.roshin.treescan.analysis.core.Deadline;
import dev.roshin.treescan.analysis.model.CandidateFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Walks a directory tree and collects the files worth analyzing.
 * <p>
 * The walk is depth-first with entries sorted by name, so an unchanged tree always
 * yields the same list in the same order. Symbolic links are never followed. The walk
 * polls the abort state and its own discovery deadline after every directory and
 * every {@value #CHECK_INTERVAL} files, and returns what it has as soon as either trips.
 */
public class Discoverer {
    private static final Logger log = LoggerFactory.getLogger(Discoverer.class);

    static final int CHECK_INTERVAL = 50;

    private static final Comparator<Path> BY_NAME = Comparator.comparing(p -> p.getFileName().toString());

    private final PathFilter filter;
    private final int maxDiscoveredFiles;

    public Discoverer(AnalysisConfig config) {
        this.filter = new PathFilter(config);
        this.maxDiscoveredFiles = config.maxDiscoveredFiles();
    }

    public DiscoveryResult discover(Path root, AnalysisBudget budget, AbortState abortState) {
        log.debug("Discovering files under {}", root);
        Deadline deadline = budget.discoveryDeadline();

        List<CandidateFile> candidates = new ArrayList<>();
        List<CandidateFile> oversized = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<Path> seen = new HashSet<>();
        Deque<PendingDirectory> pending = new ArrayDeque<>();
        pending.push(new PendingDirectory(root, 0));

        int directoriesVisited = 0;
        int filesSeen = 0;
        boolean earlyStopped = false;

        walk:
        while (!pending.isEmpty()) {
            if (shouldStop(deadline, abortState)) {
                earlyStopped = true;
                break;
            }
            PendingDirectory directory = pending.pop();
            if (!seen.add(directory.path())) {
                continue;
            }

            List<Path> children;
            try {
                children = listSorted(directory.path());
            } catch (IOException e) {
                log.warn("Could not list directory {}: {}", directory.path(), e.toString());
                warnings.add("Could not list directory: " + relativize(root, directory.path()));
                continue;
            }
            directoriesVisited++;

            List<Path> subdirectories = new ArrayList<>();
            for (Path child : children) {
                BasicFileAttributes attributes;
                try {
                    attributes = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
                } catch (IOException e) {
                    log.debug("Could not stat {}: {}", child, e.toString());
                    continue;
                }

                if (attributes.isDirectory()) {
                    if (filter.shouldDescend(child, directory.depth() + 1)) {
                        subdirectories.add(child);
                    }
                    continue;
                }
                if (!attributes.isRegularFile()) {
                    continue;
                }
                Optional<String> category = filter.categoryOf(child);
                if (category.isEmpty() || !seen.add(child)) {
                    continue;
                }

                filesSeen++;
                long size = attributes.size();
                boolean eligible = !filter.exceedsSizeLimit(size);
                CandidateFile file = new CandidateFile(child, relativize(root, child), size, category.get(), eligible);
                if (eligible) {
                    candidates.add(file);
                } else {
                    log.info("Skipping large file: {} ({} bytes)", file.relativePath(), size);
                    oversized.add(file);
                }

                if (candidates.size() + oversized.size() >= maxDiscoveredFiles) {
                    log.warn("Discovery stopped at the cap of {} files", maxDiscoveredFiles);
                    earlyStopped = true;
                    break walk;
                }
                if (filesSeen % CHECK_INTERVAL == 0 && shouldStop(deadline, abortState)) {
                    earlyStopped = true;
                    break walk;
                }
            }

            for (int i = subdirectories.size() - 1; i >= 0; i--) {
                pending.push(new PendingDirectory(subdirectories.get(i), directory.depth() + 1));
            }
        }

        if (earlyStopped) {
            log.warn("Discovery stopped early after {} directories, {} files", directoriesVisited, filesSeen);
        } else {
            log.debug("Discovery finished: {} directories, {} files", directoriesVisited, filesSeen);
        }
        return new DiscoveryResult(
                ImmutableList.copyOf(candidates),
                ImmutableList.copyOf(oversized),
                directoriesVisited,
                earlyStopped,
                ImmutableList.copyOf(warnings)
        );
    }

    private boolean shouldStop(Deadline deadline, AbortState abortState) {
        if (abortState.isAborted()) {
            log.debug("Discovery interrupted by abort");
            return true;
        }
        if (deadline.isExpired()) {
            log.debug("Discovery time slice exhausted");
            return true;
        }
        return false;
    }

    private static List<Path> listSorted(Path directory) throws IOException {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            List<Path> children = Lists.newArrayList(stream);
            children.sort(BY_NAME);
            return children;
        }
    }

    private static String relativize(Path root, Path path) {
        return Joiner.on('/').join(root.relativize(path));
    }

    private record PendingDirectory(Path path, int depth) {
    }
}
