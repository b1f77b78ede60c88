package dev.roshin.treescan.analysis.discovery;

import dev.roshin.treescan.analysis.config.AnalysisConfig;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which directories the walk enters and which files become candidates.
 */
public class PathFilter {
    private final Map<String, String> categories;
    private final Set<String> skipDirectories;
    private final boolean skipHiddenDirectories;
    private final long maxFileSizeBytes;
    private final int maxDirDepth;

    public PathFilter(AnalysisConfig config) {
        this.categories = config.categories();
        this.skipDirectories = config.skipDirectories();
        this.skipHiddenDirectories = config.skipHiddenDirectories();
        this.maxFileSizeBytes = config.maxFileSizeBytes();
        this.maxDirDepth = config.maxDirDepth();
    }

    /**
     * Whether the walk should enter {@code dir}, found {@code depth} levels below the root.
     */
    public boolean shouldDescend(Path dir, int depth) {
        if (maxDirDepth != -1 && depth > maxDirDepth) {
            return false;
        }
        Path name = dir.getFileName();
        if (name == null) {
            return true;
        }
        String dirName = name.toString();
        if (skipDirectories.contains(dirName)) {
            return false;
        }
        return !(skipHiddenDirectories && dirName.startsWith("."));
    }

    /**
     * Category of a file: an exact file-name entry wins over an extension entry.
     * Empty when the file is not of interest.
     */
    public Optional<String> categoryOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return Optional.empty();
        }
        String fileName = name.toString().toLowerCase(Locale.ROOT);
        String byName = categories.get(fileName);
        if (byName != null) {
            return Optional.of(byName);
        }
        String extension = extensionOf(fileName);
        return extension.isEmpty() ? Optional.empty() : Optional.ofNullable(categories.get(extension));
    }

    public boolean exceedsSizeLimit(long sizeBytes) {
        return sizeBytes > maxFileSizeBytes;
    }

    /**
     * Lower-case extension including the dot, or "" when there is none.
     * Leading dots (".bashrc") do not count as an extension.
     */
    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
