package dev.roshin.treescan.analysis.config;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration parameters for a bounded-time tree analysis.
 *
 * @param softTimeout        Cooperative time limit for the whole run
 * @param hardTimeout        Preemptive backstop, must be longer than {@code softTimeout}
 * @param maxFiles           Maximum number of files analyzed; larger candidate sets are sampled
 * @param maxFileSizeBytes   Files larger than this are skipped as too large
 * @param maxDirDepth        Maximum directory depth below the root, -1 for unlimited
 * @param maxDiscoveredFiles File-count cap for the discovery walk
 * @param discoveryShare     Fraction of the soft budget the discovery walk may use
 * @param perFileCeiling     Upper bound of the per-file timeout
 * @param perFileFloor       Lower bound of the per-file timeout
 * @param drainGrace         How long in-flight files may keep running after the soft deadline
 * @param maxWorkers         Hard cap on the worker pool size
 * @param maxContentChars    Characters of file content handed to analyzers, the rest is truncated
 * @param skipHiddenDirectories Whether directories starting with '.' are pruned
 * @param categories         Extension (".py") or exact lower-case file name ("license") to category
 * @param skipDirectories    Directory names pruned from the walk
 */
public record AnalysisConfig(
        Duration softTimeout,
        Duration hardTimeout,
        int maxFiles,
        long maxFileSizeBytes,
        int maxDirDepth,
        int maxDiscoveredFiles,
        double discoveryShare,
        Duration perFileCeiling,
        Duration perFileFloor,
        Duration drainGrace,
        int maxWorkers,
        int maxContentChars,
        boolean skipHiddenDirectories,
        Map<String, String> categories,
        Set<String> skipDirectories
) {
    private static final String PREFIX = "treescan.";

    /**
     * Source code extensions and their language category.
     */
    public static final Map<String, String> CODE_EXTENSIONS = ImmutableMap.<String, String>builder()
            .put(".py", "python")
            .put(".js", "javascript")
            .put(".ts", "typescript")
            .put(".java", "java")
            .put(".c", "c")
            .put(".cpp", "cpp")
            .put(".cs", "csharp")
            .put(".go", "go")
            .put(".rb", "ruby")
            .put(".php", "php")
            .put(".swift", "swift")
            .put(".kt", "kotlin")
            .put(".scala", "scala")
            .put(".rs", "rust")
            .build();

    /**
     * Build output, VCS metadata and dependency caches.
     */
    public static final Set<String> DEFAULT_SKIP_DIRECTORIES = ImmutableSet.of(
            ".git", "node_modules", "venv", "env", ".venv", "__pycache__",
            "build", "dist", "target", ".github", ".idea", ".gradle", "vendor"
    );

    /**
     * Default configuration: 35 second soft budget, 500 files.
     */
    public static final AnalysisConfig DEFAULT = builder().build();

    /**
     * Creates a config with validation.
     */
    public AnalysisConfig {
        requirePositive(softTimeout, "softTimeout");
        requirePositive(hardTimeout, "hardTimeout");
        if (hardTimeout.compareTo(softTimeout) <= 0) {
            throw new IllegalArgumentException(
                    "hardTimeout must be longer than softTimeout, got: " + hardTimeout + " <= " + softTimeout);
        }
        if (maxFiles <= 0) {
            throw new IllegalArgumentException("maxFiles must be positive, got: " + maxFiles);
        }
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("maxFileSizeBytes must be positive, got: " + maxFileSizeBytes);
        }
        if (maxDirDepth < -1 || maxDirDepth == 0) {
            throw new IllegalArgumentException(
                    "maxDirDepth must be positive or -1 for unlimited, got: " + maxDirDepth);
        }
        if (maxDiscoveredFiles < maxFiles) {
            throw new IllegalArgumentException(
                    "maxDiscoveredFiles must be at least maxFiles, got: " + maxDiscoveredFiles);
        }
        if (discoveryShare <= 0 || discoveryShare > 1) {
            throw new IllegalArgumentException("discoveryShare must be in (0, 1], got: " + discoveryShare);
        }
        requirePositive(perFileCeiling, "perFileCeiling");
        requirePositive(perFileFloor, "perFileFloor");
        if (perFileFloor.compareTo(perFileCeiling) > 0) {
            throw new IllegalArgumentException("perFileFloor must not exceed perFileCeiling");
        }
        if (drainGrace == null || drainGrace.isNegative()) {
            throw new IllegalArgumentException("drainGrace must not be negative, got: " + drainGrace);
        }
        if (maxWorkers <= 0) {
            throw new IllegalArgumentException("maxWorkers must be positive, got: " + maxWorkers);
        }
        if (maxContentChars <= 0) {
            throw new IllegalArgumentException("maxContentChars must be positive, got: " + maxContentChars);
        }
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("At least one file category is required");
        }
        categories = normalizeKeys(categories);
        skipDirectories = skipDirectories == null ? Set.of() : ImmutableSet.copyOf(skipDirectories);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-filled with this config's values.
     */
    public Builder toBuilder() {
        return new Builder()
                .softTimeout(softTimeout)
                .hardTimeout(hardTimeout)
                .maxFiles(maxFiles)
                .maxFileSizeBytes(maxFileSizeBytes)
                .maxDirDepth(maxDirDepth)
                .maxDiscoveredFiles(maxDiscoveredFiles)
                .discoveryShare(discoveryShare)
                .perFileCeiling(perFileCeiling)
                .perFileFloor(perFileFloor)
                .drainGrace(drainGrace)
                .maxWorkers(maxWorkers)
                .maxContentChars(maxContentChars)
                .skipHiddenDirectories(skipHiddenDirectories)
                .categories(categories)
                .skipDirectories(skipDirectories);
    }

    /**
     * Creates a config with the given soft budget and a hard backstop 15% later.
     */
    public static AnalysisConfig withSoftTimeout(Duration softTimeout) {
        return builder().softTimeout(softTimeout).build();
    }

    /**
     * Returns true if directory depth is unlimited.
     */
    public boolean isUnlimitedDepth() {
        return maxDirDepth == -1;
    }

    /**
     * Applies {@code treescan.*} overrides on top of {@link #DEFAULT}.
     * Unknown keys are ignored.
     */
    public static AnalysisConfig fromProperties(Properties properties) {
        Builder builder = builder();
        String soft = properties.getProperty(PREFIX + "softTimeoutSeconds");
        if (soft != null) {
            builder.softTimeout(Duration.ofSeconds(parseLong(soft, "softTimeoutSeconds")));
        }
        String hard = properties.getProperty(PREFIX + "hardTimeoutSeconds");
        if (hard != null) {
            builder.hardTimeout(Duration.ofSeconds(parseLong(hard, "hardTimeoutSeconds")));
        }
        String value;
        if ((value = properties.getProperty(PREFIX + "maxFiles")) != null) {
            builder.maxFiles((int) parseLong(value, "maxFiles"));
        }
        if ((value = properties.getProperty(PREFIX + "maxFileSizeBytes")) != null) {
            builder.maxFileSizeBytes(parseLong(value, "maxFileSizeBytes"));
        }
        if ((value = properties.getProperty(PREFIX + "maxDirDepth")) != null) {
            builder.maxDirDepth((int) parseLong(value, "maxDirDepth"));
        }
        if ((value = properties.getProperty(PREFIX + "maxDiscoveredFiles")) != null) {
            builder.maxDiscoveredFiles((int) parseLong(value, "maxDiscoveredFiles"));
        }
        if ((value = properties.getProperty(PREFIX + "perFileTimeoutMillis")) != null) {
            builder.perFileCeiling(Duration.ofMillis(parseLong(value, "perFileTimeoutMillis")));
        }
        if ((value = properties.getProperty(PREFIX + "drainGraceMillis")) != null) {
            builder.drainGrace(Duration.ofMillis(parseLong(value, "drainGraceMillis")));
        }
        if ((value = properties.getProperty(PREFIX + "maxWorkers")) != null) {
            builder.maxWorkers((int) parseLong(value, "maxWorkers"));
        }
        if ((value = properties.getProperty(PREFIX + "maxContentChars")) != null) {
            builder.maxContentChars((int) parseLong(value, "maxContentChars"));
        }
        if ((value = properties.getProperty(PREFIX + "skipHiddenDirectories")) != null) {
            builder.skipHiddenDirectories(Boolean.parseBoolean(value.trim()));
        }
        if ((value = properties.getProperty(PREFIX + "categories")) != null) {
            // ".py=python,.java=java,license=license"
            builder.categories(Splitter.on(',').trimResults().omitEmptyStrings()
                    .withKeyValueSeparator(Splitter.on('=').trimResults()).split(value));
        }
        if ((value = properties.getProperty(PREFIX + "skipDirectories")) != null) {
            builder.skipDirectories(ImmutableSet.copyOf(
                    Splitter.on(',').trimResults().omitEmptyStrings().split(value)));
        }
        return builder.build();
    }

    /**
     * Loads overrides from a properties file.
     *
     * @throws IllegalArgumentException if the file cannot be read or holds invalid values
     */
    public static AnalysisConfig load(Path propertiesFile) {
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read analysis config: " + propertiesFile, e);
        }
        return fromProperties(properties);
    }

    private static long parseLong(String value, String key) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + duration);
        }
    }

    private static Map<String, String> normalizeKeys(Map<String, String> categories) {
        ImmutableMap.Builder<String, String> normalized = ImmutableMap.builder();
        categories.forEach((key, category) -> normalized.put(key.toLowerCase(Locale.ROOT), category));
        return normalized.buildKeepingLast();
    }

    /**
     * Builder for {@link AnalysisConfig}. A hard timeout left unset is derived as soft + 15%.
     */
    public static class Builder {
        private Duration softTimeout = Duration.ofSeconds(35);
        private Duration hardTimeout;
        private int maxFiles = 500;
        private long maxFileSizeBytes = 5L * 1024 * 1024;
        private int maxDirDepth = 20;
        private int maxDiscoveredFiles = 50_000;
        private double discoveryShare = 0.2;
        private Duration perFileCeiling = Duration.ofSeconds(5);
        private Duration perFileFloor = Duration.ofMillis(50);
        private Duration drainGrace = Duration.ofSeconds(2);
        private int maxWorkers = 8;
        private int maxContentChars = 1_000_000;
        private boolean skipHiddenDirectories = true;
        private Map<String, String> categories = CODE_EXTENSIONS;
        private Set<String> skipDirectories = DEFAULT_SKIP_DIRECTORIES;

        private Builder() {
        }

        public Builder softTimeout(Duration softTimeout) {
            this.softTimeout = softTimeout;
            return this;
        }

        public Builder hardTimeout(Duration hardTimeout) {
            this.hardTimeout = hardTimeout;
            return this;
        }

        public Builder maxFiles(int maxFiles) {
            this.maxFiles = maxFiles;
            return this;
        }

        public Builder maxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
            return this;
        }

        public Builder maxDirDepth(int maxDirDepth) {
            this.maxDirDepth = maxDirDepth;
            return this;
        }

        public Builder maxDiscoveredFiles(int maxDiscoveredFiles) {
            this.maxDiscoveredFiles = maxDiscoveredFiles;
            return this;
        }

        public Builder discoveryShare(double discoveryShare) {
            this.discoveryShare = discoveryShare;
            return this;
        }

        public Builder perFileCeiling(Duration perFileCeiling) {
            this.perFileCeiling = perFileCeiling;
            return this;
        }

        public Builder perFileFloor(Duration perFileFloor) {
            this.perFileFloor = perFileFloor;
            return this;
        }

        public Builder drainGrace(Duration drainGrace) {
            this.drainGrace = drainGrace;
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder maxContentChars(int maxContentChars) {
            this.maxContentChars = maxContentChars;
            return this;
        }

        public Builder skipHiddenDirectories(boolean skipHiddenDirectories) {
            this.skipHiddenDirectories = skipHiddenDirectories;
            return this;
        }

        public Builder categories(Map<String, String> categories) {
            this.categories = categories;
            return this;
        }

        public Builder skipDirectories(Set<String> skipDirectories) {
            this.skipDirectories = skipDirectories;
            return this;
        }

        public AnalysisConfig build() {
            Duration hard = hardTimeout;
            if (hard == null && softTimeout != null) {
                hard = softTimeout.plus(softTimeout.multipliedBy(15).dividedBy(100));
                if (hard.equals(softTimeout)) {
                    hard = softTimeout.plusMillis(1);
                }
            }
            return new AnalysisConfig(
                    softTimeout, hard, maxFiles, maxFileSizeBytes, maxDirDepth, maxDiscoveredFiles,
                    discoveryShare, perFileCeiling, perFileFloor, drainGrace, maxWorkers,
                    maxContentChars, skipHiddenDirectories, categories, skipDirectories);
        }
    }
}
