package dev.roshin.treescan.analysis.checks;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Iterables;
import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;

import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;

/**
 * Test flakiness findings.
 *
 * @param filesChecked      Files analyzed, test files or not
 * @param testFiles         Files whose path marks them as tests
 * @param flakyFiles        Test files mentioning flakiness or retries
 * @param flakyDetection    Whether any test carries a flaky-test annotation
 * @param retryMechanism    Whether a test retry mechanism is configured or used
 * @param quarantinedTests  Whether flaky tests are skipped or quarantined
 * @param testsByType       Test files per type (unit, integration, e2e, functional, unknown)
 * @param flakyByType       Flaky test files per type
 * @param flakyAnnotations  "path: annotation" entries, at most {@value #ANNOTATION_LIMIT}
 * @param flakyTestFiles    Flaky test files, the first {@value #FILE_LIMIT} by path
 */
public record ReliabilityMetrics(
        int filesChecked,
        int testFiles,
        int flakyFiles,
        boolean flakyDetection,
        boolean retryMechanism,
        boolean quarantinedTests,
        Map<String, Integer> testsByType,
        Map<String, Integer> flakyByType,
        SortedSet<String> flakyAnnotations,
        SortedSet<String> flakyTestFiles
) implements MergeableMetrics<ReliabilityMetrics> {

    public static final int ANNOTATION_LIMIT = 10;
    public static final int FILE_LIMIT = 5;

    /**
     * Test cases assumed per test file when estimating the failure rate.
     */
    public static final int ESTIMATED_TESTS_PER_FILE = 5;

    public static final ReliabilityMetrics EMPTY = new ReliabilityMetrics(0, 0, 0, false, false, false,
            Map.of(), Map.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of());

    public ReliabilityMetrics {
        testsByType = ImmutableSortedMap.copyOf(testsByType);
        flakyByType = ImmutableSortedMap.copyOf(flakyByType);
        flakyAnnotations = limit(flakyAnnotations, ANNOTATION_LIMIT);
        flakyTestFiles = limit(flakyTestFiles, FILE_LIMIT);
    }

    /**
     * Metrics of a file that is not a test.
     */
    public static ReliabilityMetrics nonTest(boolean retryMechanism) {
        return new ReliabilityMetrics(1, 0, 0, false, retryMechanism, false,
                Map.of(), Map.of(), ImmutableSortedSet.of(), ImmutableSortedSet.of());
    }

    @Override
    public ReliabilityMetrics merge(ReliabilityMetrics other) {
        return new ReliabilityMetrics(
                filesChecked + other.filesChecked,
                testFiles + other.testFiles,
                flakyFiles + other.flakyFiles,
                flakyDetection || other.flakyDetection,
                retryMechanism || other.retryMechanism,
                quarantinedTests || other.quarantinedTests,
                sum(testsByType, other.testsByType),
                sum(flakyByType, other.flakyByType),
                union(flakyAnnotations, other.flakyAnnotations),
                union(flakyTestFiles, other.flakyTestFiles)
        );
    }

    public int estimatedTests() {
        return testFiles * ESTIMATED_TESTS_PER_FILE;
    }

    /**
     * Flaky test files against estimated test cases, as a percentage.
     */
    public double flakinessPercent() {
        int total = estimatedTests();
        return total == 0 ? 0.0 : flakyFiles * 100.0 / total;
    }

    private static Map<String, Integer> sum(Map<String, Integer> left, Map<String, Integer> right) {
        Map<String, Integer> merged = new TreeMap<>(left);
        right.forEach((type, count) -> merged.merge(type, count, Integer::sum));
        return merged;
    }

    private static SortedSet<String> union(SortedSet<String> left, SortedSet<String> right) {
        return ImmutableSortedSet.<String>naturalOrder().addAll(left).addAll(right).build();
    }

    private static SortedSet<String> limit(SortedSet<String> values, int limit) {
        return ImmutableSortedSet.copyOf(Iterables.limit(ImmutableSortedSet.copyOf(values), limit));
    }
}
