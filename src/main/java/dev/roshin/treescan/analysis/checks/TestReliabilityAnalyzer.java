package dev.roshin.treescan.analysis.checks;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.core.FileAnalyzer;
import dev.roshin.treescan.analysis.core.FileContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Looks for signs of flaky tests in test files: flakiness keywords, flaky-test
 * annotations, quarantining and retry mechanisms.
 * <p>
 * Files whose path does not look like a test only count towards
 * {@link ReliabilityMetrics#filesChecked()}, except build and runner configuration
 * files, which are checked for retry plugins.
 */
public class TestReliabilityAnalyzer implements FileAnalyzer<ReliabilityMetrics> {
    private static final Logger log = LoggerFactory.getLogger(TestReliabilityAnalyzer.class);

    static final Pattern TEST_FILE = Pattern.compile(
            ".*test.*\\.py$|.*Test.*\\.java$|.*\\.test\\.[jt]sx?$|.*\\.spec\\.[jt]sx?$|.*_spec\\.rb$|.*_test\\.rb$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern FLAKY = Pattern.compile(
            "flaky|intermittent|non-deterministic|unstable|occasionally fails|retry|@Retry|@FlakyTest"
                    + "|Test\\.retryTimes|pytest\\.mark\\.flaky|flake8|quarantine",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern QUARANTINE = Pattern.compile("quarantine|skip|disabled", Pattern.CASE_INSENSITIVE);

    private static final Pattern PYTHON_ANNOTATION = Pattern.compile("@pytest\\.mark\\.flaky");
    private static final Pattern JVM_ANNOTATION = Pattern.compile("@(?:Flaky|Retry|FlakyTest)");
    private static final Pattern JS_ANNOTATION = Pattern.compile("(?:test|it)\\.retryTimes");

    private static final int ANNOTATIONS_PER_FILE = 2;

    static final Map<String, Pattern> RETRY_MECHANISMS = ImmutableMap.of(
            "junit", Pattern.compile("@Retry|RetryRule|RetryAnalyzer"),
            "pytest", Pattern.compile("pytest-rerunfailures|rerun|--reruns|pytest\\.mark\\.flaky"),
            "jest", Pattern.compile("jest-circus|--retries|retry")
    );

    static final Set<String> RUNNER_CONFIG_FILES = ImmutableSet.of(
            "pytest.ini", "tox.ini", "setup.cfg", "pyproject.toml", "package.json", "jest.config.js",
            "pom.xml", "build.gradle"
    );

    /**
     * Source extensions plus runner configuration files, for
     * {@link AnalysisConfig.Builder#categories(Map)}.
     */
    public static final Map<String, String> CATEGORIES = categories();

    @Override
    public String name() {
        return "test_reliability";
    }

    @Override
    public ReliabilityMetrics empty() {
        return ReliabilityMetrics.EMPTY;
    }

    @Override
    public ReliabilityMetrics analyze(FileContext context) throws IOException {
        String path = context.file().relativePath();
        String fileName = context.file().path().getFileName().toString().toLowerCase(Locale.ROOT);
        boolean runnerConfig = RUNNER_CONFIG_FILES.contains(fileName);
        if (!runnerConfig && !TEST_FILE.matcher(path).matches()) {
            return ReliabilityMetrics.nonTest(false);
        }

        String content = context.readContent();
        boolean retry = usesRetryMechanism(context.guard(content));
        if (runnerConfig) {
            return ReliabilityMetrics.nonTest(retry);
        }

        String type = testTypeOf(path);
        boolean flaky = FLAKY.matcher(context.guard(content)).find();
        Set<String> annotations = flaky ? annotationsOf(context, content) : Set.of();
        boolean quarantined = flaky && QUARANTINE.matcher(context.guard(content)).find();
        if (flaky) {
            log.debug("Possibly flaky test: {}", path);
        }

        return new ReliabilityMetrics(
                1,
                1,
                flaky ? 1 : 0,
                !annotations.isEmpty(),
                retry,
                quarantined,
                Map.of(type, 1),
                flaky ? Map.of(type, 1) : Map.of(),
                ImmutableSortedSet.copyOf(annotations),
                flaky ? ImmutableSortedSet.of(path) : ImmutableSortedSet.of()
        );
    }

    static String testTypeOf(String relativePath) {
        String path = relativePath.toLowerCase(Locale.ROOT);
        if (path.contains("unit")) {
            return "unit";
        } else if (path.contains("integration")) {
            return "integration";
        } else if (path.contains("e2e") || path.contains("end-to-end")) {
            return "e2e";
        } else if (path.contains("functional")) {
            return "functional";
        }
        return "unknown";
    }

    private static boolean usesRetryMechanism(CharSequence content) {
        for (Pattern pattern : RETRY_MECHANISMS.values()) {
            if (pattern.matcher(content).find()) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> annotationsOf(FileContext context, String content) {
        Pattern pattern = annotationPatternFor(context.file().path().getFileName().toString());
        if (pattern == null) {
            return Set.of();
        }
        Set<String> found = new TreeSet<>();
        Matcher matcher = pattern.matcher(context.guard(content));
        while (found.size() < ANNOTATIONS_PER_FILE && matcher.find()) {
            found.add(context.file().relativePath() + ": " + matcher.group());
        }
        return found;
    }

    private static Pattern annotationPatternFor(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".py")) {
            return PYTHON_ANNOTATION;
        }
        if (name.endsWith(".java") || name.endsWith(".kt")) {
            return JVM_ANNOTATION;
        }
        for (String extension : List.of(".js", ".jsx", ".ts", ".tsx")) {
            if (name.endsWith(extension)) {
                return JS_ANNOTATION;
            }
        }
        return null;
    }

    private static Map<String, String> categories() {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.<String, String>builder()
                .putAll(AnalysisConfig.CODE_EXTENSIONS)
                .put(".jsx", "javascript")
                .put(".tsx", "typescript");
        for (String fileName : RUNNER_CONFIG_FILES) {
            builder.put(fileName, "config");
        }
        return builder.buildOrThrow();
    }
}
