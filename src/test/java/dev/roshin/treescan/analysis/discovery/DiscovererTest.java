package dev.roshin.treescan.analysis.discovery;

import com.google.common.testing.FakeTicker;
import dev.roshin.treescan.analysis.config.AnalysisBudget;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.core.AbortSignal;
import dev.roshin.treescan.analysis.core.AbortState;
import dev.roshin.treescan.analysis.model.CandidateFile;
import dev.roshin.treescan.analysis.model.enums.AbortReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class DiscovererTest {

    @TempDir
    Path root;

    private final FakeTicker ticker = new FakeTicker();

    private final AnalysisConfig config = AnalysisConfig.builder()
            .softTimeout(Duration.ofSeconds(10))
            .maxFiles(10)
            .maxDiscoveredFiles(100)
            .maxFileSizeBytes(100)
            .maxDirDepth(2)
            .build();

    @Test
    void walksInSortedOrder() throws IOException {
        write("b.py");
        write("a/z.js");
        write("a/b.go");
        write("c.java");

        DiscoveryResult result = discover(config);

        // files of a directory come before its subdirectories
        assertEquals(List.of("b.py", "c.java", "a/b.go", "a/z.js"), paths(result.candidates()));
        assertFalse(result.earlyStopped());
        assertEquals(2, result.directoriesVisited());
    }

    @Test
    void prunesSkippedHiddenAndDeepDirectories() throws IOException {
        write("src/app.py");
        write("node_modules/pkg/index.js");
        write(".venv/lib/site.py");
        write("target/Generated.java");
        write("one/two/kept.py");
        write("one/two/three/too_deep.py");
        write("README.md");

        DiscoveryResult result = discover(config);

        assertEquals(List.of("one/two/kept.py", "src/app.py"), paths(result.candidates()));
    }

    @Test
    void separatesOversizedFiles() throws IOException {
        write("small.py");
        Files.writeString(root.resolve("large.py"), "x".repeat(101));

        DiscoveryResult result = discover(config);

        assertEquals(List.of("small.py"), paths(result.candidates()));
        assertEquals(List.of("large.py"), paths(result.oversized()));
        assertFalse(result.oversized().get(0).eligible());
        assertEquals(2, result.filesDiscovered());
    }

    @Test
    void stopsAtDiscoveryCap() throws IOException {
        for (int i = 0; i < 5; i++) {
            write("f" + i + ".py");
        }

        DiscoveryResult result = discover(config.toBuilder().maxFiles(3).maxDiscoveredFiles(3).build());

        assertTrue(result.earlyStopped());
        assertEquals(List.of("f0.py", "f1.py", "f2.py"), paths(result.candidates()));
    }

    @Test
    void returnsNothingWhenAlreadyAborted() throws IOException {
        write("a.py");
        AnalysisBudget budget = AnalysisBudget.start(config, ticker);
        AbortState state = stateFor(budget);
        state.trip(AbortReason.EXTERNAL);

        DiscoveryResult result = new Discoverer(config).discover(root, budget, state);

        assertTrue(result.earlyStopped());
        assertTrue(result.candidates().isEmpty());
    }

    @Test
    void stopsWhenDiscoveryShareIsUsedUp() throws IOException {
        write("a.py");
        AnalysisBudget budget = AnalysisBudget.start(config, ticker);
        ticker.advance(Duration.ofSeconds(3));

        DiscoveryResult result = new Discoverer(config).discover(root, budget, stateFor(budget));

        assertTrue(result.earlyStopped());
        assertTrue(result.candidates().isEmpty());
    }

    @Test
    void doesNotFollowSymbolicLinks() throws IOException {
        write("real/a.py");
        try {
            Files.createSymbolicLink(root.resolve("link"), root.resolve("real"));
            Files.createSymbolicLink(root.resolve("b.py"), root.resolve("real/a.py"));
        } catch (UnsupportedOperationException | IOException e) {
            assumeTrue(false, "symbolic links not supported: " + e);
        }

        DiscoveryResult result = discover(config);

        assertEquals(List.of("real/a.py"), paths(result.candidates()));
    }

    private DiscoveryResult discover(AnalysisConfig analysisConfig) {
        AnalysisBudget budget = AnalysisBudget.start(analysisConfig, ticker);
        return new Discoverer(analysisConfig).discover(root, budget, stateFor(budget));
    }

    private static AbortState stateFor(AnalysisBudget budget) {
        return new AbortState(budget.softDeadline(), budget.hardDeadline(), new AbortSignal());
    }

    private void write(String relativePath) throws IOException {
        Path file = root.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "x");
    }

    private static List<String> paths(List<CandidateFile> files) {
        return files.stream().map(CandidateFile::relativePath).collect(Collectors.toList());
    }
}
