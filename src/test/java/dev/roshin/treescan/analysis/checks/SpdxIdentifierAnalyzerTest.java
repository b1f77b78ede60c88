package dev.roshin.treescan.analysis.checks;

import com.google.common.base.Ticker;
import dev.roshin.treescan.analysis.core.AbortSignal;
import dev.roshin.treescan.analysis.core.AbortState;
import dev.roshin.treescan.analysis.core.Deadline;
import dev.roshin.treescan.analysis.core.FileContext;
import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.model.CandidateFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpdxIdentifierAnalyzerTest {

    @TempDir
    Path root;

    private final SpdxIdentifierAnalyzer analyzer = new SpdxIdentifierAnalyzer();
    private final SpdxScoreCalculator calculator = new SpdxScoreCalculator();

    @Test
    void classifiesIdentifiers() throws IOException {
        SpdxMetrics metrics = analyzer.analyze(context("lib.c",
                "// SPDX-License-Identifier: MIT\n"
                        + "# spdx-license-identifier: GPL-2.0\n"
                        + "SPDX-License-Identifier: Made-Up-1\n"));

        assertEquals(1, metrics.filesChecked());
        assertEquals(1, metrics.filesWithSpdx());
        assertEquals(Set.of("MIT"), metrics.validIdentifiers());
        assertEquals(Set.of("GPL-2.0"), metrics.deprecatedIdentifiers());
        assertEquals(Set.of("Made-Up-1"), metrics.unknownIdentifiers());
        assertEquals(Set.of("lib.c"), metrics.taggedFiles());
    }

    @Test
    void unknownIdentifierDoesNotTagFile() throws IOException {
        SpdxMetrics metrics = analyzer.analyze(context("x.py", "# SPDX-License-Identifier: Homemade\n"));

        assertEquals(0, metrics.filesWithSpdx());
        assertTrue(metrics.taggedFiles().isEmpty());
        assertFalse(metrics.hasValidIdentifier());
    }

    @Test
    void mergeLimitsListedFiles() {
        SpdxMetrics merged = SpdxMetrics.EMPTY;
        for (int i = 0; i < 30; i++) {
            merged = merged.merge(new SpdxMetrics(1, 1, new TreeSet<>(Set.of("MIT")),
                    new TreeSet<>(), new TreeSet<>(), new TreeSet<>(Set.of(String.format("f%02d.py", i)))));
        }

        assertEquals(30, merged.filesWithSpdx());
        assertEquals(SpdxMetrics.LIST_LIMIT, merged.taggedFiles().size());
        assertEquals("f00.py", merged.taggedFiles().first());
    }

    @Test
    void scoresCoverageOfValidTags() {
        SpdxMetrics metrics = new SpdxMetrics(2, 1, new TreeSet<>(Set.of("MIT")),
                new TreeSet<>(), new TreeSet<>(), new TreeSet<>(Set.of("a.py")));

        assertEquals(75.0, score(metrics));
    }

    @Test
    void deprecatedOnlyScoresLower() {
        SpdxMetrics metrics = new SpdxMetrics(1, 1, new TreeSet<>(),
                new TreeSet<>(Set.of("GPL-2.0")), new TreeSet<>(), new TreeSet<>(Set.of("a.py")));

        assertEquals(60.0, score(metrics));
    }

    @Test
    void untaggedScoresMinimum() {
        assertEquals(0.0, score(SpdxMetrics.EMPTY));
    }

    private double score(SpdxMetrics metrics) {
        return calculator.calculate(new AggregateMetrics<>(metrics, metrics.filesChecked(), Map.of(), Map.of()))
                .total();
    }

    private FileContext context(String name, String content) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content);
        Ticker ticker = Ticker.systemTicker();
        AbortState state = new AbortState(
                Deadline.after(Duration.ofMinutes(1), ticker), Deadline.after(Duration.ofMinutes(2), ticker),
                new AbortSignal());
        return new FileContext(new CandidateFile(file, name, Files.size(file), "c", true),
                Deadline.after(Duration.ofMinutes(1), ticker), state, 1_000_000);
    }
}
