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

import static org.junit.jupiter.api.Assertions.assertEquals;

class CodeCommentAnalyzerTest {

    @TempDir
    Path root;

    private final CodeCommentAnalyzer analyzer = new CodeCommentAnalyzer();

    @Test
    void countsPythonCommentsAndDocstrings() throws IOException {
        String source = String.join("\n",
                "\"\"\"Module docstring.\"\"\"",
                "# comment",
                "import os",
                "",
                "def f():",
                "    '''",
                "    multi",
                "    '''",
                "    return 1  # trailing",
                "");

        CommentMetrics metrics = analyzer.analyze(context("module.py", "python", source));

        assertEquals(new CommentMetrics(1, 1, 8, 5, 1), metrics);
    }

    @Test
    void countsCStyleBlocksAndDocComments() throws IOException {
        String source = String.join("\n",
                "/**",
                " * Doc.",
                " */",
                "public class A {",
                "    // line",
                "    int x; /* inline */",
                "}",
                "");

        CommentMetrics metrics = analyzer.analyze(context("A.java", "java", source));

        assertEquals(new CommentMetrics(1, 1, 7, 6, 1), metrics);
    }

    @Test
    void countsRubyBlockComments() throws IOException {
        String source = String.join("\n",
                "=begin",
                "notes",
                "=end",
                "puts 'hi' # not a line comment",
                "# line comment");

        CommentMetrics metrics = analyzer.analyze(context("run.rb", "ruby", source));

        assertEquals(new CommentMetrics(1, 1, 5, 4, 0), metrics);
    }

    @Test
    void uncommentedFile() throws IOException {
        CommentMetrics metrics = analyzer.analyze(context("plain.go", "go", "package main\n\nfunc main() {}\n"));

        assertEquals(new CommentMetrics(1, 0, 2, 0, 0), metrics);
    }

    @Test
    void unknownLanguageCountsOnlyLines() throws IOException {
        CommentMetrics metrics = analyzer.analyze(context("LICENSE", "license", "# heading\ntext\n"));

        assertEquals(new CommentMetrics(1, 0, 2, 0, 0), metrics);
    }

    @Test
    void scoresCommentDensity() {
        CommentScoreCalculator calculator = new CommentScoreCalculator();
        CommentMetrics metrics = new CommentMetrics(2, 1, 100, 10, 2);

        double score = calculator.calculate(new AggregateMetrics<>(metrics, 2, Map.of(), Map.of())).total();

        assertEquals(67.5, score);
    }

    @Test
    void noFilesScoresMinimum() {
        CommentScoreCalculator calculator = new CommentScoreCalculator();

        double score = calculator.calculate(
                new AggregateMetrics<>(CommentMetrics.EMPTY, 0, Map.of(), Map.of())).total();

        assertEquals(0.0, score);
    }

    @Test
    void commentRatioCapsAtForty() {
        CommentScoreCalculator calculator = new CommentScoreCalculator();
        CommentMetrics metrics = new CommentMetrics(1, 1, 100, 90, 0);

        double ratioScore = calculator.calculate(new AggregateMetrics<>(metrics, 1, Map.of(), Map.of()))
                .components().get("commentRatio");

        assertEquals(40.0, ratioScore);
    }

    private FileContext context(String name, String category, String content) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content);
        Ticker ticker = Ticker.systemTicker();
        AbortState state = new AbortState(
                Deadline.after(Duration.ofMinutes(1), ticker), Deadline.after(Duration.ofMinutes(2), ticker),
                new AbortSignal());
        return new FileContext(new CandidateFile(file, name, Files.size(file), category, true),
                Deadline.after(Duration.ofMinutes(1), ticker), state, 1_000_000);
    }
}
