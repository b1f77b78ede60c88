package dev.roshin.treescan.analysis.spoon;

import com.google.common.base.Ticker;
import dev.roshin.treescan.analysis.config.AnalysisConfig;
import dev.roshin.treescan.analysis.core.AbortSignal;
import dev.roshin.treescan.analysis.core.AbortState;
import dev.roshin.treescan.analysis.core.Deadline;
import dev.roshin.treescan.analysis.core.FileContext;
import dev.roshin.treescan.analysis.core.TreeAnalyzer;
import dev.roshin.treescan.analysis.model.AggregateMetrics;
import dev.roshin.treescan.analysis.model.AnalysisReport;
import dev.roshin.treescan.analysis.model.CandidateFile;
import dev.roshin.treescan.analysis.model.enums.RunStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JavaComplexityAnalyzerTest {

    private static final String ORDERS = String.join("\n",
            "public class Orders {",
            "    public Orders() {",
            "    }",
            "",
            "    int simple() {",
            "        return 1;",
            "    }",
            "",
            "    int branchy(int a, boolean b, boolean c) {",
            "        if (a > 0 && b) {",
            "            return 1;",
            "        }",
            "        for (int i = 0; i < a; i++) {",
            "            if (c || b) {",
            "                a--;",
            "            }",
            "        }",
            "        switch (a) {",
            "            case 1:",
            "                return 2;",
            "            case 2:",
            "                return 3;",
            "            default:",
            "                return b ? 4 : 5;",
            "        }",
            "    }",
            "}",
            "");

    @TempDir
    Path root;

    private final JavaComplexityAnalyzer analyzer = new JavaComplexityAnalyzer();

    @Test
    void measuresMethodsAndConstructors() throws IOException {
        ComplexityMetrics metrics = analyzer.analyze(context("Orders.java", ORDERS));

        assertEquals(1, metrics.files());
        assertEquals(3, metrics.functions());
        assertEquals(11, metrics.totalComplexity());
        assertEquals(2, metrics.simple());
        assertEquals(1, metrics.moderate());
        assertEquals(0, metrics.complex() + metrics.veryComplex());
        assertTrue(metrics.mostComplex().isEmpty());
    }

    @Test
    void reportsVeryComplexMethods() throws IOException {
        StringBuilder source = new StringBuilder("public class Big {\n    int huge(int x) {\n        int y = 0;\n");
        for (int i = 0; i < 25; i++) {
            source.append("        if (x == ").append(i).append(") {\n            y++;\n        }\n");
        }
        source.append("        return y;\n    }\n}\n");

        ComplexityMetrics metrics = analyzer.analyze(context("Big.java", source.toString()));

        assertEquals(1, metrics.veryComplex());
        assertEquals(1, metrics.mostComplex().size());
        ComplexFunction function = metrics.mostComplex().get(0);
        assertEquals("Big.huge", function.name());
        assertEquals(26, function.complexity());
        assertEquals("Big.java", function.file());
        assertEquals(2, function.line());
    }

    @Test
    void mergeKeepsTheMostComplexFunctions() {
        ComplexityMetrics merged = ComplexityMetrics.EMPTY;
        for (int i = 0; i < 12; i++) {
            ComplexFunction function = new ComplexFunction("F" + i + ".java", "F" + i + ".run", 11 + i, 1);
            merged = merged.merge(new ComplexityMetrics(1, 1, 11 + i, 0, 0, 1, 0, List.of(function)));
        }

        assertEquals(12, merged.files());
        assertEquals(ComplexityMetrics.TOP_LIMIT, merged.mostComplex().size());
        assertEquals(22, merged.mostComplex().get(0).complexity());
        assertEquals(13, merged.mostComplex().get(9).complexity());
    }

    @Test
    void scoresByAverageAndVeryComplexShare() {
        ComplexityScoreCalculator calculator = new ComplexityScoreCalculator();

        assertEquals(90.0, score(calculator, new ComplexityMetrics(1, 10, 30, 10, 0, 0, 0, List.of())));
        assertEquals(60.0, score(calculator, new ComplexityMetrics(1, 10, 70, 5, 4, 0, 1, List.of())));
        assertEquals(0.0, score(calculator, new ComplexityMetrics(1, 4, 64, 1, 0, 2, 1, List.of())));
        assertEquals(0.0, score(calculator, ComplexityMetrics.EMPTY));
    }

    @Test
    void runsThroughTheEngine() throws IOException {
        Files.writeString(root.resolve("Orders.java"), ORDERS);
        Files.createDirectories(root.resolve("util"));
        Files.writeString(root.resolve("util/Helper.java"), "class Helper {\n    void help() {\n    }\n}\n");
        Files.writeString(root.resolve("notes.py"), "print('not java')\n");
        AnalysisConfig config = AnalysisConfig.builder()
                .softTimeout(Duration.ofSeconds(60))
                .perFileCeiling(Duration.ofSeconds(30))
                .categories(Map.of(".java", "java"))
                .build();

        AnalysisReport<ComplexityMetrics> report = new TreeAnalyzer(config)
                .analyze(root, analyzer, new ComplexityScoreCalculator());

        assertEquals(RunStatus.COMPLETED, report.status());
        assertEquals(2, report.filesAnalyzed());
        assertEquals(4, report.metrics().metrics().functions());
        assertEquals(90.0, report.score().total());
    }

    private static double score(ComplexityScoreCalculator calculator, ComplexityMetrics metrics) {
        return calculator.calculate(new AggregateMetrics<>(
                metrics, metrics.files(), Map.of(), Map.of())).total();
    }

    private FileContext context(String name, String content) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content);
        Ticker ticker = Ticker.systemTicker();
        AbortState state = new AbortState(
                Deadline.after(Duration.ofMinutes(1), ticker), Deadline.after(Duration.ofMinutes(2), ticker),
                new AbortSignal());
        return new FileContext(new CandidateFile(file, name, Files.size(file), "java", true),
                Deadline.after(Duration.ofMinutes(1), ticker), state, 1_000_000);
    }
}
