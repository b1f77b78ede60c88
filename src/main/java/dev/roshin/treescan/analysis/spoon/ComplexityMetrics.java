package dev.roshin.treescan.analysis.spoon;

import com.google.common.collect.ImmutableList;
import dev.roshin.treescan.analysis.aggregate.MergeableMetrics;

import java.util.List;
import java.util.stream.Stream;

/**
 * Cyclomatic complexity counters.
 *
 * @param files           Files analyzed
 * @param functions       Methods and constructors measured
 * @param totalComplexity Sum of all measured complexities
 * @param simple          Functions with complexity 1-5
 * @param moderate        Functions with complexity 6-10
 * @param complex         Functions with complexity 11-20
 * @param veryComplex     Functions with complexity above 20
 * @param mostComplex     The {@value #TOP_LIMIT} most complex functions above 10
 */
public record ComplexityMetrics(
        int files,
        int functions,
        long totalComplexity,
        int simple,
        int moderate,
        int complex,
        int veryComplex,
        List<ComplexFunction> mostComplex
) implements MergeableMetrics<ComplexityMetrics> {

    public static final int TOP_LIMIT = 10;
    static final int REPORT_THRESHOLD = 10;

    public static final ComplexityMetrics EMPTY = new ComplexityMetrics(0, 0, 0, 0, 0, 0, 0, List.of());

    public ComplexityMetrics {
        mostComplex = mostComplex.stream()
                .sorted(ComplexFunction.MOST_COMPLEX_FIRST)
                .limit(TOP_LIMIT)
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public ComplexityMetrics merge(ComplexityMetrics other) {
        return new ComplexityMetrics(
                files + other.files,
                functions + other.functions,
                totalComplexity + other.totalComplexity,
                simple + other.simple,
                moderate + other.moderate,
                complex + other.complex,
                veryComplex + other.veryComplex,
                Stream.concat(mostComplex.stream(), other.mostComplex.stream())
                        .collect(ImmutableList.toImmutableList())
        );
    }

    public double averageComplexity() {
        return functions == 0 ? 0.0 : (double) totalComplexity / functions;
    }
}
