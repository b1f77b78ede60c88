package dev.roshin.treescan.analysis.spoon;

import java.util.Comparator;

/**
 * A method whose cyclomatic complexity exceeds the reporting threshold.
 *
 * @param file       Path relative to the analysis root
 * @param name       Declaring type and method name, e.g. {@code OrderService.place}
 * @param complexity Cyclomatic complexity
 * @param line       Line of the declaration, 0 when unknown
 */
public record ComplexFunction(
        String file,
        String name,
        int complexity,
        int line
) {
    /**
     * Most complex first; ties broken by location so the order is total.
     */
    public static final Comparator<ComplexFunction> MOST_COMPLEX_FIRST =
            Comparator.comparingInt(ComplexFunction::complexity).reversed()
                    .thenComparing(ComplexFunction::file)
                    .thenComparingInt(ComplexFunction::line)
                    .thenComparing(ComplexFunction::name);

    @Override
    public String toString() {
        return String.format("%s [%s:%d] complexity %d", name, file, line, complexity);
    }
}
