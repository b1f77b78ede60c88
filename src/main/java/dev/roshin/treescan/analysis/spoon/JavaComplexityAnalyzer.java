package dev.roshin.treescan.analysis.spoon;

import dev.roshin.treescan.analysis.core.FileAnalyzer;
import dev.roshin.treescan.analysis.core.FileContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.code.BinaryOperatorKind;
import spoon.reflect.code.CtBinaryOperator;
import spoon.reflect.code.CtCase;
import spoon.reflect.code.CtCatch;
import spoon.reflect.code.CtConditional;
import spoon.reflect.code.CtIf;
import spoon.reflect.code.CtLoop;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtType;
import spoon.reflect.visitor.filter.TypeFilter;
import spoon.support.compiler.VirtualFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Measures the cyclomatic complexity of every method and constructor in a Java
 * source file, using a Spoon model of that file alone.
 * <p>
 * Complexity starts at 1 and adds one per {@code if}, loop, non-default {@code case},
 * {@code catch}, ternary and {@code &&}/{@code ||}.
 */
public class JavaComplexityAnalyzer implements FileAnalyzer<ComplexityMetrics> {
    private static final Logger log = LoggerFactory.getLogger(JavaComplexityAnalyzer.class);

    private static final int COMPLIANCE_LEVEL = 17;

    @Override
    public String name() {
        return "java_complexity";
    }

    @Override
    public ComplexityMetrics empty() {
        return ComplexityMetrics.EMPTY;
    }

    @Override
    public ComplexityMetrics analyze(FileContext context) throws IOException {
        String content = context.readContent();
        CtModel model = buildModel(content, context.file().path().getFileName().toString());
        context.checkpoint();

        List<CtMethod<?>> methods = model.getElements(new TypeFilter<>(CtMethod.class));
        List<CtConstructor<?>> constructors = model.getElements(new TypeFilter<>(CtConstructor.class));

        List<CtExecutable<?>> executables = new ArrayList<>(methods);
        for (CtConstructor<?> constructor : constructors) {
            if (!constructor.isImplicit()) {
                executables.add(constructor);
            }
        }

        int simple = 0;
        int moderate = 0;
        int complex = 0;
        int veryComplex = 0;
        long total = 0;
        List<ComplexFunction> mostComplex = new ArrayList<>();

        for (CtExecutable<?> executable : executables) {
            context.checkpoint();
            int complexity = complexityOf(executable);
            total += complexity;

            if (complexity <= 5) {
                simple++;
            } else if (complexity <= 10) {
                moderate++;
            } else if (complexity <= 20) {
                complex++;
            } else {
                veryComplex++;
            }
            if (complexity > ComplexityMetrics.REPORT_THRESHOLD) {
                mostComplex.add(new ComplexFunction(
                        context.file().relativePath(), nameOf(executable), complexity, lineOf(executable)));
            }
        }

        log.debug("{}: {} functions, total complexity {}", context.file().relativePath(), executables.size(), total);
        return new ComplexityMetrics(1, executables.size(), total, simple, moderate, complex, veryComplex, mostComplex);
    }

    private CtModel buildModel(String content, String fileName) {
        Launcher launcher = new Launcher();
        launcher.getEnvironment().setComplianceLevel(COMPLIANCE_LEVEL);
        launcher.getEnvironment().setNoClasspath(true); // single file, no dependencies
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setShouldCompile(false);
        launcher.getEnvironment().setCommentEnabled(false);
        launcher.addInputResource(new VirtualFile(content, fileName));
        return launcher.buildModel();
    }

    static int complexityOf(CtExecutable<?> executable) {
        int complexity = 1;
        for (CtElement element : executable.getElements(new TypeFilter<>(CtElement.class))) {
            if (element instanceof CtIf
                    || element instanceof CtLoop
                    || element instanceof CtCatch
                    || element instanceof CtConditional) {
                complexity++;
            } else if (element instanceof CtCase<?> caseStatement) {
                if (!caseStatement.getCaseExpressions().isEmpty()) {
                    complexity++;
                }
            } else if (element instanceof CtBinaryOperator<?> operator) {
                if (operator.getKind() == BinaryOperatorKind.AND || operator.getKind() == BinaryOperatorKind.OR) {
                    complexity++;
                }
            }
        }
        return complexity;
    }

    private static String nameOf(CtExecutable<?> executable) {
        CtType<?> declaringType = executable.getParent(CtType.class);
        String owner = declaringType != null ? declaringType.getSimpleName() : "?";
        return owner + "." + executable.getSimpleName();
    }

    private static int lineOf(CtElement element) {
        if (element.getPosition() != null && element.getPosition().isValidPosition()) {
            return element.getPosition().getLine();
        }
        return 0;
    }
}
