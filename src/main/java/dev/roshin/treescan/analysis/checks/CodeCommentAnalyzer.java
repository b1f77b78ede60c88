package dev.roshin.treescan.analysis.checks;

import dev.roshin.treescan.analysis.core.FileAnalyzer;
import dev.roshin.treescan.analysis.core.FileContext;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts comment lines, code lines and doc comments per source file.
 * The comment syntax is chosen by the file's language category.
 */
public class CodeCommentAnalyzer implements FileAnalyzer<CommentMetrics> {

    private static final int CHECKPOINT_LINES = 1000;

    private static final CommentSyntax HASH_TRIPLE_QUOTE = new CommentSyntax(
            Pattern.compile("\\s*#"),
            Pattern.compile("\"\"\"|'''"),
            Pattern.compile("\"\"\"|'''"),
            Pattern.compile("^\\s*(\"\"\".+?\"\"\"|'''.+?''')", Pattern.MULTILINE | Pattern.DOTALL));

    private static final CommentSyntax C_STYLE = new CommentSyntax(
            Pattern.compile("\\s*//"),
            Pattern.compile("/\\*"),
            Pattern.compile("\\*/"),
            Pattern.compile("^\\s*/\\*\\*.+?\\*/", Pattern.MULTILINE | Pattern.DOTALL));

    private static final CommentSyntax RUBY = new CommentSyntax(
            Pattern.compile("\\s*#"),
            Pattern.compile("^=begin"),
            Pattern.compile("^=end"),
            null);

    private static final Map<String, CommentSyntax> SYNTAX_BY_LANGUAGE = Map.ofEntries(
            Map.entry("python", HASH_TRIPLE_QUOTE),
            Map.entry("ruby", RUBY),
            Map.entry("javascript", C_STYLE),
            Map.entry("typescript", C_STYLE),
            Map.entry("java", C_STYLE),
            Map.entry("c", C_STYLE),
            Map.entry("cpp", C_STYLE),
            Map.entry("csharp", C_STYLE),
            Map.entry("go", C_STYLE),
            Map.entry("php", C_STYLE),
            Map.entry("kotlin", C_STYLE),
            Map.entry("swift", C_STYLE),
            Map.entry("scala", C_STYLE),
            Map.entry("rust", C_STYLE)
    );

    @Override
    public String name() {
        return "code_comments";
    }

    @Override
    public CommentMetrics empty() {
        return CommentMetrics.EMPTY;
    }

    @Override
    public CommentMetrics analyze(FileContext context) throws IOException {
        String content = context.readContent();
        List<String> lines = List.of(content.split("\n", -1));
        CommentSyntax syntax = SYNTAX_BY_LANGUAGE.get(context.file().category());

        long codeLines = 0;
        long commentLines = 0;
        boolean inBlock = false;
        int lineNumber = 0;
        for (String line : lines) {
            if (++lineNumber % CHECKPOINT_LINES == 0) {
                context.checkpoint();
            }
            if (!line.isBlank()) {
                codeLines++;
            }
            if (syntax == null) {
                continue;
            }
            if (inBlock) {
                commentLines++;
                inBlock = !syntax.blockEnd().matcher(line).find();
                continue;
            }
            if (syntax.lineComment().matcher(line).lookingAt()) {
                commentLines++;
                continue;
            }
            Matcher start = syntax.blockStart().matcher(line);
            if (start.find()) {
                commentLines++;
                inBlock = !syntax.blockEnd().matcher(line).region(start.end(), line.length()).find();
            }
        }

        boolean hasDocstring = syntax != null
                && syntax.docstring() != null
                && syntax.docstring().matcher(context.guard(content)).find();
        return CommentMetrics.ofFile(codeLines, commentLines, hasDocstring);
    }

    private record CommentSyntax(Pattern lineComment, Pattern blockStart, Pattern blockEnd, Pattern docstring) {
    }
}
