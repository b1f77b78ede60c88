package dev.roshin.treescan.analysis.core;

import com.google.common.testing.FakeTicker;
import dev.roshin.treescan.analysis.model.CandidateFile;
import dev.roshin.treescan.analysis.model.enums.AbortReason;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileContextTest {

    @TempDir
    Path root;

    private final FakeTicker ticker = new FakeTicker();

    private final AbortState abortState = new AbortState(
            Deadline.after(Duration.ofSeconds(10), ticker),
            Deadline.after(Duration.ofSeconds(12), ticker),
            new AbortSignal());

    @Test
    void readsContent() throws IOException {
        FileContext context = contextFor("hello\nworld\n", 1000);

        assertEquals("hello\nworld\n", context.readContent());
        assertFalse(context.truncated());
    }

    @Test
    void truncatesLongContent() throws IOException {
        FileContext context = contextFor("x".repeat(20_000), 10_000);

        assertEquals(10_000, context.readContent().length());
        assertTrue(context.truncated());
    }

    @Test
    void replacesMalformedInput() throws IOException {
        Path file = root.resolve("binary.py");
        Files.write(file, new byte[]{'a', (byte) 0xff, 'b'});
        FileContext context = new FileContext(candidate(file), Deadline.after(Duration.ofSeconds(1), ticker),
                abortState, 1000);

        assertEquals("a\uFFFDb", context.readContent());
    }

    @Test
    void checkpointFailsAfterFileDeadline() throws IOException {
        FileContext context = contextFor("x", 1000);

        assertDoesNotThrow(context::checkpoint);
        ticker.advance(Duration.ofSeconds(2));
        assertThrows(FileTimeoutException.class, context::checkpoint);
    }

    @Test
    void softAbortDoesNotStopInFlightFile() throws IOException {
        FileContext context = contextFor("x", 1000);

        abortState.trip(AbortReason.SOFT_DEADLINE);

        assertDoesNotThrow(context::checkpoint);
    }

    @Test
    void hardAbortStopsInFlightFile() throws IOException {
        FileContext context = contextFor("x", 1000);

        abortState.trip(AbortReason.HARD_DEADLINE);

        assertThrows(FileTimeoutException.class, context::checkpoint);
    }

    @Test
    void guardedRegexFailsAfterDeadline() throws IOException {
        FileContext context = contextFor("x", 1000);
        CharSequence text = context.guard("a".repeat(20_000));
        Pattern pattern = Pattern.compile("b");

        assertFalse(pattern.matcher(text).find());
        ticker.advance(Duration.ofSeconds(2));
        assertThrows(FileTimeoutException.class, () -> pattern.matcher(text).find());
    }

    private FileContext contextFor(String content, int maxContentChars) throws IOException {
        Path file = root.resolve("sample.py");
        Files.writeString(file, content);
        return new FileContext(candidate(file), Deadline.after(Duration.ofSeconds(1), ticker),
                abortState, maxContentChars);
    }

    private static CandidateFile candidate(Path file) throws IOException {
        return new CandidateFile(file, file.getFileName().toString(), Files.size(file), "python", true);
    }
}
