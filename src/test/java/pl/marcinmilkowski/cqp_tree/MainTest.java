package pl.marcinmilkowski.cqp_tree;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        InputStream in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return Main.run(args, in, new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testTranslateQueryArgument() {
        int status = run("", "translate", "deptreepy", "-q", "TREE_ (pos NOUN) (pos ADJ)");

        assertEquals(0, status);
        assertEquals("a:[pos=\"NOUN\"] []* [pos=\"ADJ\" & dephead=a.ref]"
            + " | b:[pos=\"ADJ\"] []* [pos=\"NOUN\" & b.dephead=ref]", stdout().strip());
    }

    @Test
    void testGuessedFrontendFromStdin() {
        int status = run("(pos NOUN)", "translate");

        assertEquals(0, status);
        assertEquals("[pos=\"NOUN\"]", stdout().strip());
    }

    @Test
    void testFileInputAndOutput() throws IOException {
        Path query = tempDir.resolve("query.txt");
        Path output = tempDir.resolve("query.cqp");
        Files.writeString(query, "(lemma cat)");

        int status = run("", "translate", "-f", query.toString(), "-o", output.toString());

        assertEquals(0, status);
        assertEquals("[lemma=\"cat\"]", Files.readString(output).strip());
        assertEquals("", stdout());
    }

    @Test
    void testFailedQueriesReportedPerInput() {
        int status = run("", "translate", "deptreepy", "-q", "(pos NOUN", "-q", "(pos ADJ)");

        assertEquals(0, status);
        assertEquals("[pos=\"ADJ\"]", stdout().strip());
        assertTrue(stderr().contains("line: 1, col: 1: Expected ')'"), stderr());
    }

    @Test
    void testNothingTranslated() {
        int status = run("", "translate", "-q", "((");

        assertEquals(1, status);
        assertTrue(stderr().contains("No front-end accepts the query"), stderr());
    }

    @Test
    void testCandidateLimitOption() {
        int status = run("", "translate", "deptreepy", "--max-candidates", "1", "-q", "TREE_ (pos NOUN) (pos ADJ)");

        assertEquals(1, status);
        assertTrue(stderr().contains("--max-candidates"), stderr());
    }

    @Test
    void testUsageAndBadArguments() {
        assertEquals(0, run("", "help"));
        assertTrue(stdout().contains("Usage:"));
        assertEquals(1, run(""));
        assertEquals(1, run("", "translate", "--bogus"));
        assertEquals(1, run("", "translate", "grew", "-q", "x"));
        assertEquals(1, run("", "translate", "-q"));
    }

    @Test
    void testListFrontends() {
        assertEquals(0, run("", "frontends"));
        assertEquals("conllu" + System.lineSeparator() + "deptreepy", stdout().strip());
    }
}
