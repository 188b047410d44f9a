package io.github.manjago.evoformula.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the commands through picocli with captured console output.
 */
class EvoFormulaCliTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream savedOut;
    private PrintStream savedErr;

    @TempDir
    Path tempDir;

    @BeforeEach
    void captureOutput() {
        savedOut = System.out;
        savedErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(savedOut);
        System.setErr(savedErr);
    }

    private int run(String... args) {
        return EvoFormulaCli.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("eval")
    class Eval {

        @Test
        @DisplayName("Evaluates at a point")
        void point() {
            assertEquals(0, run("eval", "x * y + 1", "-x", "x=2", "-x", "y=3"));
            assertEquals("7.0", stdout().trim());
        }

        @Test
        @DisplayName("Sweeps a range")
        void sweep() {
            assertEquals(0, run("eval", "x * 2", "--from", "0", "--to", "3", "--step", "1"));
            String[] lines = stdout().trim().split("\\R");
            assertEquals(3, lines.length);
            assertEquals("2.0\t4.0", lines[2]);
        }

        @Test
        @DisplayName("Prints the simplified form")
        void simplify() {
            assertEquals(0, run("eval", "x * 1 + 0", "--simplify", "-x", "x=5"));
            assertTrue(stdout().contains("Simplified: x"), stdout());
        }

        @Test
        @DisplayName("Syntax error exits with 2")
        void syntaxError() {
            assertEquals(2, run("eval", "x +"));
            assertTrue(stderr().contains("Parse error"), stderr());
        }

        @Test
        @DisplayName("Unbound variable exits with 2")
        void unbound() {
            assertEquals(2, run("eval", "x + z", "-x", "x=1"));
            assertTrue(stderr().contains("z"), stderr());
        }
    }

    @Nested
    @DisplayName("search")
    class Search {

        @Test
        @DisplayName("Quiet search prints the best expression only")
        void quietSearch() {
            int code = run("search", "-t", "x * 2", "-e", "3", "-p", "10", "--threads", "1", "--seed", "1", "-q");
            assertEquals(0, code, stderr());
            assertEquals(1, stdout().trim().split("\\R").length, stdout());
        }

        @Test
        @DisplayName("Verbose search prints a final report")
        void verboseSearch() throws Exception {
            Path config = tempDir.resolve("fast.conf");
            Files.writeString(config, """
                evoformula {
                  population { size = 12, elites = 2, fresh = 2, crossovers = 10 }
                  domain { left = 0, right = 1, step = 0.1 }
                  reporting.interval = 1
                }
                """);
            int code = run("search", "-t", "sin(x)", "-f", config.toString(), "-e", "2",
                    "--fitness", "correlation", "--seed", "5", "--seed-expr", "x");
            assertEquals(0, code, stderr());
            assertTrue(stdout().contains("SEARCH COMPLETE"), stdout());
            assertTrue(stdout().contains("Epoch"), stdout());
        }

        @Test
        @DisplayName("Target with a variable the search does not sweep exits with 2")
        void foreignVariable() {
            assertEquals(2, run("search", "-t", "x + y", "-q"));
            assertTrue(stderr().contains("y"), stderr());
        }

        @Test
        @DisplayName("Bad target exits with 2")
        void badTarget() {
            assertEquals(2, run("search", "-t", "sin(", "-q"));
        }

        @Test
        @DisplayName("Invalid override exits with 2")
        void badOverride() {
            assertEquals(2, run("search", "-t", "x", "-p", "0", "-q"));
        }

        @Test
        @DisplayName("Target is required")
        void missingTarget() {
            assertNotEquals(0, run("search"));
        }
    }

    @Test
    @DisplayName("info prints the default configuration")
    void info() {
        assertEquals(0, run("info"));
        assertTrue(stdout().contains("population.size"));
        assertTrue(stdout().contains("erf"));
    }
}
