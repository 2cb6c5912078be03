package com.scanparse;

import com.scanparse.adapter.file.ExpressionFileProcessor;
import com.scanparse.core.DefaultLineProcessor;
import com.scanparse.tree.LevelOrderTreeRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command-line runner of ScanParseApplication.
 */
@ExtendWith(OutputCaptureExtension.class)
class ScanParseApplicationTest {

    private static final String USAGE = "Usage: scanparse <input_filename>";

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream stdout;
    private CommandLineRunner runner;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        ExpressionFileProcessor processor = new ExpressionFileProcessor(
                new DefaultLineProcessor(new LevelOrderTreeRenderer()),
                new PrintStream(stdout, true, StandardCharsets.UTF_8),
                true,
                "output",
                StandardCharsets.UTF_8);
        runner = new ScanParseApplication().scanParseRunner(processor);
    }

    @Test
    @DisplayName("No arguments logs usage")
    void noArguments(CapturedOutput output) {
        assertDoesNotThrow(() -> runner.run());

        assertTrue(output.getErr().contains(USAGE));
    }

    @Test
    @DisplayName("Two input files logs usage and processes neither")
    void twoArguments(CapturedOutput output) throws IOException {
        Path first = Files.writeString(tempDir.resolve("one.txt"), "x\n");
        Path second = Files.writeString(tempDir.resolve("two.txt"), "y\n");

        assertDoesNotThrow(() -> runner.run(first.toString(), second.toString()));

        assertTrue(output.getErr().contains(USAGE));
        assertFalse(Files.exists(tempDir.resolve("one.output")));
        assertFalse(Files.exists(tempDir.resolve("two.output")));
    }

    @Test
    @DisplayName("Spring options are ignored when picking the input file")
    void skipsOptions(CapturedOutput output) throws IOException {
        Path input = Files.writeString(tempDir.resolve("exprs.txt"), "x\n");

        assertDoesNotThrow(() -> runner.run("--scanparse.echo-to-stdout=false", input.toString()));

        assertFalse(output.getErr().contains(USAGE));
        assertTrue(Files.exists(tempDir.resolve("exprs.output")));
        assertTrue(stdout.toString(StandardCharsets.UTF_8).startsWith("EXPR\n"));
        assertTrue(output.getErr().contains("Finished"));
    }

    @Test
    @DisplayName("Missing input is logged, not thrown")
    void missingInput(CapturedOutput output) {
        Path input = tempDir.resolve("absent.txt");

        assertDoesNotThrow(() -> runner.run(input.toString()));

        assertTrue(output.getErr().contains("Failed to read input file"));
        assertFalse(Files.exists(tempDir.resolve("absent.output")));
    }
}
