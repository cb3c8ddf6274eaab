package com.raditha.sweep.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for error handling, exit codes and help generation.
 */
class ErrorHandlingTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outContent;
    private ByteArrayOutputStream errContent;
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() {
        outContent = new ByteArrayOutputStream();
        errContent = new ByteArrayOutputStream();
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(outContent));
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void testInvalidOption() {
        int exitCode = SweeperCLI.commandLine().execute("--invalid-option");

        assertEquals(2, exitCode, "Invalid option should return exit code 2");
        String errorOutput = errContent.toString();
        assertTrue(errorOutput.contains("Unknown option") || errorOutput.contains("Unmatched argument"),
                "Error message should indicate unknown option");
        assertTrue(errorOutput.contains("Usage:"), "Usage should follow the error");
    }

    @Test
    void testMissingValue() {
        int exitCode = SweeperCLI.commandLine().execute("--threads");

        assertEquals(2, exitCode);
        String errorOutput = errContent.toString();
        assertTrue(errorOutput.contains("Missing required parameter") || errorOutput.contains("Expected parameter"),
                "Error message should indicate missing parameter");
    }

    @Test
    void testInvalidType() {
        int exitCode = SweeperCLI.commandLine().execute("--threads", "many");

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("many"));
    }

    @Test
    void testInvalidEnumValues() {
        int exitCode = SweeperCLI.commandLine().execute("--mode", "invalid-mode");

        assertEquals(2, exitCode, "Invalid enum value should return exit code 2");
        String errorOutput = errContent.toString();
        assertTrue(errorOutput.contains("Invalid run mode") || errorOutput.contains("Must be: apply or dry-run"),
                "Error message should indicate valid enum values");

        errContent.reset();
        assertEquals(2, SweeperCLI.commandLine().execute("--grammar", "cobol"));
        assertTrue(errContent.toString().contains("Unknown grammar"));
    }

    @Test
    void testConfigurationErrors() {
        assertEquals(2, SweeperCLI.commandLine().execute("--threads", "0", tempDir.toString()));
        assertTrue(errContent.toString().contains("Configuration error: Threads must be positive"));

        errContent.reset();
        assertEquals(2, SweeperCLI.commandLine().execute("--export", "xml", tempDir.toString()));
        assertTrue(errContent.toString().contains("Export format must be"));

        errContent.reset();
        assertEquals(2, SweeperCLI.commandLine().execute("--config-file",
                tempDir.resolve("missing.yml").toString(), tempDir.toString()));
        assertTrue(errContent.toString().contains("Configuration file not found"));
    }

    @Test
    void testOutputPathMustBeDirectory() throws IOException {
        Path file = Files.writeString(tempDir.resolve("report.txt"), "x");

        int exitCode = SweeperCLI.commandLine().execute("--export", "csv", "--output", file.toString(),
                tempDir.toString());

        assertEquals(2, exitCode);
        assertTrue(errContent.toString().contains("not a directory"));
    }

    @Test
    void testMissingPathIsAnIoError() {
        int exitCode = SweeperCLI.commandLine().execute(tempDir.resolve("does-not-exist").toString());

        assertEquals(3, exitCode);
        assertTrue(errContent.toString().contains("I/O error: "));
    }

    @Test
    void testHelpGeneration() {
        int exitCode = SweeperCLI.commandLine().execute("--help");

        assertEquals(0, exitCode, "Help should return exit code 0");
        String output = outContent.toString();
        assertTrue(output.contains("Usage:"), "Help should contain usage section");
        assertTrue(output.contains("sweeper"), "Help should contain program name");
        assertTrue(output.contains("Removes local variables whose values are never read"));
        assertTrue(output.contains("--mode"));
        assertTrue(output.contains("--reassignment"));
        assertTrue(output.contains("--marker"));
        assertTrue(output.contains("--version"), "Help should contain version option");
    }

    @Test
    void testVersionOutput() {
        int exitCode = SweeperCLI.commandLine().execute("-V");

        assertEquals(0, exitCode);
        assertTrue(outContent.toString().contains("Sweeper v1.0.0"));
    }
}
