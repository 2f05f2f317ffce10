package com.regolith;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RegolithCLI}.
 */
class RegolithCLITest {

    @TempDir
    Path tempDir;

    private final ch.qos.logback.classic.Logger root =
        (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
    private final Level originalLevel = root.getLevel();

    @AfterEach
    void restoreLogLevel() {
        root.setLevel(originalLevel);
    }

    @Test
    void execute_renderSubcommand_writesFile() {
        Path output = tempDir.resolve("out.svg");
        StringWriter out = new StringWriter();
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("render", "-o", output.toString(), "a+b");

        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(out.toString()).contains("Wrote");
    }

    @Test
    void execute_flavorsSubcommand_listsPosixEre() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("flavors");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("(ID: posix-ere)");
    }

    @Test
    void execute_verbose_setsDebugBeforeSubcommandRuns() {
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        commandLine.execute("--verbose", "flavors");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void execute_quiet_setsErrorLevel() {
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        commandLine.execute("-q", "flavors");

        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void execute_unknownSubcommand_returnsUsageError() {
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("draw");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void execute_version_printsVersion() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = RegolithCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Regolith 1.0.0-SNAPSHOT");
    }
}
