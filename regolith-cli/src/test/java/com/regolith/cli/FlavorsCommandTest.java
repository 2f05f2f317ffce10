package com.regolith.cli;

import com.regolith.core.flavor.FlavorRegistry;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FlavorsCommand}.
 */
class FlavorsCommandTest {

    @Test
    void call_listsDiscoveredFlavors() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new FlavorsCommand());
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Flavors:")
            .contains("  • POSIX Extended Regular Expressions (IEEE Std 1003.1) (ID: posix-ere)")
            .contains("Flags: none")
            .contains("Features: posixClasses");
    }

    @Test
    void call_withNoFlavors_saysSo() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new FlavorsCommand(FlavorRegistry.of(List.of())));
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute();

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("No flavors found.");
    }
}
