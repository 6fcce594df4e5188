package com.dotprint;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DotPrintCLI}.
 */
class DotPrintCLITest {

    private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void resetLogging() {
        root.setLevel(Level.INFO);
    }

    @Test
    void parse_globalOptions_areRecognized() {
        DotPrintCLI cli = new DotPrintCLI();
        new CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void execute_quiet_setsRootLevelToError() {
        CommandLine commandLine = DotPrintCLI.commandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        int exitCode = commandLine.execute("-q", "list");

        assertThat(exitCode).isZero();
        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
    }

    @Test
    void execute_verbose_setsRootLevelToDebug() {
        CommandLine commandLine = DotPrintCLI.commandLine();
        commandLine.setOut(new PrintWriter(new StringWriter()));

        commandLine.execute("-v", "list");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
    }

    @Test
    void execute_help_listsSubcommands() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = DotPrintCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("render", "quote", "list");
    }
}
