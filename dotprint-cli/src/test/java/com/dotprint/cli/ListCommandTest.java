package com.dotprint.cli;

import com.dotprint.DotPrintCLI;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void list_printsRegisteredTargets() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = DotPrintCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("list");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Output Targets:")
            .contains("filesystem (FileSystemTarget)")
            .contains("console (ConsoleTarget)");
    }
}
