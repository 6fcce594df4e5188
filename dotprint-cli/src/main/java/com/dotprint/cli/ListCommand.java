package com.dotprint.cli;

import com.dotprint.core.output.OutputTarget;
import com.dotprint.core.output.OutputTargets;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the output targets registered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dotprint list
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available output targets",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Output Targets:");
        out.println();

        List<OutputTarget> targets = OutputTargets.all();
        for (OutputTarget target : targets) {
            out.printf("  • %s (%s)%n", target.getId(), target.getClass().getSimpleName());
        }

        if (targets.isEmpty()) {
            out.println("  No output targets found.");
        }
        out.flush();
        return 0;
    }
}
