package com.dotprint.cli;

import com.dotprint.core.printing.DotRenderer;
import com.dotprint.core.printing.Printers;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the final DOT form of each argument, one per line.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * $ dotprint quote node_1 graph 'a b' 3.5
 * node_1
 * "graph"
 * "a b"
 * 3.5
 * }</pre>
 */
@Command(
    name = "quote",
    description = "Print strings as DOT identifiers, quoting and escaping where needed",
    mixinStandardHelpOptions = true
)
public class QuoteCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "TEXT", description = "Strings to print")
    private List<String> texts;

    @Override
    public Integer call() {
        for (String text : texts) {
            spec.commandLine().getOut().println(DotRenderer.printIt(text, Printers.STRING));
        }
        spec.commandLine().getOut().flush();
        return 0;
    }
}
