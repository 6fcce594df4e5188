package com.dotprint.core.output.impl;

import com.dotprint.core.output.GeneratedFile;
import com.dotprint.core.output.GeneratedOutput;
import com.dotprint.core.output.OutputContext;
import com.dotprint.core.output.OutputTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated documents to standard output.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers ("true"/"false", default: "false")</li>
 *   <li>{@code console.separator} - separator between documents (default: "---")</li>
 *   <li>{@code console.showHeaders} - print a "// file" header per document (default: "false")</li>
 * </ul>
 *
 * <p>With the defaults a single document is printed exactly as generated, so the
 * output can be piped straight into {@code dot}.
 */
public class ConsoleTarget implements OutputTarget {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleTarget.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int SEPARATOR_WIDTH = 80;

    private final PrintStream out;

    /**
     * Creates a target printing to {@link System#out}.
     */
    public ConsoleTarget() {
        this(System.out);
    }

    /**
     * Creates a target printing to the given stream.
     *
     * @param out stream to print to
     */
    public ConsoleTarget(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void write(GeneratedOutput output, OutputContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "false"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault("console.showHeaders", "false"));

        logger.debug("Printing {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (i > 0) {
                printSeparator(separator, useColors);
            }
            if (showHeaders) {
                out.println(colored("// " + file.relativePath(), ANSI_CYAN, useColors));
            }
            out.print(file.content());
        }
        out.flush();
    }

    private void printSeparator(String separator, boolean useColors) {
        // DOT treats lines starting with '#' as comments, so the separator stays a comment
        int repeatCount = separator.isEmpty() ? 0 : Math.max(1, SEPARATOR_WIDTH / separator.length());
        out.println(colored("# " + separator.repeat(repeatCount), ANSI_YELLOW, useColors));
    }

    private static String colored(String text, String color, boolean useColors) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
