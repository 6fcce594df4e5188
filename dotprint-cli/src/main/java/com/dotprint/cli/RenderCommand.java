package com.dotprint.cli;

import com.dotprint.core.config.ConfigLoader;
import com.dotprint.core.config.DotPrintConfig;
import com.dotprint.core.definition.DefinitionConverter;
import com.dotprint.core.definition.DefinitionException;
import com.dotprint.core.definition.GraphDefinition;
import com.dotprint.core.definition.GraphDefinitionLoader;
import com.dotprint.core.generator.DotGenerator;
import com.dotprint.core.generator.GeneratedDiagram;
import com.dotprint.core.model.DotGraph;
import com.dotprint.core.output.GeneratedOutput;
import com.dotprint.core.output.OutputContext;
import com.dotprint.core.output.OutputTarget;
import com.dotprint.core.output.OutputTargets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Renders a YAML graph definition to a DOT document.
 *
 * <p><b>Workflow:</b>
 * <ol>
 *   <li>Load configuration from {@code dotprint.yaml} (defaults if absent)</li>
 *   <li>Load and convert the graph definition</li>
 *   <li>Generate the DOT document</li>
 *   <li>Write it with the selected output target</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * dotprint render pipeline.yaml
 * dotprint render pipeline.yaml -o build/graphs
 * dotprint render pipeline.yaml -t console
 * dotprint render pipeline.yaml -c ci/dotprint.yaml
 * }</pre>
 */
@Command(
    name = "render",
    description = "Render a YAML graph definition to DOT",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", paramLabel = "DEFINITION", description = "Graph definition file (YAML)")
    private Path definitionPath;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get("dotprint.yaml");

    @Option(names = {"-o", "--output"}, description = "Output directory (overrides configuration)")
    private Path outputDir;

    @Option(names = {"-t", "--target"}, description = "Output target id (overrides configuration)")
    private String targetId;

    @Override
    public Integer call() {
        DotPrintConfig config = ConfigLoader.load(configPath);

        String target = targetId != null ? targetId : config.output().targetOrDefault();
        Optional<OutputTarget> outputTarget = OutputTargets.find(target);
        if (outputTarget.isEmpty()) {
            log.error("Unknown output target: {}. Use 'dotprint list' to see available targets.", target);
            return 1;
        }

        try {
            GraphDefinition definition = new GraphDefinitionLoader().load(definitionPath);
            DotGraph graph = new DefinitionConverter().convert(definition);
            GeneratedDiagram diagram = new DotGenerator().generate(graph, config.render().toGeneratorConfig());

            String directory = outputDir != null ? outputDir.toString() : config.output().directoryOrDefault();
            OutputContext context = new OutputContext(directory, config.output().settings());
            outputTarget.get().write(GeneratedOutput.of(List.of(diagram)), context);

            log.info("Rendered {} with target '{}'", definitionPath, outputTarget.get().getId());
            return 0;
        } catch (DefinitionException e) {
            log.error("Invalid graph definition {}: {}", definitionPath, e.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            log.error("Failed to write output: {}", e.getMessage(), e);
            return 1;
        }
    }
}
