package com.dotprint.core.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link GraphDefinition}s from YAML.
 *
 * <p>Unlike configuration, a definition has no sensible default: a missing or
 * malformed file is an error.
 */
public class GraphDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphDefinitionLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Loads a definition file.
     *
     * @param path path to the YAML file
     * @return the definition
     * @throws DefinitionException if the file is missing, unreadable or malformed
     */
    public GraphDefinition load(Path path) {
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new DefinitionException("Graph definition not found or not readable: " + path);
        }
        try {
            log.debug("Loading graph definition from: {}", path);
            return parse(Files.readString(path));
        } catch (IOException e) {
            throw new DefinitionException("Failed to read graph definition: " + path, e);
        }
    }

    /**
     * Parses a definition from YAML text.
     *
     * @param yaml YAML document
     * @return the definition
     * @throws DefinitionException if the text is not a valid definition
     */
    public GraphDefinition parse(String yaml) {
        try {
            GraphDefinition definition = YAML_MAPPER.readValue(yaml, GraphDefinition.class);
            if (definition == null) {
                throw new DefinitionException("Graph definition is empty");
            }
            return definition;
        } catch (IOException e) {
            throw new DefinitionException("Invalid graph definition: " + e.getMessage(), e);
        }
    }
}
