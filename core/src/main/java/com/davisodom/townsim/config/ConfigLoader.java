package com.davisodom.townsim.config;

import com.davisodom.townsim.data.SchemaValidator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads {@link SimulationConfig} from YAML.
 *
 * The bundled {@value #DEFAULT_RESOURCE} is used when no external file is given. Both are
 * validated against the config schema before binding; an invalid file is fatal.
 */
public class ConfigLoader {

    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "townsim-config.yml";

    private final ObjectMapper yamlMapper;
    private final SchemaValidator validator;

    public ConfigLoader(SchemaValidator validator) {
        this.validator = validator;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Load from an external file, or the bundled defaults when {@code file} is null.
     */
    public SimulationConfig load(Path file) {
        if (file == null) {
            return loadDefaults();
        }
        if (!Files.exists(file)) {
            throw new ConfigException("Config file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            SimulationConfig config = parse(in, file.toString());
            LOGGER.info("Loaded config from " + file);
            return config;
        } catch (IOException e) {
            throw new ConfigException("Failed to read config " + file, e);
        }
    }

    public SimulationConfig loadDefaults() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LOGGER.warning(DEFAULT_RESOURCE + " not found, using built-in defaults");
                return new SimulationConfig();
            }
            return parse(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new ConfigException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    SimulationConfig parse(InputStream in, String sourceName) throws IOException {
        JsonNode tree = yamlMapper.readTree(in);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return new SimulationConfig();
        }
        List<String> errors = validator.validate(SchemaValidator.SIMULATION_CONFIG, tree);
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid config " + sourceName + ": " + String.join("; ", errors));
        }
        return yamlMapper.treeToValue(tree, SimulationConfig.class);
    }
}
