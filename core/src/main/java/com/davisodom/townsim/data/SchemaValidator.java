package com.davisodom.townsim.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * JSON Schema (draft 7) validation for world data and configuration.
 *
 * Schemas are loaded from the {@code schemas/} classpath folder and cached by name.
 */
public class SchemaValidator {

    private static final Logger LOGGER = Logger.getLogger(SchemaValidator.class.getName());

    public static final String WORLD_MAP = "world-map.json";
    public static final String CHARACTERS = "characters.json";
    public static final String NPCS = "npcs.json";
    public static final String SIMULATION_CONFIG = "simulation-config.json";

    private final ObjectMapper mapper;
    private final JsonSchemaFactory schemaFactory;
    private final Map<String, JsonSchema> schemas = new ConcurrentHashMap<>();

    public SchemaValidator() {
        this.mapper = new ObjectMapper();
        this.schemaFactory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    }

    /**
     * Validate a JSON tree against a schema.
     *
     * @param schemaName schema filename (e.g. "world-map.json")
     * @return validation messages, empty when the document is valid
     * @throws IllegalStateException if the schema itself is missing
     */
    public List<String> validate(String schemaName, JsonNode data) {
        JsonSchema schema = schemas.computeIfAbsent(schemaName, this::loadSchema);
        Set<ValidationMessage> errors = schema.validate(data);

        if (errors.isEmpty()) {
            LOGGER.fine("Validation passed for " + schemaName);
            return Collections.emptyList();
        }
        List<String> messages = new ArrayList<>();
        for (ValidationMessage error : errors) {
            messages.add(error.getMessage());
        }
        Collections.sort(messages);
        LOGGER.warning("Validation failed for " + schemaName + ":");
        for (String message : messages) {
            LOGGER.warning("  - " + message);
        }
        return messages;
    }

    /**
     * Validate raw JSON text against a schema.
     *
     * @return true if valid, false on validation errors or unparseable input
     */
    public boolean isValid(String schemaName, String jsonData) {
        try {
            return validate(schemaName, mapper.readTree(jsonData)).isEmpty();
        } catch (IOException e) {
            LOGGER.warning("Unparseable JSON for " + schemaName + ": " + e.getMessage());
            return false;
        }
    }

    private JsonSchema loadSchema(String schemaName) {
        InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schemas/" + schemaName);
        if (schemaStream == null) {
            throw new IllegalStateException("Schema not found: " + schemaName);
        }
        try (InputStream in = schemaStream) {
            return schemaFactory.getSchema(in);
        } catch (IOException e) {
            throw new IllegalStateException("Schema unreadable: " + schemaName, e);
        }
    }
}
