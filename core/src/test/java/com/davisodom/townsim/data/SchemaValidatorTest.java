package com.davisodom.townsim.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    private static final String VALID_MAP = "{\"id\": \"town\", \"nodes\": ["
            + "{\"id\": \"town-0-0\", \"x\": 16, \"y\": 16, \"type\": \"waypoint\", \"connectedTo\": [\"town-0-1\"]},"
            + "{\"id\": \"town-0-1\", \"x\": 48, \"y\": 16, \"type\": \"entrance\", \"connectedTo\": [\"town-0-0\"],"
            + " \"leadsTo\": {\"mapId\": \"cafe\", \"nodeId\": \"cafe-0-0\"}}],"
            + " \"obstacles\": [{\"id\": \"park\", \"type\": \"zone\", \"tileRow\": 1, \"tileCol\": 0,"
            + " \"tileWidth\": 2, \"tileHeight\": 2, \"facility\": {\"tags\": [\"public\"]}}]}";

    private SchemaValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SchemaValidator();
    }

    @Test
    @DisplayName("Valid map passes")
    void testValidMap() {
        assertTrue(validator.isValid(SchemaValidator.WORLD_MAP, VALID_MAP));
    }

    @Test
    @DisplayName("Missing required fields are reported")
    void testMissingFields() throws Exception {
        List<String> errors = validator.validate(SchemaValidator.WORLD_MAP,
                new ObjectMapper().readTree("{\"name\": \"Town\"}"));

        assertEquals(2, errors.size(), "Both id and nodes are missing: " + errors);
    }

    @Test
    @DisplayName("Unknown facility tags are rejected")
    void testUnknownTag() {
        String map = VALID_MAP.replace("\"public\"", "\"casino\"");

        assertFalse(validator.isValid(SchemaValidator.WORLD_MAP, map));
    }

    @Test
    @DisplayName("Schedule times must be HH:MM")
    void testScheduleTime() {
        String good = "[{\"id\": \"alice\", \"mapId\": \"home\", \"schedule\": [{\"time\": \"07:30\", \"activity\": \"eat\"}]}]";
        String bad = "[{\"id\": \"alice\", \"mapId\": \"home\", \"schedule\": [{\"time\": \"7.30am\", \"activity\": \"eat\"}]}]";

        assertTrue(validator.isValid(SchemaValidator.CHARACTERS, good));
        assertFalse(validator.isValid(SchemaValidator.CHARACTERS, bad));
    }

    @Test
    @DisplayName("NPC direction is restricted")
    void testNpcDirection() {
        assertTrue(validator.isValid(SchemaValidator.NPCS,
                "[{\"id\": \"mayor\", \"mapId\": \"town\", \"nodeId\": \"town-0-0\", \"direction\": \"up\"}]"));
        assertFalse(validator.isValid(SchemaValidator.NPCS,
                "[{\"id\": \"mayor\", \"mapId\": \"town\", \"nodeId\": \"town-0-0\", \"direction\": \"north\"}]"));
    }

    @Test
    @DisplayName("Unparseable JSON is invalid")
    void testUnparseable() {
        assertFalse(validator.isValid(SchemaValidator.WORLD_MAP, "{not json"));
    }

    @Test
    @DisplayName("Missing schema is an error")
    void testMissingSchema() {
        assertThrows(IllegalStateException.class,
                () -> validator.validate("nope.json", new ObjectMapper().createObjectNode()));
    }
}
