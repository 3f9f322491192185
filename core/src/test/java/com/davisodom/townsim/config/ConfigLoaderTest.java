package com.davisodom.townsim.config;

import com.davisodom.townsim.data.SchemaValidator;
import com.davisodom.townsim.model.ActionId;
import com.davisodom.townsim.model.NeedType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private ConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigLoader(new SchemaValidator());
    }

    private SimulationConfig parse(String yaml) throws IOException {
        return loader.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test.yml");
    }

    @Test
    @DisplayName("Bundled config loads with the documented defaults")
    void testBundledDefaults() {
        SimulationConfig config = loader.load(null);

        assertEquals(20, config.simulation.tickRateHz);
        assertEquals(50, config.simulation.tickIntervalMs());
        assertEquals("Asia/Tokyo", config.time.timezone);
        assertEquals(10.0, config.needs.interruptThreshold, 0.001);
        assertEquals(0.2, config.needs.rate(NeedType.BLADDER), 0.0001);
        assertTrue(config.action(ActionId.TOILET).fixed);
        assertEquals(5, config.action(ActionId.TOILET).duration);
        assertEquals(30, config.action(ActionId.EAT).durationRange.defaultMinutes);
        assertFalse(config.persistence.enabled);
    }

    @Test
    @DisplayName("Partial files keep defaults for everything they omit")
    void testPartialMerge() throws IOException {
        SimulationConfig config = parse(String.join("\n",
                "behavior:",
                "  restProbability: 0.5",
                "needs:",
                "  decayPerMinute:",
                "    bladder: 0.5",
                "actions:",
                "  eat:",
                "    cost: 3",
                ""));

        assertEquals(0.5, config.behavior.restProbability, 0.001);
        assertEquals(20.0, config.behavior.urgentThreshold, 0.001);
        assertEquals(0.5, config.needs.rate(NeedType.BLADDER), 0.0001);
        assertEquals(0.15, config.needs.rate(NeedType.SATIETY), 0.0001, "Other rates are merged in");
        assertEquals(3, config.action(ActionId.EAT).cost);
        assertEquals(60, config.action(ActionId.EAT).durationRange.max, "Action fields not named keep their default");
        assertNotNull(config.action(ActionId.SLEEP), "Unnamed actions stay in the table");
        assertEquals(150.0, config.movement.speed, 0.001);
    }

    @Test
    @DisplayName("An empty document yields the built-in defaults")
    void testEmptyDocument() throws IOException {
        SimulationConfig config = parse("");

        assertEquals(5, config.simulation.notifyEveryTicks);
        assertEquals("home", config.behavior.safeMapId);
    }

    @Test
    @DisplayName("Out of range values are rejected")
    void testInvalidValue() {
        ConfigException e = assertThrows(ConfigException.class,
                () -> parse("simulation:\n  tickRateHz: 0\n"));
        assertTrue(e.getMessage().contains("test.yml"));

        assertThrows(ConfigException.class, () -> parse("behavior:\n  restProbability: 2\n"));
        assertThrows(ConfigException.class, () -> parse("needs:\n  decayPerMinute:\n    thirst: 1\n"));
    }

    @Test
    @DisplayName("Unknown actions are rejected")
    void testUnknownAction() {
        assertThrows(ConfigException.class, () -> parse("actions:\n  dance:\n    duration: 5\n"));
    }

    @Test
    @DisplayName("External files are read from disk")
    void testExternalFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("townsim-config.yml");
        Files.write(file, "time:\n  timezone: UTC\npersistence:\n  enabled: true\n".getBytes(StandardCharsets.UTF_8));

        SimulationConfig config = loader.load(file);

        assertEquals("UTC", config.time.timezone);
        assertTrue(config.persistence.enabled);
        assertEquals("data", config.persistence.dataFolder);
    }

    @Test
    @DisplayName("A missing external file is fatal")
    void testMissingFile(@TempDir Path dir) {
        assertThrows(ConfigException.class, () -> loader.load(dir.resolve("nope.yml")));
    }
}
