package com.davisodom.townsim;

import com.davisodom.townsim.core.SimulationEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the bundled config and sample world the way {@code main} does, without starting the loop.
 */
class TownSimulationTest {

    private TownSimulation simulation;

    @BeforeEach
    void setUp() throws IOException {
        simulation = TownSimulation.create(null, null);
    }

    @AfterEach
    void tearDown() {
        simulation.getEngine().shutdown();
    }

    @Test
    @DisplayName("Simulation should load the bundled world")
    void testLoads() {
        SimulationEngine engine = simulation.getEngine();

        assertEquals(3, engine.getWorld().getMaps().size());
        assertEquals(2, engine.getWorld().getCharacters().size());
        assertEquals(2, engine.getWorld().getNpcs().size());
        assertEquals("town", engine.getWorld().getCurrentMapId());
        assertFalse(simulation.getConfig().persistence.enabled, "Bundled config runs without a store");
    }

    @Test
    @DisplayName("Manual ticks advance the world")
    void testManualTicks() {
        SimulationEngine engine = simulation.getEngine();
        engine.triggerInitialBehaviorDecisions();

        for (int i = 1; i <= 10; i++) {
            engine.tick();
            assertEquals(i, engine.getTickEngine().getCurrentTick(), "Tick counter should increment by 1 each call");
        }
        assertEquals(10, engine.getWorld().getTick());
        assertFalse(engine.isPaused(), "No phase should have failed");
    }
}
