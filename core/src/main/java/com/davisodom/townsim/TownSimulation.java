package com.davisodom.townsim;

import com.davisodom.townsim.action.FacilityActionMapping;
import com.davisodom.townsim.behavior.BehaviorDecider;
import com.davisodom.townsim.behavior.RuleBasedBehaviorDecider;
import com.davisodom.townsim.config.ConfigLoader;
import com.davisodom.townsim.config.SimulationConfig;
import com.davisodom.townsim.core.SimulationEngine;
import com.davisodom.townsim.data.SchemaValidator;
import com.davisodom.townsim.data.WorldData;
import com.davisodom.townsim.data.WorldDataLoader;
import com.davisodom.townsim.persistence.FileStateStore;
import com.davisodom.townsim.persistence.StateStore;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Wires config, world data, persistence and the decider into a {@link SimulationEngine}.
 *
 * <p>Run headless with {@code TownSimulation [config.yml] [worldDir]}. Without arguments the
 * bundled config and sample world are used.
 */
public class TownSimulation {

    private static final Logger LOGGER = Logger.getLogger(TownSimulation.class.getName());

    private final SimulationConfig config;
    private final SimulationEngine engine;

    public TownSimulation(SimulationConfig config, WorldData world, BehaviorDecider decider, StateStore store,
                          Clock clock, Random random) {
        this.config = config;
        this.engine = new SimulationEngine(config, decider, FacilityActionMapping.defaults(), store, clock, random);
        engine.initialize(world, config.simulation.currentMapId);
    }

    /**
     * Load everything from the given locations; null arguments select the bundled defaults.
     */
    public static TownSimulation create(Path configFile, Path worldDirectory) throws IOException {
        SchemaValidator validator = new SchemaValidator();

        // Load configuration
        SimulationConfig config = new ConfigLoader(validator).load(configFile);

        // Load world data
        WorldDataLoader loader = new WorldDataLoader(validator);
        WorldData world = worldDirectory != null
                ? loader.loadFromDirectory(worldDirectory)
                : loader.loadFromClasspath(WorldDataLoader.DEFAULT_RESOURCE_ROOT);

        // Persistence
        StateStore store = null;
        if (config.persistence.enabled) {
            store = new FileStateStore(new File(config.persistence.dataFolder), Logger.getLogger("TownSim.Store"));
            LOGGER.info("[STORE] Persisting to " + config.persistence.dataFolder);
        }

        Random random = new Random();
        BehaviorDecider decider = new RuleBasedBehaviorDecider(random, config.behavior, FacilityActionMapping.defaults());
        TownSimulation simulation = new TownSimulation(config, world, decider, store, Clock.systemDefaultZone(), random);
        simulation.engine.restoreFromStore();
        return simulation;
    }

    public SimulationConfig getConfig() {
        return config;
    }

    public SimulationEngine getEngine() {
        return engine;
    }

    public static void main(String[] args) throws Exception {
        configureLogging();
        Path configFile = args.length > 0 ? Paths.get(args[0]) : null;
        Path worldDirectory = args.length > 1 ? Paths.get(args[1]) : null;

        TownSimulation simulation = create(configFile, worldDirectory);
        SimulationEngine engine = simulation.getEngine();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("[SIM] Shutdown requested");
            engine.shutdown();
            stopped.countDown();
        }, "TownSim-Shutdown"));

        engine.getActivityLog().addListener(entry -> LOGGER.info(String.format("[SIM] Day %d %s %s %s %s",
                entry.day(), entry.time(), entry.agentId(), entry.type(), entry.detail())));
        engine.start();
        stopped.await();
    }

    private static void configureLogging() {
        try (InputStream in = TownSimulation.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Could not apply logging.properties: " + e.getMessage());
        }
    }
}
