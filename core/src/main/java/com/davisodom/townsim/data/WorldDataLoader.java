package com.davisodom.townsim.data;

import com.davisodom.townsim.model.MapLink;
import com.davisodom.townsim.model.PathNode;
import com.davisodom.townsim.model.WorldMap;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads maps, characters and NPCs from a world folder.
 *
 * Layout, on the classpath or on disk:
 * <pre>
 *   maps/_manifest.txt   one map file name per line ('#' comments allowed)
 *   maps/*.json          one map per file
 *   characters.json      array of characters
 *   npcs.json            array of NPCs
 * </pre>
 * On disk the manifest is optional; without one every {@code maps/*.json} file is read.
 * Every document is schema-checked, then cross-references are verified. Any problem is fatal.
 */
public class WorldDataLoader {

    private static final Logger LOGGER = Logger.getLogger(WorldDataLoader.class.getName());

    public static final String DEFAULT_RESOURCE_ROOT = "world/";
    static final String MAPS_FOLDER = "maps/";
    static final String MANIFEST = "_manifest.txt";
    static final String CHARACTERS_FILE = "characters.json";
    static final String NPCS_FILE = "npcs.json";

    private interface Source {
        /**
         * @return the stream, or null when the entry does not exist
         */
        InputStream open(String relativePath) throws IOException;

        List<String> listMapFiles() throws IOException;
    }

    private final SchemaValidator validator;
    private final ObjectMapper mapper;

    public WorldDataLoader(SchemaValidator validator) {
        this.validator = validator;
        this.mapper = new ObjectMapper();
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Load the world bundled under {@code root} on the classpath (e.g. "world/").
     */
    public WorldData loadFromClasspath(String root) {
        String prefix = root.endsWith("/") ? root : root + "/";
        ClassLoader loader = getClass().getClassLoader();
        return load(prefix, new Source() {
            @Override
            public InputStream open(String relativePath) {
                return loader.getResourceAsStream(prefix + relativePath);
            }

            @Override
            public List<String> listMapFiles() throws IOException {
                List<String> files = readManifest(open(MAPS_FOLDER + MANIFEST));
                if (files == null) {
                    throw new WorldDataException("Missing " + prefix + MAPS_FOLDER + MANIFEST);
                }
                return files;
            }
        });
    }

    /**
     * Load a world from a directory on disk.
     */
    public WorldData loadFromDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new WorldDataException("World directory not found: " + directory);
        }
        return load(directory.toString(), new Source() {
            @Override
            public InputStream open(String relativePath) throws IOException {
                Path file = directory.resolve(relativePath);
                return Files.exists(file) ? Files.newInputStream(file) : null;
            }

            @Override
            public List<String> listMapFiles() throws IOException {
                Path mapsDir = directory.resolve(MAPS_FOLDER);
                List<String> files = readManifest(open(MAPS_FOLDER + MANIFEST));
                if (files != null) {
                    return files;
                }
                if (!Files.isDirectory(mapsDir)) {
                    return Collections.emptyList();
                }
                try (Stream<Path> entries = Files.list(mapsDir)) {
                    return entries.map(p -> p.getFileName().toString())
                            .filter(name -> name.endsWith(".json"))
                            .sorted()
                            .collect(Collectors.toList());
                }
            }
        });
    }

    private WorldData load(String origin, Source source) {
        try {
            List<WorldMap> maps = new ArrayList<>();
            for (String file : source.listMapFiles()) {
                JsonNode tree = readTree(source, MAPS_FOLDER + file);
                if (tree == null) {
                    throw new WorldDataException("Map file listed but missing: " + file);
                }
                validate(SchemaValidator.WORLD_MAP, tree, file);
                maps.add(mapper.treeToValue(tree, WorldMap.class));
            }
            List<CharacterDefinition> characters = readList(source, CHARACTERS_FILE, SchemaValidator.CHARACTERS,
                    new TypeReference<List<CharacterDefinition>>() {});
            List<NpcDefinition> npcs = readList(source, NPCS_FILE, SchemaValidator.NPCS,
                    new TypeReference<List<NpcDefinition>>() {});

            WorldData data = new WorldData(maps, characters, npcs);
            verify(data);
            LOGGER.info(String.format("[SIM] Loaded world from %s: %d maps, %d characters, %d NPCs",
                    origin, maps.size(), characters.size(), npcs.size()));
            return data;
        } catch (IOException e) {
            throw new WorldDataException("Failed to read world data from " + origin, e);
        }
    }

    private <T> List<T> readList(Source source, String file, String schema, TypeReference<List<T>> type)
            throws IOException {
        JsonNode tree = readTree(source, file);
        if (tree == null) {
            return Collections.emptyList();
        }
        validate(schema, tree, file);
        return mapper.convertValue(tree, type);
    }

    private JsonNode readTree(Source source, String relativePath) throws IOException {
        try (InputStream in = source.open(relativePath)) {
            return in != null ? mapper.readTree(in) : null;
        }
    }

    private void validate(String schema, JsonNode tree, String file) {
        List<String> errors = validator.validate(schema, tree);
        if (!errors.isEmpty()) {
            throw new WorldDataException("Invalid " + file + ": " + String.join("; ", errors));
        }
    }

    private static List<String> readManifest(InputStream in) throws IOException {
        if (in == null) {
            return null;
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return br.lines()
                    .map(String::trim)
                    .filter(s -> !s.isBlank() && !s.startsWith("#"))
                    .collect(Collectors.toList());
        }
    }

    /**
     * Cross-reference checks the schemas cannot express.
     */
    void verify(WorldData data) {
        Map<String, WorldMap> maps = new LinkedHashMap<>();
        for (WorldMap map : data.maps()) {
            if (maps.put(map.getId(), map) != null) {
                throw new WorldDataException("Duplicate map id: " + map.getId());
            }
        }
        for (WorldMap map : maps.values()) {
            if (map.getSpawnNodeId() != null && !map.hasNode(map.getSpawnNodeId())) {
                throw new WorldDataException(String.format("Map %s: unknown spawn node %s",
                        map.getId(), map.getSpawnNodeId()));
            }
            Set<String> seen = new HashSet<>();
            for (PathNode node : map.getNodes()) {
                if (!seen.add(node.getId())) {
                    throw new WorldDataException(String.format("Map %s: duplicate node %s", map.getId(), node.getId()));
                }
                for (String neighbor : node.getConnectedTo()) {
                    if (!map.hasNode(neighbor)) {
                        throw new WorldDataException(String.format("Map %s: node %s connects to unknown node %s",
                                map.getId(), node.getId(), neighbor));
                    }
                }
                MapLink link = node.getLeadsTo();
                if (link != null) {
                    WorldMap target = maps.get(link.mapId());
                    if (target == null || !target.hasNode(link.nodeId())) {
                        throw new WorldDataException(String.format("Map %s: entrance %s leads to unknown %s:%s",
                                map.getId(), node.getId(), link.mapId(), link.nodeId()));
                    }
                }
            }
        }

        Set<String> characterIds = new HashSet<>();
        for (CharacterDefinition character : data.characters()) {
            if (!characterIds.add(character.id())) {
                throw new WorldDataException("Duplicate character id: " + character.id());
            }
            WorldMap map = maps.get(character.mapId());
            if (map == null || !map.hasNode(character.startNodeId(map))) {
                throw new WorldDataException(String.format("Character %s starts at unknown location %s:%s",
                        character.id(), character.mapId(), character.nodeId()));
            }
        }
        Set<String> npcIds = new HashSet<>();
        for (NpcDefinition npc : data.npcs()) {
            if (!npcIds.add(npc.id())) {
                throw new WorldDataException("Duplicate NPC id: " + npc.id());
            }
            WorldMap map = maps.get(npc.mapId());
            if (map == null || !map.hasNode(npc.nodeId())) {
                throw new WorldDataException(String.format("NPC %s stands at unknown location %s:%s",
                        npc.id(), npc.mapId(), npc.nodeId()));
            }
        }
    }
}
