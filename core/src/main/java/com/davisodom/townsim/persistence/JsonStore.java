package com.davisodom.townsim.persistence;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.*;
import java.nio.file.*;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.logging.Logger;

/**
 * Versioned JSON files in one data folder.
 *
 * Every document is wrapped with its schema version, written to a temp file and moved into
 * place atomically. Overwritten files can be backed up first; the newest five backups are kept.
 */
public class JsonStore {

    private static final int MAX_BACKUPS = 5;

    private final File dataFolder;
    private final Logger logger;
    private final ObjectMapper jsonMapper;

    public static final int SCHEMA_VERSION = 1;

    public JsonStore(File dataFolder, Logger logger) throws IOException {
        this.dataFolder = dataFolder;
        this.logger = logger;

        this.jsonMapper = new ObjectMapper();
        this.jsonMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.jsonMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.jsonMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        Files.createDirectories(dataFolder.toPath());
    }

    public ObjectMapper getMapper() {
        return jsonMapper;
    }

    /**
     * Save data to a JSON file.
     *
     * @param filename path relative to the data folder; parent folders are created
     * @param backup   copy the previous file aside before replacing it
     */
    public <T> void saveJson(String filename, T data, int schemaVersion, boolean backup) throws IOException {
        File file = new File(dataFolder, filename);
        Files.createDirectories(file.getParentFile().toPath());

        if (backup && file.exists()) {
            backupFile(file);
        }

        VersionedData<T> versioned = new VersionedData<>(schemaVersion, data);

        File tempFile = new File(file.getAbsolutePath() + ".tmp");
        jsonMapper.writeValue(tempFile, versioned);
        Files.move(tempFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

        logger.fine(String.format("[STORE] Saved %s (schema v%d)", filename, schemaVersion));
    }

    public <T> T loadJson(String filename, Class<T> dataClass) throws IOException {
        return loadJson(filename, jsonMapper.getTypeFactory().constructType(dataClass));
    }

    /**
     * Load a versioned document.
     *
     * @return the payload, or null when the file does not exist
     * @throws IOException when the file is unreadable or was written by a newer schema
     */
    public <T> T loadJson(String filename, JavaType dataType) throws IOException {
        File file = new File(dataFolder, filename);

        if (!file.exists()) {
            logger.fine(String.format("[STORE] %s not found", filename));
            return null;
        }

        JavaType wrapper = jsonMapper.getTypeFactory().constructParametricType(VersionedData.class, dataType);
        VersionedData<T> versioned = jsonMapper.readValue(file, wrapper);

        if (versioned.schemaVersion > SCHEMA_VERSION) {
            throw new IOException(String.format("%s has schema v%d, newer than supported v%d",
                    filename, versioned.schemaVersion, SCHEMA_VERSION));
        }
        if (versioned.schemaVersion < SCHEMA_VERSION) {
            logger.warning(String.format("[STORE] %s has schema v%d, reading as v%d",
                    filename, versioned.schemaVersion, SCHEMA_VERSION));
        }

        logger.fine(String.format("[STORE] Loaded %s (schema v%d)", filename, versioned.schemaVersion));
        return versioned.data;
    }

    public boolean exists(String filename) {
        return new File(dataFolder, filename).exists();
    }

    /**
     * Delete every file in the data folder, backups included.
     */
    public void deleteAll() throws IOException {
        if (!dataFolder.exists()) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dataFolder.toPath())) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        }
        for (Path path : paths) {
            if (!path.equals(dataFolder.toPath())) {
                Files.deleteIfExists(path);
            }
        }
    }

    private void backupFile(File file) throws IOException {
        String backupName = file.getName() + ".backup." + Instant.now().toEpochMilli();
        File backupFile = new File(file.getParentFile(), backupName);

        Files.copy(file.toPath(), backupFile.toPath(), StandardCopyOption.REPLACE_EXISTING);
        logger.fine("[STORE] Backed up " + file.getName() + " to " + backupName);

        cleanOldBackups(file);
    }

    private void cleanOldBackups(File originalFile) {
        File folder = originalFile.getParentFile();
        String baseName = originalFile.getName();

        File[] backups = folder.listFiles((dir, name) ->
                name.startsWith(baseName + ".backup."));

        if (backups != null && backups.length > MAX_BACKUPS) {
            Arrays.sort(backups, (a, b) ->
                    Long.compare(a.lastModified(), b.lastModified()));

            for (int i = 0; i < backups.length - MAX_BACKUPS; i++) {
                if (backups[i].delete()) {
                    logger.fine("[STORE] Deleted old backup: " + backups[i].getName());
                } else {
                    logger.warning("[STORE] Could not delete old backup: " + backups[i].getName());
                }
            }
        }
    }

    /**
     * Versioned data wrapper for migration support
     */
    public static class VersionedData<T> {
        public int schemaVersion;
        public T data;

        public VersionedData() {} // For Jackson

        public VersionedData(int schemaVersion, T data) {
            this.schemaVersion = schemaVersion;
            this.data = data;
        }
    }
}
