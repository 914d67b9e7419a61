package io.fuzzdeck.core.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.fuzzdeck.api.settings.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Settings persisted as a flat JSON object. The file is read once at construction
 * and rewritten on every {@link #set}.
 */
public class JsonFileSettingsStore implements SettingsStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileSettingsStore.class);
    private static final TypeReference<Map<String, String>> MAP_TYPE = new TypeReference<>() {};

    private final Path path;
    private final ObjectMapper objectMapper;
    private final Map<String, String> values = new TreeMap<>();

    /**
     * @throws UncheckedIOException if the file exists but cannot be read as a JSON object
     */
    public JsonFileSettingsStore(Path path) {
        this.path = Objects.requireNonNull(path, "path");
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public synchronized void set(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        save();
    }

    public Path path() {
        return path;
    }

    private void load() {
        if (!Files.exists(path)) {
            log.debug("Settings file {} does not exist yet", path);
            return;
        }
        try {
            Map<String, String> stored = objectMapper.readValue(path.toFile(), MAP_TYPE);
            if (stored != null) {
                values.putAll(stored);
            }
            log.info("Loaded {} settings from {}", values.size(), path.toAbsolutePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read settings file: " + path, e);
        }
    }

    private void save() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), values);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write settings file: " + path, e);
        }
    }
}
