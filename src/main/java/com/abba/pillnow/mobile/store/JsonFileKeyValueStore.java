package com.abba.pillnow.mobile.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class JsonFileKeyValueStore implements KeyValueStore {

    private static final TypeReference<LinkedHashMap<String, String>> ENTRIES = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private Map<String, String> entries;

    public JsonFileKeyValueStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries().get(key));
    }

    @Override
    public synchronized void put(String key, String value) {
        entries().put(key, value);
        write();
    }

    @Override
    public synchronized void remove(String key) {
        if (entries().remove(key) != null) {
            write();
        }
    }

    private Map<String, String> entries() {
        if (entries == null) {
            entries = load();
        }
        return entries;
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), ENTRIES);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private void write() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.debug("Stored {} entries in {}", entries.size(), file);
    }
}
