package com.abba.pillnow.mobile.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileKeyValueStoreTest {

    @TempDir
    Path dir;

    @Test
    void entriesSurviveReopen() {
        Path file = dir.resolve("state/pillnow.json");
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(file, new ObjectMapper());

        store.put("schedule_status_cache", "{\"a\":1}");
        store.put("alarm_trigger_timestamps", "{}");
        store.remove("alarm_trigger_timestamps");

        JsonFileKeyValueStore reopened = new JsonFileKeyValueStore(file, new ObjectMapper());
        assertThat(reopened.get("schedule_status_cache")).hasValue("{\"a\":1}");
        assertThat(reopened.get("alarm_trigger_timestamps")).isEmpty();
        assertThat(Files.exists(dir.resolve("state/pillnow.json.tmp"))).isFalse();
    }

    @Test
    void missingFileReadsEmpty() {
        JsonFileKeyValueStore store = new JsonFileKeyValueStore(dir.resolve("absent.json"), new ObjectMapper());

        assertThat(store.get("anything")).isEmpty();
        store.remove("anything");
        assertThat(Files.exists(dir.resolve("absent.json"))).isFalse();
    }
}
