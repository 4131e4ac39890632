package com.example.retrain.store;

import com.example.retrain.engine.EngineState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStateStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingFileLoadsInitialState() {
        JsonFileStateStore store = new JsonFileStateStore(dir.resolve("state.json"));

        assertEquals(EngineState.initial(), store.load());
    }

    @Test
    void savedStateIsReadBackWhole() {
        Path file = dir.resolve("nested/state.json");
        JsonFileStateStore store = new JsonFileStateStore(file);
        EngineState state = new EngineState(Instant.parse("2026-10-18T08:00:00Z"), "abc123", 0.82, 4,
                Instant.parse("2026-10-18T09:30:00Z"));

        store.save(state);

        assertEquals(state, new JsonFileStateStore(file).load());
    }

    @Test
    void writesSnakeCaseKeysAndIsoTimes() throws Exception {
        Path file = dir.resolve("state.json");
        new JsonFileStateStore(file).save(
                new EngineState(Instant.parse("2026-10-18T08:00:00Z"), "abc", null, 1, null));

        String json = Files.readString(file, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"last_retrain_time\" : \"2026-10-18T08:00:00Z\""), json);
        assertTrue(json.contains("\"retrain_count\" : 1"), json);
        assertTrue(json.contains("\"last_quality_score\" : null"), json);
    }

    @Test
    void unknownKeysAreIgnored() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{\"retrain_count\": 2, \"last_performance\": 0.7}");

        assertEquals(2, new JsonFileStateStore(file).load().retrainCount());
    }

    @Test
    void corruptFileIsReportedNotReset() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{ not json");

        JsonFileStateStore store = new JsonFileStateStore(file);

        assertThrows(StoreUnavailableException.class, store::load);
    }

    @Test
    void negativeCountIsReportedAsUnavailable() throws Exception {
        Path file = dir.resolve("state.json");
        Files.writeString(file, "{\"retrain_count\": -1}");

        assertThrows(StoreUnavailableException.class, () -> new JsonFileStateStore(file).load());
    }

    @Test
    void repeatedSavesLeaveNoTempFiles() throws Exception {
        JsonFileStateStore store = new JsonFileStateStore(dir.resolve("state.json"));
        for (int i = 0; i < 5; i++) {
            store.save(EngineState.initial().withLastCheckTime(Instant.ofEpochSecond(i)));
        }

        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count());
        }
        assertEquals(Instant.ofEpochSecond(4), store.load().lastCheckTime());
    }
}
