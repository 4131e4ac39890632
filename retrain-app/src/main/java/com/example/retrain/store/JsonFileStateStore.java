package com.example.retrain.store;

import com.example.retrain.engine.EngineState;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link StateStore} keeping the whole record in one pretty-printed JSON file.
 *
 * <p>
 * Writes go to a temporary sibling file which then replaces the target with an atomic move,
 * so a concurrent {@link #load()} reads either the old or the new document.
 * A missing file means "never initialized"; an unreadable or malformed one is reported as
 * {@link StoreUnavailableException}.
 * </p>
 */
@Slf4j
public class JsonFileStateStore implements StateStore {

    private final Path path;
    private final ObjectMapper mapper;

    public JsonFileStateStore(Path path) {
        this.path = path.toAbsolutePath();
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public EngineState load() {
        if (Files.notExists(path)) {
            return EngineState.initial();
        }
        try {
            return mapper.readValue(path.toFile(), EngineState.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new StoreUnavailableException("Cannot read retrain state from " + path, e);
        }
    }

    @Override
    public synchronized void save(EngineState state) {
        Path tmp = null;
        try {
            Files.createDirectories(path.getParent());
            tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}; falling back to replace", path);
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved retrain state to {}: {}", path, state);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StoreUnavailableException("Cannot write retrain state to " + path, e);
        }
    }

    public Path path() {
        return path;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to remove temp state file {}: {}", tmp, e.toString());
        }
    }
}
