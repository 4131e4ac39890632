package com.example.retrain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only audit trail of retrain attempts, one JSON document per line.
 *
 * <p>
 * Audit data, not engine state: a failed append is logged and does not fail the retrain.
 * </p>
 */
@Slf4j
public class RetrainEventLog {

    private final Path path;
    private final ObjectMapper mapper;

    public RetrainEventLog(Path path) {
        this.path = path.toAbsolutePath();
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized void append(RetrainEvent event) {
        try {
            Files.createDirectories(path.getParent());
            try (BufferedWriter w = Files.newBufferedWriter(
                    path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                w.write(mapper.writeValueAsString(event));
                w.newLine();
            }
        } catch (IOException e) {
            log.warn("Failed to append retrain event {}: {}", event.id(), e.toString());
        }
    }

    /** Newest first, at most {@code limit} entries. Malformed lines are skipped. */
    public synchronized List<RetrainEvent> recent(int limit) {
        if (limit <= 0 || Files.notExists(path)) return List.of();
        List<RetrainEvent> all = new ArrayList<>();
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            lines.map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(line -> {
                        try {
                            all.add(mapper.readValue(line, RetrainEvent.class));
                        } catch (IOException e) {
                            log.warn("Skipping malformed retrain event line: {}", e.toString());
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read retrain events from " + path, e);
        }
        Collections.reverse(all);
        return List.copyOf(all.subList(0, Math.min(limit, all.size())));
    }
}
