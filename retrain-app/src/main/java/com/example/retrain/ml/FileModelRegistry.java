package com.example.retrain.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link ModelRegistry} on the local file system.
 *
 * <p>Layout: {@code <root>/<name>/v<version>.json}, one JSON document per version.</p>
 */
@Slf4j
public class FileModelRegistry implements ModelRegistry {

    private static final Pattern VERSION_FILE = Pattern.compile("v(\\d+)\\.json");

    private final Path root;
    private final Clock clock;
    private final ObjectMapper om;

    public FileModelRegistry(Path root) {
        this(root, Clock.systemUTC());
    }

    public FileModelRegistry(Path root, Clock clock) {
        this.root = root.toAbsolutePath();
        this.clock = clock;
        this.om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public RegisteredModel latest(String name) throws IOException {
        OptionalInt version = latestVersion(name);
        if (version.isEmpty()) {
            throw new ModelNotFoundException(name);
        }
        return om.readValue(versionFile(name, version.getAsInt()).toFile(), RegisteredModel.class);
    }

    @Override
    public synchronized RegisteredModel register(String name, LinearModel model, int samples, double trainingR2)
            throws IOException {
        int next = latestVersion(name).orElse(0) + 1;
        RegisteredModel entry = new RegisteredModel(name, next, model, samples, trainingR2, clock.instant());

        Path dir = root.resolve(name);
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "v" + next, ".tmp");
        try {
            om.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entry);
            Files.move(tmp, versionFile(name, next), StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.info("Registered {} version {} (samples={}, r2={})", name, next, samples, trainingR2);
        return entry;
    }

    private OptionalInt latestVersion(String name) throws IOException {
        Path dir = root.resolve(name);
        if (!Files.isDirectory(dir)) return OptionalInt.empty();
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> VERSION_FILE.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .mapToInt(m -> Integer.parseInt(m.group(1)))
                    .max();
        }
    }

    private Path versionFile(String name, int version) {
        return root.resolve(name).resolve("v" + version + ".json");
    }
}
