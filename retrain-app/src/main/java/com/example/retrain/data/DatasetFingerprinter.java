package com.example.retrain.data;

import com.example.retrain.engine.EngineState;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content fingerprint of the dataset file, used to detect changes between retrains.
 *
 * <p>
 * SHA-256 over the full byte content, read in {@value #CHUNK_SIZE}-byte chunks so the file
 * is never buffered whole. A missing file fingerprints to {@link #NO_DATA}, which compares
 * like any other value.
 * </p>
 */
public class DatasetFingerprinter {

    /** Fingerprint of a dataset that does not exist. */
    public static final String NO_DATA = "";

    static final int CHUNK_SIZE = 8192;

    /**
     * @return lowercase hex SHA-256 of the file, or {@link #NO_DATA} if it does not exist
     * @throws UncheckedIOException if the file exists but cannot be read
     */
    public String fingerprint(Path path) {
        if (!Files.exists(path)) {
            return NO_DATA;
        }
        MessageDigest digest = sha256();
        byte[] buf = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(path)) {
            int n;
            while ((n = in.read(buf)) != -1) {
                digest.update(buf, 0, n);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot fingerprint dataset " + path, e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Changed when no fingerprint was stored yet or the current one differs.
     */
    public ChangeCheck hasChanged(Path path, EngineState state) {
        String current = fingerprint(path);
        String last = state.lastDataFingerprint();
        return new ChangeCheck(last == null || !last.equals(current), current);
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    /**
     * @param changed     whether the dataset differs from the one last trained on
     * @param fingerprint the current fingerprint
     */
    public record ChangeCheck(boolean changed, String fingerprint) {}
}
