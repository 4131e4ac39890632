package com.example.retrain.data;

import com.example.retrain.engine.EngineState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class DatasetFingerprinterTest {

    @TempDir
    Path dir;

    private final DatasetFingerprinter fingerprinter = new DatasetFingerprinter();

    @Test
    void sameContentSameFingerprint() throws Exception {
        Path a = Files.writeString(dir.resolve("a.csv"), "x,target\n1,2\n");
        Path b = Files.writeString(dir.resolve("b.csv"), "x,target\n1,2\n");

        assertEquals(fingerprinter.fingerprint(a), fingerprinter.fingerprint(b));
    }

    @Test
    void differentContentDifferentFingerprint() throws Exception {
        Path a = Files.writeString(dir.resolve("a.csv"), "x,target\n1,2\n");
        Path b = Files.writeString(dir.resolve("b.csv"), "x,target\n1,3\n");

        assertNotEquals(fingerprinter.fingerprint(a), fingerprinter.fingerprint(b));
    }

    @Test
    void knownSha256() throws Exception {
        Path f = Files.writeString(dir.resolve("abc.txt"), "abc");

        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", fingerprinter.fingerprint(f));
    }

    @Test
    void filesLargerThanOneChunk() throws Exception {
        byte[] big = new byte[DatasetFingerprinter.CHUNK_SIZE * 3 + 17];
        Arrays.fill(big, (byte) 'x');
        Path a = Files.write(dir.resolve("a.bin"), big);
        big[big.length - 1] = 'y';
        Path b = Files.write(dir.resolve("b.bin"), big);

        assertNotEquals(fingerprinter.fingerprint(a), fingerprinter.fingerprint(b));
    }

    @Test
    void missingFileIsNoData() {
        assertEquals(DatasetFingerprinter.NO_DATA, fingerprinter.fingerprint(dir.resolve("absent.csv")));
    }

    @Test
    void changedWhenNoFingerprintStored() {
        DatasetFingerprinter.ChangeCheck check =
                fingerprinter.hasChanged(dir.resolve("absent.csv"), EngineState.initial());

        assertTrue(check.changed());
        assertEquals("", check.fingerprint());
    }

    @Test
    void unchangedWhenFingerprintMatches() throws Exception {
        Path f = Files.writeString(dir.resolve("data.csv"), "x,target\n1,2\n");
        String fp = fingerprinter.fingerprint(f);
        EngineState state = new EngineState(null, fp, null, 1, null);

        assertFalse(fingerprinter.hasChanged(f, state).changed());

        Files.writeString(f, "x,target\n1,2\n3,4\n");
        assertTrue(fingerprinter.hasChanged(f, state).changed());
    }

    @Test
    void deletedDatasetCountsAsChange() throws Exception {
        Path f = Files.writeString(dir.resolve("data.csv"), "x,target\n1,2\n");
        EngineState state = new EngineState(null, fingerprinter.fingerprint(f), null, 1, null);
        Files.delete(f);

        assertTrue(fingerprinter.hasChanged(f, state).changed());
    }

    @Test
    void unreadableDatasetIsAnError() throws Exception {
        Path notAFile = Files.createDirectories(dir.resolve("cleaned.csv"));

        assertThrows(UncheckedIOException.class, () -> fingerprinter.fingerprint(notAFile));
    }
}
