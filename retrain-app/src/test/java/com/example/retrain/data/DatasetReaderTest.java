package com.example.retrain.data;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetReaderTest {

    @TempDir
    Path dir;

    private final DatasetReader reader = new DatasetReader();

    @Test
    void targetColumnIsSplitOff() throws Exception {
        Path csv = Files.writeString(dir.resolve("d.csv"), "a,target,b\n1,10,2\n3,30,4\n");

        Dataset data = reader.read(csv);

        assertEquals(List.of("a", "b"), data.featureNames());
        assertEquals(2, data.size());
        assertArrayEquals(new double[]{3, 4}, data.features().get(1));
        assertArrayEquals(new double[]{10, 30}, data.targets());
    }

    @Test
    void fallsBackToHousingTarget() throws Exception {
        Path csv = Files.writeString(dir.resolve("d.csv"), "MedInc,MedHouseVal\n8.3,4.5\n");

        Dataset data = reader.read(csv);

        assertEquals(List.of("MedInc"), data.featureNames());
        assertArrayEquals(new double[]{4.5}, data.targets());
    }

    @Test
    void malformedRowsAreSkipped() throws Exception {
        Path csv = Files.writeString(dir.resolve("d.csv"), "x,target\n1,2\nfoo,3\n4\n\n5,6\n");

        Dataset data = reader.read(csv);

        assertArrayEquals(new double[]{2, 6}, data.targets());
    }

    @Test
    void missingTargetColumnIsRejected() throws Exception {
        Path csv = Files.writeString(dir.resolve("d.csv"), "x,y\n1,2\n");

        assertThrows(IllegalArgumentException.class, () -> reader.read(csv));
    }

    @Test
    void emptyFileIsRejected() throws Exception {
        Path csv = Files.writeString(dir.resolve("d.csv"), "");

        assertThrows(IllegalArgumentException.class, () -> reader.read(csv));
    }
}
