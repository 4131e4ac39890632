package com.example.retrain.data;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class HoldoutSplitTest {

    @Test
    void partitionsEveryRowOnce() {
        HoldoutSplit split = HoldoutSplit.of(103);

        assertEquals(21, split.testIndices().length);
        assertEquals(82, split.trainIndices().length);
        int[] all = IntStream.concat(Arrays.stream(split.testIndices()), Arrays.stream(split.trainIndices()))
                .sorted().toArray();
        assertArrayEquals(IntStream.range(0, 103).toArray(), all);
    }

    @Test
    void sameSeedSameSplit() {
        assertArrayEquals(HoldoutSplit.of(50).testIndices(), HoldoutSplit.of(50).testIndices());
        assertFalse(Arrays.equals(HoldoutSplit.of(50, 0.2, 1L).testIndices(),
                HoldoutSplit.of(50, 0.2, 2L).testIndices()));
    }

    @Test
    void emptyDataset() {
        HoldoutSplit split = HoldoutSplit.of(0);

        assertEquals(0, split.testIndices().length);
        assertEquals(0, split.trainIndices().length);
    }

    @Test
    void rejectsDegenerateFraction() {
        assertThrows(IllegalArgumentException.class, () -> HoldoutSplit.of(10, 0.0, 42L));
        assertThrows(IllegalArgumentException.class, () -> HoldoutSplit.of(10, 1.0, 42L));
    }

    @Test
    void comparesByIndicesAndKeepsThemPrivate() {
        HoldoutSplit split = HoldoutSplit.of(20);
        int first = split.testIndices()[0];

        split.testIndices()[0] = -1;

        assertEquals(first, split.testIndices()[0]);
        assertEquals(HoldoutSplit.of(20), split);
        assertEquals(HoldoutSplit.of(20).hashCode(), split.hashCode());
        assertNotEquals(HoldoutSplit.of(20, 0.2, 7L), split);
    }
}
