package com.example.retrain.data;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTest {

    private static Dataset sample() {
        List<double[]> rows = new ArrayList<>();
        rows.add(new double[]{1, 2});
        rows.add(new double[]{3, 4});
        rows.add(new double[]{5, 6});
        return new Dataset(List.of("a", "b"), rows, new double[]{10, 20, 30});
    }

    @Test
    void equalContentsAreEqual() {
        assertEquals(sample(), sample());
        assertEquals(sample().hashCode(), sample().hashCode());
        assertNotEquals(sample(), sample().select(new int[]{0, 1}));
    }

    @Test
    void inputsAreCopied() {
        double[] row = {1, 2};
        double[] y = {10};
        Dataset data = new Dataset(List.of("a", "b"), List.of(row), y);

        row[0] = 99;
        y[0] = 99;
        data.targets()[0] = 99;

        assertArrayEquals(new double[]{1, 2}, data.features().get(0));
        assertArrayEquals(new double[]{10}, data.targets());
    }

    @Test
    void selectKeepsIndexOrder() {
        Dataset picked = sample().select(new int[]{2, 0});

        assertArrayEquals(new double[]{30, 10}, picked.targets());
        assertArrayEquals(new double[]{5, 6}, picked.features().get(0));
        assertEquals(List.of("a", "b"), picked.featureNames());
    }

    @Test
    void mismatchedLengthsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new Dataset(List.of("a"), List.of(new double[]{1}), new double[]{1, 2}));
    }
}
