package com.example.retrain.ml;

import com.example.retrain.data.DatasetReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class RegistryQualityEvaluatorTest {

    @TempDir
    Path dir;

    private Path dataset;
    private FileModelRegistry registry;
    private RegistryQualityEvaluator evaluator;

    @BeforeEach
    void setUp() {
        dataset = dir.resolve("cleaned.csv");
        registry = new FileModelRegistry(dir.resolve("models"));
        evaluator = new RegistryQualityEvaluator(registry, new DatasetReader(), "HousingModel", dataset);
    }

    private void writeLine(int rows) throws Exception {
        StringBuilder sb = new StringBuilder("x,target\n");
        for (int i = 0; i < rows; i++) sb.append(i).append(',').append(2 * i + 1).append('\n');
        Files.writeString(dataset, sb.toString());
    }

    @Test
    void noDataset() {
        assertEquals(OptionalDouble.empty(), evaluator.currentQuality());
    }

    @Test
    void noModel() throws Exception {
        writeLine(10);

        assertEquals(OptionalDouble.empty(), evaluator.currentQuality());
    }

    @Test
    void scoresLatestModelOnHeldOutRows() throws Exception {
        writeLine(30);
        registry.register("HousingModel", new LinearModel(List.of("x"), new double[]{1, 2}), 24, 1.0);

        OptionalDouble q = evaluator.currentQuality();

        assertTrue(q.isPresent());
        assertEquals(1.0, q.getAsDouble(), 1e-9);
        assertEquals(q, evaluator.currentQuality());
    }

    @Test
    void featureMismatch() throws Exception {
        writeLine(10);
        registry.register("HousingModel", new LinearModel(List.of("other"), new double[]{1, 2}), 8, 1.0);

        assertEquals(OptionalDouble.empty(), evaluator.currentQuality());
    }

    @Test
    void datasetWithoutTargetIsEmptyNotThrown() throws Exception {
        Files.writeString(dataset, "a,b\n1,2\n");
        registry.register("HousingModel", new LinearModel(List.of("a"), new double[]{0, 1}), 8, 1.0);

        assertEquals(OptionalDouble.empty(), evaluator.currentQuality());
    }
}
