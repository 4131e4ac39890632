package com.example.retrain.ml;

import com.example.retrain.data.Dataset;
import com.example.retrain.data.DatasetReader;
import com.example.retrain.data.HoldoutSplit;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalDouble;

/**
 * Scores the latest registered model on the held-out split of the current dataset (R²).
 *
 * <p>
 * Uses the same {@link HoldoutSplit} seed as {@link TrainingJob}, so repeated calls against an
 * unchanged dataset return the same value. No model, no dataset, or a dataset the model cannot
 * be applied to yields an empty result.
 * </p>
 */
@Slf4j
public class RegistryQualityEvaluator implements QualityEvaluator {

    private final ModelRegistry registry;
    private final DatasetReader reader;
    private final String modelName;
    private final Path datasetPath;

    public RegistryQualityEvaluator(ModelRegistry registry, DatasetReader reader, String modelName, Path datasetPath) {
        this.registry = registry;
        this.reader = reader;
        this.modelName = modelName;
        this.datasetPath = datasetPath;
    }

    @Override
    public OptionalDouble currentQuality() {
        if (!Files.exists(datasetPath)) {
            log.debug("No dataset at {}; quality unknown", datasetPath.toAbsolutePath());
            return OptionalDouble.empty();
        }
        try {
            RegisteredModel latest = registry.latest(modelName);
            Dataset data = reader.read(datasetPath);
            if (data.isEmpty()) {
                return OptionalDouble.empty();
            }
            if (!latest.model().featureNames().equals(data.featureNames())) {
                log.warn("Model {} v{} expects features {} but dataset has {}",
                        modelName, latest.version(), latest.model().featureNames(), data.featureNames());
                return OptionalDouble.empty();
            }
            Dataset test = data.select(HoldoutSplit.of(data.size()).testIndices());
            double r2 = RegressionMetrics.r2(test.targets(), latest.model().predict(test.features()));
            log.debug("Model {} v{} scores r2={} on {} held-out rows", modelName, latest.version(), r2, test.size());
            return OptionalDouble.of(r2);
        } catch (ModelNotFoundException e) {
            log.debug("{}; quality unknown", e.getMessage());
            return OptionalDouble.empty();
        } catch (Exception e) {
            log.warn("Error getting model performance: {}", e.toString());
            return OptionalDouble.empty();
        }
    }
}
