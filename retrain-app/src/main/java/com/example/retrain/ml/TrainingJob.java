package com.example.retrain.ml;

import com.example.retrain.data.Dataset;
import com.example.retrain.data.DatasetReader;
import com.example.retrain.data.HoldoutSplit;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default external training program, launched as a separate process by
 * {@link com.example.retrain.job.ProcessJobSupervisor}.
 *
 * <p>
 * Fits a least-squares model on the train split of the dataset, scores it on the held-out
 * split and registers it as the next model version. Success is reported only through the
 * exit status; on failure the cause is written to standard error.
 * </p>
 *
 * <pre>
 * java -cp ... com.example.retrain.ml.TrainingJob \
 *      [--dataset=data/processed/cleaned.csv] [--registry=models] [--model-name=HousingModel]
 * </pre>
 */
@Slf4j
public final class TrainingJob {

    public static final String DEFAULT_DATASET = "data/processed/cleaned.csv";
    public static final String DEFAULT_REGISTRY = "models";
    public static final String DEFAULT_MODEL_NAME = "HousingModel";

    private final DatasetReader reader;
    private final LeastSquaresTrainer trainer;
    private final ModelRegistry registry;

    TrainingJob(DatasetReader reader, LeastSquaresTrainer trainer, ModelRegistry registry) {
        this.reader = reader;
        this.trainer = trainer;
        this.registry = registry;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.err));
    }

    /** @return process exit status: 0 on success, 1 on failure, 2 on bad arguments */
    static int run(String[] args, PrintStream err) {
        Map<String, String> opts;
        try {
            opts = parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println("usage: TrainingJob [--dataset=PATH] [--registry=DIR] [--model-name=NAME]");
            return 2;
        }
        Path dataset = Paths.get(opts.getOrDefault("dataset", DEFAULT_DATASET));
        Path registryDir = Paths.get(opts.getOrDefault("registry", DEFAULT_REGISTRY));
        String modelName = opts.getOrDefault("model-name", DEFAULT_MODEL_NAME);

        try {
            TrainingJob job = new TrainingJob(new DatasetReader(), new LeastSquaresTrainer(),
                    new FileModelRegistry(registryDir));
            RegisteredModel registered = job.train(dataset, modelName);
            log.info("Training & registration complete: {} v{} r2={}",
                    registered.name(), registered.version(), registered.trainingR2());
            return 0;
        } catch (Exception e) {
            err.println("Training failed: " + e);
            return 1;
        }
    }

    RegisteredModel train(Path dataset, String modelName) throws Exception {
        log.info("Starting model training on {}", dataset.toAbsolutePath());
        Dataset data = reader.read(dataset);
        HoldoutSplit split = HoldoutSplit.of(data.size());
        Dataset train = data.select(split.trainIndices());
        Dataset test = data.select(split.testIndices());

        LinearModel model = trainer.fit(train);
        double r2 = RegressionMetrics.r2(test.targets(), model.predict(test.features()));
        log.info("LinearRegression finished: R² = {} (train={}, test={})", r2, train.size(), test.size());

        return registry.register(modelName, model, train.size(), r2);
    }

    private static Map<String, String> parse(String[] args) {
        Map<String, String> opts = new LinkedHashMap<>();
        for (String a : args) {
            if (!a.startsWith("--") || !a.contains("=")) {
                throw new IllegalArgumentException("unrecognized argument: " + a);
            }
            int eq = a.indexOf('=');
            String key = a.substring(2, eq);
            if (!key.equals("dataset") && !key.equals("registry") && !key.equals("model-name")) {
                throw new IllegalArgumentException("unknown option: --" + key);
            }
            opts.put(key, a.substring(eq + 1));
        }
        return opts;
    }
}
