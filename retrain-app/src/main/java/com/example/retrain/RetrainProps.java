package com.example.retrain;

import com.example.retrain.engine.PolicyConfig;
import com.example.retrain.ml.TrainingJob;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code retrain.*}. Policy values are only the startup defaults;
 * runtime changes go through {@code POST /v1/retrain/config} and are not written back.
 */
@Component
@ConfigurationProperties(prefix = "retrain")
@Getter
@Setter
public class RetrainProps {

    /** Cleaned dataset the model is trained and scored on. */
    private String datasetPath = TrainingJob.DEFAULT_DATASET;
    private String stateFile = "logs/retrain_state.json";
    private String eventLog = "logs/retrain_events.jsonl";
    private String registryDir = TrainingJob.DEFAULT_REGISTRY;
    private String modelName = TrainingJob.DEFAULT_MODEL_NAME;

    private final Policy policy = new Policy();
    private final Job job = new Job();
    private final Schedule schedule = new Schedule();

    @Getter
    @Setter
    public static class Policy {
        private double minQualityThreshold = PolicyConfig.DEFAULT_MIN_QUALITY;
        private double degradationThreshold = PolicyConfig.DEFAULT_DEGRADATION;
        private boolean autoRetrainEnabled = true;
        private Duration minRetrainInterval = PolicyConfig.DEFAULT_MIN_INTERVAL;

        PolicyConfig toConfig() {
            return new PolicyConfig(minQualityThreshold, degradationThreshold, autoRetrainEnabled, minRetrainInterval);
        }
    }

    @Getter
    @Setter
    public static class Job {
        /** Training command line; empty runs the bundled {@link TrainingJob} on this JVM's class path. */
        private List<String> command = new ArrayList<>();
        private String workingDir = ".";
    }

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = false;
        private Duration interval = Duration.ofHours(1);
    }
}
