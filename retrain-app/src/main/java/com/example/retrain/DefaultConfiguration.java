package com.example.retrain;

import com.example.retrain.data.DatasetFingerprinter;
import com.example.retrain.data.DatasetReader;
import com.example.retrain.engine.RetrainOrchestrator;
import com.example.retrain.job.JobSupervisor;
import com.example.retrain.job.ProcessJobSupervisor;
import com.example.retrain.ml.FileModelRegistry;
import com.example.retrain.ml.ModelRegistry;
import com.example.retrain.ml.QualityEvaluator;
import com.example.retrain.ml.RegistryQualityEvaluator;
import com.example.retrain.store.JsonFileStateStore;
import com.example.retrain.store.RetrainEventLog;
import com.example.retrain.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Wires the retraining engine from {@link RetrainProps}.
 *
 * <p>
 * Every collaborator of {@link RetrainOrchestrator} is its own bean, so tests and alternative
 * hosts can replace the state store, the quality evaluator or the job supervisor individually.
 * </p>
 */
@Configuration
@Slf4j
public class DefaultConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    StateStore stateStore(RetrainProps props) {
        return new JsonFileStateStore(Paths.get(props.getStateFile()));
    }

    @Bean
    RetrainEventLog retrainEventLog(RetrainProps props) {
        return new RetrainEventLog(Paths.get(props.getEventLog()));
    }

    @Bean
    ModelRegistry modelRegistry(RetrainProps props, Clock clock) {
        return new FileModelRegistry(Paths.get(props.getRegistryDir()), clock);
    }

    @Bean
    QualityEvaluator qualityEvaluator(ModelRegistry registry, RetrainProps props) {
        return new RegistryQualityEvaluator(registry, new DatasetReader(), props.getModelName(),
                Paths.get(props.getDatasetPath()));
    }

    @Bean
    JobSupervisor jobSupervisor(RetrainProps props) {
        List<String> command = props.getJob().getCommand();
        if (command.isEmpty()) {
            command = bundledTrainingCommand(props);
        }
        return new ProcessJobSupervisor(command, Paths.get(props.getJob().getWorkingDir()));
    }

    @Bean
    RetrainOrchestrator retrainOrchestrator(StateStore stateStore,
                                            QualityEvaluator qualityEvaluator,
                                            JobSupervisor jobSupervisor,
                                            RetrainEventLog retrainEventLog,
                                            MeterRegistry meterRegistry,
                                            Clock clock,
                                            RetrainProps props) {
        log.info("Retrain engine: dataset={}, state={}, model={}",
                Paths.get(props.getDatasetPath()).toAbsolutePath(),
                Paths.get(props.getStateFile()).toAbsolutePath(),
                props.getModelName());
        return new RetrainOrchestrator(stateStore, new DatasetFingerprinter(), Paths.get(props.getDatasetPath()),
                qualityEvaluator, jobSupervisor, retrainEventLog, meterRegistry, clock,
                props.getPolicy().toConfig());
    }

    private static List<String> bundledTrainingCommand(RetrainProps props) {
        Path java = Path.of(System.getProperty("java.home"), "bin", "java");
        return TrainingJobCommand.build(java, System.getProperty("java.class.path"),
                Paths.get(props.getDatasetPath()), Paths.get(props.getRegistryDir()), props.getModelName());
    }
}
