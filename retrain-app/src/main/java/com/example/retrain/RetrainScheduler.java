package com.example.retrain;

import com.example.retrain.engine.CheckResult;
import com.example.retrain.engine.RetrainInProgressException;
import com.example.retrain.engine.RetrainOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic {@link RetrainOrchestrator#checkAndRetrain()}, enabled with {@code retrain.schedule.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "retrain.schedule", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class RetrainScheduler {

    private final RetrainOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${retrain.schedule.interval:PT1H}", initialDelayString = "${retrain.schedule.interval:PT1H}")
    public void check() {
        try {
            CheckResult result = orchestrator.checkAndRetrain();
            if (result.retrainTriggered()) {
                log.info("Scheduled check retrained: success={}, reason={}",
                        result.outcome().success(), result.reason());
            }
        } catch (RetrainInProgressException e) {
            log.info("Scheduled check skipped: {}", e.getMessage());
        }
    }
}
