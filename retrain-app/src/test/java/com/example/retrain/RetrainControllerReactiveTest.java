package com.example.retrain;

import com.example.retrain.dto.TriggerRequest;
import com.example.retrain.engine.RetrainOrchestrator;
import com.example.retrain.engine.RetrainOutcome;
import com.example.retrain.engine.TooSoonException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Controller publishers without the web layer: engine calls happen on subscription only.
 */
@ExtendWith(MockitoExtension.class)
class RetrainControllerReactiveTest {

    private static final Instant NOW = Instant.parse("2026-10-18T12:00:00Z");

    @Mock
    RetrainOrchestrator orchestrator;

    private RetrainController controller() {
        return new RetrainController(orchestrator, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void triggerIsLazy() {
        controller().trigger(new TriggerRequest("x", true));

        verifyNoInteractions(orchestrator);
    }

    @Test
    void missingBodyUsesDefaults() {
        when(orchestrator.triggerRetrain(TriggerRequest.DEFAULT_REASON, false)).thenReturn(
                new RetrainOutcome("id", true, TriggerRequest.DEFAULT_REASON, NOW, 1.0, null, null, "ok"));

        StepVerifier.create(controller().trigger(null))
                .expectNextMatches(r -> r.success() && NOW.equals(r.timestamp()))
                .verifyComplete();
    }

    @Test
    void tooSoonSurfacesAsError() {
        when(orchestrator.triggerRetrain("x", false)).thenThrow(new TooSoonException("Too soon since last retrain"));

        StepVerifier.create(controller().trigger(new TriggerRequest("x", false)))
                .expectError(TooSoonException.class)
                .verify();
    }

    @Test
    void logsLimitIsValidated() {
        StepVerifier.create(controller().logs(1001))
                .expectError(IllegalArgumentException.class)
                .verify();
        verifyNoInteractions(orchestrator);
    }
}
