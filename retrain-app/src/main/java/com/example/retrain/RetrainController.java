package com.example.retrain;

import com.example.retrain.dto.CheckResponse;
import com.example.retrain.dto.ConfigUpdateRequest;
import com.example.retrain.dto.ConfigView;
import com.example.retrain.dto.RetrainLogsView;
import com.example.retrain.dto.RetrainResponse;
import com.example.retrain.dto.StatusView;
import com.example.retrain.dto.TriggerRequest;
import com.example.retrain.engine.RetrainOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * HTTP surface of the retraining engine.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li><b>GET</b> {@code /v1/retrain/status}: state, current verdict, current quality, config.</li>
 *   <li><b>POST</b> {@code /v1/retrain/check}: check and retrain if warranted.</li>
 *   <li><b>POST</b> {@code /v1/retrain/trigger}: manual retrain, body {@code {"reason": ..., "force": ...}}.</li>
 *   <li><b>POST</b> {@code /v1/retrain/config}: partial policy update.</li>
 *   <li><b>GET</b> {@code /v1/retrain/logs/{limit}}: newest retrain attempts.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>
 * Check and trigger block for as long as the training job runs, and status scores the model;
 * all engine calls are moved to {@code Schedulers.boundedElastic()} so event-loop threads
 * never block.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * A failed training job is a 200 with {@code success=false}. Cooldown rejections (429),
 * concurrent attempts (409) and store faults (503) are mapped by {@link GlobalExceptionHandler}.
 * </p>
 *
 * <h2>Example</h2>
 * <pre>{@code
 * curl -s -X POST -H 'Content-Type: application/json' \
 *      -d '{"reason":"new data drop","force":false}' \
 *      http://127.0.0.1:8080/v1/retrain/trigger | jq
 * }</pre>
 */
@RestController
@RequestMapping(path = "/v1/retrain", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "retrain", description = "Model retraining decisions and orchestration")
public class RetrainController {

    private final RetrainOrchestrator orchestrator;
    private final Clock clock;

    @GetMapping("/status")
    @Operation(summary = "Current retraining status and configuration")
    public Mono<StatusView> status() {
        return Mono.fromCallable(orchestrator::status)
                .subscribeOn(Schedulers.boundedElastic())
                .map(s -> StatusView.of(s, clock.instant()));
    }

    @PostMapping("/check")
    @Operation(summary = "Check whether retraining is needed and run it if so")
    public Mono<CheckResponse> check() {
        return Mono.fromCallable(orchestrator::checkAndRetrain)
                .subscribeOn(Schedulers.boundedElastic())
                .map(r -> CheckResponse.of(r, clock.instant()));
    }

    @PostMapping(path = "/trigger", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Trigger model retraining", description = "Rejected with 429 inside the cooldown unless force=true")
    public Mono<RetrainResponse> trigger(@RequestBody(required = false) TriggerRequest request) {
        TriggerRequest req = request == null ? new TriggerRequest(null, null) : request;
        String reason = req.reasonOrDefault();
        log.info("Retrain triggered via API: reason='{}', force={}", reason, req.forced());
        return Mono.fromCallable(() -> orchestrator.triggerRetrain(reason, req.forced()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(o -> RetrainResponse.of(o, clock.instant()));
    }

    @PostMapping(path = "/config", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Update retraining configuration", description = "Only the provided fields change")
    public ConfigView updateConfig(@Valid @RequestBody ConfigUpdateRequest request) {
        return ConfigView.of(orchestrator.updateConfig(request.toUpdate()));
    }

    @GetMapping("/logs/{limit}")
    @Operation(summary = "Recent retraining attempts, newest first")
    public Mono<RetrainLogsView> logs(@PathVariable int limit) {
        if (limit < 1 || limit > 1000) {
            return Mono.error(new IllegalArgumentException("limit must be between 1 and 1000"));
        }
        return Mono.fromCallable(() -> orchestrator.recentEvents(limit))
                .subscribeOn(Schedulers.boundedElastic())
                .map(RetrainLogsView::of);
    }
}
