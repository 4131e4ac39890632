package com.example.retrain.engine;

import com.example.retrain.data.DatasetFingerprinter;
import com.example.retrain.data.DatasetFingerprinter.ChangeCheck;
import com.example.retrain.job.JobResult;
import com.example.retrain.job.JobSupervisor;
import com.example.retrain.ml.QualityEvaluator;
import com.example.retrain.store.RetrainEvent;
import com.example.retrain.store.RetrainEventLog;
import com.example.retrain.store.StateStore;
import com.example.retrain.store.StoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether the model is stale and, if so, runs the training job and records the result.
 *
 * <h2>Operations</h2>
 * <ul>
 *   <li>{@link #checkAndRetrain()}: records the check, evaluates the policy, retrains when warranted.</li>
 *   <li>{@link #triggerRetrain(String, boolean)}: manual retrain; honours the cooldown unless forced.</li>
 *   <li>{@link #status()}: read-only snapshot of state, verdict, quality and config.</li>
 *   <li>{@link #updateConfig(PolicyConfigUpdate)}: partial merge into the in-memory policy.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>
 * One instance per model family. A single lock guards every state-affecting sequence
 * (load, compute, save, including the training job in between). A second caller is rejected
 * with {@link RetrainInProgressException} instead of queueing behind a multi-minute job.
 * {@link #status()} does not lock; the store hands out whole records only.
 * </p>
 *
 * <h2>Errors</h2>
 * <p>
 * A failing training job is returned as data and leaves the state untouched, as does a job whose
 * dataset cannot be fingerprinted afterwards. Cooldown rejections raise {@link TooSoonException}.
 * Store and process-launch faults propagate; a store fault after a successful job is still
 * written to the event log as a failed attempt first.
 * </p>
 *
 * <h2>Metrics</h2>
 * <ul>
 *   <li>{@code retrain.attempts}: counter tagged {@code outcome=success|failure}.</li>
 *   <li>{@code retrain.duration}: timer around the training job and state update.</li>
 *   <li>{@code retrain.rejected}: counter tagged {@code cause=cooldown|in_progress}.</li>
 *   <li>{@code retrain.checks}: counter tagged {@code verdict=retrain|skip}.</li>
 * </ul>
 */
@Slf4j
public class RetrainOrchestrator {

    private final StateStore store;
    private final DatasetFingerprinter fingerprinter;
    private final Path datasetPath;
    private final QualityEvaluator evaluator;
    private final JobSupervisor supervisor;
    private final RetrainEventLog eventLog;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicReference<PolicyConfig> config;
    private final ReentrantLock lock = new ReentrantLock();

    public RetrainOrchestrator(StateStore store,
                               DatasetFingerprinter fingerprinter,
                               Path datasetPath,
                               QualityEvaluator evaluator,
                               JobSupervisor supervisor,
                               RetrainEventLog eventLog,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               PolicyConfig initialConfig) {
        this.store = store;
        this.fingerprinter = fingerprinter;
        this.datasetPath = datasetPath;
        this.evaluator = evaluator;
        this.supervisor = supervisor;
        this.eventLog = eventLog;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.config = new AtomicReference<>(initialConfig);
    }

    /* ===================== PUBLIC OPERATIONS ===================== */

    /**
     * Records the check time, then retrains if the standard verdict says so.
     * The updated check time is persisted even when nothing else happens.
     */
    public CheckResult checkAndRetrain() {
        acquire();
        try {
            EngineState state = store.load().withLastCheckTime(clock.instant());
            store.save(state);

            Verdict verdict = evaluate(state).verdict();
            meterRegistry.counter("retrain.checks", "verdict", verdict.shouldRetrain() ? "retrain" : "skip")
                    .increment();
            if (!verdict.shouldRetrain()) {
                log.info("No retraining needed: {}", verdict.reason());
                return CheckResult.noAction(verdict.reason());
            }
            RetrainOutcome outcome = runRetrain("Auto-trigger: " + verdict.reason());
            return new CheckResult(true, verdict.reason(), outcome);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the training job and, on success, records the new state.
     *
     * @param reason why the retrain is requested (logged and returned)
     * @param force  skip the cooldown check
     * @throws TooSoonException if not forced and the cooldown blocks the retrain
     */
    public RetrainOutcome triggerRetrain(String reason, boolean force) {
        acquire();
        try {
            // store faults surface before the job runs, forced or not
            EngineState state = store.load();
            if (!force) {
                Verdict verdict = evaluate(state).verdict();
                if (verdict.cooldownBlocked()) {
                    meterRegistry.counter("retrain.rejected", "cause", "cooldown").increment();
                    log.info("Rejected retrain '{}': {}", reason, verdict.reason());
                    throw new TooSoonException(verdict.reason());
                }
            }
            return runRetrain(reason);
        } finally {
            lock.unlock();
        }
    }

    /** Current state, verdict, quality and config. No side effects. */
    public EngineStatus status() {
        EngineState state = store.load();
        Signals signals = evaluate(state);
        return new EngineStatus(state, signals.verdict(), signals.quality(), signals.change().changed(), config.get());
    }

    /** Merges the non-null fields of {@code update}; returns the resulting config. */
    public PolicyConfig updateConfig(PolicyConfigUpdate update) {
        PolicyConfig updated = config.updateAndGet(c -> c.merge(update));
        log.info("Retrain config updated: {}", updated);
        return updated;
    }

    public PolicyConfig config() {
        return config.get();
    }

    /** Newest retrain attempts first. */
    public List<RetrainEvent> recentEvents(int limit) {
        return eventLog.recent(limit);
    }

    /* ===================== INTERNAL ===================== */

    private void acquire() {
        if (!lock.tryLock()) {
            meterRegistry.counter("retrain.rejected", "cause", "in_progress").increment();
            throw new RetrainInProgressException();
        }
    }

    private Signals evaluate(EngineState state) {
        ChangeCheck change = fingerprinter.hasChanged(datasetPath, state);
        OptionalDouble quality = evaluator.currentQuality();
        Verdict verdict = DecisionPolicy.decide(state, config.get(), change.changed(), quality, clock.instant());
        return new Signals(change, quality, verdict);
    }

    // caller holds the lock
    private RetrainOutcome runRetrain(String reason) {
        String id = UUID.randomUUID().toString();
        Instant start = clock.instant();
        OptionalDouble before = evaluator.currentQuality();
        log.info("Starting model retraining [{}]: {}", id, reason);

        JobResult result = supervisor.runTrainingJob();

        if (!result.succeeded()) {
            String error = result.stderr().isBlank()
                    ? "training job exited with status " + result.exitCode()
                    : result.stderr().strip();
            log.warn("Retraining [{}] failed with exit status {}: {}", id, result.exitCode(), error);
            return record(RetrainOutcome.failed(id, reason, start, seconds(start, clock.instant()), error), before);
        }

        OptionalDouble after = evaluator.currentQuality();
        Double newQuality = after.isPresent() ? after.getAsDouble() : null;
        String fingerprint;
        try {
            fingerprint = fingerprinter.fingerprint(datasetPath);
        } catch (UncheckedIOException e) {
            String error = "training job succeeded but the dataset could not be fingerprinted: " + e.getMessage();
            log.warn("Retraining [{}]: {}", id, error, e);
            return record(RetrainOutcome.failed(id, reason, start, seconds(start, clock.instant()), error), before);
        }

        Instant completed = clock.instant();
        EngineState next;
        try {
            next = store.load().afterSuccessfulRetrain(completed, fingerprint, newQuality);
            store.save(next);
        } catch (StoreUnavailableException e) {
            record(RetrainOutcome.failed(id, reason, start, seconds(start, completed),
                    "retrain state could not be saved: " + e.getMessage()), before);
            throw e;
        }

        RetrainOutcome outcome = RetrainOutcome.succeeded(id, reason, start, seconds(start, completed), newQuality);
        log.info("Retraining [{}] completed in {}s, retrain_count={}, quality={}",
                id, outcome.durationSeconds(), next.retrainCount(), newQuality);
        return record(outcome, before);
    }

    private RetrainOutcome record(RetrainOutcome outcome, OptionalDouble before) {
        meterRegistry.counter("retrain.attempts", "outcome", outcome.success() ? "success" : "failure").increment();
        meterRegistry.timer("retrain.duration")
                .record((long) (outcome.durationSeconds() * 1000), TimeUnit.MILLISECONDS);
        eventLog.append(new RetrainEvent(outcome.retrainId(), outcome.startTime(), outcome.reason(), outcome.success(),
                outcome.durationSeconds(), before.isPresent() ? before.getAsDouble() : null, outcome.newQuality(),
                outcome.error()));
        return outcome;
    }

    private static double seconds(Instant from, Instant to) {
        return Math.max(0L, Duration.between(from, to).toMillis()) / 1000.0;
    }

    private record Signals(ChangeCheck change, OptionalDouble quality, Verdict verdict) {}
}
