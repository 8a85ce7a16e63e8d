package com.decisionledger.engine;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.config.DecisionLedgerProperties;
import com.decisionledger.contract.FieldViolation;
import com.decisionledger.contract.SchemaValidator;
import com.decisionledger.contract.ValidationException;
import com.decisionledger.integration.ExternalDependencyException;
import com.decisionledger.integration.FeatureStore;
import com.decisionledger.integration.FeatureValue;
import com.decisionledger.ledger.EventType;
import com.decisionledger.ledger.TraceLedger;
import com.decisionledger.ledger.TraceRecord;
import com.decisionledger.ledger.TraceStatus;
import com.decisionledger.logic.EvaluationContext;
import com.decisionledger.registry.DecisionFunctionArtifact;
import com.decisionledger.registry.DecisionFunctionRegistry;
import com.decisionledger.registry.EffectiveWindow;
import com.decisionledger.registry.FeatureBinding;
import com.decisionledger.registry.VersionNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates decision functions. Every call to {@link #execute} ends with
 * exactly one ledger record: OK with the hashes of input, output and feature
 * snapshot, or ERROR with the failure's error code. Payloads behind those
 * hashes go to the {@link PayloadArchive} so a decision can be replayed from
 * its trace alone.
 */
@Service
public class DecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(DecisionEngine.class);

    private final DecisionFunctionRegistry registry;
    private final TraceLedger ledger;
    private final PayloadArchive archive;
    private final FeatureStore featureStore;
    private final SchemaValidator validator;
    private final Clock clock;
    private final ExecutorService workers;
    private final ExecutorService featureWorkers;
    private final Duration executionTimeout;
    private final Duration queueTimeout;
    private final Duration featureFetchTimeout;
    private final Retry featureRetry;
    private final Cache<String, DecisionFunctionArtifact> artifactCache;

    public DecisionEngine(DecisionFunctionRegistry registry,
                          TraceLedger ledger,
                          PayloadArchive archive,
                          FeatureStore featureStore,
                          SchemaValidator validator,
                          DecisionLedgerProperties properties,
                          Clock clock,
                          @Qualifier("decisionWorkers") ExecutorService workers,
                          @Qualifier("featureFetchWorkers") ExecutorService featureWorkers) {
        this.registry = registry;
        this.ledger = ledger;
        this.archive = archive;
        this.featureStore = featureStore;
        this.validator = validator;
        this.clock = clock;
        this.workers = workers;
        this.featureWorkers = featureWorkers;

        DecisionLedgerProperties.Engine engine = properties.getEngine();
        DecisionLedgerProperties.FeatureFetch fetch = engine.getFeatureFetch();
        this.executionTimeout = engine.getExecutionTimeout();
        this.queueTimeout = engine.getQueueTimeout();
        this.featureFetchTimeout = fetch.getTimeout();
        this.featureRetry = Retry.of("feature-store", RetryConfig.custom()
            .maxAttempts(fetch.getMaxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(fetch.getInitialBackoff(), fetch.getMultiplier()))
            .retryExceptions(ExternalDependencyException.class)
            .build());
        this.featureRetry.getEventPublisher().onRetry(event ->
            log.warn("Feature fetch attempt {} failed, retrying in {}ms: {}", event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
        this.artifactCache = Caffeine.newBuilder()
            .maximumSize(engine.getArtifactCacheSize())
            .build();
    }

    public DecisionResult execute(ExecutionRequest request) {
        Instant asOf = request.asOf() != null ? request.asOf() : clock.instant();
        String traceId = UUID.randomUUID().toString();
        TraceRecord.Builder trace = TraceRecord.builder(EventType.DECISION_EXECUTED)
            .traceId(traceId)
            .function(request.functionId(), request.version())
            .callerId(request.callerId())
            .asOf(asOf);

        DecisionFunctionArtifact artifact;
        Map<String, Object> output;
        try {
            artifact = resolve(request, asOf);
            trace.function(artifact.functionId(), artifact.version()).functionHash(artifact.functionHash());

            Map<String, Object> input = canonicalInput(request.input());
            trace.inputHash(archive.put(input));
            validator.validate(artifact.inputSchema(), input, SchemaValidator.Direction.INPUT);

            Map<String, Object> snapshot = fetchFeatures(artifact, input, asOf);
            trace.featureSnapshotRef(archive.put(snapshot));

            output = evaluate(artifact, input, snapshot, asOf);
            trace.outputHash(archive.put(output));
        } catch (DecisionLedgerException ex) {
            recordFailure(trace, ex);
            throw ex;
        } catch (RuntimeException ex) {
            DecisionExecutionException failure = new DecisionExecutionException(request.version() == null
                ? request.functionId() : DecisionFunctionArtifact.key(request.functionId(), request.version()), ex);
            recordFailure(trace, failure);
            throw failure;
        }

        TraceRecord record = ledger.append(trace.status(TraceStatus.OK).timestamp(clock.instant()).build());
        log.debug("Decision {} by {} trace_id={} output_hash={}", artifact.key(), request.callerId(), traceId,
            record.outputHash());
        return new DecisionResult(traceId, artifact.functionId(), artifact.version(), artifact.functionHash(), output,
            record.inputHash(), record.outputHash(), record.featureSnapshotRef(), record.sequence(),
            record.chainHash(), asOf);
    }

    /**
     * Re-runs a version against a recorded input and feature snapshot. Nothing
     * is fetched and nothing is written to the ledger. Any version that has
     * left DRAFT can be replayed, whether or not it is in force.
     *
     * @return the canonical output
     */
    public Map<String, Object> replay(String functionId, String version, Map<String, Object> input,
                                      Map<String, Object> featureSnapshot, Instant asOf) {
        DecisionFunctionArtifact artifact = artifact(functionId, version);
        if (!artifact.status().isFrozen()) {
            throw new InactiveFunctionException(artifact.key() + " is still a draft and cannot be replayed");
        }
        Map<String, Object> canonical = canonicalInput(input);
        validator.validate(artifact.inputSchema(), canonical, SchemaValidator.Direction.INPUT);
        return evaluate(artifact, canonical, CanonicalJson.normalize(featureSnapshot), asOf);
    }

    private DecisionFunctionArtifact resolve(ExecutionRequest request, Instant asOf) {
        String functionId = request.functionId();
        if (request.version() != null) {
            DecisionFunctionArtifact artifact = artifact(functionId, request.version());
            boolean inForce = registry.effectiveIndex(functionId).windowOf(request.version())
                .map(window -> window.contains(asOf))
                .orElse(false);
            if (!inForce) {
                throw new InactiveFunctionException(functionId, request.version(), asOf);
            }
            return artifact;
        }

        EffectiveWindow window = registry.effectiveIndex(functionId).resolve(asOf).orElse(null);
        if (window == null) {
            if (registry.versions(functionId).isEmpty()) {
                throw new VersionNotFoundException(functionId, asOf);
            }
            throw new InactiveFunctionException(functionId, null, asOf);
        }
        return artifact(functionId, window.version());
    }

    private DecisionFunctionArtifact artifact(String functionId, String version) {
        String key = DecisionFunctionArtifact.key(functionId, version);
        DecisionFunctionArtifact cached = artifactCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        DecisionFunctionArtifact loaded = registry.require(functionId, version);
        if (loaded.status().isReleased()) {
            artifactCache.put(key, loaded);
        }
        return loaded;
    }

    private Map<String, Object> canonicalInput(Map<String, Object> input) {
        try {
            return CanonicalJson.normalize(input);
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(SchemaValidator.Direction.INPUT,
                List.of(new FieldViolation("$", "input is not representable as JSON")));
        }
    }

    private Map<String, Object> fetchFeatures(DecisionFunctionArtifact artifact, Map<String, Object> input,
                                              Instant asOf) {
        FeatureBinding binding = artifact.featureBinding();
        if (binding.isEmpty()) {
            return Map.of();
        }
        Object entity = input.get(binding.entityField());
        if (entity == null) {
            throw new ValidationException(SchemaValidator.Direction.INPUT,
                List.of(new FieldViolation(binding.entityField(), "is required to look up features")));
        }
        String entityId = String.valueOf(entity);
        Map<String, FeatureValue> fetched = Retry.decorateSupplier(featureRetry,
            () -> fetchOnce(artifact.key(), entityId, binding.featureNames(), asOf)).get();

        Map<String, Object> snapshot = new TreeMap<>();
        fetched.forEach((name, feature) -> {
            if (feature.observedAt().isAfter(asOf)) {
                throw new ExternalDependencyException("feature-store",
                    "returned " + name + " observed after " + asOf);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", feature.value());
            entry.put("observed_at", feature.observedAt());
            snapshot.put(name, entry);
        });
        return CanonicalJson.normalize(snapshot);
    }

    private Map<String, FeatureValue> fetchOnce(String key, String entityId, List<String> names, Instant asOf) {
        try {
            return runOnWorker(featureWorkers, key, () -> featureStore.getFeaturesAt(entityId, names, asOf),
                featureFetchTimeout);
        } catch (TimeoutException ex) {
            throw new ExternalDependencyException("feature-store", ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(key);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof DecisionLedgerException failure) {
                throw failure;
            }
            throw new ExternalDependencyException("feature-store", String.valueOf(ex.getCause().getMessage()),
                ex.getCause());
        }
    }

    private Map<String, Object> evaluate(DecisionFunctionArtifact artifact, Map<String, Object> input,
                                         Map<String, Object> snapshot, Instant asOf) {
        EvaluationContext context = new EvaluationContext(artifact.functionId(), artifact.version(), asOf,
            featureValues(snapshot));
        Map<String, Object> frozenInput = Collections.unmodifiableMap(input);

        Map<String, Object> raw;
        try {
            raw = runOnWorker(workers, artifact.key(), () -> artifact.logic().execute(frozenInput, context),
                executionTimeout);
        } catch (TimeoutException ex) {
            log.warn("Execution of {} timed out: {}", artifact.key(), ex.getMessage());
            throw new ExecutionTimeoutException(artifact.key(), ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(artifact.key());
        } catch (ExecutionException ex) {
            throw new DecisionExecutionException(artifact.key(), ex.getCause());
        }

        Map<String, Object> output;
        try {
            output = CanonicalJson.normalize(raw);
        } catch (IllegalArgumentException ex) {
            throw new DecisionExecutionException(artifact.key(), ex);
        }
        validator.validate(artifact.outputSchema(), output, SchemaValidator.Direction.OUTPUT);
        return output;
    }

    /**
     * Runs {@code task} on {@code pool}. The {@code timeout} starts when a
     * worker picks the task up; time spent queued for a worker is bounded by
     * the queue timeout instead. The task is cancelled on either timeout and
     * on interrupt.
     */
    private <T> T runOnWorker(ExecutorService pool, String key, Callable<T> task, Duration timeout)
            throws TimeoutException, InterruptedException, ExecutionException {
        CountDownLatch started = new CountDownLatch(1);
        Future<T> call;
        try {
            call = pool.submit(() -> {
                started.countDown();
                return task.call();
            });
        } catch (RejectedExecutionException ex) {
            throw new DecisionExecutionException(key, ex);
        }
        try {
            if (!started.await(queueTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TimeoutException("found no free worker within " + queueTimeout.toMillis() + "ms");
            }
            try {
                return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException ex) {
                throw new TimeoutException("did not finish within " + timeout.toMillis() + "ms");
            }
        } catch (TimeoutException | InterruptedException ex) {
            call.cancel(true);
            throw ex;
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> featureValues(Map<String, Object> snapshot) {
        Map<String, Object> values = new LinkedHashMap<>();
        snapshot.forEach((name, entry) -> values.put(name,
            entry instanceof Map<?, ?> map ? ((Map<String, Object>) map).get("value") : entry));
        return values;
    }

    private void recordFailure(TraceRecord.Builder trace, DecisionLedgerException failure) {
        trace.status(TraceStatus.ERROR)
            .errorCode(failure.getErrorCode().name())
            .attribute("error_message", failure.getMessage())
            .timestamp(clock.instant());
        if (failure instanceof ValidationException validation) {
            trace.attribute("violated_fields", String.join(",", validation.violatedFields()));
        }
        try {
            ledger.append(trace.build());
        } catch (DecisionLedgerException appendFailure) {
            log.error("Could not record {} failure on the ledger: {}", failure.getErrorCode(),
                appendFailure.getMessage());
            failure.addSuppressed(appendFailure);
        }
        log.warn("Decision failed code={} message={}", failure.getErrorCode(), failure.getMessage());
    }
}
