package com.decisionledger.engine;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.ErrorCode;
import com.decisionledger.contract.SchemaValidator;
import com.decisionledger.contract.ValidationException;
import com.decisionledger.integration.ExternalDependencyException;
import com.decisionledger.integration.FeatureStore;
import com.decisionledger.integration.FeatureValue;
import com.decisionledger.integration.InMemoryFeatureStore;
import com.decisionledger.ledger.TraceRecord;
import com.decisionledger.ledger.TraceStatus;
import com.decisionledger.registry.VersionNotFoundException;
import com.decisionledger.support.SampleFunctions;
import com.decisionledger.support.TestKit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.decisionledger.support.TestKit.EPOCH;
import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final Instant FEB = Instant.parse("2024-02-01T00:00:00Z");
    private static final Instant MAR = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant APR = Instant.parse("2024-04-01T00:00:00Z");

    private TestKit kit = TestKit.create();

    @AfterEach
    void tearDown() {
        kit.close();
    }

    private static Map<String, Object> loan(int creditScore, int amount) {
        return Map.of("credit_score", creditScore, "amount", amount);
    }

    private TraceRecord lastRecord() {
        long size = kit.ledger.size();
        return kit.ledger.readRange(size, size).get(0);
    }

    @Nested
    @DisplayName("Successful execution")
    class Success {

        @Test
        void execute_returnsOutputAndRecordsAnOkTrace() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);

            DecisionResult result = kit.engine.execute(
                ExecutionRequest.latest("loan", loan(720, 5000), "teller-1", FEB));

            assertEquals(Map.of("eligible", true), result.output());
            assertEquals("1.0.0", result.version());
            TraceRecord trace = kit.ledger.get(result.traceId()).orElseThrow();
            assertEquals(TraceStatus.OK, trace.status());
            assertEquals("teller-1", trace.callerId());
            assertEquals(FEB, trace.asOf());
            assertEquals(CanonicalJson.hash(loan(720, 5000)), trace.inputHash());
            assertEquals(CanonicalJson.hash(Map.of("eligible", true)), trace.outputHash());
            assertEquals(result.functionHash(), trace.functionHash());
            assertEquals(trace.sequence(), result.sequence());
            assertEquals(trace.chainHash(), result.chainHash());
            assertTrue(kit.archive.get(trace.inputHash()).isPresent());
        }

        @Test
        void latestRequest_resolvesTheVersionInForceAtAsOf() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);
            kit.release(SampleFunctions.loanEligibility("loan", "2.0.0", 600), MAR);

            DecisionResult before = kit.engine.execute(ExecutionRequest.latest("loan", loan(650, 5000), "c", FEB));
            DecisionResult after = kit.engine.execute(ExecutionRequest.latest("loan", loan(650, 5000), "c", APR));

            assertEquals("1.0.0", before.version());
            assertEquals(false, before.output().get("eligible"));
            assertEquals("2.0.0", after.version());
            assertEquals(true, after.output().get("eligible"));
        }

        @Test
        void missingAsOf_meansNow() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);

            DecisionResult result = kit.engine.execute(ExecutionRequest.latest("loan", loan(720, 5000), "c", null));

            assertEquals(kit.clock.instant(), result.asOf());
        }

        @Test
        void pinnedVersion_isHonouredInsideItsWindow() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);
            kit.release(SampleFunctions.loanEligibility("loan", "2.0.0", 600), MAR);

            DecisionResult result = kit.engine.execute(
                ExecutionRequest.pinned("loan", "1.0.0", loan(650, 5000), "c", FEB));
            assertEquals("1.0.0", result.version());

            InactiveFunctionException ex = assertThrows(InactiveFunctionException.class, () -> kit.engine.execute(
                ExecutionRequest.pinned("loan", "1.0.0", loan(650, 5000), "c", APR)));
            assertEquals(ErrorCode.INACTIVE_FUNCTION, ex.getErrorCode());
            assertEquals(TraceStatus.ERROR, lastRecord().status());
        }
    }

    @Nested
    @DisplayName("Failures are traced")
    class Failures {

        @Test
        void invalidInput_recordsEveryViolatedField() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);

            ValidationException ex = assertThrows(ValidationException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("loan", Map.of("credit_score", 900, "amount", -1), "c", FEB)));

            assertEquals(SchemaValidator.Direction.INPUT, ex.getDirection());
            assertEquals(2, ex.getViolations().size());
            TraceRecord trace = lastRecord();
            assertEquals(TraceStatus.ERROR, trace.status());
            assertEquals("VALIDATION_ERROR", trace.errorCode());
            assertNotNull(trace.inputHash());
            assertNull(trace.outputHash());
            String violated = trace.attributes().get("violated_fields");
            assertTrue(violated.contains("credit_score"));
            assertTrue(violated.contains("amount"));
        }

        @Test
        void inputThatIsNotJson_isAValidationError() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);

            ValidationException ex = assertThrows(ValidationException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("loan", Map.of("credit_score", new Object()), "c", FEB)));
            assertEquals(List.of("$"), ex.violatedFields());
        }

        @Test
        void unknownFunction_isVersionNotFound() {
            assertThrows(VersionNotFoundException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("nope", loan(720, 5000), "c", FEB)));

            TraceRecord trace = lastRecord();
            assertEquals("VERSION_NOT_FOUND", trace.errorCode());
            assertEquals("nope", trace.functionId());
        }

        @Test
        void beforeFirstActivation_isInactive() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), MAR);

            assertThrows(InactiveFunctionException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("loan", loan(720, 5000), "c", FEB)));
            assertEquals("INACTIVE_FUNCTION", lastRecord().errorCode());
        }

        @Test
        void approvedButNeverActivated_isInactive() {
            kit.approve(SampleFunctions.loanEligibility("loan", "1.0.0", 700));

            assertThrows(InactiveFunctionException.class, () -> kit.engine.execute(
                ExecutionRequest.pinned("loan", "1.0.0", loan(720, 5000), "c", FEB)));
        }

        @Test
        void logicFailure_isAnExecutionError() {
            kit.release(SampleFunctions.nativeFunction("boom", "1.0.0", (input, ctx) -> {
                throw new IllegalStateException("division by zero");
            }), EPOCH);

            DecisionExecutionException ex = assertThrows(DecisionExecutionException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("boom", loan(720, 5000), "c", FEB)));

            assertEquals(ErrorCode.EXECUTION_ERROR, ex.getErrorCode());
            assertEquals("EXECUTION_ERROR", lastRecord().errorCode());
        }

        @Test
        void outputBreakingItsSchema_isNotReturned() {
            kit.release(SampleFunctions.nativeFunction("bad", "1.0.0",
                (input, ctx) -> Map.of("eligible", "yes")), EPOCH);

            ValidationException ex = assertThrows(ValidationException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("bad", loan(720, 5000), "c", FEB)));

            assertEquals(SchemaValidator.Direction.OUTPUT, ex.getDirection());
            assertEquals(List.of("eligible"), ex.violatedFields());
            assertNull(lastRecord().outputHash());
        }

        @Test
        void slowLogic_timesOut() {
            kit.close();
            kit = TestKit.create(p -> p.getEngine().setExecutionTimeout(Duration.ofMillis(100)));
            kit.release(SampleFunctions.nativeFunction("slow", "1.0.0", (input, ctx) -> {
                Thread.sleep(5_000);
                return Map.of("eligible", true);
            }), EPOCH);

            ExecutionTimeoutException ex = assertThrows(ExecutionTimeoutException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("slow", loan(720, 5000), "c", FEB)));

            assertEquals(ErrorCode.EXECUTION_TIMEOUT, ex.getErrorCode());
            assertEquals("EXECUTION_TIMEOUT", lastRecord().errorCode());
        }

        @Test
        @DisplayName("Interrupting the caller cancels the evaluation and still records the outcome")
        void interruptedCaller_isCancelled() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            kit.release(SampleFunctions.nativeFunction("slow", "1.0.0", (input, ctx) -> {
                started.countDown();
                Thread.sleep(10_000);
                return Map.of("eligible", true);
            }), EPOCH);

            AtomicReference<Throwable> thrown = new AtomicReference<>();
            Thread caller = new Thread(() -> {
                try {
                    kit.engine.execute(ExecutionRequest.latest("slow", loan(720, 5000), "c", FEB));
                } catch (Throwable t) {
                    thrown.set(t);
                }
            });
            caller.start();
            assertTrue(started.await(5, TimeUnit.SECONDS));
            caller.interrupt();
            caller.join(5_000);

            assertInstanceOf(ExecutionCancelledException.class, thrown.get());
            assertEquals("EXECUTION_CANCELLED", lastRecord().errorCode());
        }
    }

    @Nested
    @DisplayName("Worker pools")
    class Workers {

        @Test
        @DisplayName("Time spent queued for a worker does not count against the execution timeout")
        void queuedCalls_keepTheirWholeTimeout() throws Exception {
            kit.close();
            kit = TestKit.create(p -> {
                p.getEngine().setWorkerThreads(1);
                p.getEngine().setExecutionTimeout(Duration.ofSeconds(1));
            });
            kit.release(SampleFunctions.nativeFunction("steady", "1.0.0", (input, ctx) -> {
                Thread.sleep(150);
                return Map.of("eligible", true);
            }), EPOCH);

            ExecutorService callers = Executors.newFixedThreadPool(10);
            try {
                List<Future<DecisionResult>> calls = new ArrayList<>();
                for (int i = 0; i < 10; i++) {
                    calls.add(callers.submit(() -> kit.engine.execute(
                        ExecutionRequest.latest("steady", loan(720, 5000), "c", FEB))));
                }
                for (Future<DecisionResult> call : calls) {
                    assertEquals(true, call.get(30, TimeUnit.SECONDS).output().get("eligible"));
                }
            } finally {
                callers.shutdownNow();
            }
        }

        @Test
        void busyWorkers_failTheCallAfterTheQueueTimeout() throws Exception {
            kit.close();
            kit = TestKit.create(p -> {
                p.getEngine().setWorkerThreads(1);
                p.getEngine().setQueueTimeout(Duration.ofMillis(100));
                p.getEngine().setExecutionTimeout(Duration.ofSeconds(5));
            });
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            kit.release(SampleFunctions.nativeFunction("blocking", "1.0.0", (input, ctx) -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return Map.of("eligible", true);
            }), EPOCH);

            Thread holder = new Thread(() -> kit.engine.execute(
                ExecutionRequest.latest("blocking", loan(720, 5000), "c", FEB)));
            holder.start();
            try {
                assertTrue(started.await(5, TimeUnit.SECONDS));

                ExecutionTimeoutException ex = assertThrows(ExecutionTimeoutException.class, () -> kit.engine.execute(
                    ExecutionRequest.latest("blocking", loan(720, 5000), "c", FEB)));
                assertTrue(ex.getMessage().contains("no free worker"));
                assertEquals("EXECUTION_TIMEOUT", lastRecord().errorCode());
            } finally {
                release.countDown();
                holder.join(5_000);
            }
        }

        @Test
        void slowFeatureFetch_doesNotHoldADecisionWorker() throws Exception {
            CountDownLatch fetching = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            FeatureStore stalled = (entityId, names, asOf) -> {
                fetching.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                return Map.of("risk_band", new FeatureValue("A", EPOCH));
            };
            kit.close();
            kit = TestKit.withFeatureStore(stalled, p -> {
                p.getEngine().setWorkerThreads(1);
                p.getEngine().setQueueTimeout(Duration.ofMillis(500));
                p.getEngine().getFeatureFetch().setTimeout(Duration.ofSeconds(5));
            });
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);

            Thread featureCaller = new Thread(() -> kit.engine.execute(ExecutionRequest.latest("risk",
                Map.of("applicant_id", "app-1", "amount", 100), "c", FEB)));
            featureCaller.start();
            try {
                assertTrue(fetching.await(5, TimeUnit.SECONDS));

                DecisionResult result = kit.engine.execute(ExecutionRequest.latest("loan", loan(720, 5000), "c", FEB));
                assertEquals(true, result.output().get("eligible"));
            } finally {
                release.countDown();
                featureCaller.join(5_000);
            }
        }
    }

    @Nested
    @DisplayName("Point-in-time features")
    class Features {

        @Test
        void features_areReadAsOfTheDecisionTime() {
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);
            kit.features().record("app-1", "risk_band", "C", EPOCH);
            kit.features().record("app-1", "risk_band", "A", MAR);
            Map<String, Object> input = Map.of("applicant_id", "app-1", "amount", 100);

            DecisionResult feb = kit.engine.execute(ExecutionRequest.latest("risk", input, "c", FEB));
            DecisionResult apr = kit.engine.execute(ExecutionRequest.latest("risk", input, "c", APR));

            assertEquals(false, feb.output().get("eligible"));
            assertEquals(true, apr.output().get("eligible"));
            Map<String, Object> snapshot = kit.archive.get(feb.featureSnapshotRef()).orElseThrow();
            assertEquals(Map.of("risk_band", Map.of("value", "C", "observed_at", "2024-01-01T00:00:00Z")), snapshot);
        }

        @Test
        void missingEntityId_isAValidationError() {
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);

            assertThrows(ValidationException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("risk", Map.of("amount", 100), "c", FEB)));
        }

        @Test
        void transientStoreFailures_areRetried() {
            AtomicInteger calls = new AtomicInteger();
            InMemoryFeatureStore backing = new InMemoryFeatureStore();
            backing.record("app-1", "risk_band", "A", EPOCH);
            FeatureStore flaky = (entityId, names, asOf) -> {
                if (calls.incrementAndGet() < 3) {
                    throw new ExternalDependencyException("feature-store", "connection reset");
                }
                return backing.getFeaturesAt(entityId, names, asOf);
            };
            kit.close();
            kit = TestKit.withFeatureStore(flaky, p -> { });
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);

            DecisionResult result = kit.engine.execute(ExecutionRequest.latest("risk",
                Map.of("applicant_id", "app-1", "amount", 100), "c", FEB));

            assertEquals(true, result.output().get("eligible"));
            assertEquals(3, calls.get());
        }

        @Test
        void persistentStoreFailure_isAnExternalDependencyError() {
            AtomicInteger calls = new AtomicInteger();
            FeatureStore down = (entityId, names, asOf) -> {
                calls.incrementAndGet();
                throw new ExternalDependencyException("feature-store", "unavailable");
            };
            kit.close();
            kit = TestKit.withFeatureStore(down, p -> p.getEngine().getFeatureFetch().setMaxAttempts(2));
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);

            ExternalDependencyException ex = assertThrows(ExternalDependencyException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("risk", Map.of("applicant_id", "app-1", "amount", 100), "c", FEB)));

            assertEquals("feature-store", ex.getDependency());
            assertEquals(2, calls.get());
            assertEquals("EXTERNAL_DEPENDENCY", lastRecord().errorCode());
        }

        @Test
        void featureFromTheFuture_isRefused() {
            FeatureStore leaky = new FeatureStore() {
                @Override
                public Map<String, FeatureValue> getFeaturesAt(String entityId, Collection<String> names,
                                                               Instant asOf) {
                    return Map.of("risk_band", new FeatureValue("A", asOf.plusSeconds(1)));
                }
            };
            kit.close();
            kit = TestKit.withFeatureStore(leaky, p -> { });
            kit.release(SampleFunctions.riskBandFunction("risk", "1.0.0"), EPOCH);

            assertThrows(ExternalDependencyException.class, () -> kit.engine.execute(
                ExecutionRequest.latest("risk", Map.of("applicant_id", "app-1", "amount", 100), "c", FEB)));
        }
    }

    @Nested
    @DisplayName("Replay")
    class Replay {

        @Test
        void replay_evaluatesWithoutTouchingTheLedger() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), EPOCH);
            long size = kit.ledger.size();

            Map<String, Object> output = kit.engine.replay("loan", "1.0.0", loan(720, 5000), Map.of(), FEB);

            assertEquals(Map.of("eligible", true), output);
            assertEquals(size, kit.ledger.size());
        }

        @Test
        void draft_cannotBeReplayed() {
            kit.registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));

            assertThrows(InactiveFunctionException.class,
                () -> kit.engine.replay("loan", "1.0.0", loan(720, 5000), Map.of(), FEB));
        }
    }
}
