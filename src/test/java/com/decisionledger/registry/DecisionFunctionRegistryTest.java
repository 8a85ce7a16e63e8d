package com.decisionledger.registry;

import com.decisionledger.integration.ExternalDependencyException;
import com.decisionledger.ledger.EventType;
import com.decisionledger.ledger.TraceRecord;
import com.decisionledger.logic.Condition;
import com.decisionledger.logic.Operator;
import com.decisionledger.logic.Rule;
import com.decisionledger.logic.RuleConflictException;
import com.decisionledger.logic.RuleSetLogic;
import com.decisionledger.support.SampleFunctions;
import com.decisionledger.support.TamperingLedgerStore;
import com.decisionledger.support.TestKit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionFunctionRegistryTest {

    private static final Instant JAN = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant MAR = Instant.parse("2024-03-01T00:00:00Z");

    private TestKit kit;
    private DecisionFunctionRegistry registry;

    @BeforeEach
    void setUp() {
        kit = TestKit.create();
        registry = kit.registry;
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    private DecisionFunctionArtifact pendingReview(String functionId) {
        DecisionFunctionArtifact draft = registry.registerDraft(SampleFunctions.loanEligibility(functionId, "1.0.0", 700));
        return registry.requestRelease(functionId, draft.version(), "alice");
    }

    private List<EventType> governanceEvents(String functionId) {
        return kit.ledger.readRange(1, kit.ledger.size()).stream()
            .filter(r -> functionId.equals(r.functionId()))
            .map(TraceRecord::eventType)
            .toList();
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        void registerDraft_freezesContentHashes() {
            DecisionFunctionArtifact artifact = registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));

            assertEquals(FunctionStatus.DRAFT, artifact.status());
            assertEquals(artifact.logic().logicHash(), artifact.logicHash());
            assertEquals(64, artifact.functionHash().length());
            assertEquals(List.of(EventType.FUNCTION_REGISTERED), governanceEvents("loan"));
        }

        @Test
        void sameVersionTwice_isADuplicate() {
            registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));
            DuplicateVersionException ex = assertThrows(DuplicateVersionException.class,
                () -> registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 650)));
            assertTrue(ex.getMessage().contains("loan@1.0.0"));
            assertEquals(700, ((Number) ((RuleSetLogic) registry.require("loan", "1.0.0").logic())
                .rules().get(0).conditions().get(0).value()).intValue());
        }

        @Test
        void untrustedLegalReference_isRejected() {
            FunctionDraft draft = SampleFunctions.loanEligibility("benefit", "1.0.0", 700);
            FunctionDraft cited = new FunctionDraft(draft.functionId(), draft.version(), draft.logic(),
                draft.inputSchema(), draft.outputSchema(), draft.featureBinding(),
                draft.metadata().withLegalReferences("https://finlex.fi/fi/laki/ajantasa/2002/20021290#L2",
                    "http://example.com/law"));

            LegalReferenceException ex = assertThrows(LegalReferenceException.class, () -> registry.registerDraft(cited));
            assertEquals(List.of("http://example.com/law"), ex.getRejectedReferences());
            assertTrue(registry.find("benefit", "1.0.0").isEmpty());
        }

        @Test
        @DisplayName("Conflicting rules fail registration before any signature is collected")
        void conflictingRules_failRegistration() {
            RuleSetLogic ambiguous = new RuleSetLogic(List.of(
                Rule.all("approve", 10, List.of(Condition.of("credit_score", Operator.GE, 650)), Map.of("eligible", true)),
                Rule.all("decline", 10, List.of(Condition.of("credit_score", Operator.LE, 700)), Map.of("eligible", false))
            ), Map.of("eligible", false));
            FunctionDraft draft = new FunctionDraft("loan", "1.0.0", ambiguous, SampleFunctions.loanInput(),
                SampleFunctions.loanOutput(), FeatureBinding.none(), FunctionMetadata.of("alice", "ambiguous"));

            RuleConflictException ex = assertThrows(RuleConflictException.class, () -> registry.registerDraft(draft));
            assertEquals(List.of("approve", "decline"), ex.getConflicts().get(0).ruleIds());
            assertTrue(registry.find("loan", "1.0.0").isEmpty());
            assertEquals(0, kit.ledger.size());
        }

        @Test
        void adjacentExclusiveBounds_onAnIntegerInput_doNotConflict() {
            RuleSetLogic split = new RuleSetLogic(List.of(
                Rule.all("above", 10, List.of(Condition.of("credit_score", Operator.GT, 700)), Map.of("eligible", true)),
                Rule.all("below", 10, List.of(Condition.of("credit_score", Operator.LT, 701)), Map.of("eligible", false))
            ), Map.of("eligible", false));
            RuleSetLogic fractional = new RuleSetLogic(List.of(
                Rule.all("above", 10, List.of(Condition.of("amount", Operator.GT, 700)), Map.of("eligible", true)),
                Rule.all("below", 10, List.of(Condition.of("amount", Operator.LT, 701)), Map.of("eligible", false))
            ), Map.of("eligible", false));

            registry.registerDraft(new FunctionDraft("loan", "1.0.0", split, SampleFunctions.loanInput(),
                SampleFunctions.loanOutput(), FeatureBinding.none(), FunctionMetadata.of("alice", "split")));
            assertThrows(RuleConflictException.class, () -> registry.registerDraft(new FunctionDraft("loan", "2.0.0",
                fractional, SampleFunctions.loanInput(), SampleFunctions.loanOutput(), FeatureBinding.none(),
                FunctionMetadata.of("alice", "fractional"))));
        }

        @Test
        void reviewNotes_carryNonBlockingFindings() {
            RuleSetLogic logic = new RuleSetLogic(List.of(
                Rule.all("r", 1, List.of(Condition.of("income", Operator.GE, 1000)), Map.of("eligible", true))
            ), Map.of("eligible", false));
            DecisionFunctionArtifact artifact = registry.registerDraft(new FunctionDraft("loan", "1.0.0", logic,
                SampleFunctions.loanInput(), SampleFunctions.loanOutput(), FeatureBinding.none(),
                FunctionMetadata.of("alice", "unknown field")));

            assertEquals(1, artifact.reviewNotes().size());
            assertTrue(artifact.reviewNotes().get(0).contains("income"));
        }
    }

    @Nested
    @DisplayName("Signing and separation of duties")
    class Signing {

        @Test
        void ownerAndReviewer_approveTheRelease() {
            DecisionFunctionArtifact artifact = pendingReview("loan");
            registry.sign("loan", "1.0.0", "alice", SignerRole.OWNER,
                kit.signature(artifact, "alice", SignerRole.OWNER));
            assertEquals(FunctionStatus.PENDING_REVIEW, registry.require("loan", "1.0.0").status());

            DecisionFunctionArtifact approved = registry.sign("loan", "1.0.0", "bob", SignerRole.REVIEWER,
                kit.signature(artifact, "bob", SignerRole.REVIEWER));

            assertEquals(FunctionStatus.APPROVED, approved.status());
            assertEquals(2, approved.signatures().size());
            assertEquals(List.of(EventType.FUNCTION_REGISTERED, EventType.RELEASE_REQUESTED, EventType.RELEASE_SIGNED,
                EventType.RELEASE_SIGNED, EventType.RELEASE_APPROVED), governanceEvents("loan"));
        }

        @Test
        void sameSignerForBothRoles_isRejected() {
            DecisionFunctionArtifact artifact = pendingReview("loan");
            registry.sign("loan", "1.0.0", "alice", SignerRole.OWNER, kit.signature(artifact, "alice", SignerRole.OWNER));

            assertThrows(SeparationOfDutiesException.class, () -> registry.sign("loan", "1.0.0", "alice",
                SignerRole.REVIEWER, kit.signature(artifact, "alice", SignerRole.REVIEWER)));
            assertEquals(FunctionStatus.PENDING_REVIEW, registry.require("loan", "1.0.0").status());
        }

        @Test
        void secondSignatureForARole_isRejected() {
            DecisionFunctionArtifact artifact = pendingReview("loan");
            registry.sign("loan", "1.0.0", "alice", SignerRole.OWNER, kit.signature(artifact, "alice", SignerRole.OWNER));

            assertThrows(SeparationOfDutiesException.class, () -> registry.sign("loan", "1.0.0", "carol",
                SignerRole.OWNER, kit.signature(artifact, "carol", SignerRole.OWNER)));
        }

        @Test
        void signatureForAnotherRoleOrKey_doesNotVerify() {
            DecisionFunctionArtifact artifact = pendingReview("loan");

            assertThrows(InvalidSignatureException.class, () -> registry.sign("loan", "1.0.0", "bob",
                SignerRole.REVIEWER, kit.signature(artifact, "bob", SignerRole.OWNER)));
            assertThrows(InvalidSignatureException.class, () -> registry.sign("loan", "1.0.0", "bob",
                SignerRole.REVIEWER, kit.signature(artifact, "mallory", SignerRole.REVIEWER)));
            assertTrue(registry.require("loan", "1.0.0").signatures().isEmpty());
        }

        @Test
        void signingOutsideReview_isAnInvalidTransition() {
            DecisionFunctionArtifact draft = registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));

            assertThrows(InvalidStateTransitionException.class, () -> registry.sign("loan", "1.0.0", "alice",
                SignerRole.OWNER, kit.signature(draft, "alice", SignerRole.OWNER)));
        }

        @Test
        @DisplayName("activate() fails when owner and reviewer are the same identity")
        void activate_refusesEqualSignerIds() {
            DecisionFunctionArtifact draft = registry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));
            Instant now = kit.clock.instant();
            DecisionFunctionArtifact forged = draft
                .withSignature(new Signature("alice", SignerRole.OWNER,
                    kit.signature(draft, "alice", SignerRole.OWNER), now), now)
                .withSignature(new Signature("alice", SignerRole.REVIEWER,
                    kit.signature(draft, "alice", SignerRole.REVIEWER), now), now)
                .withStatus(FunctionStatus.APPROVED, now);
            kit.artifacts.compareAndSet(draft.key(), kit.artifacts.get(draft.key()).orElseThrow().revision(), forged);

            assertThrows(SeparationOfDutiesException.class, () -> registry.activate("loan", "1.0.0", JAN, "ops"));
            assertTrue(registry.effectiveIndex("loan").windows().isEmpty());
        }

        @Test
        void reject_returnsToDraftAndDiscardsSignatures() {
            DecisionFunctionArtifact artifact = pendingReview("loan");
            registry.sign("loan", "1.0.0", "alice", SignerRole.OWNER, kit.signature(artifact, "alice", SignerRole.OWNER));

            DecisionFunctionArtifact rejected = registry.reject("loan", "1.0.0", "bob", "threshold too low");

            assertEquals(FunctionStatus.DRAFT, rejected.status());
            assertTrue(rejected.signatures().isEmpty());
            assertTrue(rejected.reviewNotes().get(rejected.reviewNotes().size() - 1).contains("threshold too low"));
            assertEquals(artifact.logicHash(), rejected.logicHash());
            assertTrue(governanceEvents("loan").contains(EventType.RELEASE_REJECTED));
        }
    }

    @Nested
    @DisplayName("Activation and retirement")
    class Lifecycle {

        @Test
        void activate_requiresApproval() {
            pendingReview("loan");
            assertThrows(InvalidStateTransitionException.class, () -> registry.activate("loan", "1.0.0", JAN, "ops"));
            assertThrows(InvalidStateTransitionException.class, () -> registry.requestRelease("loan", "1.0.0", "alice"));
        }

        @Test
        void newActivation_deprecatesTheVersionInForce() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), JAN);
            DecisionFunctionArtifact v2 = kit.release(SampleFunctions.loanEligibility("loan", "2.0.0", 680), MAR);

            assertEquals(FunctionStatus.ACTIVE, v2.status());
            assertEquals(FunctionStatus.DEPRECATED, registry.require("loan", "1.0.0").status());
            assertEquals("1.0.0", registry.resolveActive("loan", Instant.parse("2024-02-01T00:00:00Z")).version());
            assertEquals("2.0.0", registry.resolveActive("loan", MAR).version());
            assertEquals(List.of("1.0.0", "2.0.0"),
                registry.versions("loan").stream().map(DecisionFunctionArtifact::version).toList());
            assertTrue(governanceEvents("loan").contains(EventType.VERSION_DEPRECATED));
            assertEquals(List.of("loan"), registry.functionIds());
        }

        @Test
        void activationBeforeTheVersionInForce_isRejected() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), MAR);
            DecisionFunctionArtifact v2 = kit.approve(SampleFunctions.loanEligibility("loan", "2.0.0", 680));

            assertThrows(InvalidStateTransitionException.class,
                () -> registry.activate("loan", v2.version(), JAN, "ops"));
            assertEquals(FunctionStatus.APPROVED, registry.require("loan", "2.0.0").status());
        }

        @Test
        void resolveActive_withoutAWindow_isVersionNotFound() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), MAR);

            assertThrows(VersionNotFoundException.class, () -> registry.resolveActive("loan", JAN));
            assertThrows(VersionNotFoundException.class, () -> registry.resolveActive("unknown", MAR));
        }

        @Test
        void retire_closesTheWindowAndIsTerminal() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), JAN);
            Instant sunset = Instant.parse("2024-05-01T00:00:00Z");

            DecisionFunctionArtifact retired = registry.retire("loan", "1.0.0", sunset, "ops");

            assertEquals(FunctionStatus.RETIRED, retired.status());
            assertEquals("1.0.0", registry.resolveActive("loan", sunset.minusSeconds(1)).version());
            assertThrows(VersionNotFoundException.class, () -> registry.resolveActive("loan", sunset));
            assertThrows(InvalidStateTransitionException.class, () -> registry.retire("loan", "1.0.0", sunset, "ops"));
            assertThrows(InvalidStateTransitionException.class, () -> registry.activate("loan", "1.0.0", sunset, "ops"));
            assertTrue(registry.find("loan", "1.0.0").isPresent());
        }

        @Test
        void governanceEvents_areChainedOnTheLedger() {
            kit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), JAN);

            assertEquals(List.of(EventType.FUNCTION_REGISTERED, EventType.RELEASE_REQUESTED, EventType.RELEASE_SIGNED,
                EventType.RELEASE_SIGNED, EventType.RELEASE_APPROVED, EventType.VERSION_ACTIVATED),
                governanceEvents("loan"));
            TraceRecord activation = kit.ledger.readRange(kit.ledger.size(), kit.ledger.size()).get(0);
            assertEquals(JAN, activation.asOf());
            assertEquals("release-bot", activation.callerId());
            assertEquals("ACTIVE", activation.attributes().get("to_status"));
            assertTrue(kit.ledger.verifyIntegrity().ok());
        }
    }

    @Nested
    @DisplayName("Transitions when the ledger refuses the governance record")
    class LedgerOutage {

        private final TamperingLedgerStore store = new TamperingLedgerStore();
        private TestKit outageKit;
        private DecisionFunctionRegistry outageRegistry;

        @BeforeEach
        void setUp() {
            outageKit = TestKit.withLedgerStore(store);
            outageRegistry = outageKit.registry;
        }

        @AfterEach
        void tearDown() {
            outageKit.close();
        }

        private List<EventType> recorded(String functionId) {
            return outageKit.ledger.readRange(1, outageKit.ledger.size()).stream()
                .filter(r -> functionId.equals(r.functionId()))
                .map(TraceRecord::eventType)
                .toList();
        }

        @Test
        void failedRegistration_leavesNoDraftBehind() {
            store.failNextAppends(1);

            assertThrows(ExternalDependencyException.class,
                () -> outageRegistry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700)));
            assertTrue(outageRegistry.find("loan", "1.0.0").isEmpty());

            outageRegistry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));
            assertEquals(List.of(EventType.FUNCTION_REGISTERED), recorded("loan"));
        }

        @Test
        void failedReleaseRequest_staysInDraftAndCanBeRetried() {
            outageRegistry.registerDraft(SampleFunctions.loanEligibility("loan", "1.0.0", 700));
            store.failNextAppends(1);

            assertThrows(ExternalDependencyException.class,
                () -> outageRegistry.requestRelease("loan", "1.0.0", "alice"));
            assertEquals(FunctionStatus.DRAFT, outageRegistry.require("loan", "1.0.0").status());
            assertEquals(List.of(EventType.FUNCTION_REGISTERED), recorded("loan"));

            DecisionFunctionArtifact pending = outageRegistry.requestRelease("loan", "1.0.0", "alice");
            assertEquals(FunctionStatus.PENDING_REVIEW, pending.status());
            assertEquals(List.of(EventType.FUNCTION_REGISTERED, EventType.RELEASE_REQUESTED), recorded("loan"));
        }

        @Test
        void failedApprovingSignature_recordsNeitherEvent() {
            DecisionFunctionArtifact artifact = outageRegistry.registerDraft(
                SampleFunctions.loanEligibility("loan", "1.0.0", 700));
            outageRegistry.requestRelease("loan", "1.0.0", "alice");
            outageRegistry.sign("loan", "1.0.0", "alice", SignerRole.OWNER,
                outageKit.signature(artifact, "alice", SignerRole.OWNER));
            store.failNextAppends(1);

            assertThrows(ExternalDependencyException.class, () -> outageRegistry.sign("loan", "1.0.0", "bob",
                SignerRole.REVIEWER, outageKit.signature(artifact, "bob", SignerRole.REVIEWER)));

            DecisionFunctionArtifact stored = outageRegistry.require("loan", "1.0.0");
            assertEquals(FunctionStatus.PENDING_REVIEW, stored.status());
            assertEquals(1, stored.signatures().size());
            assertEquals(List.of(EventType.FUNCTION_REGISTERED, EventType.RELEASE_REQUESTED,
                EventType.RELEASE_SIGNED), recorded("loan"));
        }

        @Test
        void failedActivation_keepsTheVersionInForce() {
            outageKit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), JAN);
            outageKit.approve(SampleFunctions.loanEligibility("loan", "2.0.0", 680));
            long recordsBefore = outageKit.ledger.size();
            store.failNextAppends(1);

            assertThrows(ExternalDependencyException.class,
                () -> outageRegistry.activate("loan", "2.0.0", MAR, "ops"));
            assertEquals(FunctionStatus.APPROVED, outageRegistry.require("loan", "2.0.0").status());
            assertEquals(FunctionStatus.ACTIVE, outageRegistry.require("loan", "1.0.0").status());
            assertEquals("1.0.0", outageRegistry.resolveActive("loan", MAR).version());
            assertEquals(recordsBefore, outageKit.ledger.size());

            outageRegistry.activate("loan", "2.0.0", MAR, "ops");
            assertEquals("2.0.0", outageRegistry.resolveActive("loan", MAR).version());
            assertEquals(FunctionStatus.DEPRECATED, outageRegistry.require("loan", "1.0.0").status());
            List<EventType> events = recorded("loan");
            assertEquals(List.of(EventType.VERSION_ACTIVATED, EventType.VERSION_DEPRECATED),
                events.subList(events.size() - 2, events.size()));
        }

        @Test
        void failedRetirement_keepsTheWindowOpen() {
            outageKit.release(SampleFunctions.loanEligibility("loan", "1.0.0", 700), JAN);
            Instant sunset = Instant.parse("2024-05-01T00:00:00Z");
            store.failNextAppends(1);

            assertThrows(ExternalDependencyException.class,
                () -> outageRegistry.retire("loan", "1.0.0", sunset, "ops"));
            assertEquals(FunctionStatus.ACTIVE, outageRegistry.require("loan", "1.0.0").status());
            assertEquals("1.0.0", outageRegistry.resolveActive("loan", sunset).version());

            assertEquals(FunctionStatus.RETIRED, outageRegistry.retire("loan", "1.0.0", sunset, "ops").status());
            assertTrue(outageKit.ledger.verifyIntegrity().ok());
        }
    }
}
