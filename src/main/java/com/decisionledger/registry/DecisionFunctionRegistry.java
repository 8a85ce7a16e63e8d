package com.decisionledger.registry;

import com.decisionledger.contract.FieldType;
import com.decisionledger.integration.LegalReferenceCheck;
import com.decisionledger.integration.LegalReferenceValidator;
import com.decisionledger.integration.Signer;
import com.decisionledger.ledger.EventType;
import com.decisionledger.ledger.TraceLedger;
import com.decisionledger.ledger.TraceRecord;
import com.decisionledger.logic.RuleAnalysis;
import com.decisionledger.logic.RuleConflictAnalyzer;
import com.decisionledger.logic.RuleConflictException;
import com.decisionledger.logic.RuleSetLogic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns decision function versions and their signed-release state machine:
 * DRAFT, PENDING_REVIEW, APPROVED, ACTIVE, DEPRECATED, RETIRED. Every
 * transition is written with compare-and-swap and recorded as a governance
 * event on the ledger; concurrent conflicting transitions are rejected.
 */
@Service
public class DecisionFunctionRegistry {

    private static final Logger log = LoggerFactory.getLogger(DecisionFunctionRegistry.class);

    private final RegistryStore<DecisionFunctionArtifact> artifacts;
    private final RegistryStore<EffectiveVersionIndex> indexes;
    private final TraceLedger ledger;
    private final Signer signer;
    private final LegalReferenceValidator legalReferenceValidator;
    private final RuleConflictAnalyzer conflictAnalyzer;
    private final Clock clock;

    public DecisionFunctionRegistry(RegistryStore<DecisionFunctionArtifact> artifacts,
                                    RegistryStore<EffectiveVersionIndex> indexes,
                                    TraceLedger ledger,
                                    Signer signer,
                                    LegalReferenceValidator legalReferenceValidator,
                                    RuleConflictAnalyzer conflictAnalyzer,
                                    Clock clock) {
        this.artifacts = artifacts;
        this.indexes = indexes;
        this.ledger = ledger;
        this.signer = signer;
        this.legalReferenceValidator = legalReferenceValidator;
        this.conflictAnalyzer = conflictAnalyzer;
        this.clock = clock;
    }

    public DecisionFunctionArtifact registerDraft(FunctionDraft draft) {
        String key = DecisionFunctionArtifact.key(draft.functionId(), draft.version());
        if (artifacts.get(key).isPresent()) {
            throw new DuplicateVersionException(draft.functionId(), draft.version());
        }
        if (draft.metadata() != null) {
            validateLegalReferences(draft);
        }

        List<String> reviewNotes = List.of();
        if (draft.logic() instanceof RuleSetLogic rules && draft.inputSchema() != null) {
            Set<String> knownFields = new LinkedHashSet<>(draft.inputSchema().fields().keySet());
            knownFields.addAll(draft.featureBinding().featureNames());
            RuleAnalysis analysis = conflictAnalyzer.analyze(rules, knownFields,
                draft.inputSchema().fieldsOfType(FieldType.INTEGER));
            if (analysis.hasBlockingConflicts()) {
                log.warn("Rejected {}: {} blocking rule conflicts", key, analysis.blocking().size());
                throw new RuleConflictException(draft.functionId(), draft.version(), analysis.blocking());
            }
            reviewNotes = analysis.reviewNotes();
        }

        DecisionFunctionArtifact artifact = DecisionFunctionArtifact.draft(draft.functionId(), draft.version(),
            draft.logic(), draft.inputSchema(), draft.outputSchema(), draft.featureBinding(), draft.metadata(),
            reviewNotes, clock.instant());
        if (!artifacts.putIfAbsent(key, artifact)) {
            throw new DuplicateVersionException(draft.functionId(), draft.version());
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("to_status", FunctionStatus.DRAFT.name());
        attributes.put("logic_hash", artifact.logicHash());
        if (!reviewNotes.isEmpty()) {
            attributes.put("review_notes", String.join("\n", reviewNotes));
        }
        try {
            ledger.append(governanceRecord(EventType.FUNCTION_REGISTERED, artifact, draft.metadata().author(), null,
                attributes));
        } catch (RuntimeException ex) {
            if (!artifacts.remove(key, 1)) {
                log.error("Could not withdraw draft {} after failed governance record", key);
            }
            throw ex;
        }
        log.info("Registered draft {} logic_hash={} review_notes={}", key, artifact.logicHash(), reviewNotes.size());
        return artifact;
    }

    public DecisionFunctionArtifact requestRelease(String functionId, String version, String requestedBy) {
        Versioned<DecisionFunctionArtifact> current = load(functionId, version);
        DecisionFunctionArtifact artifact = current.value();
        requireStatus(artifact, FunctionStatus.DRAFT, "request release of");

        DecisionFunctionArtifact updated = artifact.withStatus(FunctionStatus.PENDING_REVIEW, clock.instant());
        commit(current, updated, List.of(governanceRecord(EventType.RELEASE_REQUESTED, updated, requestedBy, null,
            transition(FunctionStatus.DRAFT, FunctionStatus.PENDING_REVIEW))));
        log.info("Release requested for {} by {}", updated.key(), requestedBy);
        return updated;
    }

    /**
     * Adds a verified signature. The second distinct role completes the
     * release and moves it to APPROVED. Signature verification is never
     * retried here; a signer outage fails the call.
     */
    public DecisionFunctionArtifact sign(String functionId, String version, String signerId,
                                         SignerRole role, byte[] signatureBytes) {
        Versioned<DecisionFunctionArtifact> current = load(functionId, version);
        DecisionFunctionArtifact artifact = current.value();
        requireStatus(artifact, FunctionStatus.PENDING_REVIEW, "sign");

        if (artifact.signature(role).isPresent()) {
            log.warn("Rejected second {} signature on {} by {}", role, artifact.key(), signerId);
            throw new SeparationOfDutiesException(artifact.key() + " already carries a " + role + " signature");
        }
        Optional<SignerRole> heldRole = artifact.roleOf(signerId);
        if (heldRole.isPresent()) {
            log.warn("Rejected {} signature on {}: {} already signed as {}", role, artifact.key(), signerId,
                heldRole.get());
            throw new SeparationOfDutiesException(signerId + " already signed " + artifact.key() + " as "
                + heldRole.get() + " and cannot also sign as " + role);
        }
        if (!signer.verify(artifact.signingPayload(role), signatureBytes, signerId)) {
            log.warn("Rejected unverifiable {} signature on {} by {}", role, artifact.key(), signerId);
            throw new InvalidSignatureException(artifact.key(), signerId, role);
        }

        Instant now = clock.instant();
        DecisionFunctionArtifact updated = artifact.withSignature(new Signature(signerId, role, signatureBytes, now), now);
        boolean complete = updated.signature(role.other()).isPresent();
        if (complete) {
            updated = updated.withStatus(FunctionStatus.APPROVED, now);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("role", role.name());
        List<TraceRecord> events = new ArrayList<>();
        events.add(governanceRecord(EventType.RELEASE_SIGNED, updated, signerId, null, attributes));
        if (complete) {
            events.add(governanceRecord(EventType.RELEASE_APPROVED, updated, signerId, null,
                transition(FunctionStatus.PENDING_REVIEW, FunctionStatus.APPROVED)));
        }
        commit(current, updated, events);
        if (complete) {
            log.info("Release {} approved (owner={}, reviewer={})", updated.key(),
                updated.signature(SignerRole.OWNER).map(Signature::signerId).orElse(null),
                updated.signature(SignerRole.REVIEWER).map(Signature::signerId).orElse(null));
        }
        return updated;
    }

    /**
     * Sends a release under review back to DRAFT, discarding collected
     * signatures. Content stays frozen; changes still need a new version.
     */
    public DecisionFunctionArtifact reject(String functionId, String version, String reviewerId, String reason) {
        Versioned<DecisionFunctionArtifact> current = load(functionId, version);
        DecisionFunctionArtifact artifact = current.value();
        requireStatus(artifact, FunctionStatus.PENDING_REVIEW, "reject");

        Instant now = clock.instant();
        DecisionFunctionArtifact updated = artifact.withoutSignatures(now)
            .withReviewNote("rejected by " + reviewerId + ": " + reason, now)
            .withStatus(FunctionStatus.DRAFT, now);

        Map<String, String> attributes = transition(FunctionStatus.PENDING_REVIEW, FunctionStatus.DRAFT);
        attributes.put("reason", reason);
        commit(current, updated, List.of(governanceRecord(EventType.RELEASE_REJECTED, updated, reviewerId, null,
            attributes)));
        log.warn("Release {} rejected by {}", updated.key(), reviewerId);
        return updated;
    }

    /**
     * Puts an approved version into force from {@code effectiveFrom}, closing
     * the window of the version in force at that point, which becomes DEPRECATED.
     */
    public DecisionFunctionArtifact activate(String functionId, String version, Instant effectiveFrom,
                                             String activatedBy) {
        Versioned<DecisionFunctionArtifact> current = load(functionId, version);
        DecisionFunctionArtifact artifact = current.value();
        requireDistinctSigners(artifact);
        requireStatus(artifact, FunctionStatus.APPROVED, "activate");
        verifySignatures(artifact);

        Versioned<EffectiveVersionIndex> index = loadIndex(functionId);
        Optional<EffectiveWindow> superseded = index.value().openWindow();
        if (superseded.isPresent() && effectiveFrom.isBefore(superseded.get().effectiveFrom())) {
            throw new InvalidStateTransitionException("effective_from " + effectiveFrom + " of " + artifact.key()
                + " precedes " + superseded.get().effectiveFrom() + " of the version in force");
        }
        EffectiveVersionIndex updatedIndex;
        try {
            updatedIndex = index.value().withActivation(version, effectiveFrom);
        } catch (IllegalArgumentException ex) {
            throw new InvalidStateTransitionException("cannot activate " + artifact.key() + ": " + ex.getMessage());
        }

        Versioned<EffectiveVersionIndex> writtenIndex =
            indexes.compareAndSet(functionId, index.revision(), updatedIndex);
        DecisionFunctionArtifact activated = artifact.withStatus(FunctionStatus.ACTIVE, clock.instant());
        Versioned<DecisionFunctionArtifact> written;
        try {
            written = artifacts.compareAndSet(artifact.key(), current.revision(), activated);
        } catch (ConcurrentReleaseModificationException ex) {
            restore(indexes, functionId, writtenIndex, index.value(), ex);
            throw ex;
        }

        Map<String, String> attributes = transition(FunctionStatus.APPROVED, FunctionStatus.ACTIVE);
        superseded.ifPresent(window -> attributes.put("supersedes", window.version()));
        List<TraceRecord> events = new ArrayList<>();
        events.add(governanceRecord(EventType.VERSION_ACTIVATED, activated, activatedBy, effectiveFrom, attributes));
        Optional<Deprecation> deprecation = superseded
            .flatMap(window -> deprecate(functionId, window.version(), version, effectiveFrom, activatedBy));
        deprecation.ifPresent(d -> events.add(d.event()));
        try {
            ledger.appendAll(events);
        } catch (RuntimeException ex) {
            log.error("Reverting activation of {}: governance record failed", activated.key());
            deprecation.ifPresent(d -> restore(artifacts, d.previous().key(), d.written(), d.previous(), ex));
            restore(artifacts, artifact.key(), written, artifact, ex);
            restore(indexes, functionId, writtenIndex, index.value(), ex);
            throw ex;
        }
        log.info("Activated {} effective_from={}", activated.key(), effectiveFrom);
        deprecation.ifPresent(d -> log.info("Deprecated {} superseded_by={}", d.previous().key(), version));
        return activated;
    }

    /**
     * Closes the effective window of a version at {@code sunsetAt} and marks it
     * RETIRED. The artifact is kept for audit and replay.
     */
    public DecisionFunctionArtifact retire(String functionId, String version, Instant sunsetAt, String retiredBy) {
        Versioned<DecisionFunctionArtifact> current = load(functionId, version);
        DecisionFunctionArtifact artifact = current.value();
        FunctionStatus from = artifact.status();
        if (from != FunctionStatus.ACTIVE && from != FunctionStatus.DEPRECATED) {
            throw new InvalidStateTransitionException(artifact.key(), from, "retire");
        }

        Versioned<EffectiveVersionIndex> index = loadIndex(functionId);
        EffectiveVersionIndex updatedIndex;
        try {
            updatedIndex = index.value().withSunset(version, sunsetAt);
        } catch (IllegalArgumentException ex) {
            throw new InvalidStateTransitionException("cannot retire " + artifact.key() + ": " + ex.getMessage());
        }
        Versioned<EffectiveVersionIndex> writtenIndex =
            indexes.compareAndSet(functionId, index.revision(), updatedIndex);
        DecisionFunctionArtifact retired = artifact.withStatus(FunctionStatus.RETIRED, clock.instant());
        Map<String, String> attributes = transition(from, FunctionStatus.RETIRED);
        attributes.put("sunset_at", sunsetAt.toString());
        try {
            commit(current, retired, List.of(governanceRecord(EventType.VERSION_RETIRED, retired, retiredBy, sunsetAt,
                attributes)));
        } catch (RuntimeException ex) {
            restore(indexes, functionId, writtenIndex, index.value(), ex);
            throw ex;
        }
        log.info("Retired {} sunset_at={}", retired.key(), sunsetAt);
        return retired;
    }

    /**
     * The version in force for {@code functionId} at {@code asOf}.
     *
     * @throws VersionNotFoundException when no window covers {@code asOf}
     */
    public DecisionFunctionArtifact resolveActive(String functionId, Instant asOf) {
        EffectiveWindow window = effectiveIndex(functionId).resolve(asOf)
            .orElseThrow(() -> new VersionNotFoundException(functionId, asOf));
        return require(functionId, window.version());
    }

    public Optional<DecisionFunctionArtifact> find(String functionId, String version) {
        return artifacts.get(DecisionFunctionArtifact.key(functionId, version)).map(Versioned::value);
    }

    public DecisionFunctionArtifact require(String functionId, String version) {
        return find(functionId, version).orElseThrow(() -> new VersionNotFoundException(functionId, version));
    }

    public List<DecisionFunctionArtifact> versions(String functionId) {
        return artifacts.keys(functionId + "@").stream()
            .map(artifacts::get)
            .flatMap(Optional::stream)
            .map(Versioned::value)
            .filter(a -> a.functionId().equals(functionId))
            .sorted(Comparator.comparing(DecisionFunctionArtifact::createdAt))
            .toList();
    }

    public List<String> functionIds() {
        return artifacts.keys("").stream()
            .map(key -> artifacts.get(key).map(v -> v.value().functionId()).orElse(null))
            .filter(id -> id != null)
            .distinct()
            .toList();
    }

    public EffectiveVersionIndex effectiveIndex(String functionId) {
        return indexes.get(functionId).map(Versioned::value).orElse(EffectiveVersionIndex.empty(functionId));
    }

    /**
     * Marks the superseded version DEPRECATED. Its governance record is
     * returned so that it commits together with the activation.
     */
    private Optional<Deprecation> deprecate(String functionId, String version, String supersededBy, Instant at,
                                            String actor) {
        while (true) {
            Versioned<DecisionFunctionArtifact> current = load(functionId, version);
            DecisionFunctionArtifact artifact = current.value();
            if (artifact.status() != FunctionStatus.ACTIVE) {
                return Optional.empty();
            }
            DecisionFunctionArtifact deprecated = artifact.withStatus(FunctionStatus.DEPRECATED, clock.instant());
            try {
                Versioned<DecisionFunctionArtifact> written =
                    artifacts.compareAndSet(artifact.key(), current.revision(), deprecated);
                Map<String, String> attributes = transition(FunctionStatus.ACTIVE, FunctionStatus.DEPRECATED);
                attributes.put("superseded_by", supersededBy);
                return Optional.of(new Deprecation(artifact, written,
                    governanceRecord(EventType.VERSION_DEPRECATED, deprecated, actor, at, attributes)));
            } catch (ConcurrentReleaseModificationException ex) {
                log.debug("Retrying deprecation of {}@{} after concurrent update", functionId, version);
            }
        }
    }

    /**
     * Writes {@code updated} over {@code current} and records its governance
     * events. When the ledger refuses the events the write is reverted, so a
     * transition is either both stored and recorded or neither.
     */
    private void commit(Versioned<DecisionFunctionArtifact> current, DecisionFunctionArtifact updated,
                        List<TraceRecord> events) {
        DecisionFunctionArtifact previous = current.value();
        Versioned<DecisionFunctionArtifact> written =
            artifacts.compareAndSet(previous.key(), current.revision(), updated);
        try {
            ledger.appendAll(events);
        } catch (RuntimeException ex) {
            log.error("Reverting {} to {}: governance record failed", previous.key(), previous.status());
            restore(artifacts, previous.key(), written, previous, ex);
            throw ex;
        }
    }

    private static <T> void restore(RegistryStore<T> store, String key, Versioned<T> written, T previous,
                                    RuntimeException cause) {
        try {
            store.compareAndSet(key, written.revision(), previous);
        } catch (ConcurrentReleaseModificationException ex) {
            log.error("Could not revert {}: modified concurrently", key);
            cause.addSuppressed(ex);
        }
    }

    private void validateLegalReferences(FunctionDraft draft) {
        List<String> rejected = new ArrayList<>();
        for (String iri : draft.metadata().legalReferences()) {
            LegalReferenceCheck check = legalReferenceValidator.validate(iri);
            if (!check.valid()) {
                rejected.add(iri);
            }
        }
        if (!rejected.isEmpty()) {
            log.warn("Rejected {}@{}: invalid legal references {}", draft.functionId(), draft.version(), rejected);
            throw new LegalReferenceException(draft.functionId(), draft.version(), rejected);
        }
    }

    private void requireDistinctSigners(DecisionFunctionArtifact artifact) {
        Optional<Signature> owner = artifact.signature(SignerRole.OWNER);
        Optional<Signature> reviewer = artifact.signature(SignerRole.REVIEWER);
        if (owner.isPresent() && reviewer.isPresent() && owner.get().signerId().equals(reviewer.get().signerId())) {
            log.warn("Refused to activate {}: owner and reviewer are both {}", artifact.key(), owner.get().signerId());
            throw new SeparationOfDutiesException("owner and reviewer of " + artifact.key()
                + " are the same identity: " + owner.get().signerId());
        }
        if (artifact.signatures().size() > 2) {
            throw new SeparationOfDutiesException(artifact.key() + " carries more than one signature per role");
        }
    }

    private void verifySignatures(DecisionFunctionArtifact artifact) {
        for (SignerRole role : SignerRole.values()) {
            Signature signature = artifact.signature(role).orElseThrow(() ->
                new InvalidStateTransitionException(artifact.key() + " is missing its " + role + " signature"));
            if (!signer.verify(artifact.signingPayload(role), signature.signatureBytes(), signature.signerId())) {
                throw new InvalidSignatureException(artifact.key(), signature.signerId(), role);
            }
        }
    }

    private Versioned<DecisionFunctionArtifact> load(String functionId, String version) {
        return artifacts.get(DecisionFunctionArtifact.key(functionId, version))
            .orElseThrow(() -> new VersionNotFoundException(functionId, version));
    }

    private Versioned<EffectiveVersionIndex> loadIndex(String functionId) {
        Optional<Versioned<EffectiveVersionIndex>> existing = indexes.get(functionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        indexes.putIfAbsent(functionId, EffectiveVersionIndex.empty(functionId));
        return indexes.get(functionId).orElseThrow();
    }

    private static void requireStatus(DecisionFunctionArtifact artifact, FunctionStatus expected, String operation) {
        if (artifact.status() != expected) {
            throw new InvalidStateTransitionException(artifact.key(), artifact.status(), operation);
        }
    }

    private static Map<String, String> transition(FunctionStatus from, FunctionStatus to) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("from_status", from.name());
        attributes.put("to_status", to.name());
        return attributes;
    }

    private TraceRecord governanceRecord(EventType type, DecisionFunctionArtifact artifact, String actor,
                                         Instant asOf, Map<String, String> attributes) {
        return TraceRecord.builder(type)
            .traceId(UUID.randomUUID().toString())
            .function(artifact.functionId(), artifact.version())
            .functionHash(artifact.functionHash())
            .callerId(actor)
            .timestamp(clock.instant())
            .asOf(asOf)
            .attributes(attributes)
            .build();
    }

    private record Deprecation(DecisionFunctionArtifact previous, Versioned<DecisionFunctionArtifact> written,
                               TraceRecord event) {
    }
}
