package com.decisionledger.audit;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.common.Hashing;
import com.decisionledger.config.DecisionLedgerProperties;
import com.decisionledger.engine.DecisionEngine;
import com.decisionledger.engine.ExecutionCancelledException;
import com.decisionledger.engine.InactiveFunctionException;
import com.decisionledger.engine.PayloadArchive;
import com.decisionledger.ledger.ChainIntegrityException;
import com.decisionledger.ledger.IntegrityReport;
import com.decisionledger.ledger.LedgerReader;
import com.decisionledger.ledger.TraceRecord;
import com.decisionledger.ledger.TraceStatus;
import com.decisionledger.registry.VersionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Independent verification of the ledger. Reads the ledger through
 * {@link LedgerReader}, re-executes recorded decisions through
 * {@link DecisionEngine#replay} and never appends anything.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final LedgerReader ledger;
    private final DecisionEngine engine;
    private final PayloadArchive archive;
    private final ExecutorService replayPool;
    private final List<String> decisionFields;
    private final Set<String> positiveValues;

    public AuditService(LedgerReader ledger,
                        DecisionEngine engine,
                        PayloadArchive archive,
                        DecisionLedgerProperties properties,
                        @Qualifier("auditReplayPool") ExecutorService replayPool) {
        this.ledger = ledger;
        this.engine = engine;
        this.archive = archive;
        this.replayPool = replayPool;
        this.decisionFields = List.copyOf(properties.getAudit().getDecisionFields());
        this.positiveValues = properties.getAudit().getPositiveValues().stream()
            .map(v -> v.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public ChainVerificationReport verifyChain() {
        long size = ledger.size();
        IntegrityReport integrity = ledger.verifyIntegrity(1, size);
        long decisions = 0;
        long governance = 0;
        Set<String> coverage = new TreeSet<>();
        for (TraceRecord record : ledger.readRange(1, size)) {
            if (record.isDecision()) {
                decisions++;
                if (record.version() != null) {
                    coverage.add(record.functionId() + "@" + record.version());
                }
            } else if (record.eventType().isGovernance()) {
                governance++;
            }
        }
        if (integrity.ok()) {
            log.info("Ledger verified: {} records, {} decisions across {} versions", integrity.recordsChecked(),
                decisions, coverage.size());
        } else {
            log.error("Ledger integrity broken at trace_id={} after {} records", integrity.firstBrokenTraceId(),
                integrity.recordsChecked());
        }
        return new ChainVerificationReport(integrity.ok(), integrity.firstBrokenTraceId(),
            integrity.recordsChecked(), decisions, governance, coverage);
    }

    /**
     * @throws ChainIntegrityException when any record fails verification
     */
    public ChainVerificationReport requireIntactChain() {
        long size = ledger.size();
        IntegrityReport integrity = ledger.verifyIntegrity(1, size);
        if (!integrity.ok()) {
            throw new ChainIntegrityException(integrity);
        }
        return verifyChain();
    }

    /**
     * Replays a recorded decision. Against its own version (or with a null
     * {@code againstVersion}) this is a determinism check and any difference
     * raises {@link DeterminismViolationException}. Against another version the
     * difference is classified by the configured decision fields.
     */
    public DriftReport replay(String traceId, String againstVersion) {
        DriftReport report = replayInternal(traceId, null, againstVersion);
        if (report.classification() == DriftClassification.VIOLATION) {
            log.error("Determinism violation on trace_id={} {}@{} expected={} actual={}", traceId,
                report.functionId(), report.replayedVersion(), report.originalOutputHash(),
                report.replayedOutputHash());
            throw new DeterminismViolationException(report);
        }
        return report;
    }

    public DriftReport replay(String traceId) {
        return replay(traceId, null);
    }

    /**
     * Replays the given traces against {@code version}. Traces recorded for
     * another function count as unavailable.
     */
    public BulkReplayReport bulkReplay(String functionId, String version, List<String> traceIds) {
        List<CompletableFuture<Optional<DriftReport>>> replays = traceIds.stream()
            .map(traceId -> CompletableFuture.supplyAsync(() -> replayForBatch(traceId, functionId, version),
                replayPool))
            .toList();

        List<DriftReport> reports = new ArrayList<>();
        for (CompletableFuture<Optional<DriftReport>> replay : replays) {
            try {
                replay.join().ifPresent(reports::add);
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw ex;
            }
        }

        BulkReplayReport summary = BulkReplayReport.of(functionId, version, traceIds.size(), reports);
        log.info("Bulk replay {}@{}: total={} identical={} regressions={} improvements={} neutral={} "
                + "violations={} unavailable={} -> {}", functionId, version, summary.total(), summary.identical(),
            summary.regressions(), summary.improvements(), summary.neutral(), summary.violations(),
            summary.unavailable(), summary.recommendation());
        return summary;
    }

    /** Replays the latest {@code sampleSize} successful decisions of the function against {@code version}. */
    public BulkReplayReport bulkReplay(String functionId, String version, int sampleSize) {
        if (sampleSize < 0) {
            throw new IllegalArgumentException("sampleSize must not be negative: " + sampleSize);
        }
        List<String> traceIds = ledger.decisions(functionId, null).stream()
            .filter(r -> r.status() == TraceStatus.OK)
            .map(TraceRecord::traceId)
            .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(traceIds);
        return bulkReplay(functionId, version, traceIds.subList(0, Math.min(sampleSize, traceIds.size())));
    }

    private Optional<DriftReport> replayForBatch(String traceId, String functionId, String version) {
        try {
            return Optional.of(replayInternal(traceId, functionId, version));
        } catch (ReplayUnavailableException ex) {
            log.warn("Skipping trace_id={} in bulk replay: {}", traceId, ex.getMessage());
            return Optional.empty();
        }
    }

    private DriftReport replayInternal(String traceId, String expectedFunctionId, String againstVersion) {
        TraceRecord original = ledger.get(traceId)
            .orElseThrow(() -> new ReplayUnavailableException(traceId, "no such trace"));
        if (expectedFunctionId != null && !expectedFunctionId.equals(original.functionId())) {
            throw new ReplayUnavailableException(traceId, "recorded for " + original.functionId() + ", not "
                + expectedFunctionId);
        }
        if (!original.isDecision() || original.status() != TraceStatus.OK) {
            throw new ReplayUnavailableException(traceId, "only successful decisions can be replayed");
        }
        Map<String, Object> input = archived(traceId, original.inputHash(), "input");
        Map<String, Object> snapshot = archived(traceId, original.featureSnapshotRef(), "feature snapshot");
        Map<String, Object> originalOutput = archived(traceId, original.outputHash(), "output");

        String version = againstVersion == null ? original.version() : againstVersion;
        boolean determinismCheck = version.equals(original.version());

        Map<String, Object> replayed = null;
        String replayError = null;
        try {
            replayed = engine.replay(original.functionId(), version, input, snapshot, original.asOf());
        } catch (VersionNotFoundException | InactiveFunctionException | ExecutionCancelledException ex) {
            throw ex;
        } catch (DecisionLedgerException ex) {
            replayError = ex.getErrorCode() + ": " + ex.getMessage();
        }

        String replayedHash = replayed == null ? null : CanonicalJson.hash(replayed);
        boolean match = original.outputHash().equals(replayedHash);
        DriftClassification classification;
        if (match) {
            classification = DriftClassification.IDENTICAL;
        } else if (determinismCheck) {
            classification = DriftClassification.VIOLATION;
        } else if (replayed == null) {
            classification = DriftClassification.REGRESSION;
        } else {
            classification = classify(originalOutput, replayed);
        }
        return new DriftReport(traceId, original.functionId(), original.version(), version,
            original.outputHash(), replayedHash, match, classification,
            replayed == null ? List.of() : changedFields(originalOutput, replayed), replayError);
    }

    private Map<String, Object> archived(String traceId, String hash, String what) {
        if (hash == null) {
            throw new ReplayUnavailableException(traceId, "trace records no " + what + " hash");
        }
        String canonical = archive.getCanonical(hash)
            .orElseThrow(() -> new ReplayUnavailableException(traceId, what + " " + hash + " is not archived"));
        if (!Hashing.sha256Hex(canonical).equals(hash)) {
            throw new ReplayUnavailableException(traceId, "archived " + what + " does not match hash " + hash);
        }
        return CanonicalJson.readMap(canonical);
    }

    /**
     * Compares the first decision field whose value flips between a favourable
     * and an unfavourable outcome. No such flip means the change is neutral.
     */
    DriftClassification classify(Map<String, Object> original, Map<String, Object> replayed) {
        for (String field : decisionFields) {
            if (!original.containsKey(field) || !replayed.containsKey(field)) {
                continue;
            }
            Boolean before = favourable(original.get(field));
            Boolean after = favourable(replayed.get(field));
            if (before == null || after == null) {
                continue;
            }
            if (before && !after) {
                return DriftClassification.REGRESSION;
            }
            if (!before && after) {
                return DriftClassification.IMPROVEMENT;
            }
        }
        return DriftClassification.NEUTRAL;
    }

    private Boolean favourable(Object value) {
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return positiveValues.contains(text.toLowerCase(Locale.ROOT));
        }
        return null;
    }

    private static List<String> changedFields(Map<String, Object> original, Map<String, Object> replayed) {
        Set<String> fields = new TreeSet<>(original.keySet());
        fields.addAll(replayed.keySet());
        return fields.stream()
            .filter(field -> !Objects.equals(original.get(field), replayed.get(field))
                || original.containsKey(field) != replayed.containsKey(field))
            .toList();
    }
}
