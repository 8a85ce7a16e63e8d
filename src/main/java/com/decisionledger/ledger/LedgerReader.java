package com.decisionledger.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the ledger. Audit only ever holds this type.
 */
public interface LedgerReader {

    Optional<TraceRecord> get(String traceId);

    /** Records of one function with {@code start <= timestamp < end}, in ledger order. */
    List<TraceRecord> rangeQuery(String functionId, Instant start, Instant end);

    List<TraceRecord> readRange(long fromSequence, long toSequence);

    List<TraceRecord> decisions(String functionId, String version);

    long size();

    IntegrityReport verifyIntegrity(long fromSequence, long toSequence);

    default IntegrityReport verifyIntegrity() {
        return verifyIntegrity(1, size());
    }
}
