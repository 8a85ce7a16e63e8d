package com.decisionledger.ledger;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only log storage behind the ledger. Records arrive sealed and in
 * sequence order; the store never assigns or rewrites anything.
 */
public interface LedgerStore {

    void appendBatch(List<TraceRecord> records);

    Optional<TraceRecord> findByTraceId(String traceId);

    Optional<TraceRecord> findBySequence(long sequence);

    boolean existsByTraceId(String traceId);

    long getLatestSequence();

    List<TraceRecord> query(Optional<String> functionId,
                            Optional<EventType> eventType,
                            Optional<Instant> fromInclusive,
                            Optional<Instant> toExclusive,
                            int limit);

    List<TraceRecord> queryBySequenceRange(long fromInclusive, long toInclusive, int limit);
}
