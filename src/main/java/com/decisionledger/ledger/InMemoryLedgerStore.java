package com.decisionledger.ledger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Arena-style store: position {@code i} holds sequence {@code i + 1}. Readers
 * see a consistent snapshot of whatever has been committed.
 */
public class InMemoryLedgerStore implements LedgerStore {

    private final CopyOnWriteArrayList<TraceRecord> records = new CopyOnWriteArrayList<>();
    private final Map<String, Long> sequenceByTraceId = new ConcurrentHashMap<>();

    @Override
    public synchronized void appendBatch(List<TraceRecord> batch) {
        long expected = records.size() + 1L;
        for (TraceRecord record : batch) {
            if (record.sequence() != expected++) {
                throw new IllegalStateException("out-of-order append: expected sequence " + (expected - 1)
                    + " but got " + record.sequence());
            }
            if (!record.isSealed()) {
                throw new IllegalStateException("unsealed record " + record.traceId());
            }
        }
        records.addAll(batch);
        batch.forEach(record -> sequenceByTraceId.put(record.traceId(), record.sequence()));
    }

    @Override
    public Optional<TraceRecord> findByTraceId(String traceId) {
        Long sequence = sequenceByTraceId.get(traceId);
        return sequence == null ? Optional.empty() : findBySequence(sequence);
    }

    @Override
    public Optional<TraceRecord> findBySequence(long sequence) {
        if (sequence < 1 || sequence > records.size()) {
            return Optional.empty();
        }
        return Optional.of(records.get((int) (sequence - 1)));
    }

    @Override
    public boolean existsByTraceId(String traceId) {
        return sequenceByTraceId.containsKey(traceId);
    }

    @Override
    public long getLatestSequence() {
        return records.size();
    }

    @Override
    public List<TraceRecord> query(Optional<String> functionId,
                                   Optional<EventType> eventType,
                                   Optional<Instant> fromInclusive,
                                   Optional<Instant> toExclusive,
                                   int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }

        return records.stream()
            .filter(r -> functionId.map(f -> f.equals(r.functionId())).orElse(true))
            .filter(r -> eventType.map(t -> t == r.eventType()).orElse(true))
            .filter(r -> fromInclusive.map(from -> !r.timestamp().isBefore(from)).orElse(true))
            .filter(r -> toExclusive.map(to -> r.timestamp().isBefore(to)).orElse(true))
            .limit(limit)
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<TraceRecord> queryBySequenceRange(long fromInclusive, long toInclusive, int limit) {
        if (limit <= 0 || toInclusive < fromInclusive) {
            return Collections.emptyList();
        }
        List<TraceRecord> snapshot = records;
        long from = Math.max(1, fromInclusive);
        long to = Math.min(snapshot.size(), toInclusive);
        List<TraceRecord> result = new ArrayList<>();
        for (long seq = from; seq <= to && result.size() < limit; seq++) {
            result.add(snapshot.get((int) (seq - 1)));
        }
        return result;
    }
}
