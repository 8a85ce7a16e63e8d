package com.decisionledger.ledger;

import com.decisionledger.common.DecisionLedgerException;
import com.decisionledger.integration.ExternalDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hash-chained, append-only ledger. Appends are linearized through one writer
 * thread which drains the queue in order-preserving batches; callers compute
 * their records in parallel and only wait for the commit. Reads go straight to
 * the store and never block on the writer.
 */
public class TraceLedger implements LedgerReader, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TraceLedger.class);

    private final LedgerStore store;
    private final ChainHasher hasher;
    private final int maxBatchSize;
    private final Duration appendTimeout;
    private final BlockingQueue<PendingAppend> queue = new LinkedBlockingQueue<>();
    private final Thread writer;
    private volatile boolean running = true;

    // writer-confined
    private long tailSequence;
    private String tailHash;

    public TraceLedger(LedgerStore store, ChainHasher hasher, int maxBatchSize, Duration appendTimeout) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be positive");
        }
        this.store = store;
        this.hasher = hasher;
        this.maxBatchSize = maxBatchSize;
        this.appendTimeout = appendTimeout;
        this.tailSequence = store.getLatestSequence();
        this.tailHash = store.findBySequence(tailSequence)
            .map(TraceRecord::chainHash)
            .orElse(hasher.genesisHash());
        this.writer = new Thread(this::drain, "trace-ledger-writer");
        this.writer.setDaemon(true);
        this.writer.start();
        log.info("Trace ledger writer started at sequence={}", tailSequence);
    }

    /**
     * Appends a record and waits for it to be committed. The wait is not
     * abandoned on interrupt: once handed to the writer a record is either
     * committed or rejected, and the caller learns which. The interrupt flag
     * is restored afterwards.
     */
    public TraceRecord append(TraceRecord record) {
        return appendAll(List.of(record)).get(0);
    }

    /**
     * Appends records as one unit: they are committed in the same store batch
     * at consecutive sequences, or none of them is.
     */
    public List<TraceRecord> appendAll(List<TraceRecord> records) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("nothing to append");
        }
        for (TraceRecord record : records) {
            if (record.isSealed()) {
                throw new IllegalArgumentException("record " + record.traceId() + " is already sealed");
            }
        }
        if (!running) {
            throw new IllegalStateException("trace ledger is closed");
        }
        PendingAppend pending = new PendingAppend(List.copyOf(records), new CompletableFuture<>());
        queue.add(pending);
        return await(pending);
    }

    @Override
    public Optional<TraceRecord> get(String traceId) {
        return store.findByTraceId(traceId);
    }

    @Override
    public List<TraceRecord> rangeQuery(String functionId, Instant start, Instant end) {
        return store.query(Optional.of(functionId), Optional.empty(), Optional.of(start), Optional.of(end),
            Integer.MAX_VALUE);
    }

    @Override
    public List<TraceRecord> readRange(long fromSequence, long toSequence) {
        return store.queryBySequenceRange(fromSequence, toSequence, Integer.MAX_VALUE);
    }

    @Override
    public List<TraceRecord> decisions(String functionId, String version) {
        return store.query(Optional.of(functionId), Optional.of(EventType.DECISION_EXECUTED),
                Optional.empty(), Optional.empty(), Integer.MAX_VALUE).stream()
            .filter(r -> version == null || version.equals(r.version()))
            .toList();
    }

    @Override
    public long size() {
        return store.getLatestSequence();
    }

    @Override
    public IntegrityReport verifyIntegrity(long fromSequence, long toSequence) {
        long from = Math.max(1, fromSequence);
        long to = Math.min(size(), toSequence);
        if (to < from) {
            return IntegrityReport.intact(0);
        }

        String anchor = from == 1
            ? hasher.genesisHash()
            : store.findBySequence(from - 1).map(TraceRecord::chainHash).orElse(null);
        long expectedSequence = from;
        long checked = 0;
        for (TraceRecord record : store.queryBySequenceRange(from, to, Integer.MAX_VALUE)) {
            checked++;
            boolean linked = record.sequence() == expectedSequence
                && anchor != null
                && anchor.equals(record.prevHash())
                && hasher.chainHash(anchor, record).equals(record.chainHash());
            if (!linked) {
                log.error("Ledger chain broken at sequence={} trace_id={}", record.sequence(), record.traceId());
                return IntegrityReport.brokenAt(record, checked);
            }
            anchor = record.chainHash();
            expectedSequence++;
        }
        return IntegrityReport.intact(checked);
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        try {
            writer.join(appendTimeout.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
        log.info("Trace ledger writer stopped at sequence={}", size());
    }

    private List<TraceRecord> await(PendingAppend pending) {
        long deadline = System.nanoTime() + appendTimeout.toNanos();
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return pending.result().get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                } catch (InterruptedException ex) {
                    interrupted = true;
                } catch (ExecutionException ex) {
                    if (ex.getCause() instanceof DecisionLedgerException failure) {
                        throw failure;
                    }
                    throw new IllegalStateException("ledger append failed", ex.getCause());
                } catch (TimeoutException ex) {
                    throw new ExternalDependencyException("ledger",
                        "append of " + pending.records().get(0).traceId() + " not acknowledged within " + appendTimeout, ex);
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void drain() {
        List<PendingAppend> batch = new ArrayList<>(maxBatchSize);
        while (running || !queue.isEmpty()) {
            try {
                PendingAppend first = queue.poll(50, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, maxBatchSize - 1);
                commit(batch);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                log.warn("Trace ledger writer interrupted with {} pending appends", queue.size());
                return;
            } finally {
                batch.clear();
            }
        }
    }

    private void commit(List<PendingAppend> batch) {
        List<TraceRecord> sealed = new ArrayList<>();
        List<PendingAppend> accepted = new ArrayList<>(batch.size());
        List<List<TraceRecord>> committed = new ArrayList<>(batch.size());
        Set<String> batchTraceIds = new HashSet<>();
        long sequence = tailSequence;
        String previous = tailHash;

        for (PendingAppend pending : batch) {
            String duplicate = duplicateTraceId(pending.records(), batchTraceIds);
            if (duplicate != null) {
                pending.result().completeExceptionally(new DuplicateTraceException(duplicate));
                continue;
            }
            List<TraceRecord> group = new ArrayList<>(pending.records().size());
            for (TraceRecord record : pending.records()) {
                batchTraceIds.add(record.traceId());
                TraceRecord linked = record.seal(++sequence, previous);
                TraceRecord chained = linked.withChainHash(hasher.chainHash(previous, linked));
                group.add(chained);
                previous = chained.chainHash();
            }
            sealed.addAll(group);
            accepted.add(pending);
            committed.add(group);
        }
        if (sealed.isEmpty()) {
            return;
        }

        try {
            store.appendBatch(sealed);
        } catch (RuntimeException ex) {
            log.error("Ledger store rejected batch of {} records: {}", sealed.size(), ex.getMessage());
            ExternalDependencyException failure = new ExternalDependencyException("ledger", "batch commit failed", ex);
            accepted.forEach(pending -> pending.result().completeExceptionally(failure));
            return;
        }
        tailSequence = sequence;
        tailHash = previous;
        for (int i = 0; i < accepted.size(); i++) {
            accepted.get(i).result().complete(committed.get(i));
        }
        log.debug("Committed ledger batch size={} tail_sequence={}", sealed.size(), tailSequence);
    }

    private String duplicateTraceId(List<TraceRecord> records, Set<String> batchTraceIds) {
        Set<String> groupTraceIds = new HashSet<>();
        for (TraceRecord record : records) {
            String traceId = record.traceId();
            if (batchTraceIds.contains(traceId) || !groupTraceIds.add(traceId) || store.existsByTraceId(traceId)) {
                return traceId;
            }
        }
        return null;
    }

    private record PendingAppend(List<TraceRecord> records, CompletableFuture<List<TraceRecord>> result) {
    }
}
