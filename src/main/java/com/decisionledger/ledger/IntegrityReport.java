package com.decisionledger.ledger;

/**
 * Result of recomputing the hash chain over a sequence range.
 */
public record IntegrityReport(boolean ok, String firstBrokenTraceId, long firstBrokenSequence, long recordsChecked) {

    public static IntegrityReport intact(long recordsChecked) {
        return new IntegrityReport(true, null, 0, recordsChecked);
    }

    public static IntegrityReport brokenAt(TraceRecord record, long recordsChecked) {
        return new IntegrityReport(false, record.traceId(), record.sequence(), recordsChecked);
    }
}
