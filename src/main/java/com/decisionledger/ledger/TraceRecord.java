package com.decisionledger.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One immutable ledger entry: a decision execution or a governance event on a
 * decision function. {@code sequence}, {@code prevHash} and {@code chainHash}
 * are assigned by the ledger writer; records built by callers leave them empty.
 */
public record TraceRecord(
    @JsonProperty("sequence") long sequence,
    @JsonProperty("trace_id") String traceId,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("function_id") String functionId,
    @JsonProperty("version") String version,
    @JsonProperty("function_hash") String functionHash,
    @JsonProperty("caller_id") String callerId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("as_of") Instant asOf,
    @JsonProperty("status") TraceStatus status,
    @JsonProperty("input_hash") String inputHash,
    @JsonProperty("output_hash") String outputHash,
    @JsonProperty("feature_snapshot_ref") String featureSnapshotRef,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("attributes") SortedMap<String, String> attributes,
    @JsonProperty("prev_hash") String prevHash,
    @JsonProperty("chain_hash") String chainHash
) {

    public TraceRecord {
        if (traceId == null || traceId.isBlank()) {
            throw new IllegalArgumentException("trace_id is required");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("event_type is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp is required");
        }
        attributes = Collections.unmodifiableSortedMap(attributes == null ? new TreeMap<>() : new TreeMap<>(attributes));
    }

    public static Builder builder(EventType eventType) {
        return new Builder(eventType);
    }

    public boolean isSealed() {
        return chainHash != null;
    }

    public boolean isDecision() {
        return eventType == EventType.DECISION_EXECUTED;
    }

    TraceRecord seal(long sequence, String prevHash) {
        return new TraceRecord(sequence, traceId, eventType, functionId, version, functionHash, callerId,
            timestamp, asOf, status, inputHash, outputHash, featureSnapshotRef, errorCode, attributes,
            prevHash, null);
    }

    TraceRecord withChainHash(String chainHash) {
        return new TraceRecord(sequence, traceId, eventType, functionId, version, functionHash, callerId,
            timestamp, asOf, status, inputHash, outputHash, featureSnapshotRef, errorCode, attributes,
            prevHash, chainHash);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(eventType);
        builder.sequence = sequence;
        builder.traceId = traceId;
        builder.functionId = functionId;
        builder.version = version;
        builder.functionHash = functionHash;
        builder.callerId = callerId;
        builder.timestamp = timestamp;
        builder.asOf = asOf;
        builder.status = status;
        builder.inputHash = inputHash;
        builder.outputHash = outputHash;
        builder.featureSnapshotRef = featureSnapshotRef;
        builder.errorCode = errorCode;
        builder.attributes.putAll(attributes);
        builder.prevHash = prevHash;
        builder.chainHash = chainHash;
        return builder;
    }

    public static final class Builder {

        private final EventType eventType;
        private long sequence;
        private String traceId;
        private String functionId;
        private String version;
        private String functionHash;
        private String callerId;
        private Instant timestamp;
        private Instant asOf;
        private TraceStatus status = TraceStatus.OK;
        private String inputHash;
        private String outputHash;
        private String featureSnapshotRef;
        private String errorCode;
        private final SortedMap<String, String> attributes = new TreeMap<>();
        private String prevHash;
        private String chainHash;

        private Builder(EventType eventType) {
            this.eventType = eventType;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder function(String functionId, String version) {
            this.functionId = functionId;
            this.version = version;
            return this;
        }

        public Builder functionHash(String functionHash) {
            this.functionHash = functionHash;
            return this;
        }

        public Builder callerId(String callerId) {
            this.callerId = callerId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder asOf(Instant asOf) {
            this.asOf = asOf;
            return this;
        }

        public Builder status(TraceStatus status) {
            this.status = status;
            return this;
        }

        public Builder inputHash(String inputHash) {
            this.inputHash = inputHash;
            return this;
        }

        public Builder outputHash(String outputHash) {
            this.outputHash = outputHash;
            return this;
        }

        public Builder featureSnapshotRef(String featureSnapshotRef) {
            this.featureSnapshotRef = featureSnapshotRef;
            return this;
        }

        public Builder errorCode(String errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder attribute(String key, String value) {
            if (value != null) {
                this.attributes.put(key, value);
            }
            return this;
        }

        public Builder attributes(Map<String, String> values) {
            values.forEach(this::attribute);
            return this;
        }

        public Builder chainHash(String chainHash) {
            this.chainHash = chainHash;
            return this;
        }

        public TraceRecord build() {
            return new TraceRecord(sequence, traceId, eventType, functionId, version, functionHash, callerId,
                timestamp, asOf, status, inputHash, outputHash, featureSnapshotRef, errorCode, attributes,
                prevHash, chainHash);
        }
    }
}
