package com.decisionledger.ledger;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.Hashing;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hashing contract of the ledger:
 * {@code chain_hash[i] = SHA-256(chain_hash[i-1] || canonical(record[i] without chain_hash))},
 * with {@code chain_hash[0]} replaced by a genesis value derived from a fixed seed.
 */
public final class ChainHasher {

    private final String genesisHash;

    public ChainHasher(String genesisSeed) {
        if (genesisSeed == null || genesisSeed.isBlank()) {
            throw new IllegalArgumentException("genesis seed is required");
        }
        this.genesisHash = Hashing.sha256Hex("decision-ledger/genesis/" + genesisSeed);
    }

    public String genesisHash() {
        return genesisHash;
    }

    public String chainHash(String previousChainHash, TraceRecord record) {
        return Hashing.sha256Hex(previousChainHash + canonicalBody(record));
    }

    /** Canonical bytes of a record, chain hash excluded. */
    public static String canonicalBody(TraceRecord record) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sequence", record.sequence());
        body.put("trace_id", record.traceId());
        body.put("event_type", record.eventType());
        body.put("function_id", record.functionId());
        body.put("version", record.version());
        body.put("function_hash", record.functionHash());
        body.put("caller_id", record.callerId());
        body.put("timestamp", record.timestamp());
        body.put("as_of", record.asOf());
        body.put("status", record.status());
        body.put("input_hash", record.inputHash());
        body.put("output_hash", record.outputHash());
        body.put("feature_snapshot_ref", record.featureSnapshotRef());
        body.put("error_code", record.errorCode());
        body.put("attributes", record.attributes());
        body.put("prev_hash", record.prevHash());
        return CanonicalJson.write(body);
    }
}
