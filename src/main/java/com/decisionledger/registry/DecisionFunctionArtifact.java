package com.decisionledger.registry;

import com.decisionledger.common.CanonicalJson;
import com.decisionledger.common.Hashing;
import com.decisionledger.contract.DataSchema;
import com.decisionledger.logic.Evaluatable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One version of a decision function. Instances are immutable; lifecycle
 * changes produce new instances that share the frozen content (logic, schemas,
 * feature binding and the hashes derived from them).
 */
public final class DecisionFunctionArtifact {

    private final String functionId;
    private final String version;
    private final Evaluatable logic;
    private final DataSchema inputSchema;
    private final DataSchema outputSchema;
    private final FeatureBinding featureBinding;
    private final String logicHash;
    private final String functionHash;
    private final FunctionMetadata metadata;
    private final FunctionStatus status;
    private final List<Signature> signatures;
    private final List<String> reviewNotes;
    private final Instant createdAt;
    private final Instant updatedAt;

    private DecisionFunctionArtifact(String functionId, String version, Evaluatable logic,
                                     DataSchema inputSchema, DataSchema outputSchema,
                                     FeatureBinding featureBinding, String logicHash, String functionHash,
                                     FunctionMetadata metadata, FunctionStatus status,
                                     List<Signature> signatures, List<String> reviewNotes,
                                     Instant createdAt, Instant updatedAt) {
        this.functionId = functionId;
        this.version = version;
        this.logic = logic;
        this.inputSchema = inputSchema;
        this.outputSchema = outputSchema;
        this.featureBinding = featureBinding;
        this.logicHash = logicHash;
        this.functionHash = functionHash;
        this.metadata = metadata;
        this.status = status;
        this.signatures = List.copyOf(signatures);
        this.reviewNotes = List.copyOf(reviewNotes);
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static DecisionFunctionArtifact draft(String functionId, String version, Evaluatable logic,
                                                 DataSchema inputSchema, DataSchema outputSchema,
                                                 FeatureBinding featureBinding, FunctionMetadata metadata,
                                                 List<String> reviewNotes, Instant createdAt) {
        requireText(functionId, "function_id");
        requireText(version, "version");
        if (logic == null || inputSchema == null || outputSchema == null || metadata == null) {
            throw new IllegalArgumentException("logic, schemas and metadata are required");
        }
        FeatureBinding binding = featureBinding == null ? FeatureBinding.none() : featureBinding;
        String logicHash = logic.logicHash();
        return new DecisionFunctionArtifact(functionId, version, logic, inputSchema, outputSchema, binding,
            logicHash, computeFunctionHash(functionId, version, logicHash, inputSchema, outputSchema, binding),
            metadata, FunctionStatus.DRAFT, List.of(), reviewNotes == null ? List.of() : reviewNotes,
            createdAt, createdAt);
    }

    public static String key(String functionId, String version) {
        return functionId + "@" + version;
    }

    public String key() {
        return key(functionId, version);
    }

    public DecisionFunctionArtifact withStatus(FunctionStatus newStatus, Instant at) {
        return new DecisionFunctionArtifact(functionId, version, logic, inputSchema, outputSchema, featureBinding,
            logicHash, functionHash, metadata, newStatus, signatures, reviewNotes, createdAt, at);
    }

    public DecisionFunctionArtifact withSignature(Signature signature, Instant at) {
        List<Signature> updated = new ArrayList<>(signatures);
        updated.add(signature);
        return new DecisionFunctionArtifact(functionId, version, logic, inputSchema, outputSchema, featureBinding,
            logicHash, functionHash, metadata, status, updated, reviewNotes, createdAt, at);
    }

    public DecisionFunctionArtifact withoutSignatures(Instant at) {
        return new DecisionFunctionArtifact(functionId, version, logic, inputSchema, outputSchema, featureBinding,
            logicHash, functionHash, metadata, status, List.of(), reviewNotes, createdAt, at);
    }

    public DecisionFunctionArtifact withReviewNote(String note, Instant at) {
        List<String> updated = new ArrayList<>(reviewNotes);
        updated.add(note);
        return new DecisionFunctionArtifact(functionId, version, logic, inputSchema, outputSchema, featureBinding,
            logicHash, functionHash, metadata, status, signatures, updated, createdAt, at);
    }

    /**
     * Bytes a signer signs for the given role: canonical JSON of the frozen
     * content identity plus the role, so a signature can neither move to
     * another version nor switch roles.
     */
    public byte[] signingPayload(SignerRole role) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("function_id", functionId);
        payload.put("version", version);
        payload.put("logic_hash", logicHash);
        payload.put("input_schema_hash", inputSchema.contentHash());
        payload.put("output_schema_hash", outputSchema.contentHash());
        payload.put("role", role.name());
        return CanonicalJson.bytes(payload);
    }

    public Optional<Signature> signature(SignerRole role) {
        return signatures.stream().filter(s -> s.role() == role).findFirst();
    }

    public Optional<SignerRole> roleOf(String signerId) {
        return signatures.stream().filter(s -> s.signerId().equals(signerId)).map(Signature::role).findFirst();
    }

    public String functionId() {
        return functionId;
    }

    public String version() {
        return version;
    }

    public Evaluatable logic() {
        return logic;
    }

    public DataSchema inputSchema() {
        return inputSchema;
    }

    public DataSchema outputSchema() {
        return outputSchema;
    }

    public FeatureBinding featureBinding() {
        return featureBinding;
    }

    public String logicHash() {
        return logicHash;
    }

    /** Hash identifying the complete frozen content, recorded on every trace. */
    public String functionHash() {
        return functionHash;
    }

    public FunctionMetadata metadata() {
        return metadata;
    }

    public FunctionStatus status() {
        return status;
    }

    public List<Signature> signatures() {
        return signatures;
    }

    public List<String> reviewNotes() {
        return reviewNotes;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "DecisionFunctionArtifact[" + key() + ", status=" + status + ", logic_hash=" + logicHash + "]";
    }

    private static String computeFunctionHash(String functionId, String version, String logicHash,
                                              DataSchema inputSchema, DataSchema outputSchema,
                                              FeatureBinding binding) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("function_id", functionId);
        content.put("version", version);
        content.put("logic_hash", logicHash);
        content.put("input_schema_hash", inputSchema.contentHash());
        content.put("output_schema_hash", outputSchema.contentHash());
        content.put("feature_binding", binding);
        return Hashing.sha256Hex(CanonicalJson.bytes(content));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
