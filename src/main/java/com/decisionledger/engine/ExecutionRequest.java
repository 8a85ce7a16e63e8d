package com.decisionledger.engine;

import java.time.Instant;
import java.util.Map;

/**
 * A request to evaluate a decision function. A null {@code version} means the
 * version in force at {@code asOf}; a null {@code asOf} means now.
 */
public record ExecutionRequest(
    String functionId,
    String version,
    Map<String, Object> input,
    String callerId,
    Instant asOf
) {

    public ExecutionRequest {
        if (functionId == null || functionId.isBlank()) {
            throw new IllegalArgumentException("function_id is required");
        }
        if (callerId == null || callerId.isBlank()) {
            throw new IllegalArgumentException("caller_id is required");
        }
        if (input == null) {
            throw new IllegalArgumentException("input is required");
        }
    }

    public static ExecutionRequest latest(String functionId, Map<String, Object> input, String callerId, Instant asOf) {
        return new ExecutionRequest(functionId, null, input, callerId, asOf);
    }

    public static ExecutionRequest pinned(String functionId, String version, Map<String, Object> input,
                                          String callerId, Instant asOf) {
        return new ExecutionRequest(functionId, version, input, callerId, asOf);
    }
}
