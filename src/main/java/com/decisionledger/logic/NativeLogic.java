package com.decisionledger.logic;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logic backed by Java code. The code reference names the implementation
 * (for example {@code "loan-eligibility@1.0.0"}) and is what the logic hash
 * covers, since compiled code has no portable canonical form.
 */
public final class NativeLogic implements Evaluatable {

    private final String codeRef;
    private final DecisionLogic logic;

    public NativeLogic(String codeRef, DecisionLogic logic) {
        if (codeRef == null || codeRef.isBlank()) {
            throw new IllegalArgumentException("code_ref is required");
        }
        if (logic == null) {
            throw new IllegalArgumentException("logic is required");
        }
        this.codeRef = codeRef;
        this.logic = logic;
    }

    public String codeRef() {
        return codeRef;
    }

    @Override
    public Map<String, Object> execute(Map<String, Object> input, EvaluationContext context) {
        try {
            Map<String, Object> output = logic.apply(input, context);
            if (output == null) {
                throw new LogicFailureException("native logic " + codeRef + " returned no output", null);
            }
            return output;
        } catch (LogicFailureException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new LogicFailureException("native logic " + codeRef + " failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public Map<String, Object> descriptor() {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("kind", "native");
        descriptor.put("code_ref", codeRef);
        return descriptor;
    }
}
