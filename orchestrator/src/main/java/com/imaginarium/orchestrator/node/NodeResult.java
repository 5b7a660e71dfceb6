package com.imaginarium.orchestrator.node;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Successful outcome of a node execution.
 *
 * @param outputs    Values keyed by output handle.
 * @param cost       Provider cost attributed to this call (zero when free).
 * @param tokensUsed Provider tokens consumed (zero for non-AI nodes).
 */
public record NodeResult(Map<String, Object> outputs, BigDecimal cost, long tokensUsed) {

    public NodeResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        cost    = cost == null ? BigDecimal.ZERO : cost;
    }

    public static NodeResult of(Map<String, Object> outputs) {
        return new NodeResult(outputs, BigDecimal.ZERO, 0);
    }
}
