package com.example.logmanager.logs.query;

import java.util.List;
import java.util.Map;

/**
 * @param clauses     SQL fragments interleaved with the AND/OR operators joining them
 * @param params      bound values keyed by parameter name, in insertion order
 * @param resolutions per-token outcome, including dropped tokens
 */
public record ConditionSet(List<String> clauses, Map<String, Object> params, List<TokenResolution> resolutions) {

    public boolean isEmpty() {
        return clauses.isEmpty();
    }

    public List<TokenResolution.Dropped> dropped() {
        return resolutions.stream()
                .filter(TokenResolution.Dropped.class::isInstance)
                .map(TokenResolution.Dropped.class::cast)
                .toList();
    }
}
