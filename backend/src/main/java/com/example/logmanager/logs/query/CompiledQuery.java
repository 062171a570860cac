package com.example.logmanager.logs.query;

import java.util.Map;

/**
 * A WHERE predicate built only from whitelisted fragments, plus the named values it binds.
 */
public record CompiledQuery(String where, Map<String, Object> params) {

    public static final String MATCH_ALL = "1=1";

    public static CompiledQuery matchAll() {
        return new CompiledQuery(MATCH_ALL, Map.of());
    }

    public boolean isMatchAll() {
        return MATCH_ALL.equals(where);
    }
}
