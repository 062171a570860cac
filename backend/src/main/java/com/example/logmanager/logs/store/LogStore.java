package com.example.logmanager.logs.store;

import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Map;

/**
 * Relational access used by the query layer. SQL uses {@code :name} placeholders; translating
 * them into whatever the driver expects is the implementation's job, so callers never depend
 * on placeholder syntax.
 */
public interface LogStore {

    <T> List<T> query(String sql, Map<String, ?> params, RowMapper<T> rowMapper);

    ExecutionResult execute(String sql, Map<String, ?> params);

    default long count(String sql, Map<String, ?> params) {
        List<Long> rows = query(sql, params, (rs, rowNum) -> rs.getLong(1));
        return rows.isEmpty() ? 0 : rows.get(0);
    }
}
