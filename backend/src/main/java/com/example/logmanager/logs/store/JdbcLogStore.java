package com.example.logmanager.logs.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

@Slf4j
@Repository
public class JdbcLogStore implements LogStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcLogStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public <T> List<T> query(String sql, Map<String, ?> params, RowMapper<T> rowMapper) {
        log.debug("Executing query: {} with {} parameter(s)", sql, params.size());
        return jdbcTemplate.query(sql, new MapSqlParameterSource(params), rowMapper);
    }

    @Override
    public ExecutionResult execute(String sql, Map<String, ?> params) {
        log.debug("Executing statement: {} with {} parameter(s)", sql, params.size());
        MapSqlParameterSource source = new MapSqlParameterSource(params);

        if (!sql.stripLeading().regionMatches(true, 0, "INSERT", 0, 6)) {
            return new ExecutionResult(jdbcTemplate.update(sql, source), null);
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        int affected = jdbcTemplate.update(sql, source, keyHolder, new String[]{"id"});
        Number key = keyHolder.getKey();
        return new ExecutionResult(affected, key == null ? null : key.longValue());
    }
}
