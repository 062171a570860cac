package com.example.logmanager.logs.store;

import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collections;
import java.util.Map;

/**
 * Maps a row of {@link #COLUMNS} to the API representation of a log.
 */
@Slf4j
@Component
public class LogRowMapper implements RowMapper<LogEntryResponse> {

    public static final String COLUMNS = "id, timestamp, level, source, message, ip, category, metadata";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public LogRowMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public LogEntryResponse mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp timestamp = rs.getTimestamp("timestamp");
        return new LogEntryResponse(
                rs.getLong("id"),
                timestamp == null ? null : timestamp.toInstant(),
                rs.getString("level"),
                rs.getString("source"),
                rs.getString("message"),
                rs.getString("ip"),
                rs.getString("category"),
                readMetadata(rs.getLong("id"), rs.getString("metadata"))
        );
    }

    private Map<String, Object> readMetadata(long id, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable metadata on log {}: {}", id, e.getOriginalMessage());
            return Collections.emptyMap();
        }
    }
}
