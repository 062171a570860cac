package com.example.logmanager.logs.DTOs;

/**
 * Query-string filters of the log list. When {@code q} is present and passes validation it
 * replaces all discrete filters.
 */
public record LogFilterRequest(
        Integer limit,
        Integer offset,
        Integer page,
        Integer pageSize,
        String level,
        String source,
        String search,
        String startDate,
        String endDate,
        String category,
        String q) {

    public static LogFilterRequest empty() {
        return new LogFilterRequest(null, null, null, null, null, null, null, null, null, null, null);
    }

    public boolean hasQuery() {
        return q != null && !q.isBlank();
    }
}
