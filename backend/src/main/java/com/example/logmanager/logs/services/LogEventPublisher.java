package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.LogDeletedEvent;
import com.example.logmanager.logs.DTOs.LogEntryResponse;

import java.util.List;

/**
 * Pushes live log changes to connected dashboards.
 */
public interface LogEventPublisher {

    void publishCreated(List<LogEntryResponse> logs);

    void publishDeleted(LogDeletedEvent event);
}
