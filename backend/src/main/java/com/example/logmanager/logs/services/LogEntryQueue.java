package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.LogEntryRequest;

/**
 * Hands new logs to an asynchronous batching pipeline instead of writing them inline.
 * Only present when a queue backend is configured.
 */
public interface LogEntryQueue {

    void enqueueLogEntry(LogEntryRequest request);
}
