package com.example.logmanager.logs.services;

/**
 * @param id     id of the stored log, null when the log was queued
 * @param queued whether the log was handed to the {@link LogEntryQueue}
 */
public record IngestResult(Long id, boolean queued) {
}
