package com.example.logmanager.logs.store;

/**
 * @param insertedId generated key of an INSERT, null for other statements
 */
public record ExecutionResult(int affectedRows, Long insertedId) {
}
