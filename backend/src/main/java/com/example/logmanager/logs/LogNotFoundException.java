package com.example.logmanager.logs;

public class LogNotFoundException extends RuntimeException {

    public LogNotFoundException(Long id) {
        super("Log entry not found: " + id);
    }
}
