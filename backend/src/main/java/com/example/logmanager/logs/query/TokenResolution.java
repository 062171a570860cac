package com.example.logmanager.logs.query;

/**
 * Outcome of resolving one token of a query. Only {@link Recognized} tokens produce SQL;
 * {@link Dropped} keeps the silently ignored ones observable.
 */
public interface TokenResolution {

    String token();

    record Operator(String token, String operator) implements TokenResolution {
    }

    record Recognized(String token, Condition condition) implements TokenResolution {
    }

    record Dropped(String token, String reason) implements TokenResolution {
    }
}
