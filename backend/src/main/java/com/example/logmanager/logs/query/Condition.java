package com.example.logmanager.logs.query;

public record Condition(String sqlFragment, String paramName, Object paramValue) {
}
