package com.example.logmanager.logs.query;

public enum ComparisonKind {
    EXACT,
    SUBSTRING,
    DATE_PREFIX
}
