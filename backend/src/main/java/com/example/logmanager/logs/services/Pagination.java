package com.example.logmanager.logs.services;

public record Pagination(int limit, int offset) {

    public int page() {
        return offset / limit + 1;
    }
}
