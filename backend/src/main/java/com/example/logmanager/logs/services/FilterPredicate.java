package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.AppliedQuery;

import java.util.Map;

/**
 * WHERE clause shared by a data query and its count query.
 */
public record FilterPredicate(String where, Map<String, Object> params, AppliedQuery applied) {
}
