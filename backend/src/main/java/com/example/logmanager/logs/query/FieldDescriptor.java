package com.example.logmanager.logs.query;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * A filterable column of the logs table and the way a DSL value is compared against it.
 */
public record FieldDescriptor(String name, ComparisonKind comparisonKind) {

    public String fragment(String paramName) {
        return switch (comparisonKind) {
            case SUBSTRING -> name + " LIKE :" + paramName;
            case DATE_PREFIX -> name + " >= :" + paramName;
            case EXACT -> name + " = :" + paramName;
        };
    }

    /**
     * @return the value to bind, or empty when it cannot be compared against this column
     */
    public Optional<Object> bind(String value) {
        return switch (comparisonKind) {
            case SUBSTRING -> Optional.of("%" + value + "%");
            case DATE_PREFIX -> parseInstant(value).map(Object.class::cast);
            case EXACT -> Optional.of(value);
        };
    }

    /**
     * Accepts an ISO date-time with or without offset (UTC assumed when absent) or a plain
     * ISO date, which widens to the start of that day in UTC.
     */
    static Optional<OffsetDateTime> parseInstant(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value).withOffsetSameInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // not an offset date-time, try the local forms
        }
        try {
            return Optional.of(LocalDateTime.parse(value).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // not a local date-time
        }
        try {
            return Optional.of(LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
