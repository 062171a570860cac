package com.example.logmanager.logs.query;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static whitelist of the fields and boolean operators accepted by the log query language.
 * Anything not listed here never reaches the generated SQL text.
 */
public final class QueryFields {

    public static final String AND = "AND";
    public static final String OR = "OR";

    private static final Set<String> OPERATORS = Set.of(AND, OR);

    private static final Map<String, FieldDescriptor> FIELDS = new LinkedHashMap<>();

    static {
        register("level", ComparisonKind.EXACT);
        register("source", ComparisonKind.EXACT);
        register("message", ComparisonKind.SUBSTRING);
        register("category", ComparisonKind.EXACT);
        register("timestamp", ComparisonKind.DATE_PREFIX);
        register("ip", ComparisonKind.EXACT);
    }

    private QueryFields() {
    }

    private static void register(String name, ComparisonKind kind) {
        FIELDS.put(name, new FieldDescriptor(name, kind));
    }

    public static Optional<FieldDescriptor> lookup(String field) {
        return Optional.ofNullable(FIELDS.get(field));
    }

    public static FieldDescriptor message() {
        return FIELDS.get("message");
    }

    public static Set<String> names() {
        return FIELDS.keySet();
    }

    /**
     * @return the upper-cased operator, or null when the token is not an operator
     */
    public static String operatorOf(String token) {
        String upper = token.toUpperCase(Locale.ROOT);
        return OPERATORS.contains(upper) ? upper : null;
    }
}
