package com.example.logmanager.logs.query;

import com.example.logmanager.logs.services.QueryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Compiles queries such as {@code level:error AND source:api AND message:"timeout"} into a
 * WHERE clause with named parameters.
 *
 * <p>The returned {@code where} text is concatenated into SQL, so it only ever contains
 * whitelisted column names, operators and {@code :paramN} placeholders. User supplied values
 * travel exclusively through {@link CompiledQuery#params()}.
 *
 * <p>Parsing is lenient: unknown fields are ignored and an unexpected failure degrades to a
 * substring search on the message instead of failing the request.
 */
@Slf4j
@Component
public class LogQueryParser {

    static final String FALLBACK_PARAM = "fallbackSearch";

    private static final List<Pattern> DANGEROUS_PATTERNS = List.of(
            Pattern.compile(";\\s*(drop|delete|update|insert|alter|create)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*"),
            Pattern.compile("xp_", Pattern.CASE_INSENSITIVE),
            Pattern.compile("exec\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("union\\s+select", Pattern.CASE_INSENSITIVE)
    );

    private final QueryTokenizer tokenizer;
    private final ConditionBuilder conditionBuilder;
    private final QueryMetrics queryMetrics;

    public LogQueryParser(QueryTokenizer tokenizer, ConditionBuilder conditionBuilder, QueryMetrics queryMetrics) {
        this.tokenizer = tokenizer;
        this.conditionBuilder = conditionBuilder;
        this.queryMetrics = queryMetrics;
    }

    public CompiledQuery parse(String query) {
        if (query == null || query.isEmpty()) {
            return CompiledQuery.matchAll();
        }

        long startTime = System.nanoTime();
        try {
            ConditionSet conditions = conditionBuilder.build(tokenizer.tokenize(query));

            if (!conditions.dropped().isEmpty()) {
                log.debug("Ignored query tokens: {}", conditions.dropped());
            }
            if (conditions.isEmpty()) {
                return CompiledQuery.matchAll();
            }

            return new CompiledQuery(String.join(" ", conditions.clauses()), conditions.params());
        } catch (RuntimeException e) {
            queryMetrics.recordFallback();
            log.warn("Query parse error, falling back to message search: query={}, error={}",
                    query, e.getMessage());
            return new CompiledQuery("message LIKE :" + FALLBACK_PARAM,
                    Map.of(FALLBACK_PARAM, "%" + query + "%"));
        } finally {
            queryMetrics.recordCompile(startTime);
        }
    }

    /**
     * Screens out obvious SQL injection shapes. This sits in front of parameter binding,
     * it does not replace it.
     */
    public boolean isValid(String query) {
        if (query == null || query.isEmpty()) {
            return false;
        }
        return DANGEROUS_PATTERNS.stream().noneMatch(pattern -> pattern.matcher(query).find());
    }
}
