package com.example.logmanager.logs.query;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns query tokens into a flat, left-to-right chain of SQL conditions.
 *
 * <p>There is no precedence and no grouping: each condition is joined to the previous one
 * by whichever operator was seen last (AND until told otherwise). Operator state is kept
 * across dropped tokens, so {@code level:error OR foo:bar source:api} joins
 * {@code source} with OR.
 */
@Component
public class ConditionBuilder {

    public ConditionSet build(List<String> tokens) {
        List<String> clauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        List<TokenResolution> resolutions = new ArrayList<>();
        String currentOperator = QueryFields.AND;
        int paramCounter = 0;

        for (String token : tokens) {
            TokenResolution resolution = resolve(token, "param" + paramCounter);
            resolutions.add(resolution);

            if (resolution instanceof TokenResolution.Operator operator) {
                currentOperator = operator.operator();
            } else if (resolution instanceof TokenResolution.Recognized recognized) {
                Condition condition = recognized.condition();
                if (!clauses.isEmpty()) {
                    clauses.add(currentOperator);
                }
                clauses.add(condition.sqlFragment());
                params.put(condition.paramName(), condition.paramValue());
                paramCounter++;
            }
        }

        return new ConditionSet(clauses, params, resolutions);
    }

    TokenResolution resolve(String token, String paramName) {
        String operator = QueryFields.operatorOf(token);
        if (operator != null) {
            return new TokenResolution.Operator(token, operator);
        }

        int colon = token.indexOf(':');
        if (colon <= 0) {
            FieldDescriptor message = QueryFields.message();
            return new TokenResolution.Recognized(token,
                    new Condition(message.fragment(paramName), paramName, message.bind(token).orElseThrow()));
        }

        String field = token.substring(0, colon).toLowerCase(Locale.ROOT);
        FieldDescriptor descriptor = QueryFields.lookup(field).orElse(null);
        if (descriptor == null) {
            return new TokenResolution.Dropped(token, "unknown field '" + field + "'");
        }

        String value = unquote(token.substring(colon + 1));
        Optional<Object> bound = descriptor.bind(value);
        if (bound.isEmpty()) {
            return new TokenResolution.Dropped(token, "invalid " + field + " value '" + value + "'");
        }
        return new TokenResolution.Recognized(token,
                new Condition(descriptor.fragment(paramName), paramName, bound.get()));
    }

    static String unquote(String value) {
        if (value.length() < 2) {
            return value;
        }
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        if ((first == '"' || first == '\'') && first == last) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
