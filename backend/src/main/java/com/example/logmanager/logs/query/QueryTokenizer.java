package com.example.logmanager.logs.query;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a query on unquoted whitespace. Quote characters stay in the token; an unterminated
 * quote runs to the end of the input.
 */
@Component
public class QueryTokenizer {

    public List<String> tokenize(String query) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quoteChar = 0;

        for (int i = 0; i < query.length(); i++) {
            char c = query.charAt(i);

            if (quoteChar == 0 && (c == '"' || c == '\'')) {
                quoteChar = c;
                current.append(c);
            } else if (quoteChar != 0 && c == quoteChar) {
                quoteChar = 0;
                current.append(c);
            } else if (quoteChar == 0 && Character.isWhitespace(c)) {
                flush(current, tokens);
            } else {
                current.append(c);
            }
        }
        flush(current, tokens);

        return tokens;
    }

    private void flush(StringBuilder current, List<String> tokens) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }
}
