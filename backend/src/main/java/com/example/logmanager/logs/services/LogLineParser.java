package com.example.logmanager.logs.services;

import com.example.logmanager.logs.DTOs.ParsedLogLine;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort split of a raw line shaped like {@code 2024-01-01 10:00:00 [ERROR] api - message},
 * used to preview how a line would be ingested.
 */
@Component
public class LogLineParser {

    public static final List<LogFormat> KNOWN_FORMATS = List.of(
            new LogFormat("default", "YYYY-MM-DD HH:mm:ss [LEVEL] source - message"),
            new LogFormat("syslog", "<pri>timestamp host app[pid]: message"),
            new LogFormat("json", "{\"timestamp\":\"...\",\"level\":\"...\",\"message\":\"...\"}")
    );

    private static final Pattern LINE = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}[ T]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?Z?)?\\s*\\[?(\\w+)]?\\s*(\\w+)?\\s*-?\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private final Clock clock;

    public LogLineParser(Clock clock) {
        this.clock = clock;
    }

    public ParsedLogLine parse(String text) {
        Matcher m = LINE.matcher(text);
        boolean matched = m.matches();

        String timestamp = matched && m.group(1) != null ? m.group(1) : clock.instant().toString();
        String level = matched && m.group(2) != null ? m.group(2).toLowerCase(Locale.ROOT) : "info";
        String source = matched && m.group(3) != null ? m.group(3) : "unknown";
        String message = matched && m.group(4) != null && !m.group(4).isEmpty() ? m.group(4) : text;

        return new ParsedLogLine(timestamp, level, source, message);
    }

    public record LogFormat(String id, String pattern) {}
}
