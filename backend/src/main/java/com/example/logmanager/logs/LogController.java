package com.example.logmanager.logs;

import com.example.logmanager.logs.DTOs.AnalyticsResponse;
import com.example.logmanager.logs.DTOs.AnomalyResponse;
import com.example.logmanager.logs.DTOs.LogEntryRequest;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.DTOs.LogFilterRequest;
import com.example.logmanager.logs.DTOs.LogPageResponse;
import com.example.logmanager.logs.DTOs.StatsResponse;
import com.example.logmanager.logs.services.IngestResult;
import com.example.logmanager.logs.services.LogAnalyticsService;
import com.example.logmanager.logs.services.LogIngestService;
import com.example.logmanager.logs.services.LogLineParser;
import com.example.logmanager.logs.services.LogQueryService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@RestController
@RequestMapping("/api/v1/logs")
public class LogController {

    static final String CSV_HEADER = "Timestamp,Level,Source,Message";

    private final LogQueryService logQueryService;
    private final LogAnalyticsService logAnalyticsService;
    private final LogIngestService logIngestService;
    private final LogLineParser logLineParser;

    public LogController(
            LogQueryService logQueryService,
            LogAnalyticsService logAnalyticsService,
            LogIngestService logIngestService,
            LogLineParser logLineParser) {
        this.logQueryService = logQueryService;
        this.logAnalyticsService = logAnalyticsService;
        this.logIngestService = logIngestService;
        this.logLineParser = logLineParser;
    }

    /**
     * Lists logs newest first. A valid {@code q} replaces the discrete filters; a rejected one
     * is ignored.
     */
    @GetMapping
    public ResponseEntity<LogPageResponse> listLogs(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String q) {

        LogFilterRequest filter = new LogFilterRequest(
                limit, offset, page, pageSize, level, source, search, startDate, endDate, category, q);
        return ResponseEntity.ok(logQueryService.search(filter));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> getStats(
            @RequestParam(defaultValue = "24h") String period,
            @RequestParam(defaultValue = "hour") String groupBy) {
        return ResponseEntity.ok(logAnalyticsService.stats(period, groupBy));
    }

    @GetMapping("/analytics")
    public ResponseEntity<AnalyticsResponse> getAnalytics(@RequestParam(defaultValue = "24h") String period) {
        return ResponseEntity.ok(logAnalyticsService.analytics(period));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomalyResponse> getAnomalies(@RequestParam(defaultValue = "24h") String period) {
        return ResponseEntity.ok(logAnalyticsService.anomalies(period));
    }

    @GetMapping("/latest")
    public ResponseEntity<Map<String, Object>> getLatest(@RequestParam(required = false) String since) {
        if (since == null || since.isBlank()) {
            throw new IllegalArgumentException("since parameter required");
        }
        return ResponseEntity.ok(Map.of("success", true, "logs", logQueryService.latest(since)));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Long>> getCount(
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String source) {
        return ResponseEntity.ok(Map.of("count", logQueryService.count(level, source)));
    }

    @GetMapping("/count/today")
    public ResponseEntity<Map<String, Long>> getCountToday() {
        return ResponseEntity.ok(Map.of("count", logQueryService.countToday()));
    }

    @GetMapping("/export")
    public ResponseEntity<?> exportLogs(
            @RequestParam(defaultValue = "json") String format,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String q) {

        LogFilterRequest filter = new LogFilterRequest(
                null, null, null, null, level, source, search, startDate, endDate, category, q);
        List<LogEntryResponse> logs = logQueryService.export(filter);
        log.info("Exporting {} logs as {}", logs.size(), format);

        if ("csv".equalsIgnoreCase(format)) {
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=logs.csv")
                    .body(toCsv(logs));
        }
        return ResponseEntity.ok(Map.of("logs", logs));
    }

    @GetMapping("/parse")
    public ResponseEntity<Map<String, Object>> parseLine(@RequestParam(required = false) String text) {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("text is required");
        }
        return ResponseEntity.ok(Map.of("parsed", logLineParser.parse(text)));
    }

    @GetMapping("/formats")
    public ResponseEntity<Map<String, Object>> getFormats() {
        return ResponseEntity.ok(Map.of("formats", LogLineParser.KNOWN_FORMATS));
    }

    @GetMapping("/{id:\\d+}")
    public ResponseEntity<Map<String, Object>> getLog(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("success", true, "log", logIngestService.findById(id)));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createLog(
            @Valid @RequestBody LogEntryRequest request,
            HttpServletRequest httpRequest) {
        IngestResult result = logIngestService.ingest(request, httpRequest.getRemoteAddr());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        if (result.queued()) {
            body.put("queued", true);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("id", result.id());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> createLogBatch(
            @RequestBody List<@Valid LogEntryRequest> requests,
            HttpServletRequest httpRequest) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("batch must contain at least one log");
        }
        List<IngestResult> results = logIngestService.ingestBatch(requests, httpRequest.getRemoteAddr());
        boolean queued = results.stream().anyMatch(IngestResult::queued);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("count", results.size());
        if (queued) {
            body.put("queued", true);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
        }
        body.put("ids", results.stream().map(IngestResult::id).filter(Objects::nonNull).toList());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/{id:\\d+}")
    public ResponseEntity<Map<String, Object>> deleteLog(@PathVariable Long id) {
        logIngestService.delete(id);
        return ResponseEntity.ok(Map.of("success", true, "deleted", 1));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> deleteMatching(@RequestParam(required = false) String q) {
        int deleted = logIngestService.deleteMatching(q);
        return ResponseEntity.ok(Map.of("success", true, "deleted", deleted));
    }

    static String toCsv(List<LogEntryResponse> logs) {
        StringBuilder csv = new StringBuilder(CSV_HEADER);
        for (LogEntryResponse entry : logs) {
            csv.append('\n')
                    .append(quote(entry.timestamp() == null ? "" : entry.timestamp().toString())).append(',')
                    .append(quote(entry.level())).append(',')
                    .append(quote(entry.source())).append(',')
                    .append(quote(entry.message()));
        }
        return csv.toString();
    }

    private static String quote(String value) {
        return "\"" + (value == null ? "" : value.replace("\"", "\"\"")) + "\"";
    }
}
