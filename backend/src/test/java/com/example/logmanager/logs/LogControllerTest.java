package com.example.logmanager.logs;

import com.example.logmanager.logs.DTOs.AppliedQuery;
import com.example.logmanager.logs.DTOs.LogEntryResponse;
import com.example.logmanager.logs.DTOs.LogFilterRequest;
import com.example.logmanager.logs.DTOs.LogPageResponse;
import com.example.logmanager.logs.DTOs.ParsedLogLine;
import com.example.logmanager.logs.DTOs.StatsResponse;
import com.example.logmanager.logs.services.IngestResult;
import com.example.logmanager.logs.services.LogAnalyticsService;
import com.example.logmanager.logs.services.LogIngestService;
import com.example.logmanager.logs.services.LogLineParser;
import com.example.logmanager.logs.services.LogQueryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(LogController.class)
@AutoConfigureMockMvc(addFilters = false)
class LogControllerTest {

    private static final Instant TS = Instant.parse("2025-01-01T00:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    private LogQueryService logQueryService;

    @MockitoBean
    private LogAnalyticsService logAnalyticsService;

    @MockitoBean
    private LogIngestService logIngestService;

    @MockitoBean
    private LogLineParser logLineParser;

    @Test
    void shouldListLogsWithFiltersFromQueryString() throws Exception {
        LogEntryResponse entry = new LogEntryResponse(1L, TS, "error", "api", "boom", "10.0.0.1", null, Map.of());
        when(logQueryService.search(any())).thenReturn(new LogPageResponse(
                true, List.of(entry), 1, 50, 50, 2, 50,
                new AppliedQuery("level:error", AppliedQuery.STRUCTURED, "level = :param0")));

        mockMvc.perform(get("/api/v1/logs")
                        .param("page", "2")
                        .param("pageSize", "50")
                        .param("q", "level:error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.logs[0].message").value("boom"))
                .andExpect(jsonPath("$.logs[0].timestamp").value("2025-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.page").value(2))
                .andExpect(jsonPath("$.query.mode").value("structured"));

        ArgumentCaptor<LogFilterRequest> filter = ArgumentCaptor.forClass(LogFilterRequest.class);
        verify(logQueryService).search(filter.capture());
        assertThat(filter.getValue().page()).isEqualTo(2);
        assertThat(filter.getValue().pageSize()).isEqualTo(50);
        assertThat(filter.getValue().q()).isEqualTo("level:error");
    }

    @Test
    void shouldReturnServiceUnavailableWhenDatabaseIsDown() throws Exception {
        when(logQueryService.search(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        mockMvc.perform(get("/api/v1/logs"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Database not available"));
    }

    @Test
    void shouldUseDefaultStatsWindow() throws Exception {
        when(logAnalyticsService.stats("24h", "hour")).thenReturn(
                new StatsResponse(true, "24h", "hour", List.of("00:00"), List.of(4L), null, null, 4));

        mockMvc.perform(get("/api/v1/logs/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.labels[0]").value("00:00"))
                .andExpect(jsonPath("$.total").value(4))
                .andExpect(jsonPath("$.byLevel").doesNotExist());
    }

    @Test
    void shouldRejectInvalidStatsPeriod() throws Exception {
        when(logAnalyticsService.stats("2w", "hour")).thenThrow(new IllegalArgumentException("Invalid period '2w'"));

        mockMvc.perform(get("/api/v1/logs/stats").param("period", "2w"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Invalid period '2w'"));
    }

    @Test
    void shouldRequireSinceForLatest() throws Exception {
        mockMvc.perform(get("/api/v1/logs/latest"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("since parameter required"));
        verifyNoInteractions(logQueryService);
    }

    @Test
    void shouldReturnCounts() throws Exception {
        when(logQueryService.count("error", null)).thenReturn(12L);
        when(logQueryService.countToday()).thenReturn(3L);

        mockMvc.perform(get("/api/v1/logs/count").param("level", "error"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(12));
        mockMvc.perform(get("/api/v1/logs/count/today"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(3));
    }

    @Test
    void shouldExportCsvWithEscapedQuotes() throws Exception {
        when(logQueryService.export(any())).thenReturn(List.of(
                new LogEntryResponse(1L, TS, "error", "api", "said \"hi\"", null, null, Map.of())));

        mockMvc.perform(get("/api/v1/logs/export").param("format", "csv"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=logs.csv"))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(
                        "Timestamp,Level,Source,Message\n\"2025-01-01T00:00:00Z\",\"error\",\"api\",\"said \"\"hi\"\"\""));
    }

    @Test
    void shouldExportJsonByDefault() throws Exception {
        when(logQueryService.export(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/logs/export"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs").isArray());
    }

    @Test
    void shouldPreviewParsedLine() throws Exception {
        when(logLineParser.parse("2024-01-01 10:00:00 [ERROR] api - down"))
                .thenReturn(new ParsedLogLine("2024-01-01 10:00:00", "error", "api", "down"));

        mockMvc.perform(get("/api/v1/logs/parse").param("text", "2024-01-01 10:00:00 [ERROR] api - down"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parsed.level").value("error"))
                .andExpect(jsonPath("$.parsed.source").value("api"));
    }

    @Test
    void shouldRequireTextForParse() throws Exception {
        mockMvc.perform(get("/api/v1/logs/parse"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("text is required"));
    }

    @Test
    void shouldListFormats() throws Exception {
        mockMvc.perform(get("/api/v1/logs/formats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.formats[0].id").value("default"))
                .andExpect(jsonPath("$.formats.length()").value(3));
    }

    @Test
    void shouldReturnSingleLog() throws Exception {
        when(logIngestService.findById(7L))
                .thenReturn(new LogEntryResponse(7L, TS, "info", "api", "hello", null, null, Map.of()));

        mockMvc.perform(get("/api/v1/logs/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.log.id").value(7));
    }

    @Test
    void shouldReturnNotFoundForMissingLog() throws Exception {
        when(logIngestService.findById(99L)).thenThrow(new LogNotFoundException(99L));

        mockMvc.perform(get("/api/v1/logs/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error", startsWith("Log entry not found")));
    }

    @Test
    void shouldCreateLog() throws Exception {
        when(logIngestService.ingest(any(), anyString())).thenReturn(new IngestResult(15L, false));

        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                    {
                                        "level" : "error",
                                        "message" : "Payment failed",
                                        "source" : "billing",
                                        "metadata" : {"orderId": 42}
                                    }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.id").value(15));
    }

    @Test
    void shouldAcceptQueuedLog() throws Exception {
        when(logIngestService.ingest(any(), anyString())).thenReturn(new IngestResult(null, true));

        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"queued one\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.queued").value(true));
    }

    @Test
    void shouldRejectLogWithoutMessage() throws Exception {
        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\": \"info\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("message is required"));
        verifyNoInteractions(logIngestService);
    }

    @Test
    void shouldRejectInvalidLevel() throws Exception {
        when(logIngestService.ingest(any(), anyString())).thenThrow(new IllegalArgumentException("invalid level"));

        mockMvc.perform(post("/api/v1/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"level\": \"fatal\", \"message\": \"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("invalid level"));
    }

    @Test
    void shouldCreateBatch() throws Exception {
        when(logIngestService.ingestBatch(anyList(), anyString())).thenReturn(List.of(
                new IngestResult(1L, false), new IngestResult(2L, false)));

        mockMvc.perform(post("/api/v1/logs/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"message\": \"a\"}, {\"message\": \"b\"}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.ids[1]").value(2));
    }

    @Test
    void shouldDeleteSingleLog() throws Exception {
        mockMvc.perform(delete("/api/v1/logs/3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(1));
        verify(logIngestService).delete(3L);
    }

    @Test
    void shouldBulkDeleteByQuery() throws Exception {
        when(logIngestService.deleteMatching("level:debug")).thenReturn(40);

        mockMvc.perform(delete("/api/v1/logs").param("q", "level:debug"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(40));
    }

    @Test
    void shouldRejectBulkDeleteWithoutQuery() throws Exception {
        when(logIngestService.deleteMatching(eq(null))).thenThrow(new IllegalArgumentException("q is required for bulk delete"));

        mockMvc.perform(delete("/api/v1/logs"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("q is required for bulk delete"));
    }
}
