package com.filingsync.ingestion.controller;

import com.filingsync.ingestion.domain.FailureCode;
import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.RunMode;
import com.filingsync.ingestion.domain.RunStatus;
import com.filingsync.ingestion.domain.RunSummary;
import com.filingsync.ingestion.service.ActiveRunException;
import com.filingsync.ingestion.service.ReconciliationEngine;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(IngestionController.class)
class IngestionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReconciliationEngine reconciliationEngine;

    @Test
    void incrementalRunReturnsSummaryWithFailures() throws Exception {
        RunSummary summary = summary(RunMode.INCREMENTAL, RunStatus.COMPLETED);
        when(reconciliationEngine.runIncremental(2)).thenReturn(summary);
        when(reconciliationEngine.getRunFailures(summary.runId())).thenReturn(List.of(
            IngestionFailureEntity.of(summary.runId(), "GUID-1", FailureCode.CONTENT_FETCH_ERROR, "HTTP 503")
        ));

        mockMvc.perform(post("/v1/ingestion/runs/incremental")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"overlapDays\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runId").value(summary.runId().toString()))
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.recordsSeen").value(18))
            .andExpect(jsonPath("$.recordsNew").value(16))
            .andExpect(jsonPath("$.recentFailures[0].documentIdentity").value("GUID-1"))
            .andExpect(jsonPath("$.recentFailures[0].code").value("CONTENT_FETCH_ERROR"));
    }

    @Test
    void historicalRunRequiresBounds() throws Exception {
        mockMvc.perform(post("/v1/ingestion/runs/historical")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\":\"2024-01-01\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("validation_error"));

        verifyNoInteractions(reconciliationEngine);
    }

    @Test
    void historicalRunPassesRange() throws Exception {
        RunSummary summary = summary(RunMode.HISTORICAL, RunStatus.COMPLETED);
        when(reconciliationEngine.runHistorical(any(), any(), any())).thenReturn(summary);

        mockMvc.perform(post("/v1/ingestion/runs/historical")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"start\":\"2023-01-01\",\"end\":\"2023-06-30\",\"chunkDays\":30}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("HISTORICAL"));

        verify(reconciliationEngine).runHistorical(eq(LocalDate.of(2023, 1, 1)), eq(LocalDate.of(2023, 6, 30)), eq(30));
    }

    @Test
    void concurrentRunIsConflict() throws Exception {
        when(reconciliationEngine.runIncremental(any())).thenThrow(new ActiveRunException("Another ingestion run is in progress"));

        mockMvc.perform(post("/v1/ingestion/runs/incremental"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("run_in_progress"));
    }

    @Test
    void unknownRunIsNotFound() throws Exception {
        UUID runId = UUID.randomUUID();
        when(reconciliationEngine.getRun(runId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/v1/ingestion/runs/{runId}", runId))
            .andExpect(status().isNotFound());
    }

    @Test
    void cancelAcceptsActiveRun() throws Exception {
        UUID runId = UUID.randomUUID();
        when(reconciliationEngine.cancel(runId)).thenReturn(true);

        mockMvc.perform(post("/v1/ingestion/runs/{runId}/cancel", runId))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.cancelRequested").value(true));
    }

    private static RunSummary summary(RunMode mode, RunStatus status) {
        return new RunSummary(UUID.randomUUID(), mode, status, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2),
            18, 16, 1, 0, 0, 0, 0, Instant.parse("2024-01-02T12:00:00Z"), Instant.parse("2024-01-02T12:01:00Z"), null);
    }
}
