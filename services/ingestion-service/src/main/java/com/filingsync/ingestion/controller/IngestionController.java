package com.filingsync.ingestion.controller;

import com.filingsync.ingestion.domain.IngestionFailureEntity;
import com.filingsync.ingestion.domain.RunSummary;
import com.filingsync.ingestion.service.ReconciliationEngine;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger surface. Runs execute synchronously on the request thread and the response
 * carries the closed ledger entry.
 */
@RestController
@RequestMapping("/v1/ingestion")
public class IngestionController {

    private final ReconciliationEngine reconciliationEngine;

    public IngestionController(ReconciliationEngine reconciliationEngine) {
        this.reconciliationEngine = reconciliationEngine;
    }

    @PostMapping("/runs/incremental")
    public IngestionRunResponse runIncremental(@Valid @RequestBody(required = false) IncrementalRunRequest request) {
        Integer overlapDays = request == null ? null : request.overlapDays();
        return toResponse(reconciliationEngine.runIncremental(overlapDays));
    }

    @PostMapping("/runs/historical")
    public IngestionRunResponse runHistorical(@Valid @RequestBody HistoricalRunRequest request) {
        RunSummary summary = reconciliationEngine.runHistorical(request.start(), request.end(), request.chunkDays());
        return toResponse(summary);
    }

    @GetMapping("/runs/{runId}")
    public IngestionRunResponse getRun(@PathVariable UUID runId) {
        RunSummary summary = reconciliationEngine.getRun(runId)
            .orElseThrow(() -> new RunNotFoundException(runId));
        return toResponse(summary);
    }

    @PostMapping("/runs/{runId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable UUID runId) {
        if (!reconciliationEngine.cancel(runId)) {
            throw new RunNotFoundException(runId);
        }
        return ResponseEntity.accepted().body(Map.of("runId", runId, "cancelRequested", true));
    }

    private IngestionRunResponse toResponse(RunSummary summary) {
        List<IngestionRunResponse.FailureItem> failures = reconciliationEngine.getRunFailures(summary.runId())
            .stream()
            .map(this::toFailureItem)
            .toList();
        return IngestionRunResponse.from(summary, failures);
    }

    private IngestionRunResponse.FailureItem toFailureItem(IngestionFailureEntity entity) {
        return new IngestionRunResponse.FailureItem(
            entity.getDocumentIdentity(),
            entity.getFailureCode(),
            entity.getFailureReason(),
            entity.getCreatedAt()
        );
    }
}
