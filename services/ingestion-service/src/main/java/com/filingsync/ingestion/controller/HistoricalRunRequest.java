package com.filingsync.ingestion.controller;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;

public record HistoricalRunRequest(
    @NotNull(message = "start is required")
    LocalDate start,

    @NotNull(message = "end is required")
    LocalDate end,

    @Min(1)
    Integer chunkDays
) {
}
