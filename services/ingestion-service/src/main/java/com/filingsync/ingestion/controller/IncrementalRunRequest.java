package com.filingsync.ingestion.controller;

import jakarta.validation.constraints.Min;

public record IncrementalRunRequest(
    @Min(0)
    Integer overlapDays
) {
}
