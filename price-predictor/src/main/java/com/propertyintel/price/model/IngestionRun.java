package com.propertyintel.price.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each load of a raw dataset into the store.
 * Stored in the ingestion_runs table.
 */
@Data
@Builder
public class IngestionRun {

    private String runId;           // UUID
    private String dataset;         // pp-2021 | postcodes
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int rowsFound;
    private int rowsWritten;
    private int rowsSkipped;
    private String errorMessage;    // null on success
}
