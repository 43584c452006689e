package com.starscape.photocatalog.features.ingest.domain;

import java.util.List;

/**
 * Aggregate result of an ingestion run. Errors are in processing order.
 */
public record IngestReport(
    boolean success,
    int ingested,
    int hashesCalculated,
    int imagesStored,
    int skipped,
    boolean cancelled,
    List<String> errors
) {
    
    public IngestReport {
        errors = List.copyOf(errors);
    }
}
