package com.starscape.photocatalog.features.ingest.domain;

import java.util.List;

/**
 * Result of ingesting one file.
 */
public record FileOutcome(
    Status status,
    String photographId,
    boolean hashCalculated,
    boolean imageStored,
    List<String> errors
) {
    
    public enum Status {
        INGESTED,
        SKIPPED,
        FAILED
    }
    
    public FileOutcome {
        errors = List.copyOf(errors);
    }
    
    public static FileOutcome ingested(String photographId, boolean hashCalculated, boolean imageStored, List<String> errors) {
        return new FileOutcome(Status.INGESTED, photographId, hashCalculated, imageStored, errors);
    }
    
    public static FileOutcome skipped(String photographId) {
        return new FileOutcome(Status.SKIPPED, photographId, false, false, List.of());
    }
    
    public static FileOutcome failed(String error) {
        return new FileOutcome(Status.FAILED, null, false, false, List.of(error));
    }
}
