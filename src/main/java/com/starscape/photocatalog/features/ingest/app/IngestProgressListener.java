package com.starscape.photocatalog.features.ingest.app;

import com.starscape.photocatalog.features.ingest.domain.FileOutcome;
import com.starscape.photocatalog.features.ingest.domain.IngestReport;

import java.nio.file.Path;

/**
 * Receives progress of an ingestion run. Cancellation is checked between files only.
 */
public interface IngestProgressListener {
    
    IngestProgressListener NONE = new IngestProgressListener() { };
    
    default void onStart(int totalFiles) {
    }
    
    default void onFileProcessed(int processed, int totalFiles, Path file, FileOutcome outcome) {
    }
    
    default void onFinish(IngestReport report) {
    }
    
    default boolean isCancelled() {
        return false;
    }
}
