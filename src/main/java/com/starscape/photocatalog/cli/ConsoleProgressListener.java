package com.starscape.photocatalog.cli;

import com.starscape.photocatalog.features.ingest.app.IngestProgressListener;
import com.starscape.photocatalog.features.ingest.domain.FileOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Logs ingestion progress. {@link #cancel()} stops the run at the next file boundary.
 */
public class ConsoleProgressListener implements IngestProgressListener {

    private static final Logger log = LoggerFactory.getLogger(ConsoleProgressListener.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();

    @Override
    public void onStart(int totalFiles) {
        log.info("Found {} image files", totalFiles);
    }

    @Override
    public void onFileProcessed(int processed, int totalFiles, Path file, FileOutcome outcome) {
        switch (outcome.status()) {
            case INGESTED -> log.info("[{}/{}] {}", processed, totalFiles, file);
            case SKIPPED -> log.info("[{}/{}] {} (already catalogued)", processed, totalFiles, file);
            case FAILED -> log.warn("[{}/{}] {} failed", processed, totalFiles, file);
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        cancelled.set(true);
    }
}
