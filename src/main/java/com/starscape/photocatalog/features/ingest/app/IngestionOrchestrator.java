package com.starscape.photocatalog.features.ingest.app;

import com.starscape.photocatalog.common.exception.ResolutionParseException;
import com.starscape.photocatalog.features.ingest.domain.FileOutcome;
import com.starscape.photocatalog.features.ingest.domain.IngestReport;
import com.starscape.photocatalog.features.ingest.domain.IngestRequest;
import com.starscape.photocatalog.features.ingest.infra.ManagedStorage;
import com.starscape.photocatalog.features.resolution.app.ResolutionParser;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives an ingestion run: discovery, then one isolated unit per file.
 * A failing file is reported and skipped; only discovery problems fail the run.
 */
@Service
public class IngestionOrchestrator {
    
    private static final Logger log = LoggerFactory.getLogger(IngestionOrchestrator.class);
    
    private final PhotoDiscovery discovery;
    private final FileIngestHandler fileIngestHandler;
    private final ResolutionParser resolutionParser;
    private final ManagedStorage storage;
    
    public IngestionOrchestrator(
            PhotoDiscovery discovery,
            FileIngestHandler fileIngestHandler,
            ResolutionParser resolutionParser,
            ManagedStorage storage) {
        this.discovery = discovery;
        this.fileIngestHandler = fileIngestHandler;
        this.resolutionParser = resolutionParser;
        this.storage = storage;
    }
    
    public IngestReport ingest(IngestRequest request) {
        return ingest(request, IngestProgressListener.NONE);
    }
    
    /**
     * Ingest all image files under the request's root.
     * @param request What to ingest and how
     * @param listener Progress callbacks; cancellation is honored between files
     * @return aggregate report, never throws
     */
    public IngestReport ingest(IngestRequest request, IngestProgressListener listener) {
        Tally tally = new Tally();
        log.info("Starting ingestion: root={}, hash={}, recursive={}, store={}, resolution={}",
                request.root(), request.calculateHash(), request.recursive(), request.storeImages(), request.resolution());
        
        Resolution resolution = resolve(request.resolution(), tally);
        
        try {
            List<Path> files = discovery.discover(request.root(), request.recursive(), storage.root());
            if (files.isEmpty()) {
                tally.fail("No image files found in: " + request.root());
            } else {
                processAll(files, request, resolution, listener, tally);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Ingestion of {} failed", request.root(), e);
            tally.fail("Error during ingestion: " + e.getMessage());
        }
        
        IngestReport report = tally.toReport();
        log.info("Ingestion finished: ingested={}, hashes={}, stored={}, skipped={}, errors={}, cancelled={}",
                report.ingested(), report.hashesCalculated(), report.imagesStored(), report.skipped(),
                report.errors().size(), report.cancelled());
        listener.onFinish(report);
        return report;
    }
    
    private void processAll(List<Path> files, IngestRequest request, Resolution resolution,
                            IngestProgressListener listener, Tally tally) {
        int total = files.size();
        listener.onStart(total);
        
        for (int i = 0; i < total; i++) {
            if (listener.isCancelled()) {
                log.info("Ingestion cancelled after {} of {} files", i, total);
                tally.cancelled = true;
                return;
            }
            
            Path file = files.get(i);
            FileOutcome outcome;
            try {
                outcome = fileIngestHandler.ingest(file, resolution, request.calculateHash(), request.storeImages());
            } catch (Exception e) {
                // The unit has rolled back; record and continue with the next file
                log.error("Failed to ingest {}", file, e);
                outcome = FileOutcome.failed("Error processing " + file + ": " + e.getMessage());
            }
            tally.record(outcome);
            listener.onFileProcessed(i + 1, total, file, outcome);
        }
    }
    
    private Resolution resolve(String spec, Tally tally) {
        if (spec == null || spec.isBlank()) {
            return null;
        }
        try {
            return resolutionParser.parseOrThrow(spec);
        } catch (ResolutionParseException e) {
            log.warn(e.getMessage());
            tally.errors.add(e.getMessage());
            return null;
        }
    }
    
    /**
     * Mutable counters for one run.
     */
    private static final class Tally {
        private int ingested;
        private int hashesCalculated;
        private int imagesStored;
        private int skipped;
        private boolean cancelled;
        private boolean fatal;
        private final List<String> errors = new ArrayList<>();
        
        void record(FileOutcome outcome) {
            switch (outcome.status()) {
                case INGESTED -> {
                    ingested++;
                    if (outcome.hashCalculated()) {
                        hashesCalculated++;
                    }
                    if (outcome.imageStored()) {
                        imagesStored++;
                    }
                }
                case SKIPPED -> skipped++;
                default -> {
                    // failures only contribute their errors
                }
            }
            errors.addAll(outcome.errors());
        }
        
        void fail(String error) {
            fatal = true;
            errors.add(error);
        }
        
        IngestReport toReport() {
            int succeeded = ingested + skipped;
            boolean success = !fatal && !(succeeded == 0 && !errors.isEmpty());
            return new IngestReport(success, ingested, hashesCalculated, imagesStored, skipped, cancelled, errors);
        }
    }
}
