package com.starscape.photocatalog.cli;

import com.starscape.photocatalog.features.ingest.app.IngestionOrchestrator;
import com.starscape.photocatalog.features.ingest.domain.IngestReport;
import com.starscape.photocatalog.features.ingest.domain.IngestRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(
        name = "ingest",
        description = {"Ingest photos from a directory or file into the catalog.",
                "Ctrl-C finishes the file in progress, then stops."},
        mixinStandardHelpOptions = true
)
public class IngestCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0",
            description = "Directory or file to ingest")
    private Path path;

    @Option(names = {"-r", "--resolution"},
            description = "Size for stored images: WIDTHxHEIGHT or a preset name (see 'presets')")
    private String resolution;

    @Option(names = "--hash",
            description = "Calculate content hashes and deduplicate identical files")
    private boolean hash;

    @Option(names = "--no-recursive",
            description = "Only ingest files directly inside the directory")
    private boolean noRecursive;

    @Option(names = "--store-images",
            description = "Store a standardized copy of each image in managed storage")
    private boolean storeImages;

    private final IngestionOrchestrator orchestrator;
    private final IngestShutdownGuard shutdownGuard;

    public IngestCommand(IngestionOrchestrator orchestrator, IngestShutdownGuard shutdownGuard) {
        this.orchestrator = orchestrator;
        this.shutdownGuard = shutdownGuard;
    }

    @Override
    public Integer call() {
        IngestRequest request = new IngestRequest(path, resolution, hash, !noRecursive, storeImages);
        ConsoleProgressListener listener = new ConsoleProgressListener();

        IngestReport report;
        shutdownGuard.begin(listener);
        try {
            report = orchestrator.ingest(request, listener);
        } finally {
            shutdownGuard.end();
        }

        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        out.printf("Ingested: %d%n", report.ingested());
        out.printf("Hashes calculated: %d%n", report.hashesCalculated());
        out.printf("Images stored: %d%n", report.imagesStored());
        out.printf("Already catalogued: %d%n", report.skipped());
        if (report.cancelled()) {
            out.println("Ingestion was cancelled before all files were processed.");
        }
        out.flush();

        for (String error : report.errors()) {
            err.println(error);
        }
        err.flush();

        return report.success() ? 0 : 1;
    }
}
