package com.starscape.photocatalog.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.photocatalog.features.metadata.app.MetadataInspector;
import com.starscape.photocatalog.features.metadata.domain.ImageMetadataReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

@Component
@Command(
        name = "info",
        description = "Show file, image, EXIF and RAW details of a single file.",
        mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0",
            description = "File to inspect")
    private Path file;

    @Option(names = "--json",
            description = "Print as JSON")
    private boolean json;

    private final MetadataInspector inspector;
    private final ObjectMapper objectMapper;

    public InfoCommand(MetadataInspector inspector, ObjectMapper objectMapper) {
        this.inspector = inspector;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ImageMetadataReport report;
        try {
            report = inspector.inspect(file);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot inspect " + file + ": " + e.getMessage());
            spec.commandLine().getErr().flush();
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            try {
                out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (IOException e) {
                spec.commandLine().getErr().println("Cannot serialize metadata: " + e.getMessage());
                spec.commandLine().getErr().flush();
                return 1;
            }
        } else {
            printSection(out, "File", report.file());
            printSection(out, "Image", report.image());
            if (!report.exif().isEmpty()) {
                out.println("EXIF");
                report.exif().forEach((directory, tags) ->
                        tags.forEach((tag, value) -> out.printf("  %s / %s: %s%n", directory, tag, value)));
            }
            printSection(out, "RAW", report.raw());
        }
        out.flush();
        return 0;
    }

    private static void printSection(PrintWriter out, String title, Map<String, ?> values) {
        if (values.isEmpty()) {
            return;
        }
        out.println(title);
        values.forEach((key, value) -> out.printf("  %s: %s%n", key, value));
    }
}
