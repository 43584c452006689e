package com.starscape.photocatalog.cli;

import com.starscape.photocatalog.features.imaging.app.ImageConverter;
import com.starscape.photocatalog.features.imaging.domain.ConversionResult;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.nio.file.Path;
import java.util.concurrent.Callable;

@Component
@Command(
        name = "convert",
        description = "Convert an image (including RAW) to JPEG or PNG.",
        mixinStandardHelpOptions = true
)
public class ConvertCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0",
            description = "Source image")
    private Path source;

    @Option(names = {"-o", "--output"},
            description = "Output file or directory (default: next to the source)")
    private String output;

    @Option(names = {"-r", "--resolution"},
            description = "Target size: WIDTHxHEIGHT or a preset name")
    private String resolution;

    @Option(names = {"-f", "--format"},
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private ImageFormat format = ImageFormat.JPEG;

    private final ImageConverter converter;

    public ConvertCommand(ImageConverter converter) {
        this.converter = converter;
    }

    @Override
    public Integer call() {
        ConversionResult result = converter.convert(source, output, resolution, format);
        if (result.success()) {
            spec.commandLine().getOut().printf("Converted %s -> %s (%d bytes)%n",
                    source, result.destination(), result.bytesWritten());
            spec.commandLine().getOut().flush();
            return 0;
        }
        spec.commandLine().getErr().println(result.message());
        spec.commandLine().getErr().flush();
        return 1;
    }
}
