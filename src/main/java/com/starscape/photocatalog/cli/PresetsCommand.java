package com.starscape.photocatalog.cli;

import com.starscape.photocatalog.features.resolution.app.ResolutionParser;
import com.starscape.photocatalog.features.resolution.domain.ResolutionPreset;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

@Component
@Command(
        name = "presets",
        description = "List the named resolution presets.",
        mixinStandardHelpOptions = true
)
public class PresetsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    private final ResolutionParser resolutionParser;

    public PresetsCommand(ResolutionParser resolutionParser) {
        this.resolutionParser = resolutionParser;
    }

    @Override
    public void run() {
        PrintWriter out = spec.commandLine().getOut();
        out.printf("%-16s %-11s %s%n", "Preset", "Resolution", "Description");
        for (ResolutionPreset preset : resolutionParser.presetsByArea()) {
            out.printf("%-16s %-11s %s%n",
                    preset.key(), resolutionParser.format(preset.resolution()), preset.description());
        }
        out.println();
        out.println("Custom sizes: WIDTHxHEIGHT, e.g. 1920x1080");
        out.flush();
    }
}
