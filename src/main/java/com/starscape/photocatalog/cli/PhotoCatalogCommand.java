package com.starscape.photocatalog.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(
        name = "photocatalog",
        description = "Ingest, deduplicate and convert photographs.",
        mixinStandardHelpOptions = true,
        version = "photocatalog 0.1.0",
        subcommands = {
                IngestCommand.class,
                ConvertCommand.class,
                PresetsCommand.class,
                InfoCommand.class
        }
)
public class PhotoCatalogCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
