package com.starscape.photocatalog.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Hands the process arguments to picocli. Disabled in tests.
 */
@Component
@Profile("!test")
public class PhotoCatalogRunner implements CommandLineRunner, ExitCodeGenerator {

    private final PhotoCatalogCommand command;
    private final IFactory factory;
    private int exitCode;

    public PhotoCatalogRunner(PhotoCatalogCommand command, IFactory factory) {
        this.command = command;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
