package com.starscape.photocatalog.features.imaging.infra;

import com.starscape.photocatalog.common.config.ImagingProperties;
import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.features.imaging.domain.RawDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a dcraw-compatible executable ("-c -w -T": TIFF to stdout, camera white balance)
 * and reads the resulting bitmap.
 */
@Component
public class ExternalRawDecoder implements RawDecoder {
    
    private static final Logger log = LoggerFactory.getLogger(ExternalRawDecoder.class);
    
    private final String command;
    private volatile Boolean available;
    
    public ExternalRawDecoder(ImagingProperties imagingProperties) {
        this.command = imagingProperties.getRawDecoderCommand();
    }
    
    @Override
    public boolean isAvailable() {
        Boolean cached = available;
        if (cached == null) {
            cached = locateExecutable() != null;
            available = cached;
            log.debug("RAW decoder '{}' available: {}", command, cached);
        }
        return cached;
    }
    
    @Override
    public BufferedImage decode(Path file) throws DecodeException {
        Path executable = locateExecutable();
        if (executable == null) {
            throw new DecodeException("RAW decoder not found: " + command);
        }
        
        ProcessBuilder builder = new ProcessBuilder(List.of(
            executable.toString(), "-c", "-w", "-T", file.toAbsolutePath().toString()));
        builder.redirectError(ProcessBuilder.Redirect.DISCARD);
        
        try {
            Process process = builder.start();
            byte[] output;
            try (InputStream stdout = process.getInputStream()) {
                output = stdout.readAllBytes();
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new DecodeException("RAW decoder exited with code " + exitCode + " for " + file.getFileName());
            }
            
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(output));
            if (image == null) {
                throw new DecodeException("RAW decoder produced no readable image for " + file.getFileName());
            }
            return image;
        } catch (IOException e) {
            throw new DecodeException("RAW decoder failed for " + file.getFileName() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecodeException("Interrupted while decoding " + file.getFileName(), e);
        }
    }
    
    private Path locateExecutable() {
        Path direct = Path.of(command);
        if (direct.isAbsolute() || command.contains(File.separator)) {
            return Files.isExecutable(direct) ? direct : null;
        }
        String searchPath = System.getenv("PATH");
        if (searchPath == null) {
            return null;
        }
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, command);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
