package com.starscape.photocatalog.features.imaging.app;

import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.common.exception.ResolutionParseException;
import com.starscape.photocatalog.features.imaging.domain.ConversionResult;
import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.resolution.app.ResolutionParser;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Converts a single image file to JPEG or PNG, optionally resized.
 */
@Service
public class ImageConverter {
    
    private static final Logger log = LoggerFactory.getLogger(ImageConverter.class);
    
    private final BackendRegistry backendRegistry;
    private final ImageTranscoder transcoder;
    private final ResolutionParser resolutionParser;
    
    public ImageConverter(BackendRegistry backendRegistry, ImageTranscoder transcoder, ResolutionParser resolutionParser) {
        this.backendRegistry = backendRegistry;
        this.transcoder = transcoder;
        this.resolutionParser = resolutionParser;
    }
    
    /**
     * Convert a file.
     * @param source Source image
     * @param output Output file or directory; null writes next to the source
     * @param resolutionSpec Target size spec; null or invalid keeps the original size
     * @param format Output format
     * @return conversion result, never throws for per-file problems
     */
    public ConversionResult convert(Path source, String output, String resolutionSpec, ImageFormat format) {
        if (!Files.isRegularFile(source)) {
            log.error("Source file not found: {}", source);
            return ConversionResult.failed(null, "Source file not found: " + source);
        }
        
        Path destination = resolveDestination(source, output, format);
        if (destination.toAbsolutePath().normalize().equals(source.toAbsolutePath().normalize())) {
            return ConversionResult.failed(destination, "Refusing to overwrite the source file: " + source);
        }
        Resolution resolution = null;
        if (resolutionSpec != null && !resolutionSpec.isBlank()) {
            try {
                resolution = resolutionParser.parseOrThrow(resolutionSpec);
            } catch (ResolutionParseException e) {
                log.warn("{}. Ignoring resolution parameter.", e.getMessage());
            }
        }
        
        try {
            Path directory = destination.toAbsolutePath().getParent();
            Files.createDirectories(directory);
            
            // RAW sources can decode to more bytes than they occupy
            long required = Files.size(source) * (resolution != null ? 2 : 1);
            long usable = Files.getFileStore(directory).getUsableSpace();
            if (usable < required) {
                log.error("Not enough disk space at destination: {} (need {}, have {})", directory, required, usable);
                return ConversionResult.failed(destination, "Not enough disk space at destination: " + directory);
            }
            
            byte[] encoded = encode(source, resolution, format);
            Files.write(destination, encoded);
            log.info("Successfully converted {} to {}", source, destination);
            return ConversionResult.converted(destination, encoded.length);
            
        } catch (DecodeException | IOException e) {
            log.error("Failed to convert {} to {}: {}", source, destination, e.getMessage());
            return ConversionResult.failed(destination,
                "Failed to convert " + source + " to " + destination + ": " + e.getMessage());
        }
    }
    
    private byte[] encode(Path source, Resolution resolution, ImageFormat format) throws DecodeException, IOException {
        Optional<ImageBackend> backend = backendRegistry.find(source);
        if (backend.isPresent()) {
            try {
                Optional<byte[]> decoded = backend.get().decode(source, format, resolution);
                if (decoded.isPresent()) {
                    return decoded.get();
                }
                log.debug("Backend {} could not decode {}, using generic decoder",
                    backend.get().getClass().getSimpleName(), source);
            } catch (RuntimeException e) {
                log.warn("Backend {} failed on {}, using generic decoder",
                    backend.get().getClass().getSimpleName(), source, e);
            }
        }
        return transcoder.resizeAndEncode(transcoder.decode(source), resolution, format);
    }
    
    /**
     * Destination file for a conversion.
     * A directory output (existing, or written with a trailing separator) receives
     * {@code <source stem>.<ext>}; any other output gets its extension replaced;
     * no output puts the file next to the source.
     */
    static Path resolveDestination(Path source, String output, ImageFormat format) {
        String stem = stem(source.getFileName().toString());
        if (output == null || output.isBlank()) {
            return source.resolveSibling(stem + "." + format.extension());
        }
        
        Path target = Path.of(output);
        if (Files.isDirectory(target) || output.endsWith("/") || output.endsWith(File.separator)) {
            return target.resolve(stem + "." + format.extension());
        }
        return target.resolveSibling(stem(target.getFileName().toString()) + "." + format.extension());
    }
    
    private static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot <= 0 ? filename : filename.substring(0, dot);
    }
}
