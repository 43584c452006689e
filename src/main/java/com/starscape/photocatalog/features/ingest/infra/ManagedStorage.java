package com.starscape.photocatalog.features.ingest.infra;

import com.starscape.photocatalog.common.config.IngestProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Managed storage for standardized bitmaps.
 * Files are named after the write time with microsecond precision, never after the source.
 */
@Component
public class ManagedStorage {
    
    private static final Logger log = LoggerFactory.getLogger(ManagedStorage.class);
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");
    private static final String PHOTOGRAPHS_DIR = "photographs";
    
    private final Path root;
    private final Clock clock;
    
    public ManagedStorage(IngestProperties ingestProperties, Clock clock) {
        this.root = ingestProperties.storageRootPath();
        this.clock = clock;
    }
    
    public Path root() {
        return root;
    }
    
    /**
     * Write encoded image bytes under a fresh name.
     * @return name relative to the storage root, e.g. photographs/20240102_030405_123456.jpg
     */
    public String store(byte[] data, String extension) throws IOException {
        Path directory = root.resolve(PHOTOGRAPHS_DIR);
        Files.createDirectories(directory);
        
        LocalDateTime timestamp = LocalDateTime.now(clock);
        while (true) {
            String filename = NAME_FORMAT.format(timestamp) + "." + extension;
            Path target = directory.resolve(filename);
            try {
                Files.write(target, data, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                log.debug("Stored image {} ({} bytes)", target, data.length);
                return PHOTOGRAPHS_DIR + "/" + filename;
            } catch (FileAlreadyExistsException e) {
                timestamp = timestamp.plusNanos(1_000);
            }
        }
    }
    
    /**
     * Copy a source file's bytes unchanged, keeping its extension.
     */
    public String copy(Path source) throws IOException {
        String filename = source.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        String extension = dot < 0 ? "bin" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        return store(Files.readAllBytes(source), extension);
    }
    
    public Path resolve(String storedName) {
        return root.resolve(storedName);
    }
    
    /**
     * Remove a stored image; used when the unit that wrote it rolls back.
     */
    public void delete(String storedName) {
        Path target = resolve(storedName);
        try {
            if (Files.deleteIfExists(target)) {
                log.debug("Removed stored image {}", target);
            }
        } catch (IOException e) {
            log.warn("Failed to remove stored image {}: {}", target, e.getMessage());
        }
    }
}
