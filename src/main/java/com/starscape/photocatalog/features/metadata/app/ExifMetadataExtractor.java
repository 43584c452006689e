package com.starscape.photocatalog.features.metadata.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.starscape.photocatalog.features.metadata.domain.CaptureMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Reads capture time and camera model from EXIF.
 */
@Service
public class ExifMetadataExtractor {
    
    private static final Logger log = LoggerFactory.getLogger(ExifMetadataExtractor.class);
    
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
        DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
    );
    
    /**
     * Extract capture metadata, reading the file's tags once.
     * Unreadable or tagless files yield {@link CaptureMetadata#empty()}.
     * Unexpected runtime failures propagate so the caller can flag the photograph.
     * @param file Image file
     * @return capture metadata
     */
    public CaptureMetadata extract(Path file) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException | IOException e) {
            log.debug("No readable metadata in {}: {}", file, e.getMessage());
            return CaptureMetadata.empty();
        }
        
        LocalDateTime captureTime = parseTimestamp(firstCaptureTag(metadata));
        String cameraModel = cleanModel(firstString(metadata, ExifIFD0Directory.class, ExifIFD0Directory.TAG_MODEL));
        
        log.debug("Extracted metadata: file={}, captureTime={}, model={}", file, captureTime, cameraModel);
        return new CaptureMetadata(captureTime, cameraModel);
    }
    
    /**
     * Original capture, then digitized, then the generic modification timestamp.
     */
    private String firstCaptureTag(Metadata metadata) {
        String value = firstString(metadata, ExifSubIFDDirectory.class, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL);
        if (value == null) {
            value = firstString(metadata, ExifSubIFDDirectory.class, ExifSubIFDDirectory.TAG_DATETIME_DIGITIZED);
        }
        if (value == null) {
            value = firstString(metadata, ExifIFD0Directory.class, ExifIFD0Directory.TAG_DATETIME);
        }
        return value;
    }
    
    private <T extends Directory> String firstString(Metadata metadata, Class<T> type, int tag) {
        for (T directory : metadata.getDirectoriesOfType(type)) {
            String value = directory.getString(tag);
            if (value != null && !value.replace("\u0000", "").isBlank()) {
                return value;
            }
        }
        return null;
    }
    
    /**
     * Parse "yyyy:MM:dd HH:mm:ss" or "yyyy-MM-dd HH:mm:ss".
     * @return the timestamp, or null when missing or unparseable
     */
    static LocalDateTime parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.replace("\u0000", "").trim();
        DateTimeParseException lastFailure = null;
        for (DateTimeFormatter format : TIMESTAMP_FORMATS) {
            try {
                return LocalDateTime.parse(trimmed, format);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        log.debug("Unparseable capture timestamp '{}': {}", trimmed,
                lastFailure == null ? "no formats" : lastFailure.getMessage());
        return null;
    }
    
    /**
     * Strip embedded null bytes and surrounding whitespace; empty means absent.
     */
    static String cleanModel(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.replace("\u0000", "").trim();
        return cleaned.isEmpty() ? null : cleaned;
    }
}
