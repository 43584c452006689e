package com.starscape.photocatalog.features.imaging.domain;

import com.starscape.photocatalog.features.resolution.domain.Resolution;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decoder for file formats that the generic image path cannot read directly.
 */
public interface ImageBackend {
    
    /**
     * Lowercase extensions (without the dot) this backend handles.
     */
    Set<String> extensions();
    
    /**
     * True only if the decoding capability is available and the file exists with a handled extension.
     */
    boolean canProcess(Path file);
    
    /**
     * Decode to a standard format, optionally resized.
     * @param file Source file
     * @param format Output format
     * @param resolution Target size, or null to keep the decoded size
     * @return encoded bytes, or empty if the file could not be decoded
     */
    Optional<byte[]> decode(Path file, ImageFormat format, Resolution resolution);
    
    /**
     * Format-specific details for inspection output.
     */
    default Map<String, Object> describe(Path file) {
        return Map.of();
    }
}
