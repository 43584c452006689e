package com.starscape.photocatalog.features.metadata.domain;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Capture details read from embedded metadata. Either field may be absent.
 */
public record CaptureMetadata(
    LocalDateTime captureTime,
    String cameraModel
) {
    
    private static final CaptureMetadata EMPTY = new CaptureMetadata(null, null);
    
    public static CaptureMetadata empty() {
        return EMPTY;
    }
    
    public Optional<LocalDateTime> captureTimeIfAny() {
        return Optional.ofNullable(captureTime);
    }
    
    public Optional<String> cameraModelIfAny() {
        return Optional.ofNullable(cameraModel);
    }
}
