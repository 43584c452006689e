package com.starscape.photocatalog.features.imaging.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats the pipeline encodes to.
 */
public enum ImageFormat {
    
    JPEG("jpg", true),
    PNG("png", false);
    
    private final String extension;
    private final boolean lossy;
    
    ImageFormat(String extension, boolean lossy) {
        this.extension = extension;
        this.lossy = lossy;
    }
    
    public String extension() { return extension; }
    public boolean isLossy() { return lossy; }
    
    /**
     * Accepts "JPEG", "jpg", "PNG" in any case.
     */
    public static Optional<ImageFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "jpeg", "jpg" -> Optional.of(JPEG);
            case "png" -> Optional.of(PNG);
            default -> Optional.empty();
        };
    }
}
