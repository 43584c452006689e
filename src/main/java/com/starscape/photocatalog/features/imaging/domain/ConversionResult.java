package com.starscape.photocatalog.features.imaging.domain;

import java.nio.file.Path;

/**
 * Outcome of converting one file.
 */
public record ConversionResult(
    boolean success,
    Path destination,
    long bytesWritten,
    String message
) {
    
    public static ConversionResult converted(Path destination, long bytesWritten) {
        return new ConversionResult(true, destination, bytesWritten, "Converted to " + destination);
    }
    
    public static ConversionResult failed(Path destination, String message) {
        return new ConversionResult(false, destination, 0, message);
    }
}
