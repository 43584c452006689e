package com.starscape.photocatalog.features.resolution.domain;

/**
 * Target pixel size. Both dimensions are always positive.
 */
public record Resolution(
    int width,
    int height
) {
    
    public Resolution {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Resolution must be positive: " + width + "x" + height);
        }
    }
    
    public long area() {
        return (long) width * height;
    }
    
    public double aspectRatio() {
        return (double) width / height;
    }
    
    @Override
    public String toString() {
        return width + "x" + height;
    }
}
