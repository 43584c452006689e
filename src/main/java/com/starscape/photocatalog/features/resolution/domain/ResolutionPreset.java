package com.starscape.photocatalog.features.resolution.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named shorthands for common target sizes.
 */
public enum ResolutionPreset {
    
    // Quality levels
    LOW("low", 640, 480, "Low quality (VGA)"),
    SMALL("small", 640, 480, "Small (VGA)"),
    XSMALL("xsmall", 320, 240, "Extra small (QVGA)"),
    MEDIUM("medium", 1920, 1080, "Medium quality (Full HD)"),
    HIGH("high", 3840, 2160, "High quality (4K UHD)"),
    LARGE("large", 3840, 2160, "Large (4K UHD)"),
    XLARGE("xlarge", 7680, 4320, "Extra large (8K UHD)"),
    
    // Video standards
    P240("240p", 426, 240, "240p"),
    P360("360p", 640, 360, "360p"),
    P480("480p", 854, 480, "480p (SD)"),
    P720("720p", 1280, 720, "720p (HD)"),
    HD("hd", 1280, 720, "HD"),
    P1080("1080p", 1920, 1080, "1080p (Full HD)"),
    FHD("fhd", 1920, 1080, "Full HD"),
    P1440("1440p", 2560, 1440, "1440p (QHD)"),
    QHD("qhd", 2560, 1440, "Quad HD"),
    P2160("2160p", 3840, 2160, "2160p (4K UHD)"),
    UHD_4K("4k", 3840, 2160, "4K UHD"),
    UHD_8K("8k", 7680, 4320, "8K UHD"),
    
    // Social and print
    SQUARE("square", 1080, 1080, "Square"),
    INSTAGRAM("instagram", 1080, 1080, "Instagram post"),
    INSTAGRAM_STORY("instagram-story", 1080, 1920, "Instagram story"),
    PORTRAIT("portrait", 1080, 1350, "Portrait 4:5"),
    LANDSCAPE("landscape", 1920, 1080, "Landscape 16:9");
    
    private final String key;
    private final Resolution resolution;
    private final String description;
    
    ResolutionPreset(String key, int width, int height, String description) {
        this.key = key;
        this.resolution = new Resolution(width, height);
        this.description = description;
    }
    
    public String key() { return key; }
    public Resolution resolution() { return resolution; }
    public String description() { return description; }
    
    /**
     * Find a preset by name, ignoring case and surrounding whitespace.
     */
    public static Optional<ResolutionPreset> fromKey(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(preset -> preset.key.equals(normalized))
                .findFirst();
    }
}
