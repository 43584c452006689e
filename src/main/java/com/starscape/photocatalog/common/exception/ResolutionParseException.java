package com.starscape.photocatalog.common.exception;

/**
 * Thrown by the strict resolution parser for malformed size specifications.
 * Always non-fatal: callers log it and continue without resizing.
 */
public class ResolutionParseException extends PhotoCatalogException {
    
    private final String spec;
    
    public ResolutionParseException(String spec) {
        super(String.format(
            "Invalid resolution format: '%s'. Use format 'WIDTHxHEIGHT' or a preset name (e.g., 'low', 'medium', 'high')",
            spec));
        this.spec = spec;
    }
    
    public String getSpec() {
        return spec;
    }
}
