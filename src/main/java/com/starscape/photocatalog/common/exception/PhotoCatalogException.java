package com.starscape.photocatalog.common.exception;

/**
 * Base type for recoverable failures of a single pipeline step.
 * Callers degrade gracefully instead of aborting the batch.
 */
public class PhotoCatalogException extends Exception {
    
    public PhotoCatalogException(String message) {
        super(message);
    }
    
    public PhotoCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
