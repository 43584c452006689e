package com.starscape.photocatalog.common.exception;

/**
 * Thrown when a content digest cannot be computed (missing file, permission denied, I/O error).
 */
public class HashException extends PhotoCatalogException {
    
    public HashException(String message, Throwable cause) {
        super(message, cause);
    }
}
