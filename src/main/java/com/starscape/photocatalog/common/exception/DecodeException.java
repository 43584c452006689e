package com.starscape.photocatalog.common.exception;

/**
 * Thrown when an image cannot be decoded into a bitmap.
 */
public class DecodeException extends PhotoCatalogException {
    
    public DecodeException(String message) {
        super(message);
    }
    
    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
