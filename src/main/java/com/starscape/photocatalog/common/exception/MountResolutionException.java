package com.starscape.photocatalog.common.exception;

/**
 * Thrown when the mount table cannot be read or a path cannot be canonicalized.
 * Never surfaced past the device resolver, which falls back to the hostname.
 */
public class MountResolutionException extends PhotoCatalogException {
    
    public MountResolutionException(String message) {
        super(message);
    }
    
    public MountResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
