package com.starscape.photocatalog.features.device.domain;

/**
 * Name of the machine, used as the device identifier for the root filesystem.
 */
@FunctionalInterface
public interface HostIdentity {
    
    String hostname();
}
