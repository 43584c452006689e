package com.starscape.photocatalog.features.device.domain;

import java.io.IOException;
import java.util.Optional;

/**
 * Lookup of volume labels and UUIDs for a device node such as /dev/sdb1.
 */
public interface VolumeDirectory {
    
    Optional<String> findLabel(String deviceNode) throws IOException;
    
    Optional<String> findUuid(String deviceNode) throws IOException;
}
