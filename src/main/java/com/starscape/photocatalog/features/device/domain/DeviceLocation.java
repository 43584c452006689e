package com.starscape.photocatalog.features.device.domain;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Where a file lives: a stable device identifier plus a path that is relative
 * to the device's mount point, or absolute for files on the root filesystem.
 */
public record DeviceLocation(
    String deviceId,
    String storagePath,
    Path mountPoint
) {
    
    public DeviceLocation {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("Device ID cannot be blank");
        }
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be blank");
        }
    }
    
    public static DeviceLocation local(String hostname, Path absolutePath) {
        return new DeviceLocation(hostname, absolutePath.toString(), null);
    }
    
    public Optional<Path> mountPointIfAny() {
        return Optional.ofNullable(mountPoint);
    }
}
