package com.starscape.photocatalog.features.device.infra;

import com.starscape.photocatalog.features.device.domain.VolumeDirectory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves labels and UUIDs from the udev symlink directories
 * (/dev/disk/by-label, /dev/disk/by-uuid). Each link is named after the label
 * or UUID and points at the device node.
 */
public class DiskByIdVolumeDirectory implements VolumeDirectory {
    
    private final Path byLabelDir;
    private final Path byUuidDir;
    
    public DiskByIdVolumeDirectory(Path byLabelDir, Path byUuidDir) {
        this.byLabelDir = byLabelDir;
        this.byUuidDir = byUuidDir;
    }
    
    @Override
    public Optional<String> findLabel(String deviceNode) throws IOException {
        return findLinkPointingAt(byLabelDir, deviceNode);
    }
    
    @Override
    public Optional<String> findUuid(String deviceNode) throws IOException {
        return findLinkPointingAt(byUuidDir, deviceNode);
    }
    
    private Optional<String> findLinkPointingAt(Path directory, String deviceNode) throws IOException {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        Path device = Path.of(deviceNode);
        Path deviceName = device.getFileName();
        
        try (DirectoryStream<Path> links = Files.newDirectoryStream(directory)) {
            for (Path link : links) {
                if (!Files.isSymbolicLink(link)) {
                    continue;
                }
                Path target = Files.readSymbolicLink(link);
                // Targets are usually relative, e.g. ../../sdb1
                if (target.equals(device) || (deviceName != null && deviceName.equals(target.getFileName()))) {
                    return Optional.of(link.getFileName().toString());
                }
            }
        }
        return Optional.empty();
    }
}
