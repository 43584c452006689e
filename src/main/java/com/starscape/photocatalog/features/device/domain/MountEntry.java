package com.starscape.photocatalog.features.device.domain;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * One line of the system mount table.
 */
public record MountEntry(
    String device,
    Path mountPoint,
    String fsType
) {
    
    private static final Set<String> NETWORK_FS_TYPES = Set.of("nfs", "nfs4", "cifs", "smbfs", "smb3");
    
    public boolean isRoot() {
        return mountPoint.getParent() == null;
    }
    
    public boolean isNetwork() {
        return fsType != null && NETWORK_FS_TYPES.contains(fsType.toLowerCase(Locale.ROOT));
    }
    
    /**
     * Leaf name of the mount point, or the whole mount point when it has none.
     */
    public String mountName() {
        Path leaf = mountPoint.getFileName();
        return leaf == null ? mountPoint.toString() : leaf.toString();
    }
}
