package com.starscape.photocatalog.features.device.domain;

import java.io.IOException;
import java.util.List;

/**
 * Source of the current mount entries.
 */
public interface MountTable {
    
    List<MountEntry> entries() throws IOException;
}
