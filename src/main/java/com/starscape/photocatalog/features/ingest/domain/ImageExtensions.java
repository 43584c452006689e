package com.starscape.photocatalog.features.ingest.domain;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * File extensions recognized as ingestible images.
 */
public final class ImageExtensions {
    
    public static final Set<String> STANDARD = Set.of(
        "jpg", "jpeg", "png", "gif", "bmp", "tiff", "tif", "webp", "heic", "heif"
    );
    
    public static final Set<String> RAW = Set.of(
        "raw", "cr2", "nef", "orf", "sr2", "arw", "dng", "raf", "rw2", "pef", "srw",
        "3fr", "mef", "mos", "ari", "bay", "crw", "cap", "dcs", "dcr", "drf", "eip",
        "erf", "fff", "iiq", "k25", "kdc", "mdc", "mrw", "nrw", "obm", "pbm", "pxn",
        "r3d", "rwl", "rwz", "x3f", "srf"
    );
    
    private static final Set<String> ALL;
    
    static {
        Set<String> all = new HashSet<>(STANDARD);
        all.addAll(RAW);
        ALL = Set.copyOf(all);
    }
    
    private ImageExtensions() {
    }
    
    public static boolean isImage(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return false;
        }
        String filename = name.toString();
        int dot = filename.lastIndexOf('.');
        return dot >= 0 && ALL.contains(filename.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
    
    public static Set<String> all() {
        return ALL;
    }
}
