package com.starscape.photocatalog.features.imaging.domain;

import com.starscape.photocatalog.common.exception.DecodeException;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Full sensor-data decode for RAW files without a usable embedded preview.
 */
public interface RawDecoder {
    
    boolean isAvailable();
    
    BufferedImage decode(Path file) throws DecodeException;
}
