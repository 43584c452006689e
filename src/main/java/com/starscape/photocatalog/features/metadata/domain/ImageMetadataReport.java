package com.starscape.photocatalog.features.metadata.domain;

import java.util.Map;

/**
 * Everything known about a single file, grouped by section.
 * Sections that do not apply are empty.
 */
public record ImageMetadataReport(
    Map<String, Object> file,
    Map<String, Object> image,
    Map<String, Map<String, String>> exif,
    Map<String, Object> raw
) {
}
