package com.starscape.photocatalog.features.imaging.domain;

/**
 * Byte range of an embedded JPEG preview inside a RAW container.
 */
public record PreviewLocation(
    long offset,
    long length
) {
}
