package com.starscape.photocatalog.features.ingest.domain;

import java.nio.file.Path;

/**
 * Parameters of one ingestion run.
 * @param root Directory or single file to ingest
 * @param resolution Target size spec for stored images, or null
 * @param calculateHash Compute content hashes and deduplicate
 * @param recursive Descend into subdirectories
 * @param storeImages Write a standardized copy into managed storage
 */
public record IngestRequest(
    Path root,
    String resolution,
    boolean calculateHash,
    boolean recursive,
    boolean storeImages
) {
    
    public IngestRequest {
        if (root == null) {
            throw new IllegalArgumentException("Root path cannot be null");
        }
    }
}
