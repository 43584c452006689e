package com.starscape.photocatalog.features.catalog.domain;

import java.util.Optional;

public interface PhotographRepository {
    Photograph save(Photograph photograph);
    Optional<Photograph> findById(String photographId);
    Optional<Photograph> findByContentHash(String contentHash);
}
