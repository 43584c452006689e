package com.starscape.photocatalog.features.catalog.domain;

import java.util.Optional;

public interface PhotoPathRepository {
    PhotoPath save(PhotoPath photoPath);
    Optional<PhotoPath> findByPathAndDevice(String path, String device);
    long countByPhotographId(String photographId);
}
