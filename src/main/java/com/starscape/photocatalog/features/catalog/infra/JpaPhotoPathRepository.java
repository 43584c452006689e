package com.starscape.photocatalog.features.catalog.infra;

import com.starscape.photocatalog.features.catalog.domain.PhotoPath;
import com.starscape.photocatalog.features.catalog.domain.PhotoPathRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaPhotoPathRepository extends JpaRepository<PhotoPath, String>, PhotoPathRepository {
    
    @Override
    PhotoPath save(PhotoPath photoPath);
    
    Optional<PhotoPath> findByPathAndDevice(String path, String device);
    
    @Override
    @Query("SELECT COUNT(p) FROM PhotoPath p WHERE p.photograph.photographId = :photographId")
    long countByPhotographId(@Param("photographId") String photographId);
}
