package com.starscape.photocatalog.features.catalog.infra;

import com.starscape.photocatalog.features.catalog.domain.Photograph;
import com.starscape.photocatalog.features.catalog.domain.PhotographRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaPhotographRepository extends JpaRepository<Photograph, String>, PhotographRepository {
    
    @Override
    Photograph save(Photograph photograph);
    
    Optional<Photograph> findByContentHash(String contentHash);
}
