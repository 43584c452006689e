package com.starscape.photocatalog.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Configuration properties for ingestion.
 * Binds to app.ingest.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.ingest")
public class IngestProperties {
    
    /**
     * Managed storage directory. Stored bitmaps are written below it and
     * discovery never descends into it.
     */
    @NotBlank
    private String storageRoot = "./media";
    
    /**
     * Format of stored bitmaps (JPEG or PNG).
     */
    @NotBlank
    private String storedFormat = "JPEG";
    
    @Min(512)
    private int hashChunkSize = 4096;
    
    public String getStorageRoot() {
        return storageRoot;
    }
    
    public void setStorageRoot(String storageRoot) {
        this.storageRoot = storageRoot;
    }
    
    public String getStoredFormat() {
        return storedFormat;
    }
    
    public void setStoredFormat(String storedFormat) {
        this.storedFormat = storedFormat;
    }
    
    public int getHashChunkSize() {
        return hashChunkSize;
    }
    
    public void setHashChunkSize(int hashChunkSize) {
        this.hashChunkSize = hashChunkSize;
    }
    
    /**
     * Storage root as an absolute, normalized path.
     */
    public Path storageRootPath() {
        return Path.of(storageRoot).toAbsolutePath().normalize();
    }
}
