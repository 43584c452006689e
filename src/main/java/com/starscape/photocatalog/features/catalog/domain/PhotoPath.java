package com.starscape.photocatalog.features.catalog.domain;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * One physical location of a photograph's source file.
 * Unique per (path, device); the path is relative to the device's mount point
 * unless the file lives on the root filesystem.
 */
@Entity
@Table(name = "photo_paths",
       uniqueConstraints = @UniqueConstraint(name = "uq_photo_paths_path_device", columnNames = {"path", "device"}))
public class PhotoPath implements Persistable<String> {
    
    @Id
    @Column(name = "path_id")
    private String pathId;
    
    @Column(nullable = false, length = 2048)
    private String path;
    
    @Column(nullable = false)
    private String device;
    
    @Column(name = "size_bytes")
    private Long sizeBytes;
    
    @Column(name = "file_created_at")
    private Instant fileCreatedAt;
    
    @Column(name = "file_modified_at")
    private Instant fileModifiedAt;
    
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "photograph_id")
    private Photograph photograph;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Transient
    private boolean isNew = true;
    
    protected PhotoPath() {
        // JPA constructor
    }
    
    public PhotoPath(String path, String device, Photograph photograph) {
        validateInput(path, device);
        
        this.pathId = "pp_" + UUID.randomUUID().toString().replace("-", "");
        this.path = path;
        this.device = device;
        this.photograph = photograph;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }
    
    private void validateInput(String path, String device) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be blank");
        }
        if (device == null || device.isBlank()) {
            throw new IllegalArgumentException("Device cannot be blank");
        }
    }
    
    @Override
    public String getId() {
        return pathId;
    }
    
    @Override
    public boolean isNew() {
        return isNew;
    }
    
    // Getters
    public String getPathId() { return pathId; }
    public String getPath() { return path; }
    public String getDevice() { return device; }
    public Long getSizeBytes() { return sizeBytes; }
    public Instant getFileCreatedAt() { return fileCreatedAt; }
    public Instant getFileModifiedAt() { return fileModifiedAt; }
    public Photograph getPhotograph() { return photograph; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    /**
     * Record the filesystem attributes observed during this ingestion.
     */
    public void refreshFileAttributes(long sizeBytes, Instant fileCreatedAt, Instant fileModifiedAt) {
        this.sizeBytes = sizeBytes;
        this.fileCreatedAt = fileCreatedAt;
        this.fileModifiedAt = fileModifiedAt;
        this.updatedAt = Instant.now();
    }
    
    @PostLoad
    @PostPersist
    protected void markNotNew() {
        this.isNew = false;
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
