package com.starscape.photocatalog.features.catalog.domain;

import com.starscape.photocatalog.features.metadata.domain.CaptureMetadata;
import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * A logical photograph, identified by the content hash of its source bytes.
 * Many {@link PhotoPath}s may point at one photograph.
 */
@Entity
@Table(name = "photographs")
public class Photograph implements Persistable<String> {
    
    private static final Pattern CONTENT_HASH = Pattern.compile("^[a-f0-9]{32}$");
    
    @Id
    @Column(name = "photograph_id")
    private String photographId;
    
    @Column(name = "content_hash", unique = true, length = 32)
    private String contentHash;
    
    @Column(name = "stored_image")
    private String storedImage;
    
    @Column(name = "capture_time")
    private LocalDateTime captureTime;
    
    @Column(name = "camera_model")
    private String cameraModel;
    
    @Column(name = "has_errors", nullable = false)
    private boolean hasErrors;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    @Transient
    private boolean isNew = true;
    
    protected Photograph() {
        // JPA constructor
    }
    
    private Photograph(String contentHash) {
        validateInput(contentHash);
        
        this.photographId = "ph_" + UUID.randomUUID().toString().replace("-", "");
        this.contentHash = contentHash;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }
    
    /**
     * New photograph for content seen for the first time.
     */
    public static Photograph withContentHash(String contentHash) {
        if (contentHash == null) {
            throw new IllegalArgumentException("Content hash cannot be null");
        }
        return new Photograph(contentHash);
    }
    
    /**
     * New photograph without a content hash (hashing skipped or failed).
     * Never deduplicated against other files.
     */
    public static Photograph anonymous() {
        return new Photograph(null);
    }
    
    private void validateInput(String contentHash) {
        if (contentHash != null && !CONTENT_HASH.matcher(contentHash).matches()) {
            throw new IllegalArgumentException("Content hash must be 32 lowercase hex characters: " + contentHash);
        }
    }
    
    @Override
    public String getId() {
        return photographId;
    }
    
    @Override
    public boolean isNew() {
        return isNew;
    }
    
    // Getters
    public String getPhotographId() { return photographId; }
    public String getContentHash() { return contentHash; }
    public String getStoredImage() { return storedImage; }
    public LocalDateTime getCaptureTime() { return captureTime; }
    public String getCameraModel() { return cameraModel; }
    public boolean hasErrors() { return hasErrors; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    
    public boolean hasStoredImage() {
        return storedImage != null;
    }
    
    public boolean hasCaptureTime() {
        return captureTime != null;
    }
    
    /**
     * Attach the managed-storage name of the stored bitmap.
     */
    public void attachStoredImage(String storedImage) {
        if (storedImage == null || storedImage.isBlank()) {
            throw new IllegalArgumentException("Stored image cannot be blank");
        }
        this.storedImage = storedImage;
        this.updatedAt = Instant.now();
    }
    
    /**
     * Fill capture time and camera model from metadata. Absent values leave the fields untouched.
     */
    public void recordCapture(CaptureMetadata metadata) {
        metadata.captureTimeIfAny().ifPresent(time -> this.captureTime = time);
        metadata.cameraModelIfAny().ifPresent(model -> this.cameraModel = model);
        this.updatedAt = Instant.now();
    }
    
    /**
     * Mark that a processing step failed. Never cleared automatically.
     */
    public void flagErrors() {
        if (!hasErrors) {
            this.hasErrors = true;
            this.updatedAt = Instant.now();
        }
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
