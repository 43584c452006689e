package com.starscape.photocatalog.features.ingest.app;

import com.starscape.photocatalog.common.config.IngestProperties;
import com.starscape.photocatalog.common.domain.StepResult;
import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.common.exception.HashException;
import com.starscape.photocatalog.features.catalog.domain.PhotoPath;
import com.starscape.photocatalog.features.catalog.domain.PhotoPathRepository;
import com.starscape.photocatalog.features.catalog.domain.Photograph;
import com.starscape.photocatalog.features.catalog.domain.PhotographRepository;
import com.starscape.photocatalog.features.device.app.DeviceResolver;
import com.starscape.photocatalog.features.device.domain.DeviceLocation;
import com.starscape.photocatalog.features.hashing.app.ContentHasher;
import com.starscape.photocatalog.features.imaging.app.BackendRegistry;
import com.starscape.photocatalog.features.imaging.app.ImageTranscoder;
import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.ingest.domain.FileOutcome;
import com.starscape.photocatalog.features.ingest.infra.ManagedStorage;
import com.starscape.photocatalog.features.metadata.app.ExifMetadataExtractor;
import com.starscape.photocatalog.features.metadata.domain.CaptureMetadata;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ingests a single file as one atomic unit.
 * Step failures (hash, decode, metadata) are collected and flag the photograph;
 * anything else rolls the whole unit back.
 */
@Service
public class FileIngestHandler {
    
    private static final Logger log = LoggerFactory.getLogger(FileIngestHandler.class);
    
    private final DeviceResolver deviceResolver;
    private final ContentHasher contentHasher;
    private final BackendRegistry backendRegistry;
    private final ImageTranscoder transcoder;
    private final ExifMetadataExtractor metadataExtractor;
    private final ManagedStorage storage;
    private final PhotographRepository photographRepository;
    private final PhotoPathRepository photoPathRepository;
    private final ImageFormat storedFormat;
    
    public FileIngestHandler(
            DeviceResolver deviceResolver,
            ContentHasher contentHasher,
            BackendRegistry backendRegistry,
            ImageTranscoder transcoder,
            ExifMetadataExtractor metadataExtractor,
            ManagedStorage storage,
            PhotographRepository photographRepository,
            PhotoPathRepository photoPathRepository,
            IngestProperties ingestProperties) {
        this.deviceResolver = deviceResolver;
        this.contentHasher = contentHasher;
        this.backendRegistry = backendRegistry;
        this.transcoder = transcoder;
        this.metadataExtractor = metadataExtractor;
        this.storage = storage;
        this.photographRepository = photographRepository;
        this.photoPathRepository = photoPathRepository;
        this.storedFormat = ImageFormat.fromName(ingestProperties.getStoredFormat())
                .orElseThrow(() -> new IllegalArgumentException(
                    "Unsupported stored format: " + ingestProperties.getStoredFormat()));
    }
    
    /**
     * Ingest one file in its own transaction.
     * @param file Source file
     * @param resolution Target size for stored images, or null for no resize
     * @param calculateHash Compute the content hash and deduplicate on it
     * @param storeImages Write a standardized copy into managed storage
     * @return outcome, including any non-fatal step errors
     * @throws IOException if the file's attributes cannot be read (the unit rolls back)
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, rollbackFor = Exception.class)
    public FileOutcome ingest(Path file, Resolution resolution, boolean calculateHash, boolean storeImages) throws IOException {
        DeviceLocation location = deviceResolver.resolve(file);
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        
        Optional<PhotoPath> existing = photoPathRepository.findByPathAndDevice(location.storagePath(), location.deviceId());
        if (existing.isPresent()) {
            PhotoPath photoPath = existing.get();
            refreshAttributes(photoPath, attributes);
            log.debug("Already catalogued: {} on '{}'", location.storagePath(), location.deviceId());
            Photograph linked = photoPath.getPhotograph();
            return FileOutcome.skipped(linked == null ? null : linked.getPhotographId());
        }
        
        List<String> errors = new ArrayList<>();
        boolean hashCalculated = false;
        Photograph photograph;
        
        // Hash before creating anything so identical content links to one photograph
        if (calculateHash) {
            StepResult<String> digest = hash(file);
            if (digest.isSuccess()) {
                hashCalculated = true;
                photograph = linkOrCreate(digest.value());
            } else {
                errors.add(digest.error());
                photograph = photographRepository.save(Photograph.anonymous());
            }
        } else {
            photograph = photographRepository.save(Photograph.anonymous());
        }
        
        boolean imageStored = false;
        if (storeImages && !photograph.hasStoredImage()) {
            StepResult<String> stored = storeImage(file, resolution, errors);
            if (stored.isSuccess()) {
                photograph.attachStoredImage(stored.value());
                imageStored = true;
            } else {
                errors.add(stored.error());
            }
        }
        
        if (!photograph.hasCaptureTime()) {
            StepResult<CaptureMetadata> metadata = extractMetadata(file);
            if (metadata.isSuccess()) {
                photograph.recordCapture(metadata.value());
            } else {
                errors.add(metadata.error());
            }
        }
        
        if (!errors.isEmpty()) {
            photograph.flagErrors();
        }
        photograph = photographRepository.save(photograph);
        
        PhotoPath photoPath = new PhotoPath(location.storagePath(), location.deviceId(), photograph);
        refreshAttributes(photoPath, attributes);
        photoPathRepository.save(photoPath);
        
        log.debug("Ingested {} as {} (hash={}, stored={}, errors={})",
                file, photograph.getPhotographId(), hashCalculated, imageStored, errors.size());
        return FileOutcome.ingested(photograph.getPhotographId(), hashCalculated, imageStored, errors);
    }
    
    private Photograph linkOrCreate(String contentHash) {
        Optional<Photograph> existing = photographRepository.findByContentHash(contentHash);
        if (existing.isPresent()) {
            log.debug("Linking to existing photograph {} (hash {})", existing.get().getPhotographId(), contentHash);
            return existing.get();
        }
        return photographRepository.save(Photograph.withContentHash(contentHash));
    }
    
    private StepResult<String> hash(Path file) {
        try {
            return StepResult.success(contentHasher.hash(file));
        } catch (HashException e) {
            log.warn(e.getMessage());
            return StepResult.failure(e.getMessage());
        }
    }
    
    /**
     * Backend decode first; otherwise a byte copy, or a generic decode and resize when a resolution is set.
     * Backend exceptions are recorded but still fall through to the generic path.
     */
    private StepResult<String> storeImage(Path file, Resolution resolution, List<String> errors) {
        try {
            Optional<ImageBackend> backend = backendRegistry.find(file);
            if (backend.isPresent()) {
                Optional<byte[]> decoded = decodeWithBackend(backend.get(), file, resolution, errors);
                if (decoded.isPresent()) {
                    return StepResult.success(remember(storage.store(decoded.get(), storedFormat.extension())));
                }
            }
            
            if (resolution == null) {
                return StepResult.success(remember(storage.copy(file)));
            }
            byte[] encoded = transcoder.resizeAndEncode(transcoder.decode(file), resolution, storedFormat);
            return StepResult.success(remember(storage.store(encoded, storedFormat.extension())));
            
        } catch (DecodeException | IOException e) {
            log.warn("Failed to store image for {}: {}", file, e.getMessage());
            return StepResult.failure("Failed to store image for " + file + ": " + e.getMessage());
        }
    }
    
    private Optional<byte[]> decodeWithBackend(ImageBackend backend, Path file, Resolution resolution, List<String> errors) {
        try {
            Optional<byte[]> decoded = backend.decode(file, storedFormat, resolution);
            if (decoded.isEmpty()) {
                log.debug("{} returned nothing for {}, using generic path", backend.getClass().getSimpleName(), file);
            }
            return decoded;
        } catch (RuntimeException e) {
            log.warn("Backend {} failed on {}", backend.getClass().getSimpleName(), file, e);
            errors.add("Failed to decode " + file + ": " + e.getMessage());
            return Optional.empty();
        }
    }
    
    private StepResult<CaptureMetadata> extractMetadata(Path file) {
        try {
            return StepResult.success(metadataExtractor.extract(file));
        } catch (RuntimeException e) {
            log.warn("Metadata extraction failed for {}", file, e);
            return StepResult.failure("Failed to extract metadata from " + file + ": " + e.getMessage());
        }
    }
    
    /**
     * Delete the stored file again if this unit rolls back.
     */
    private String remember(String storedName) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        storage.delete(storedName);
                    }
                }
            });
        }
        return storedName;
    }
    
    private static void refreshAttributes(PhotoPath photoPath, BasicFileAttributes attributes) {
        photoPath.refreshFileAttributes(
            attributes.size(),
            attributes.creationTime().toInstant(),
            attributes.lastModifiedTime().toInstant()
        );
    }
}
