package com.starscape.photocatalog.features.ingest.app;

import com.starscape.photocatalog.features.catalog.domain.PhotoPath;
import com.starscape.photocatalog.features.catalog.domain.Photograph;
import com.starscape.photocatalog.features.catalog.infra.JpaPhotoPathRepository;
import com.starscape.photocatalog.features.catalog.infra.JpaPhotographRepository;
import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.ingest.domain.FileOutcome;
import com.starscape.photocatalog.features.ingest.domain.IngestReport;
import com.starscape.photocatalog.features.ingest.domain.IngestRequest;
import com.starscape.photocatalog.features.ingest.infra.ManagedStorage;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import com.starscape.photocatalog.integration.CorruptImageReaderSpi;
import com.starscape.photocatalog.integration.TestUtils;
import com.starscape.photocatalog.integration.TiffFixtures;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end ingestion against the embedded database and a temporary source tree.
 */
@ActiveProfiles("test")
@SpringBootTest
class IngestionOrchestratorIntegrationTest {
    
    @TestConfiguration
    static class ExplodingBackendConfig {
        @Bean
        ImageBackend explodingBackend() {
            return new ExplodingBackend();
        }
    }
    
    /**
     * Claims .x3f files and always fails while decoding.
     */
    static class ExplodingBackend implements ImageBackend {
        @Override
        public Set<String> extensions() {
            return Set.of("x3f");
        }
        
        @Override
        public boolean canProcess(Path file) {
            return Files.isRegularFile(file);
        }
        
        @Override
        public Optional<byte[]> decode(Path file, ImageFormat format, Resolution resolution) {
            throw new IllegalStateException("sensor data corrupt");
        }
    }
    
    @TempDir
    Path tempDir;
    
    @Autowired
    private IngestionOrchestrator orchestrator;
    
    @Autowired
    private JpaPhotographRepository photographRepository;
    
    @Autowired
    private JpaPhotoPathRepository photoPathRepository;
    
    @Autowired
    private ManagedStorage storage;
    
    private Path sources;
    
    @BeforeEach
    void setUp() throws IOException {
        photoPathRepository.deleteAll();
        photographRepository.deleteAll();
        sources = Files.createDirectories(tempDir.resolve("sources"));
    }
    
    private IngestRequest request(String resolution, boolean hash, boolean store) {
        return new IngestRequest(sources, resolution, hash, true, store);
    }
    
    private long storedFileCount() throws IOException {
        Path photographs = storage.root().resolve("photographs");
        if (!Files.isDirectory(photographs)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(photographs)) {
            return files.count();
        }
    }
    
    @Test
    void identicalContentInTwoPlacesBecomesOnePhotograph() throws Exception {
        byte[] image = TestUtils.createTestImage(120, 80);
        Files.createDirectories(sources.resolve("a"));
        Files.createDirectories(sources.resolve("b"));
        Files.write(sources.resolve("a/IMG_0001.jpg"), image);
        Files.write(sources.resolve("b/copy of IMG_0001.jpg"), image);
        
        IngestReport report = orchestrator.ingest(request(null, true, false));
        
        assertTrue(report.success(), report.errors().toString());
        assertEquals(2, report.ingested());
        assertEquals(2, report.hashesCalculated());
        assertEquals(0, report.skipped());
        assertTrue(report.errors().isEmpty());
        
        List<Photograph> photographs = photographRepository.findAll();
        assertEquals(1, photographs.size());
        assertEquals(DigestUtils.md5Hex(image), photographs.get(0).getContentHash());
        assertEquals(2, photoPathRepository.countByPhotographId(photographs.get(0).getPhotographId()));
        
        List<PhotoPath> paths = photoPathRepository.findAll();
        assertEquals(2, paths.size());
        assertEquals(Long.valueOf(image.length), paths.get(0).getSizeBytes());
        assertNotNull(paths.get(0).getFileModifiedAt());
        assertFalse(paths.get(0).getDevice().isBlank());
    }
    
    @Test
    void secondRunSkipsKnownPaths() throws Exception {
        TestUtils.writeTestImage(sources.resolve("one.jpg"), 32, 32);
        TestUtils.writeTestImage(sources.resolve("two.png"), 48, 32);
        orchestrator.ingest(request(null, true, false));
        
        IngestReport again = orchestrator.ingest(request(null, true, false));
        
        assertTrue(again.success());
        assertEquals(0, again.ingested());
        assertEquals(2, again.skipped());
        assertEquals(2, photographRepository.count());
        assertEquals(2, photoPathRepository.count());
    }
    
    @Test
    void withoutHashingEveryFileGetsItsOwnPhotograph() throws Exception {
        byte[] image = TestUtils.createTestImage(20, 20);
        Files.write(sources.resolve("x.jpg"), image);
        Files.write(sources.resolve("y.jpg"), image);
        
        IngestReport report = orchestrator.ingest(request(null, false, false));
        
        assertEquals(2, report.ingested());
        assertEquals(0, report.hashesCalculated());
        List<Photograph> photographs = photographRepository.findAll();
        assertEquals(2, photographs.size());
        assertTrue(photographs.stream().allMatch(p -> p.getContentHash() == null));
    }
    
    @Test
    void storesResizedStandardImage() throws Exception {
        TestUtils.writeTestImage(sources.resolve("wide.jpg"), 400, 300);
        
        IngestReport report = orchestrator.ingest(request("200x200", true, true));
        
        assertTrue(report.success(), report.errors().toString());
        assertEquals(1, report.imagesStored());
        Photograph photograph = photographRepository.findAll().get(0);
        assertTrue(photograph.getStoredImage().startsWith("photographs/"));
        assertTrue(photograph.getStoredImage().endsWith(".jpg"));
        assertFalse(photograph.hasErrors());
        
        BufferedImage stored = TestUtils.readImage(storage.resolve(photograph.getStoredImage()));
        assertEquals(200, stored.getWidth());
        assertEquals(150, stored.getHeight());
    }
    
    @Test
    void invalidResolutionIsReportedButFilesStillIngest() throws Exception {
        TestUtils.writeTestImage(sources.resolve("one.jpg"), 40, 30);
        
        IngestReport report = orchestrator.ingest(request("bogus", true, true));
        
        assertTrue(report.success());
        assertEquals(1, report.ingested());
        assertEquals(1, report.imagesStored());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Invalid resolution format: 'bogus'"));
    }
    
    @Test
    void emptyDirectoryFails() {
        IngestReport report = orchestrator.ingest(request(null, true, false));
        
        assertFalse(report.success());
        assertEquals(List.of("No image files found in: " + sources), report.errors());
    }
    
    @Test
    void missingRootFails() {
        Path missing = tempDir.resolve("nowhere");
        
        IngestReport report = orchestrator.ingest(new IngestRequest(missing, null, true, true, false));
        
        assertFalse(report.success());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Error during ingestion: Path does not exist"));
    }
    
    @Test
    void cancellationStopsBetweenFiles() throws Exception {
        TestUtils.writeTestImage(sources.resolve("1.jpg"), 10, 10);
        TestUtils.writeTestImage(sources.resolve("2.jpg"), 11, 10);
        TestUtils.writeTestImage(sources.resolve("3.jpg"), 12, 10);
        
        IngestProgressListener cancelAfterFirst = new IngestProgressListener() {
            private int processed;
            
            @Override
            public void onFileProcessed(int count, int totalFiles, Path file, FileOutcome outcome) {
                processed = count;
            }
            
            @Override
            public boolean isCancelled() {
                return processed >= 1;
            }
        };
        
        IngestReport report = orchestrator.ingest(request(null, true, false), cancelAfterFirst);
        
        assertTrue(report.cancelled());
        assertEquals(1, report.ingested());
        assertEquals(1, photoPathRepository.count());
    }
    
    @Test
    void recordsCaptureTimeAndCameraModel() throws Exception {
        Files.write(sources.resolve("exif.tif"),
            TiffFixtures.exifTiff("Canon EOS R5", "2024:01:01 10:00:00", "2023:06:15 14:30:00", null));
        
        IngestReport report = orchestrator.ingest(request(null, true, false));
        
        assertEquals(1, report.ingested());
        Photograph photograph = photographRepository.findAll().get(0);
        assertEquals(LocalDateTime.of(2023, 6, 15, 14, 30, 0), photograph.getCaptureTime());
        assertEquals("Canon EOS R5", photograph.getCameraModel());
    }
    
    @Test
    void backendFailureFlagsPhotographAndBatchContinues() throws Exception {
        Files.writeString(sources.resolve("a_broken.x3f"), "sigma raw bytes");
        TestUtils.writeTestImage(sources.resolve("b_fine.jpg"), 16, 16);
        
        IngestReport report = orchestrator.ingest(request(null, true, true));
        
        assertTrue(report.success());
        assertEquals(2, report.ingested());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Failed to decode"));
        assertTrue(report.errors().get(0).contains("sensor data corrupt"));
        
        List<Photograph> flagged = photographRepository.findAll().stream().filter(Photograph::hasErrors).toList();
        assertEquals(1, flagged.size());
        assertTrue(flagged.get(0).hasStoredImage());
    }
    
    @Test
    void failingUnitRollsBackAndLeavesNoStoredFile() throws Exception {
        // Deep enough that the stored path exceeds the column width
        Path deep = sources.resolve("a_deep");
        for (int i = 0; i < 11; i++) {
            deep = deep.resolve(String.valueOf((char) ('a' + i)).repeat(200));
        }
        Files.createDirectories(deep);
        TestUtils.writeTestImage(deep.resolve("too_long.jpg"), 16, 16);
        TestUtils.writeTestImage(sources.resolve("b_fine.jpg"), 24, 16);
        long storedBefore = storedFileCount();
        
        IngestReport report = orchestrator.ingest(request(null, true, true));
        
        assertTrue(report.success());
        assertEquals(1, report.ingested());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Error processing "));
        assertEquals(1, photographRepository.count());
        assertEquals(1, photoPathRepository.count());
        assertEquals(storedBefore + 1, storedFileCount());
    }
    
    @Test
    void unreadableImageIsCataloguedWithErrorFlag() throws Exception {
        Files.write(sources.resolve("damaged.jpg"), CorruptImageReaderSpi.corruptImage());
        CorruptImageReaderSpi spi = CorruptImageReaderSpi.register();
        IngestReport report;
        try {
            report = orchestrator.ingest(request("100x100", true, true));
        } finally {
            spi.deregister();
        }
        
        assertTrue(report.success());
        assertEquals(1, report.ingested());
        assertEquals(0, report.imagesStored());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Failed to store image for "));
        assertTrue(report.errors().get(0).contains(CorruptImageReaderSpi.FAILURE));
        
        Photograph photograph = photographRepository.findAll().get(0);
        assertTrue(photograph.hasErrors());
        assertFalse(photograph.hasStoredImage());
        assertEquals(DigestUtils.md5Hex(CorruptImageReaderSpi.corruptImage()), photograph.getContentHash());
        assertEquals(1, photoPathRepository.count());
    }
}
