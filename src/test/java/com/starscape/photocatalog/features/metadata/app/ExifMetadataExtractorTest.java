package com.starscape.photocatalog.features.metadata.app;

import com.starscape.photocatalog.features.metadata.domain.CaptureMetadata;
import com.starscape.photocatalog.integration.TestUtils;
import com.starscape.photocatalog.integration.TiffFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ExifMetadataExtractorTest {
    
    @TempDir
    Path tempDir;
    
    private final ExifMetadataExtractor extractor = new ExifMetadataExtractor();
    
    private Path tiff(String model, String dateTime, String original, String digitized) throws Exception {
        return Files.write(tempDir.resolve("photo.tif"), TiffFixtures.exifTiff(model, dateTime, original, digitized));
    }
    
    @Test
    void prefersOriginalCaptureTime() throws Exception {
        Path file = tiff("Canon EOS R5", "2024:01:01 10:00:00", "2023:06:15 14:30:00", "2023:06:16 09:00:00");
        
        CaptureMetadata metadata = extractor.extract(file);
        
        assertEquals(LocalDateTime.of(2023, 6, 15, 14, 30, 0), metadata.captureTime());
        assertEquals("Canon EOS R5", metadata.cameraModel());
    }
    
    @Test
    void fallsBackToDigitizedThenModificationTime() throws Exception {
        CaptureMetadata digitized = extractor.extract(tiff(null, "2024:01:01 10:00:00", null, "2023:06:16 09:00:00"));
        assertEquals(LocalDateTime.of(2023, 6, 16, 9, 0, 0), digitized.captureTime());
        
        CaptureMetadata modified = extractor.extract(tiff(null, "2024:01:01 10:00:00", null, null));
        assertEquals(LocalDateTime.of(2024, 1, 1, 10, 0, 0), modified.captureTime());
    }
    
    @Test
    void acceptsDashedTimestamps() throws Exception {
        CaptureMetadata metadata = extractor.extract(tiff(null, null, "2022-12-24 18:05:09", null));
        
        assertEquals(LocalDateTime.of(2022, 12, 24, 18, 5, 9), metadata.captureTime());
    }
    
    @Test
    void unparseableTimestampIsAbsent() throws Exception {
        CaptureMetadata metadata = extractor.extract(tiff("NIKON D750", null, "sometime in June", null));
        
        assertNull(metadata.captureTime());
        assertEquals("NIKON D750", metadata.cameraModel());
    }
    
    @Test
    void stripsWhitespaceFromModel() throws Exception {
        CaptureMetadata metadata = extractor.extract(tiff("  ILCE-7M3   ", null, null, null));
        
        assertEquals("ILCE-7M3", metadata.cameraModel());
    }
    
    @Test
    void imagesWithoutExifHaveNoMetadata() throws Exception {
        Path jpeg = TestUtils.writeTestImage(tempDir.resolve("plain.jpg"), 32, 32);
        
        CaptureMetadata metadata = extractor.extract(jpeg);
        
        assertNull(metadata.captureTime());
        assertNull(metadata.cameraModel());
    }
    
    @Test
    void garbageFilesHaveNoMetadata() throws Exception {
        Path garbage = Files.write(tempDir.resolve("broken.jpg"), new byte[] {0x01, 0x02, 0x03, 0x04});
        
        assertEquals(CaptureMetadata.empty(), extractor.extract(garbage));
    }
    
    @Test
    void cleansModelStrings() {
        assertEquals("X100V", ExifMetadataExtractor.cleanModel("X100V\u0000\u0000 "));
        assertNull(ExifMetadataExtractor.cleanModel(" \u0000 "));
        assertNull(ExifMetadataExtractor.cleanModel(null));
    }
    
    @Test
    void parsesBothTimestampForms() {
        assertEquals(LocalDateTime.of(2020, 2, 29, 23, 59, 59), ExifMetadataExtractor.parseTimestamp("2020:02:29 23:59:59"));
        assertEquals(LocalDateTime.of(2020, 2, 29, 23, 59, 59), ExifMetadataExtractor.parseTimestamp("2020-02-29 23:59:59"));
        assertNull(ExifMetadataExtractor.parseTimestamp("0000:00:00 00:00:00"));
        assertNull(ExifMetadataExtractor.parseTimestamp(null));
    }
}
