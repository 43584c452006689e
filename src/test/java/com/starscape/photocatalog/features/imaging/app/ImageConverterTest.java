package com.starscape.photocatalog.features.imaging.app;

import com.starscape.photocatalog.common.config.ImagingProperties;
import com.starscape.photocatalog.features.imaging.domain.ConversionResult;
import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.resolution.app.ResolutionParser;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import com.starscape.photocatalog.integration.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ImageConverterTest {
    
    @TempDir
    Path tempDir;
    
    private ImageConverter converter;
    
    @BeforeEach
    void setUp() {
        ImageTranscoder transcoder = new ImageTranscoder(new ImagingProperties());
        converter = new ImageConverter(new BackendRegistry(List.of()), transcoder, new ResolutionParser());
    }
    
    @Test
    void convertsNextToSourceWithResolution() throws Exception {
        Path source = Files.write(tempDir.resolve("scan.png"), TestUtils.createTransparentPngImage(400, 300));
        
        ConversionResult result = converter.convert(source, null, "200x200", ImageFormat.JPEG);
        
        assertTrue(result.success(), result.message());
        assertEquals(tempDir.resolve("scan.jpg"), result.destination());
        BufferedImage image = TestUtils.readImage(result.destination());
        assertEquals(200, image.getWidth());
        assertEquals(150, image.getHeight());
    }
    
    @Test
    void writesIntoOutputDirectoryCreatingIt() throws Exception {
        Path source = TestUtils.writeTestImage(tempDir.resolve("in/photo.jpg"), 64, 48);
        String output = tempDir.resolve("out/nested").toString() + "/";
        
        ConversionResult result = converter.convert(source, output, null, ImageFormat.PNG);
        
        assertTrue(result.success(), result.message());
        assertEquals(tempDir.resolve("out/nested/photo.png"), result.destination());
        assertTrue(Files.isRegularFile(result.destination()));
    }
    
    @Test
    void invalidResolutionIsIgnored() throws Exception {
        Path source = TestUtils.writeTestImage(tempDir.resolve("photo.jpg"), 64, 48);
        
        ConversionResult result = converter.convert(source, tempDir.resolve("copy.png").toString(), "bogus", ImageFormat.PNG);
        
        assertTrue(result.success(), result.message());
        assertEquals(64, TestUtils.readImage(result.destination()).getWidth());
    }
    
    @Test
    void missingSourceFails() {
        ConversionResult result = converter.convert(tempDir.resolve("missing.nef"), null, null, ImageFormat.JPEG);
        
        assertFalse(result.success());
        assertTrue(result.message().startsWith("Source file not found"));
    }
    
    @Test
    void undecodableSourceFails() throws Exception {
        Path source = Files.writeString(tempDir.resolve("photo.heic"), "not decodable here");
        
        ConversionResult result = converter.convert(source, null, null, ImageFormat.JPEG);
        
        assertFalse(result.success());
        assertTrue(result.message().contains("Failed to convert"));
    }
    
    @Test
    void refusesToOverwriteSource() throws Exception {
        Path source = TestUtils.writeTestImage(tempDir.resolve("photo.jpg"), 16, 16);
        
        ConversionResult result = converter.convert(source, null, null, ImageFormat.JPEG);
        
        assertFalse(result.success());
    }
    
    @Test
    void resolvesDestinations() throws Exception {
        Path source = Path.of("/photos/DSC_0001.NEF");
        Path existingDir = Files.createDirectories(tempDir.resolve("exports"));
        
        assertEquals(Path.of("/photos/DSC_0001.jpg"), ImageConverter.resolveDestination(source, null, ImageFormat.JPEG));
        assertEquals(existingDir.resolve("DSC_0001.png"),
            ImageConverter.resolveDestination(source, existingDir.toString(), ImageFormat.PNG));
        assertEquals(Path.of("/tmp/out.jpg"), ImageConverter.resolveDestination(source, "/tmp/out.tiff", ImageFormat.JPEG));
        assertEquals(Path.of("renamed.png"), ImageConverter.resolveDestination(source, "renamed", ImageFormat.PNG));
    }
    
    @Test
    void backendFailureFallsBackToGenericDecoder() throws Exception {
        ImageBackend failing = new ImageBackend() {
            @Override
            public Set<String> extensions() {
                return Set.of("png");
            }
            
            @Override
            public boolean canProcess(Path file) {
                return Files.isRegularFile(file);
            }
            
            @Override
            public Optional<byte[]> decode(Path file, ImageFormat format, Resolution resolution) {
                throw new IllegalStateException("decoder crashed");
            }
        };
        ImageConverter withFailingBackend = new ImageConverter(new BackendRegistry(List.of(failing)),
            new ImageTranscoder(new ImagingProperties()), new ResolutionParser());
        Path source = TestUtils.writeTestImage(tempDir.resolve("scan.png"), 80, 60);
        
        ConversionResult result = withFailingBackend.convert(source, null, "40x40", ImageFormat.JPEG);
        
        assertTrue(result.success(), result.message());
        assertEquals(40, TestUtils.readImage(result.destination()).getWidth());
    }
}
