package com.starscape.photocatalog.features.imaging.app;

import com.starscape.photocatalog.common.config.ImagingProperties;
import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import com.starscape.photocatalog.integration.CorruptImageReaderSpi;
import com.starscape.photocatalog.integration.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageTranscoderTest {
    
    @TempDir
    Path tempDir;
    
    private final ImageTranscoder transcoder = new ImageTranscoder(new ImagingProperties());
    
    @Test
    void fitsRelativelyTallerSourceToTargetHeight() {
        // 4:3 is narrower than 16:9
        assertEquals(new Resolution(1440, 1080), transcoder.scaledSize(4000, 3000, new Resolution(1920, 1080)));
    }
    
    @Test
    void fitsRelativelyWiderSourceToTargetWidth() {
        assertEquals(new Resolution(1920, 480), transcoder.scaledSize(4000, 1000, new Resolution(1920, 1080)));
    }
    
    @Test
    void keepsAspectRatioWithinRounding() {
        Resolution size = transcoder.scaledSize(3000, 4000, new Resolution(800, 800));
        
        assertEquals(800, size.height());
        assertEquals(600, size.width());
    }
    
    @Test
    void neverProducesZeroDimensions() {
        Resolution size = transcoder.scaledSize(10000, 1, new Resolution(100, 100));
        
        assertEquals(100, size.width());
        assertEquals(1, size.height());
    }
    
    @Test
    void resizesAndEncodesJpeg() throws Exception {
        BufferedImage source = TestUtils.readImage(TestUtils.createTestImage(400, 300));
        
        byte[] encoded = transcoder.resizeAndEncode(source, new Resolution(200, 200), ImageFormat.JPEG);
        BufferedImage result = TestUtils.readImage(encoded);
        
        assertEquals(200, result.getWidth());
        assertEquals(150, result.getHeight());
        assertEquals(0xFF, encoded[0] & 0xFF);
        assertEquals(0xD8, encoded[1] & 0xFF);
    }
    
    @Test
    void keepsSizeWithoutTarget() throws Exception {
        BufferedImage source = TestUtils.readImage(TestUtils.createTestImage(64, 48));
        
        BufferedImage result = TestUtils.readImage(transcoder.resizeAndEncode(source, null, ImageFormat.PNG));
        
        assertEquals(64, result.getWidth());
        assertEquals(48, result.getHeight());
    }
    
    @Test
    void flattensTransparencyOntoWhiteForJpeg() throws Exception {
        BufferedImage source = TestUtils.readImage(TestUtils.createTransparentPngImage(64, 64));
        
        BufferedImage result = TestUtils.readImage(transcoder.resizeAndEncode(source, null, ImageFormat.JPEG));
        
        assertFalse(result.getColorModel().hasAlpha());
        Color transparentSide = new Color(result.getRGB(8, 32));
        assertTrue(transparentSide.getRed() > 240 && transparentSide.getGreen() > 240 && transparentSide.getBlue() > 240,
            "transparent area should become white but was " + transparentSide);
        Color opaqueSide = new Color(result.getRGB(56, 32));
        assertTrue(opaqueSide.getBlue() > 200 && opaqueSide.getRed() < 60, "opaque area should stay blue");
    }
    
    @Test
    void pngOutputKeepsTransparency() throws Exception {
        BufferedImage source = TestUtils.readImage(TestUtils.createTransparentPngImage(64, 64));
        
        BufferedImage result = TestUtils.readImage(transcoder.resizeAndEncode(source, new Resolution(32, 32), ImageFormat.PNG));
        
        assertTrue(result.getColorModel().hasAlpha());
        assertEquals(0, result.getRGB(2, 16) >>> 24);
    }
    
    @Test
    void normalizationLeavesOpaqueRgbUntouched() {
        BufferedImage rgb = new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB);
        
        assertSame(rgb, ImageTranscoder.normalizeForLossy(rgb));
    }
    
    @Test
    void decodeRejectsNonImages() throws Exception {
        Path text = Files.writeString(tempDir.resolve("notes.jpg"), "not an image");
        
        assertThrows(DecodeException.class, () -> transcoder.decode(text));
        assertThrows(DecodeException.class, () -> transcoder.decode(new byte[] {1, 2, 3}));
    }
    
    @Test
    void readerFailuresBecomeDecodeExceptions() throws Exception {
        CorruptImageReaderSpi spi = CorruptImageReaderSpi.register();
        try {
            Path file = Files.write(tempDir.resolve("damaged.jpg"), CorruptImageReaderSpi.corruptImage());
            
            DecodeException fromFile = assertThrows(DecodeException.class, () -> transcoder.decode(file));
            DecodeException fromBytes = assertThrows(DecodeException.class,
                () -> transcoder.decode(CorruptImageReaderSpi.corruptImage()));
            
            assertInstanceOf(IllegalArgumentException.class, fromFile.getCause());
            assertTrue(fromFile.getMessage().contains(CorruptImageReaderSpi.FAILURE));
            assertInstanceOf(IllegalArgumentException.class, fromBytes.getCause());
        } finally {
            spi.deregister();
        }
    }
}
