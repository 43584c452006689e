package com.starscape.photocatalog.features.imaging.app;

import com.starscape.photocatalog.common.config.ImagingProperties;
import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.resizers.configurations.Antialiasing;
import net.coobird.thumbnailator.resizers.configurations.Rendering;
import net.coobird.thumbnailator.resizers.configurations.ScalingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Aspect-preserving resize and re-encode of bitmaps.
 */
@Service
public class ImageTranscoder {
    
    private static final Logger log = LoggerFactory.getLogger(ImageTranscoder.class);
    
    private final double jpegQuality;
    
    public ImageTranscoder(ImagingProperties imagingProperties) {
        this.jpegQuality = imagingProperties.getJpegQuality();
    }
    
    /**
     * Decode a file with the registered ImageIO readers.
     * @throws DecodeException if no reader understands the file or it cannot be read
     */
    public BufferedImage decode(Path file) throws DecodeException {
        try {
            BufferedImage image = ImageIO.read(file.toFile());
            if (image == null) {
                throw new DecodeException("Unsupported image format: " + file.getFileName());
            }
            return image;
        } catch (IOException | RuntimeException e) {
            // ImageIO readers throw unchecked exceptions on corrupt input
            throw new DecodeException("Failed to decode " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
    
    /**
     * Decode in-memory image bytes.
     * @throws DecodeException if the bytes are not a readable image
     */
    public BufferedImage decode(byte[] data) throws DecodeException {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
            if (image == null) {
                throw new DecodeException("Unsupported image data (" + data.length + " bytes)");
            }
            return image;
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Failed to decode image data: " + e.getMessage(), e);
        }
    }
    
    /**
     * Size that fits the source inside the target while keeping its aspect ratio.
     * A relatively wider source is fitted to the target width, otherwise to the target height.
     */
    public Resolution scaledSize(int sourceWidth, int sourceHeight, Resolution target) {
        double sourceAspect = (double) sourceWidth / sourceHeight;
        int width;
        int height;
        if (sourceAspect > target.aspectRatio()) {
            width = target.width();
            height = (int) (target.width() / sourceAspect);
        } else {
            height = target.height();
            width = (int) (target.height() * sourceAspect);
        }
        return new Resolution(Math.max(1, width), Math.max(1, height));
    }
    
    /**
     * Optionally resize, then encode.
     * Lossy output gets alpha and palette images flattened onto white first.
     * @param image Decoded bitmap
     * @param target Target size, or null to keep the original size
     * @param format Output format
     * @return encoded bytes
     */
    public byte[] resizeAndEncode(BufferedImage image, Resolution target, ImageFormat format) throws IOException {
        BufferedImage source = format.isLossy() ? normalizeForLossy(image) : image;
        
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(source)
                .scalingMode(ScalingMode.PROGRESSIVE_BILINEAR)
                .antialiasing(Antialiasing.ON)
                .rendering(Rendering.QUALITY)
                .imageType(outputImageType(source, format))
                .outputFormat(format.extension());
        
        if (target != null) {
            Resolution size = scaledSize(image.getWidth(), image.getHeight(), target);
            builder.forceSize(size.width(), size.height());
            log.debug("Resizing {}x{} to {} (requested {})", image.getWidth(), image.getHeight(), size, target);
        } else {
            builder.scale(1.0);
        }
        
        if (format.isLossy()) {
            builder.outputQuality(jpegQuality);
        }
        
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        builder.toOutputStream(output);
        return output.toByteArray();
    }
    
    private static int outputImageType(BufferedImage source, ImageFormat format) {
        if (!format.isLossy() && source.getColorModel().hasAlpha()) {
            return BufferedImage.TYPE_INT_ARGB;
        }
        return BufferedImage.TYPE_INT_RGB;
    }
    
    /**
     * RGB and grayscale pass through; everything else is composited onto an opaque white background.
     */
    static BufferedImage normalizeForLossy(BufferedImage image) {
        boolean needsFlattening = image.getColorModel().hasAlpha()
                || image.getColorModel() instanceof IndexColorModel
                || image.getType() == BufferedImage.TYPE_CUSTOM;
        if (!needsFlattening) {
            return image;
        }
        
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
