package com.starscape.photocatalog.features.metadata.app;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.starscape.photocatalog.features.imaging.app.BackendRegistry;
import com.starscape.photocatalog.features.metadata.domain.ImageMetadataReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Collects file, image, EXIF and RAW details of one file for display.
 */
@Service
public class MetadataInspector {
    
    private static final Logger log = LoggerFactory.getLogger(MetadataInspector.class);
    
    private final BackendRegistry backendRegistry;
    
    public MetadataInspector(BackendRegistry backendRegistry) {
        this.backendRegistry = backendRegistry;
    }
    
    /**
     * Inspect a file.
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if its attributes cannot be read
     */
    public ImageMetadataReport inspect(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new NoSuchFileException(file.toString(), null, "File not found");
        }
        Map<String, Object> fileInfo = describeFile(file);
        Map<String, Object> imageInfo = describeImage(file);
        Map<String, Map<String, String>> exif = extractExif(file);
        Map<String, Object> raw = backendRegistry.find(file)
                .map(backend -> backend.describe(file))
                .orElse(Map.of());
        return new ImageMetadataReport(fileInfo, imageInfo, exif, raw);
    }
    
    private Map<String, Object> describeFile(Path file) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("path", file.toAbsolutePath().toString());
        info.put("name", file.getFileName().toString());
        info.put("extension", BackendRegistry.extensionOf(file));
        info.put("size_bytes", attributes.size());
        info.put("size_mb", Math.round(attributes.size() / (1024.0 * 1024.0) * 100.0) / 100.0);
        info.put("created", attributes.creationTime().toInstant().toString());
        info.put("modified", attributes.lastModifiedTime().toInstant().toString());
        return info;
    }
    
    /**
     * Dimensions and color model from the image header, without decoding pixels.
     */
    private Map<String, Object> describeImage(Path file) {
        Map<String, Object> info = new LinkedHashMap<>();
        try (ImageInputStream input = ImageIO.createImageInputStream(file.toFile())) {
            if (input == null) {
                return info;
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return info;
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                info.put("width", reader.getWidth(0));
                info.put("height", reader.getHeight(0));
                info.put("format", reader.getFormatName().toUpperCase(Locale.ROOT));
                
                Iterator<ImageTypeSpecifier> types = reader.getImageTypes(0);
                if (types != null && types.hasNext()) {
                    ColorModel colorModel = types.next().getColorModel();
                    info.put("mode", colorMode(colorModel));
                    info.put("has_transparency", colorModel.hasAlpha());
                }
            } finally {
                reader.dispose();
            }
        } catch (IOException | RuntimeException e) {
            // Readers for some RAW containers fail on their TIFF structure
            log.debug("Could not read image header of {}: {}", file, e.getMessage());
            info.put("error", sanitizeString(e.getMessage()));
        }
        return info;
    }
    
    /**
     * Every tag of every metadata directory, keyed by directory name.
     */
    private Map<String, Map<String, String>> extractExif(Path file) {
        Map<String, Map<String, String>> exif = new LinkedHashMap<>();
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(file.toFile());
            for (Directory directory : metadata.getDirectories()) {
                String directoryName = sanitizeString(directory.getName());
                Map<String, String> tags = new LinkedHashMap<>();
                for (Tag tag : directory.getTags()) {
                    tags.put(sanitizeString(tag.getTagName()), sanitizeString(tag.getDescription()));
                }
                if (!tags.isEmpty()) {
                    exif.put(directoryName, tags);
                }
            }
        } catch (ImageProcessingException | IOException e) {
            log.debug("Failed to extract EXIF data: {}", e.getMessage());
        }
        return exif;
    }
    
    private static String colorMode(ColorModel colorModel) {
        if (colorModel instanceof IndexColorModel) {
            return "P";
        }
        if (colorModel.getNumColorComponents() == 1) {
            return colorModel.hasAlpha() ? "LA" : "L";
        }
        return colorModel.hasAlpha() ? "RGBA" : "RGB";
    }
    
    /**
     * Remove null bytes, which JSON output and terminals do not handle.
     */
    private static String sanitizeString(String str) {
        if (str == null) {
            return null;
        }
        return str.replace("\u0000", "");
    }
}
