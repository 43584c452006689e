package com.starscape.photocatalog.features.imaging.infra;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.starscape.photocatalog.common.exception.DecodeException;
import com.starscape.photocatalog.features.imaging.app.BackendRegistry;
import com.starscape.photocatalog.features.imaging.app.ImageTranscoder;
import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import com.starscape.photocatalog.features.imaging.domain.ImageFormat;
import com.starscape.photocatalog.features.imaging.domain.PreviewLocation;
import com.starscape.photocatalog.features.imaging.domain.RawDecoder;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decodes TIFF-container RAW files (NEF, CR2, ARW, DNG and relatives).
 * Prefers the largest embedded JPEG preview; falls back to the external RAW decoder.
 */
@Component
public class RawImageBackend implements ImageBackend {
    
    private static final Logger log = LoggerFactory.getLogger(RawImageBackend.class);
    
    static final Set<String> EXTENSIONS = Set.of(
        "nef", "nrw", "cr2", "arw", "srf", "sr2", "dng", "pef", "srw",
        "orf", "rw2", "3fr", "erf", "mef", "mos", "iiq", "kdc", "dcr"
    );
    
    // TIFF tags JPEGInterchangeFormat / JPEGInterchangeFormatLength
    private static final int TAG_PREVIEW_OFFSET = 0x0201;
    private static final int TAG_PREVIEW_LENGTH = 0x0202;
    
    // Single-strip JPEG images (CR2 and DNG keep the full-size preview this way)
    private static final int TAG_COMPRESSION = 0x0103;
    private static final int TAG_STRIP_OFFSETS = 0x0111;
    private static final int TAG_STRIP_BYTE_COUNTS = 0x0117;
    private static final Set<Integer> JPEG_COMPRESSIONS = Set.of(6, 7);
    
    // Previews beyond this size are not plausible and are ignored
    private static final long MAX_PREVIEW_BYTES = 64L * 1024 * 1024;
    
    private final ImageTranscoder transcoder;
    private final RawDecoder rawDecoder;
    
    public RawImageBackend(ImageTranscoder transcoder, RawDecoder rawDecoder) {
        this.transcoder = transcoder;
        this.rawDecoder = rawDecoder;
    }
    
    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }
    
    @Override
    public boolean canProcess(Path file) {
        return ImageIO.getImageReadersByFormatName("jpeg").hasNext()
                && Files.isRegularFile(file)
                && EXTENSIONS.contains(BackendRegistry.extensionOf(file));
    }
    
    @Override
    public Optional<byte[]> decode(Path file, ImageFormat format, Resolution resolution) {
        try {
            Optional<BufferedImage> preview = extractPreview(file);
            BufferedImage image;
            if (preview.isPresent()) {
                image = preview.get();
                log.debug("Using embedded preview of {} ({}x{})", file, image.getWidth(), image.getHeight());
            } else if (rawDecoder.isAvailable()) {
                log.debug("No usable preview in {}, decoding sensor data", file);
                image = rawDecoder.decode(file);
            } else {
                log.warn("No usable preview in {} and no RAW decoder available", file);
                return Optional.empty();
            }
            return Optional.of(transcoder.resizeAndEncode(image, resolution, format));
        } catch (DecodeException | IOException e) {
            log.warn("Failed to decode RAW file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
    
    @Override
    public Map<String, Object> describe(Path file) {
        Map<String, Object> raw = new LinkedHashMap<>();
        try {
            List<PreviewLocation> previews = locatePreviews(file);
            raw.put("embedded_previews", previews.size());
            if (!previews.isEmpty()) {
                PreviewLocation largest = previews.get(0);
                raw.put("preview_offset", largest.offset());
                raw.put("preview_length", largest.length());
                Optional<BufferedImage> image = extractPreview(file);
                image.ifPresent(preview -> {
                    raw.put("preview_width", preview.getWidth());
                    raw.put("preview_height", preview.getHeight());
                });
            }
            raw.put("raw_decoder_available", rawDecoder.isAvailable());
        } catch (IOException e) {
            raw.put("error", e.getMessage());
        }
        return raw;
    }
    
    /**
     * Largest embedded preview that is a decodable JPEG.
     */
    Optional<BufferedImage> extractPreview(Path file) throws IOException {
        long fileSize = Files.size(file);
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            for (PreviewLocation location : locatePreviews(file)) {
                if (location.offset() + location.length() > fileSize) {
                    log.debug("Preview at {} (+{}) lies outside {}", location.offset(), location.length(), file);
                    continue;
                }
                byte[] bytes = read(channel, location);
                if (!isJpeg(bytes)) {
                    continue;
                }
                try {
                    return Optional.of(transcoder.decode(bytes));
                } catch (DecodeException e) {
                    log.debug("Preview at {} in {} not decodable: {}", location.offset(), file, e.getMessage());
                }
            }
        }
        return Optional.empty();
    }
    
    /**
     * Preview byte ranges declared by the file's IFDs, largest first.
     */
    List<PreviewLocation> locatePreviews(Path file) throws IOException {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(file.toFile());
        } catch (ImageProcessingException e) {
            log.debug("Cannot read IFDs of {}: {}", file, e.getMessage());
            return List.of();
        }
        
        Set<PreviewLocation> previews = new LinkedHashSet<>();
        for (Directory directory : metadata.getDirectories()) {
            addPreview(previews, directory, TAG_PREVIEW_OFFSET, TAG_PREVIEW_LENGTH);
            Integer compression = directory.getInteger(TAG_COMPRESSION);
            if (compression != null && JPEG_COMPRESSIONS.contains(compression)) {
                addPreview(previews, directory, TAG_STRIP_OFFSETS, TAG_STRIP_BYTE_COUNTS);
            }
        }
        List<PreviewLocation> sorted = new ArrayList<>(previews);
        sorted.sort(Comparator.comparingLong(PreviewLocation::length).reversed());
        return sorted;
    }
    
    /**
     * Adds the range if both tags hold a single plausible value; multi-strip images are skipped.
     */
    private static void addPreview(Set<PreviewLocation> previews, Directory directory, int offsetTag, int lengthTag) {
        if (!directory.containsTag(offsetTag) || !directory.containsTag(lengthTag)) {
            return;
        }
        Long offset = directory.getLongObject(offsetTag);
        Long length = directory.getLongObject(lengthTag);
        if (offset != null && length != null && offset > 0 && length > 0 && length <= MAX_PREVIEW_BYTES) {
            previews.add(new PreviewLocation(offset, length));
        }
    }
    
    private static byte[] read(FileChannel channel, PreviewLocation location) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate((int) location.length());
        long position = location.offset();
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
        return buffer.array();
    }
    
    private static boolean isJpeg(byte[] bytes) {
        return bytes.length > 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8;
    }
}
