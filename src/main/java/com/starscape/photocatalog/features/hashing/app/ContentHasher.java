package com.starscape.photocatalog.features.hashing.app;

import com.starscape.photocatalog.common.config.IngestProperties;
import com.starscape.photocatalog.common.exception.HashException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;

/**
 * Computes the content digest used as the deduplication key.
 * Files are streamed in fixed-size chunks so memory use does not grow with file size.
 */
@Service
public class ContentHasher {
    
    private static final Logger log = LoggerFactory.getLogger(ContentHasher.class);
    
    private final int chunkSize;
    
    public ContentHasher(IngestProperties ingestProperties) {
        this.chunkSize = ingestProperties.getHashChunkSize();
    }
    
    /**
     * Calculate the MD5 digest of a file.
     * @param file File to read
     * @return 32 lowercase hex characters
     * @throws HashException if the file cannot be read
     */
    public String hash(Path file) throws HashException {
        MessageDigest digest = DigestUtils.getMd5Digest();
        byte[] buffer = new byte[chunkSize];
        
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        } catch (IOException e) {
            throw new HashException("Failed to calculate hash for " + file + ": " + e.getMessage(), e);
        }
        
        String hex = Hex.encodeHexString(digest.digest());
        log.debug("Calculated hash: file={}, md5={}", file, hex);
        return hex;
    }
}
