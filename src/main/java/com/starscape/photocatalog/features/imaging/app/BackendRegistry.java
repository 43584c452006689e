package com.starscape.photocatalog.features.imaging.app;

import com.starscape.photocatalog.features.imaging.domain.ImageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Maps lowercase file extensions to the backend that decodes them.
 * Exactly one backend may own an extension.
 */
@Component
public class BackendRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(BackendRegistry.class);
    
    private final Map<String, ImageBackend> backends = new TreeMap<>();
    
    public BackendRegistry(List<ImageBackend> imageBackends) {
        for (ImageBackend backend : imageBackends) {
            for (String extension : backend.extensions()) {
                register(extension, backend);
            }
        }
        log.info("Registered image backends for extensions: {}", backends.keySet());
    }
    
    /**
     * Register a backend for one extension.
     * @throws IllegalStateException if another backend already owns the extension
     */
    public void register(String extension, ImageBackend backend) {
        String key = normalize(extension);
        ImageBackend existing = backends.get(key);
        if (existing != null && existing != backend) {
            throw new IllegalStateException(String.format(
                "Extension '.%s' is already handled by %s",
                key, existing.getClass().getSimpleName()));
        }
        backends.put(key, backend);
    }
    
    /**
     * Backend for the file, if one is registered for its extension and reports it can process it.
     */
    public Optional<ImageBackend> find(Path file) {
        ImageBackend backend = backends.get(extensionOf(file));
        if (backend == null || !backend.canProcess(file)) {
            return Optional.empty();
        }
        return Optional.of(backend);
    }
    
    public Set<String> extensions() {
        return Collections.unmodifiableSet(backends.keySet());
    }
    
    public static String extensionOf(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String filename = name.toString();
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
    
    private static String normalize(String extension) {
        String key = extension.startsWith(".") ? extension.substring(1) : extension;
        return key.toLowerCase(Locale.ROOT);
    }
}
