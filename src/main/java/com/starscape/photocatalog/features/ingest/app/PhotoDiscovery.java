package com.starscape.photocatalog.features.ingest.app;

import com.starscape.photocatalog.features.ingest.domain.ImageExtensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Finds candidate image files below a root.
 * The managed-storage directory is pruned wherever it appears, so generated
 * bitmaps are never ingested as sources.
 */
@Component
public class PhotoDiscovery {
    
    private static final Logger log = LoggerFactory.getLogger(PhotoDiscovery.class);
    
    /**
     * Discover image files.
     * @param root Directory to walk, or a single file
     * @param recursive Descend into subdirectories
     * @param excludedRoot Managed-storage directory to skip entirely
     * @return candidate files, sorted
     * @throws IllegalArgumentException if the root does not exist
     * @throws IOException if the root cannot be walked
     */
    public List<Path> discover(Path root, boolean recursive, Path excludedRoot) throws IOException {
        if (!Files.exists(root)) {
            throw new IllegalArgumentException("Path does not exist: " + root);
        }
        Path start = root.toRealPath();
        Path excluded = canonical(excludedRoot);
        
        if (excluded != null && start.startsWith(excluded)) {
            log.info("Skipping {}: inside managed storage {}", root, excluded);
            return List.of();
        }
        
        if (Files.isRegularFile(start)) {
            return ImageExtensions.isImage(start) ? List.of(start) : List.of();
        }
        
        List<Path> found = new ArrayList<>();
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;
        Files.walkFileTree(start, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (excluded != null && dir.startsWith(excluded)) {
                    log.debug("Pruning managed storage directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!ImageExtensions.isImage(file)) {
                    return FileVisitResult.CONTINUE;
                }
                if (attrs.isRegularFile()) {
                    found.add(file);
                } else if (attrs.isSymbolicLink() && isLinkedImage(file, excluded)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
            
            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Cannot read {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        
        found.sort(null);
        log.debug("Discovered {} image files under {}", found.size(), start);
        return found;
    }
    
    /**
     * File links are followed to their target; the target decides the managed-storage exclusion.
     */
    private static boolean isLinkedImage(Path link, Path excluded) {
        if (!Files.isRegularFile(link)) {
            return false;
        }
        try {
            Path target = link.toRealPath();
            if (excluded != null && target.startsWith(excluded)) {
                log.debug("Skipping {}: links into managed storage {}", link, excluded);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Cannot resolve link {}: {}", link, e.getMessage());
            return false;
        }
    }
    
    private static Path canonical(Path path) throws IOException {
        if (path == null) {
            return null;
        }
        return Files.exists(path) ? path.toRealPath() : path.toAbsolutePath().normalize();
    }
}
