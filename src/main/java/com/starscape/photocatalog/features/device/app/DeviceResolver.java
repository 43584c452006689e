package com.starscape.photocatalog.features.device.app;

import com.starscape.photocatalog.common.exception.MountResolutionException;
import com.starscape.photocatalog.features.device.domain.DeviceLocation;
import com.starscape.photocatalog.features.device.domain.HostIdentity;
import com.starscape.photocatalog.features.device.domain.MountEntry;
import com.starscape.photocatalog.features.device.domain.MountTable;
import com.starscape.photocatalog.features.device.domain.VolumeDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Identifies the volume a file lives on and the file's path relative to that volume.
 * Identity follows the volume (label, UUID, server) rather than where it happens
 * to be mounted, so catalog entries survive remounts.
 */
@Service
public class DeviceResolver {
    
    private static final Logger log = LoggerFactory.getLogger(DeviceResolver.class);
    private static final String DEV_PREFIX = "/dev/";
    
    private final MountTable mountTable;
    private final VolumeDirectory volumeDirectory;
    private final HostIdentity hostIdentity;
    
    public DeviceResolver(MountTable mountTable, VolumeDirectory volumeDirectory, HostIdentity hostIdentity) {
        this.mountTable = mountTable;
        this.volumeDirectory = volumeDirectory;
        this.hostIdentity = hostIdentity;
    }
    
    /**
     * Resolve the device identifier and storage path of a file.
     * Never fails: any lookup problem falls back to hostname plus absolute path.
     * @param file File (or not-yet-existing path) to locate
     * @return device location
     */
    public DeviceLocation resolve(Path file) {
        Path canonical;
        try {
            canonical = canonicalize(file);
        } catch (MountResolutionException e) {
            log.debug("Falling back to hostname for {}: {}", file, e.getMessage());
            return DeviceLocation.local(hostIdentity.hostname(), file.toAbsolutePath().normalize());
        }
        
        try {
            Optional<MountEntry> mount = findMount(canonical);
            if (mount.isEmpty() || mount.get().isRoot()) {
                return DeviceLocation.local(hostIdentity.hostname(), canonical);
            }
            
            MountEntry entry = mount.get();
            String deviceId = identify(entry);
            String relative = toPortable(entry.mountPoint().relativize(canonical));
            if (relative.isEmpty()) {
                // The path is the mount point itself
                relative = ".";
            }
            log.debug("Resolved {} to device '{}' path '{}'", file, deviceId, relative);
            return new DeviceLocation(deviceId, relative, entry.mountPoint());
        } catch (MountResolutionException e) {
            log.debug("Falling back to hostname for {}: {}", file, e.getMessage());
            return DeviceLocation.local(hostIdentity.hostname(), canonical);
        }
    }
    
    /**
     * Most specific mount containing the path (longest mount point, compared by path components).
     */
    Optional<MountEntry> findMount(Path canonical) throws MountResolutionException {
        List<MountEntry> entries;
        try {
            entries = mountTable.entries();
        } catch (IOException e) {
            throw new MountResolutionException("Cannot read mount table: " + e.getMessage(), e);
        }
        return entries.stream()
                .filter(entry -> canonical.startsWith(entry.mountPoint()))
                .max(Comparator.comparingInt(entry -> entry.mountPoint().toString().length()));
    }
    
    /**
     * Build a device identifier, trying label, UUID, network server and device node in that order.
     */
    String identify(MountEntry entry) {
        String device = entry.device();
        
        if (device.startsWith(DEV_PREFIX)) {
            Optional<String> label = lookup(() -> volumeDirectory.findLabel(device), "label", device);
            if (label.isPresent()) {
                return DeviceLabels.sanitize(label.get()) + " (" + entry.mountPoint() + ")";
            }
            
            Optional<String> uuid = lookup(() -> volumeDirectory.findUuid(device), "UUID", device);
            if (uuid.isPresent()) {
                String shortUuid = uuid.get().substring(0, Math.min(8, uuid.get().length()));
                return entry.mountName() + " [" + shortUuid + "]";
            }
        }
        
        if (entry.isNetwork()) {
            Optional<String> server = serverName(device);
            if (server.isPresent()) {
                return server.get() + " (" + entry.mountPoint() + ")";
            }
        }
        
        String nodeName = device.startsWith(DEV_PREFIX) ? device.substring(DEV_PREFIX.length()) : device;
        return nodeName + " (" + entry.mountName() + ")";
    }
    
    /**
     * Server part of "host:/export" or "//host/share".
     */
    static Optional<String> serverName(String device) {
        if (device.startsWith("//")) {
            String rest = device.substring(2);
            int slash = rest.indexOf('/');
            String server = slash < 0 ? rest : rest.substring(0, slash);
            return server.isEmpty() ? Optional.empty() : Optional.of(server);
        }
        int colon = device.indexOf(':');
        if (colon > 0) {
            return Optional.of(device.substring(0, colon));
        }
        return Optional.empty();
    }
    
    private Optional<String> lookup(VolumeLookup lookup, String kind, String device) {
        try {
            return lookup.find();
        } catch (IOException e) {
            log.debug("Volume {} lookup failed for {}: {}", kind, device, e.getMessage());
            return Optional.empty();
        }
    }
    
    /**
     * Canonical form of the nearest existing ancestor, with any missing tail re-attached.
     */
    private Path canonicalize(Path file) throws MountResolutionException {
        Path absolute = file.toAbsolutePath().normalize();
        Deque<Path> missing = new ArrayDeque<>();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing)) {
            missing.push(existing.getFileName());
            existing = existing.getParent();
        }
        if (existing == null) {
            throw new MountResolutionException("No existing ancestor for " + absolute);
        }
        
        Path canonical;
        try {
            canonical = existing.toRealPath();
        } catch (IOException e) {
            throw new MountResolutionException("Cannot canonicalize " + existing + ": " + e.getMessage(), e);
        }
        while (!missing.isEmpty()) {
            canonical = canonical.resolve(missing.pop());
        }
        return canonical;
    }
    
    private static String toPortable(Path relative) {
        return relative.toString().replace(File.separatorChar, '/');
    }
    
    @FunctionalInterface
    private interface VolumeLookup {
        Optional<String> find() throws IOException;
    }
}
