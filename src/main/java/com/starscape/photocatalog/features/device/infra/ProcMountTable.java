package com.starscape.photocatalog.features.device.infra;

import com.starscape.photocatalog.features.device.domain.MountEntry;
import com.starscape.photocatalog.features.device.domain.MountTable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a /proc/mounts style file: "device mountpoint fstype options dump pass".
 */
public class ProcMountTable implements MountTable {
    
    private static final Pattern OCTAL_ESCAPE = Pattern.compile("\\\\([0-7]{3})");
    
    private final Path source;
    
    public ProcMountTable(Path source) {
        this.source = source;
    }
    
    @Override
    public List<MountEntry> entries() throws IOException {
        List<MountEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(source, StandardCharsets.UTF_8)) {
            MountEntry entry = parseLine(line);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }
    
    /**
     * Parse one mount table line.
     * @return the entry, or null for blank or malformed lines
     */
    static MountEntry parseLine(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length < 3 || parts[0].isEmpty()) {
            return null;
        }
        String mountPoint = unescape(parts[1]);
        if (!mountPoint.startsWith("/")) {
            return null;
        }
        return new MountEntry(unescape(parts[0]), Path.of(mountPoint), parts[2]);
    }
    
    /**
     * Undo the octal escapes the kernel uses for whitespace and backslashes (\040, \011, \012, \134).
     */
    static String unescape(String value) {
        Matcher matcher = OCTAL_ESCAPE.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            char decoded = (char) Integer.parseInt(matcher.group(1), 8);
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(decoded)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
