package com.starscape.photocatalog.features.device.infra;

import com.starscape.photocatalog.features.device.domain.MountEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcMountTableTest {
    
    @TempDir
    Path tempDir;
    
    @Test
    void readsEntriesAndUnescapesOctalSequences() throws Exception {
        Path mounts = Files.writeString(tempDir.resolve("mounts"), String.join("\n",
            "/dev/root / ext4 rw,relatime 0 0",
            "proc /proc proc rw 0 0",
            "/dev/sdb1 /media/user/My\\040Photos vfat rw 0 0",
            "",
            "nas:/export /mnt/nas nfs4 rw 0 0"
        ));
        
        List<MountEntry> entries = new ProcMountTable(mounts).entries();
        
        assertEquals(4, entries.size());
        assertTrue(entries.get(0).isRoot());
        assertEquals(Path.of("/media/user/My Photos"), entries.get(2).mountPoint());
        assertEquals("My Photos", entries.get(2).mountName());
        assertTrue(entries.get(3).isNetwork());
        assertFalse(entries.get(2).isNetwork());
    }
    
    @Test
    void skipsMalformedLines() {
        assertNull(ProcMountTable.parseLine("garbage"));
        assertNull(ProcMountTable.parseLine("none relative-path tmpfs rw 0 0"));
    }
    
    @Test
    void unescapesTabsNewlinesAndBackslashes() {
        assertEquals("a\tb\nc\\d", ProcMountTable.unescape("a\\011b\\012c\\134d"));
    }
}
