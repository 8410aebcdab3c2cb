package io.plaice.storage;

import io.plaice.core.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FileFrameStoreTest {

    @TempDir
    Path dir;

    @Test
    void frames_are_named_by_zero_padded_age() {
        assertEquals("frame-0001.png", FileFrameStore.frameName(1));
        assertEquals("frame-0420.png", FileFrameStore.frameName(420));
        assertEquals("frame-12345.png", FileFrameStore.frameName(12345));
    }

    @Test
    void write_frame_creates_file_and_leaves_no_tmp() throws Exception {
        var store = new FileFrameStore(dir);
        var c = new Canvas(2, 2);
        String id = store.writeFrame(c.snapshot(), 3);

        assertEquals("frame-0003.png", id);
        assertTrue(Files.exists(dir.resolve(id)));
        try (var files = Files.list(dir)) {
            assertTrue(files.noneMatch(p -> p.toString().endsWith(".tmp")));
        }
    }

    @Test
    void load_latest_picks_highest_age_not_lexical_order() {
        var store = new FileFrameStore(dir);
        var c = new Canvas(2, 1);
        store.writeFrame(c.snapshot(), 9999);
        c.write(1, 0, new Rgb(1, 2, 3));
        store.writeFrame(c.snapshot(), 10000);
        store.writeFinal(c.snapshot());

        var latest = store.loadLatest();
        assertNotNull(latest);
        assertEquals(10000, latest.age());
        assertEquals("frame-10000.png", latest.id());
        assertEquals(new Rgb(1, 2, 3), latest.frame().rgbAt(1, 0));
    }

    @Test
    void load_latest_on_empty_dir_is_null() {
        assertNull(new FileFrameStore(dir).loadLatest());
    }

    @Test
    void unwritable_target_surfaces_as_unchecked_io() throws Exception {
        var store = new FileFrameStore(dir);
        // A directory where the frame file should go makes the final move fail.
        Files.createDirectories(dir.resolve(FileFrameStore.frameName(1)).resolve("blocker"));
        var snap = new Canvas(1, 1).snapshot();
        assertThrows(UncheckedIOException.class, () -> store.writeFrame(snap, 1));
    }

    @Test
    void export_policy_every_n_cycles() {
        var p = new ExportPolicy(3);
        assertFalse(p.shouldExport(0));
        assertFalse(p.shouldExport(2));
        assertTrue(p.shouldExport(3));
        assertTrue(p.shouldExport(6));
        assertTrue(ExportPolicy.EVERY_CYCLE.shouldExport(1));
        assertThrows(IllegalArgumentException.class, () -> new ExportPolicy(0));
    }
}
