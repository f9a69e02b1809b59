package org.example.manga.service;

import org.example.manga.model.GeneratedImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactStoreTest {

    @TempDir
    Path tempDir;

    private final ArtifactStore store = new ArtifactStore();

    @Test
    void saveImage_addsCounterWhenNameIsTaken() {
        GeneratedImage image = new GeneratedImage(new byte[]{1, 2, 3}, "image/png");

        Path first = store.saveImage(tempDir, "page_1_final", image);
        Path second = store.saveImage(tempDir, "page_1_final", image);

        assertEquals("page_1_final.png", first.getFileName().toString());
        assertEquals("page_1_final_1.png", second.getFileName().toString());
    }

    @Test
    void retireAsFailed_renamesInPlace() throws Exception {
        Path image = Files.write(tempDir.resolve("page_1_final.png"), new byte[]{1});

        Path retired = store.retireAsFailed(image);

        assertFalse(Files.exists(image));
        assertTrue(Files.exists(retired));
        assertTrue(retired.getFileName().toString().matches("page_1_final_failed_\\d+\\.png"));
    }

    @Test
    void findLatest_skipsRetiredFailures() throws Exception {
        Path older = Files.write(tempDir.resolve("page_1_final.png"), new byte[]{1});
        Path newer = Files.write(tempDir.resolve("page_1_final_1.png"), new byte[]{2});
        Path failed = Files.write(tempDir.resolve("page_1_final_failed_99.png"), new byte[]{3});
        Files.setLastModifiedTime(older, FileTime.fromMillis(1_000));
        Files.setLastModifiedTime(newer, FileTime.fromMillis(2_000));
        Files.setLastModifiedTime(failed, FileTime.fromMillis(3_000));

        assertEquals(newer, store.findLatest(tempDir, "page_1_final").orElseThrow());
        assertTrue(store.findLatest(tempDir.resolve("missing"), "page_1").isEmpty());
    }

    @Test
    void writeTextAtomically_replacesContent() throws Exception {
        Path file = tempDir.resolve("story.md");
        Files.writeString(file, "old");

        store.writeTextAtomically(file, "new");

        assertEquals("new", Files.readString(file));
        try (var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void readBytes_missingFileThrows() {
        assertThrows(ArtifactStorageException.class, () -> store.readBytes(tempDir.resolve("nope.png")));
    }

    @Test
    void sanitizeBaseName_producesFileSafeNames() {
        assertEquals("page_1_arrival", ArtifactStore.sanitizeBaseName("Page 1: Arrival!"));
        assertEquals("generated_image", ArtifactStore.sanitizeBaseName("???"));
        assertEquals(64, ArtifactStore.sanitizeBaseName("a".repeat(100)).length());
    }
}
