package org.example.manga.service;

import org.example.manga.config.PipelineProperties;
import org.example.manga.model.FailureRecord;
import org.example.manga.model.GenerationPhase;
import org.example.manga.model.PageMemoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PageMemoryStoreTest {

    @TempDir
    Path tempDir;

    private PageMemoryStore store;
    private Path story;

    @BeforeEach
    void setUp() throws Exception {
        store = new PageMemoryStore(new ArtifactStore(), new PipelineProperties());
        story = tempDir.resolve("story.md");
        Files.writeString(story, "## Page 1\nHello\n");
    }

    @Test
    void read_returnsEmptyMapWhenNoMemoryFileExists() {
        assertTrue(store.read(story).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("manga_memory.md")));
    }

    @Test
    void recordPass_overwritesPreviousPhaseLine() {
        Path first = tempDir.resolve("first.png");
        Path second = tempDir.resolve("second.png");

        store.recordPass(story, "Page 1", GenerationPhase.ART, first, null);
        store.recordPass(story, "Page 1", GenerationPhase.ART, second, tempDir.resolve("prompts/p.txt"));

        PageMemoryEntry entry = store.find(story, "Page 1").orElseThrow();
        assertEquals(second.toAbsolutePath().toString(), entry.phase1().artifactPath());
        assertEquals(tempDir.resolve("prompts/p.txt").toAbsolutePath().toString(), entry.phase1().promptRef());
        assertNull(entry.phase2());
    }

    @Test
    void recordFailure_skipsExactDuplicates() throws Exception {
        store.recordFailure(story, "Page 1", GenerationPhase.ART, "wrong hairstyle", null);
        store.recordFailure(story, "Page 1", GenerationPhase.ART, "wrong hairstyle", null);
        store.recordFailure(story, "Page 1", GenerationPhase.LETTERING, "wrong hairstyle", null);

        PageMemoryEntry entry = store.find(story, "Page 1").orElseThrow();
        assertEquals(2, entry.failureLog().size());
        String content = Files.readString(tempDir.resolve("manga_memory.md"));
        assertEquals(1, content.split("Phase 1 Attempt: FAILED", -1).length - 1);
    }

    @Test
    void write_producesReadableMarkdownLedger() throws Exception {
        Path art = tempDir.resolve("page_1_phase_1.png");
        Path failed = tempDir.resolve("page_1_final_failed_1.png");

        store.recordPass(story, "Page 1", GenerationPhase.ART, art, null);
        store.recordFailure(story, "Page 1", GenerationPhase.LETTERING, "missing dialogue", failed);

        String content = Files.readString(tempDir.resolve("manga_memory.md"));
        assertTrue(content.contains("## Page 1\n"));
        assertTrue(content.contains("- Phase 1: `" + art.toAbsolutePath() + "` [PASSED]"));
        assertTrue(content.contains("- Phase 2 Attempt: FAILED. Reason: missing dialogue [FILE: `"
                + failed.toAbsolutePath() + "`]"));

        FailureRecord failure = store.find(story, "Page 1").orElseThrow().failureLog().get(0);
        assertEquals(2, failure.phase());
        assertEquals(failed.toAbsolutePath().toString(), failure.failedArtifactPath());
    }

    @Test
    void find_keepsOtherPagesAndMatchesHeadersIgnoringCase() {
        store.recordPass(story, "Page 1: Arrival", GenerationPhase.LETTERING, tempDir.resolve("a.png"), null);
        store.recordPass(story, "Page 2: Departure", GenerationPhase.LETTERING, tempDir.resolve("b.png"), null);
        store.recordFailure(story, "PAGE 1: ARRIVAL", GenerationPhase.LETTERING, "blurry", null);

        Map<String, PageMemoryEntry> entries = store.read(story);
        assertEquals(2, entries.size());
        PageMemoryEntry first = entries.get("Page 1: Arrival");
        assertNotNull(first.phase2());
        assertEquals(1, first.failureLog().size());
    }

    @Test
    void recordFailure_flattensMultiLineReasons() {
        store.recordFailure(story, "Page 1", GenerationPhase.ART, "bubbles present\n  and text in panel 2", null);

        assertEquals("bubbles present and text in panel 2",
                store.find(story, "Page 1").orElseThrow().failureLog().get(0).reason());
    }
}
