package org.example.manga.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunOptionsTest {

    @Test
    void defaults_matchDocumentedValues() {
        RunOptions options = RunOptions.defaults();

        assertFalse(options.twoPhase());
        assertEquals(3, options.retryCount());
        assertEquals(8, options.minScore());
        assertEquals(7, options.minLikeness());
        assertNull(options.minLettering());
        assertEquals(Layout.SQUARE, options.layout());
        assertEquals("shonen", options.style());
        assertFalse(options.hasPageSelector());
        assertFalse(options.referenceGenerationOnly());
    }

    @Test
    void build_rejectsOutOfRangeValues() {
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().retryCount(0).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().retryCount(11).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().minScore(11).build());
        assertThrows(IllegalArgumentException.class, () -> RunOptions.builder().minLettering(-1).build());
    }

    @Test
    void build_rejectsPageSelectorCombinedWithStartPage() {
        assertThrows(IllegalArgumentException.class,
                () -> RunOptions.builder().pageSelector("1").startPage("2").build());
    }

    @Test
    void build_treatsBlankStringsAsUnset() {
        RunOptions options = RunOptions.builder()
                .pageSelector("  ")
                .startPage("")
                .style(" ")
                .layout(null)
                .build();

        assertNull(options.pageSelector());
        assertNull(options.startPage());
        assertEquals("shonen", options.style());
        assertEquals(Layout.SQUARE, options.layout());
    }

    @Test
    void referenceGenerationOnly_impliedByOnlyModes() {
        assertTrue(RunOptions.builder().characterGenerationOnly(true).build().referenceGenerationOnly());
        assertTrue(RunOptions.builder().environmentGenerationOnly(true).build().referenceGenerationOnly());
    }
}
