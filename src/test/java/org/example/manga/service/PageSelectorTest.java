package org.example.manga.service;

import org.example.manga.model.PageRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageSelectorTest {

    private final PageSelector selector = new PageSelector();

    private final List<PageRecord> pages = List.of(
            new PageRecord("Page 1: Arrival", "a", 0),
            new PageRecord("Page 2: The Roof", "b", 1),
            new PageRecord("Page 10: Goodbye", "c", 2));

    @Test
    void select_matchesNumbersExactly() {
        List<PageRecord> selected = selector.select(pages, "1");

        assertEquals(1, selected.size());
        assertEquals("Page 1: Arrival", selected.get(0).header());
    }

    @Test
    void select_supportsSeveralTargetsAndText() {
        assertEquals(2, selector.select(pages, "1, 10").size());
        assertEquals(2, selector.select(pages, "2 and goodbye").size());
        assertEquals(2, selector.select(pages, "01 & 2").size());
    }

    @Test
    void select_returnsEmptyWhenNothingMatches() {
        assertTrue(selector.select(pages, "7").isEmpty());
    }

    @Test
    void startingFrom_slicesFromFirstMatch() {
        List<PageRecord> selected = selector.startingFrom(pages, "2");

        assertEquals(List.of("Page 2: The Roof", "Page 10: Goodbye"),
                selected.stream().map(PageRecord::header).toList());
        assertTrue(selector.startingFrom(pages, "Epilogue").isEmpty());
    }
}
