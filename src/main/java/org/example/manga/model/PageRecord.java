package org.example.manga.model;

/**
 * One page of a story document: the full header line, the raw content below it,
 * and its position in the continuity chain.
 */
public record PageRecord(String header, String content, int index) {

    public static final String SINGLE_PAGE_HEADER = "Single Page";

    public static PageRecord singlePage(String content) {
        return new PageRecord(SINGLE_PAGE_HEADER, content, 0);
    }
}
