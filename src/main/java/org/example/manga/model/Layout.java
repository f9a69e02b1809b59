package org.example.manga.model;

public enum Layout {
    SQUARE("1:1", "Square composition (1:1)."),
    WEBTOON("9:16", "Vertical webtoon page (9:16). Stack panels top to bottom for vertical scrolling."),
    STRIP("16:9", "Horizontal strip (16:9). Arrange panels left to right."),
    SINGLE_PAGE("3:4", "Portrait manga page (3:4) with a traditional multi-panel grid.");

    private final String aspectRatio;
    private final String directive;

    Layout(String aspectRatio, String directive) {
        this.aspectRatio = aspectRatio;
        this.directive = directive;
    }

    public String aspectRatio() {
        return aspectRatio;
    }

    public String directive() {
        return directive;
    }

    /**
     * Accepts {@code webtoon}, {@code strip}, {@code single_page}/{@code single-page} and
     * {@code square}; blank input means square.
     */
    public static Layout fromName(String name) {
        if (name == null || name.isBlank()) {
            return SQUARE;
        }
        String normalized = name.trim().toUpperCase().replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown layout: " + name, e);
        }
    }
}
