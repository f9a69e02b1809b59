package org.example.manga.model;

/**
 * Immutable, validated configuration of one pipeline run.
 * Score thresholds use a 1-10 scale; {@link ReviewThresholds} converts them.
 */
public record RunOptions(
        boolean twoPhase,
        int retryCount,
        int minScore,
        int minLikeness,
        int minContinuity,
        int minStory,
        Integer minLettering,
        Integer minNoBubbles,
        boolean color,
        Layout layout,
        String pageSelector,
        String startPage,
        boolean autoGenerateCharacters,
        boolean autoGenerateEnvironments,
        boolean characterGenerationOnly,
        boolean environmentGenerationOnly,
        String style,
        String scenePrompt
) {

    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final int MAX_RETRY_COUNT = 10;

    public RunOptions {
        if (retryCount < 1 || retryCount > MAX_RETRY_COUNT) {
            throw new IllegalArgumentException("retryCount must be between 1 and " + MAX_RETRY_COUNT + ": " + retryCount);
        }
        requireScale("minScore", minScore);
        requireScale("minLikeness", minLikeness);
        requireScale("minContinuity", minContinuity);
        requireScale("minStory", minStory);
        if (minLettering != null) {
            requireScale("minLettering", minLettering);
        }
        if (minNoBubbles != null) {
            requireScale("minNoBubbles", minNoBubbles);
        }
        if (isSet(pageSelector) && isSet(startPage)) {
            throw new IllegalArgumentException("pageSelector and startPage cannot be combined");
        }
        layout = layout == null ? Layout.SQUARE : layout;
        style = isSet(style) ? style.trim() : "shonen";
        scenePrompt = scenePrompt == null ? "" : scenePrompt;
        pageSelector = isSet(pageSelector) ? pageSelector.trim() : null;
        startPage = isSet(startPage) ? startPage.trim() : null;
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean referenceGenerationOnly() {
        return characterGenerationOnly || environmentGenerationOnly;
    }

    public boolean hasPageSelector() {
        return pageSelector != null;
    }

    private static void requireScale(String name, int value) {
        if (value < 0 || value > 10) {
            throw new IllegalArgumentException(name + " must be between 0 and 10: " + value);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }

    public static final class Builder {
        private boolean twoPhase;
        private int retryCount = DEFAULT_RETRY_COUNT;
        private int minScore = 8;
        private int minLikeness = 7;
        private int minContinuity = 7;
        private int minStory = 7;
        private Integer minLettering;
        private Integer minNoBubbles;
        private boolean color;
        private Layout layout = Layout.SQUARE;
        private String pageSelector;
        private String startPage;
        private boolean autoGenerateCharacters;
        private boolean autoGenerateEnvironments;
        private boolean characterGenerationOnly;
        private boolean environmentGenerationOnly;
        private String style = "shonen";
        private String scenePrompt = "";

        private Builder() {
        }

        public Builder twoPhase(boolean twoPhase) {
            this.twoPhase = twoPhase;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder minScore(int minScore) {
            this.minScore = minScore;
            return this;
        }

        public Builder minLikeness(int minLikeness) {
            this.minLikeness = minLikeness;
            return this;
        }

        public Builder minContinuity(int minContinuity) {
            this.minContinuity = minContinuity;
            return this;
        }

        public Builder minStory(int minStory) {
            this.minStory = minStory;
            return this;
        }

        public Builder minLettering(Integer minLettering) {
            this.minLettering = minLettering;
            return this;
        }

        public Builder minNoBubbles(Integer minNoBubbles) {
            this.minNoBubbles = minNoBubbles;
            return this;
        }

        public Builder color(boolean color) {
            this.color = color;
            return this;
        }

        public Builder layout(Layout layout) {
            this.layout = layout;
            return this;
        }

        public Builder pageSelector(String pageSelector) {
            this.pageSelector = pageSelector;
            return this;
        }

        public Builder startPage(String startPage) {
            this.startPage = startPage;
            return this;
        }

        public Builder autoGenerateCharacters(boolean autoGenerateCharacters) {
            this.autoGenerateCharacters = autoGenerateCharacters;
            return this;
        }

        public Builder autoGenerateEnvironments(boolean autoGenerateEnvironments) {
            this.autoGenerateEnvironments = autoGenerateEnvironments;
            return this;
        }

        public Builder characterGenerationOnly(boolean characterGenerationOnly) {
            this.characterGenerationOnly = characterGenerationOnly;
            return this;
        }

        public Builder environmentGenerationOnly(boolean environmentGenerationOnly) {
            this.environmentGenerationOnly = environmentGenerationOnly;
            return this;
        }

        public Builder style(String style) {
            this.style = style;
            return this;
        }

        public Builder scenePrompt(String scenePrompt) {
            this.scenePrompt = scenePrompt;
            return this;
        }

        public RunOptions build() {
            return new RunOptions(twoPhase, retryCount, minScore, minLikeness, minContinuity, minStory,
                    minLettering, minNoBubbles, color, layout, pageSelector, startPage,
                    autoGenerateCharacters, autoGenerateEnvironments,
                    characterGenerationOnly, environmentGenerationOnly, style, scenePrompt);
        }
    }
}
