package org.example.manga.model;

/**
 * Minimum scores (0-100 per dimension, 0-400 total) a candidate must meet.
 */
public record ReviewThresholds(int total, int likeness, int continuity, int lettering, int story) {

    private static final int DEFAULT_ART_NO_BUBBLES = 50;
    private static final int DEFAULT_FINAL_LETTERING = 95;

    /**
     * Converts the 1-10 scale options into score thresholds for one phase.
     */
    public static ReviewThresholds forPhase(RunOptions options, GenerationPhase phase) {
        int lettering;
        if (phase == GenerationPhase.ART) {
            Integer configured = options.minNoBubbles() != null ? options.minNoBubbles() : options.minLettering();
            lettering = configured != null ? configured * 10 : DEFAULT_ART_NO_BUBBLES;
        } else {
            lettering = options.minLettering() != null ? options.minLettering() * 10 : DEFAULT_FINAL_LETTERING;
        }
        return new ReviewThresholds(
                options.minScore() * 40,
                options.minLikeness() * 10,
                options.minContinuity() * 10,
                lettering,
                options.minStory() * 10);
    }
}
