package org.example.manga.model;

/**
 * Sub-scores on a 0-100 scale. {@code letteringOrNoBubbles} holds the no-bubble score
 * for art reviews and the lettering score for final reviews.
 */
public record ReviewScores(int likeness, int continuity, int letteringOrNoBubbles, int story) {

    public static ReviewScores zero() {
        return new ReviewScores(0, 0, 0, 0);
    }
}
