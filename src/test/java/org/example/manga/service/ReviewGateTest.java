package org.example.manga.service;

import org.example.manga.model.ReviewResult;
import org.example.manga.model.ReviewScores;
import org.example.manga.model.ReviewThresholds;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReviewGateTest {

    private final ReviewGate gate = new ReviewGate();
    private final ReviewThresholds thresholds = new ReviewThresholds(320, 70, 70, 95, 70);

    @Test
    void passes_whenEveryThresholdIsMet() {
        ReviewResult review = new ReviewResult(new ReviewScores(70, 70, 95, 90), 325, "fine", false);

        assertTrue(gate.passes(review, thresholds));
    }

    @Test
    void passes_failsWhenOneSubScoreMissesDespiteHighTotal() {
        ReviewResult review = new ReviewResult(new ReviewScores(60, 100, 100, 100), 360, "face is off", true);

        assertFalse(gate.passes(review, thresholds));
        assertEquals(1, gate.shortfalls(review, thresholds).size());
        assertTrue(gate.shortfalls(review, thresholds).get(0).startsWith("likeness"));
    }

    @Test
    void passes_failsWhenTotalMissesDespiteSubScores() {
        ReviewResult review = new ReviewResult(new ReviewScores(75, 75, 95, 70), 315, "borderline", true);

        assertFalse(gate.passes(review, thresholds));
    }

    @Test
    void passes_ignoresReviewerPassFlag() {
        ReviewResult review = new ReviewResult(new ReviewScores(100, 100, 50, 100), 350, "typos", true);

        assertFalse(gate.passes(review, thresholds));
    }
}
