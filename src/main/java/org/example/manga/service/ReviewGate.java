package org.example.manga.service;

import org.example.manga.model.ReviewResult;
import org.example.manga.model.ReviewScores;
import org.example.manga.model.ReviewThresholds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides pass/fail from review scores. Every threshold must be met; the reviewer's own
 * pass flag is ignored.
 */
@Component
public class ReviewGate {

    private static final Logger log = LoggerFactory.getLogger(ReviewGate.class);

    public boolean passes(ReviewResult review, ReviewThresholds thresholds) {
        List<String> misses = shortfalls(review, thresholds);
        if (!misses.isEmpty()) {
            log.info("Review below threshold: {}", String.join(", ", misses));
            return false;
        }
        return true;
    }

    /**
     * Human readable list of the thresholds the review missed, empty when it passes.
     */
    public List<String> shortfalls(ReviewResult review, ReviewThresholds thresholds) {
        ReviewScores scores = review.subScores();
        List<String> misses = new ArrayList<>();
        check(misses, "total", review.totalScore(), thresholds.total());
        check(misses, "likeness", scores.likeness(), thresholds.likeness());
        check(misses, "continuity", scores.continuity(), thresholds.continuity());
        check(misses, "lettering", scores.letteringOrNoBubbles(), thresholds.lettering());
        check(misses, "story", scores.story(), thresholds.story());
        return misses;
    }

    private static void check(List<String> misses, String name, int score, int threshold) {
        if (score < threshold) {
            misses.add(name + " " + score + "<" + threshold);
        }
    }
}
