package org.example.manga.model;

/**
 * Verdict from the review service. {@code passFlag} is the reviewer's own opinion; the
 * pipeline recomputes pass/fail from the scores.
 */
public record ReviewResult(ReviewScores subScores, int totalScore, String reason, boolean passFlag) {

    public static ReviewResult autoPass(String reason) {
        return new ReviewResult(ReviewScores.zero(), 0, reason, true);
    }

    public boolean mentionsAny(String... keywords) {
        if (reason == null) {
            return false;
        }
        String lower = reason.toLowerCase();
        for (String keyword : keywords) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
