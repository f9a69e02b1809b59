package org.example.manga.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReviewThresholdsTest {

    @Test
    void forPhase_defaultsScaleToScoreRanges() {
        ReviewThresholds art = ReviewThresholds.forPhase(RunOptions.defaults(), GenerationPhase.ART);
        ReviewThresholds lettering = ReviewThresholds.forPhase(RunOptions.defaults(), GenerationPhase.LETTERING);

        assertEquals(new ReviewThresholds(320, 70, 70, 50, 70), art);
        assertEquals(new ReviewThresholds(320, 70, 70, 95, 70), lettering);
    }

    @Test
    void forPhase_artPrefersNoBubblesThresholdOverLettering() {
        RunOptions lettering = RunOptions.builder().minLettering(6).build();
        RunOptions both = RunOptions.builder().minLettering(6).minNoBubbles(9).build();

        assertEquals(60, ReviewThresholds.forPhase(lettering, GenerationPhase.ART).lettering());
        assertEquals(90, ReviewThresholds.forPhase(both, GenerationPhase.ART).lettering());
        assertEquals(60, ReviewThresholds.forPhase(both, GenerationPhase.LETTERING).lettering());
    }

    @Test
    void layoutFromName_parsesLeniently() {
        assertEquals(Layout.SINGLE_PAGE, Layout.fromName("single-page"));
        assertEquals(Layout.WEBTOON, Layout.fromName(" Webtoon "));
        assertEquals(Layout.SQUARE, Layout.fromName(null));
        assertThrows(IllegalArgumentException.class, () -> Layout.fromName("panorama"));
    }
}
