package org.example.manga.model;

/**
 * Pipeline phase. Single-phase runs record their only pass as {@link #LETTERING},
 * since that output is the final page.
 */
public enum GenerationPhase {
    ART(1),
    LETTERING(2);

    private final int number;

    GenerationPhase(int number) {
        this.number = number;
    }

    public int number() {
        return number;
    }
}
