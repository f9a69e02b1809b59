package org.example.manga.service.generation;

/**
 * @param artPhase true when reviewing Phase 1 art, which must contain no speech bubbles
 * @param color    true when the page is expected to be in color
 */
public record ReviewFlags(boolean artPhase, boolean color) {
}
