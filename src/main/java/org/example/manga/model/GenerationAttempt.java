package org.example.manga.model;

public record GenerationAttempt(String pageHeader, GenerationPhase phase, String promptText, int attemptNumber) {
}
