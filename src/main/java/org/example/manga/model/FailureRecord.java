package org.example.manga.model;

/**
 * One rejected attempt. {@code failedArtifactPath} is set only when the rejected image was kept on disk.
 */
public record FailureRecord(int phase, String reason, String failedArtifactPath) {
}
