package org.example.manga.model;

/**
 * A passed phase as stored in page memory.
 *
 * @param artifactPath absolute path of the accepted image
 * @param promptRef    prompt audit file the image was generated from, may be null
 */
public record PhaseRecord(String artifactPath, String promptRef) {
}
