package org.example.manga.service;

public class ArtifactStorageException extends RuntimeException {

    public ArtifactStorageException(String message) {
        super(message);
    }

    public ArtifactStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
