package org.example.manga.service.generation;

/**
 * A failed call that may succeed on the next attempt (no image, timeout, 5xx).
 */
public class TransientGenerationException extends GenerationServiceException {

    public TransientGenerationException(String message) {
        super(message);
    }

    public TransientGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
