package org.example.manga.service.generation;

/**
 * Base exception for failures talking to the generation or review model.
 */
public class GenerationServiceException extends RuntimeException {

    public GenerationServiceException(String message) {
        super(message);
    }

    public GenerationServiceException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Fatal errors stop the whole run instead of consuming a retry.
     */
    public boolean isFatal() {
        return false;
    }
}
