package org.example.manga.service.generation;

/**
 * The reviewer answered, but not with a parseable verdict.
 */
public class ReviewParseException extends GenerationServiceException {

    private final String rawResponse;

    public ReviewParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }

    public String getRawResponse() {
        return rawResponse;
    }
}
