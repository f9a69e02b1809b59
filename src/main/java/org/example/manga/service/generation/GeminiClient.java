package org.example.manga.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.manga.model.ReferenceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Thin wrapper over the Gemini {@code generateContent} REST endpoint shared by the
 * image generation and review services. Maps HTTP failures onto the generation exception types.
 */
public class GeminiClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiClient.class);

    private final WebClient webClient;
    private final String apiKey;
    private final int timeoutSeconds;
    private final ObjectMapper objectMapper;

    public GeminiClient(String baseUrl, String apiKey, int timeoutSeconds, ObjectMapper objectMapper) {
        this.apiKey = apiKey;
        this.timeoutSeconds = timeoutSeconds;
        this.objectMapper = objectMapper;
        // Inline image responses are large
        this.webClient = WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader("x-goog-api-key", apiKey == null ? "" : apiKey)
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(32 * 1024 * 1024))
                .build();
        log.info("Gemini client initialized: baseUrl={}", baseUrl);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public ObjectNode newRequest() {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode contents = request.putArray("contents");
        contents.addObject().put("role", "user").putArray("parts");
        return request;
    }

    public ArrayNode parts(ObjectNode request) {
        return (ArrayNode) request.get("contents").get(0).get("parts");
    }

    public void addText(ObjectNode request, String text) {
        parts(request).addObject().put("text", text);
    }

    public void addImage(ObjectNode request, ReferenceImage image) {
        addImage(request, image.mimeType(), image.data());
    }

    public void addImage(ObjectNode request, String mimeType, byte[] data) {
        ObjectNode inlineData = parts(request).addObject().putObject("inlineData");
        inlineData.put("mimeType", mimeType);
        inlineData.put("data", Base64.getEncoder().encodeToString(data));
    }

    public void addSafetySettings(ObjectNode request, Map<String, String> thresholds) {
        ArrayNode settings = request.putArray("safetySettings");
        thresholds.forEach((category, threshold) ->
                settings.addObject().put("category", category).put("threshold", threshold));
    }

    /**
     * Posts a request to {@code /models/{model}:generateContent} and returns the parsed response.
     */
    public JsonNode generateContent(String model, ObjectNode request) {
        if (!hasApiKey()) {
            throw new AuthenticationException("Gemini API key is not configured");
        }
        try {
            String response = webClient.post()
                    .uri("/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();

            if (response == null || response.isBlank()) {
                throw new TransientGenerationException("Empty response from Gemini API");
            }
            return objectMapper.readTree(response);

        } catch (WebClientResponseException e) {
            log.error("Gemini API error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw translate(e.getStatusCode().value(), e.getResponseBodyAsString(), e);
        } catch (GenerationServiceException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to call Gemini model {}", model, e);
            throw new TransientGenerationException("Failed to call Gemini: " + e.getMessage(), e);
        }
    }

    /**
     * Joins the text parts of the first candidate.
     */
    public static String firstCandidateText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : firstCandidateParts(response)) {
            if (part.has("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }

    public static JsonNode firstCandidateParts(JsonNode response) {
        return response.path("candidates").path(0).path("content").path("parts");
    }

    static GenerationServiceException translate(int status, String body, Throwable cause) {
        String lower = body == null ? "" : body.toLowerCase();
        if (status == 401 || status == 403 || lower.contains("api key not valid") || lower.contains("permission denied")) {
            return new AuthenticationException("Authentication failed: check the Gemini API key (HTTP " + status + ")", cause);
        }
        if (status == 429 || lower.contains("quota exceeded") || lower.contains("resource_exhausted")) {
            return new QuotaExceededException("Gemini API quota exceeded (HTTP " + status + ")", cause);
        }
        if (status == 400) {
            return new TransientGenerationException("Gemini rejected the request as malformed (HTTP 400)", cause);
        }
        return new TransientGenerationException("Gemini API error (HTTP " + status + ")", cause);
    }
}
