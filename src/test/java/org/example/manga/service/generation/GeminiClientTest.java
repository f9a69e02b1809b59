package org.example.manga.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeminiClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final GeminiClient client = new GeminiClient("http://localhost:9", "test-key", 5, objectMapper);

    @Test
    void translate_mapsAuthenticationFailures() {
        assertInstanceOf(AuthenticationException.class, GeminiClient.translate(401, "", null));
        assertInstanceOf(AuthenticationException.class, GeminiClient.translate(403, "", null));
        assertInstanceOf(AuthenticationException.class,
                GeminiClient.translate(400, "{\"error\": \"API key not valid. Please pass a valid API key.\"}", null));
    }

    @Test
    void translate_mapsQuotaFailures() {
        GenerationServiceException e = GeminiClient.translate(429, "", null);
        assertInstanceOf(QuotaExceededException.class, e);
        assertTrue(e.isFatal());
        assertInstanceOf(QuotaExceededException.class,
                GeminiClient.translate(500, "{\"status\": \"RESOURCE_EXHAUSTED\"}", null));
    }

    @Test
    void translate_treatsOtherFailuresAsRetryable() {
        GenerationServiceException malformed = GeminiClient.translate(400, "bad field", null);
        GenerationServiceException server = GeminiClient.translate(503, "unavailable", null);

        assertInstanceOf(TransientGenerationException.class, malformed);
        assertTrue(malformed.getMessage().contains("malformed"));
        assertInstanceOf(TransientGenerationException.class, server);
        assertFalse(server.isFatal());
    }

    @Test
    void request_collectsPartsAndSafetySettings() {
        ObjectNode request = client.newRequest();
        client.addText(request, "Draw a page");
        client.addImage(request, "image/png", new byte[]{1, 2, 3});
        client.addSafetySettings(request, Map.of("HARM_CATEGORY_HARASSMENT", "BLOCK_ONLY_HIGH"));

        JsonNode parts = request.path("contents").path(0).path("parts");
        assertEquals("user", request.path("contents").path(0).path("role").asText());
        assertEquals("Draw a page", parts.path(0).path("text").asText());
        assertEquals("image/png", parts.path(1).path("inlineData").path("mimeType").asText());
        assertEquals("AQID", parts.path(1).path("inlineData").path("data").asText());
        assertEquals("BLOCK_ONLY_HIGH", request.path("safetySettings").path(0).path("threshold").asText());
    }

    @Test
    void firstCandidateText_joinsTextParts() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"candidates": [{"content": {"parts": [{"text": "{\\"a\\": "}, {"inlineData": {}}, {"text": "1}"}]}}]}
                """);

        assertEquals("{\"a\": 1}", GeminiClient.firstCandidateText(response));
        assertEquals("", GeminiClient.firstCandidateText(objectMapper.readTree("{}")));
    }
}
