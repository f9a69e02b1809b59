package org.example.manga.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.manga.model.GeneratedImage;
import org.example.manga.model.GenerationConstraints;
import org.example.manga.model.Layout;
import org.example.manga.model.ReferenceImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GeminiGenerationServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GeminiClient client;
    private GeminiGenerationService service;

    @BeforeEach
    void setUp() {
        client = spy(new GeminiClient("http://localhost:9", "test-key", 5, objectMapper));
        service = new GeminiGenerationService(client, "image-model");
    }

    @Test
    void generate_sendsLabelledAttachmentsAndReturnsInlineImage() throws Exception {
        JsonNode response = objectMapper.readTree("""
                {"candidates": [{"content": {"parts": [
                  {"text": "Here is your page"},
                  {"inlineData": {"mimeType": "image/png", "data": "AQID"}}
                ]}}]}
                """);
        doReturn(response).when(client).generateContent(eq("image-model"), any(ObjectNode.class));
        ReferenceImage kenji = ReferenceImage.fromFile(Path.of("characters/kenji_portrait.png"), new byte[]{9});

        Optional<GeneratedImage> image = service.generate("Draw page 1", List.of(kenji),
                GenerationConstraints.image(Layout.WEBTOON));

        assertTrue(image.isPresent());
        assertArrayEquals(new byte[]{1, 2, 3}, image.get().data());

        ArgumentCaptor<ObjectNode> request = ArgumentCaptor.forClass(ObjectNode.class);
        verify(client).generateContent(eq("image-model"), request.capture());
        JsonNode parts = request.getValue().path("contents").path(0).path("parts");
        assertEquals("Draw page 1", parts.path(0).path("text").asText());
        assertEquals("Reference: kenji portrait", parts.path(1).path("text").asText());
        assertTrue(parts.path(2).has("inlineData"));
        JsonNode config = request.getValue().path("generationConfig");
        assertEquals("9:16", config.path("imageConfig").path("aspectRatio").asText());
        assertTrue(config.path("responseModalities").toString().contains("IMAGE"));
        assertTrue(request.getValue().path("safetySettings").size() > 0);
    }

    @Test
    void generate_returnsEmptyWhenPromptIsBlocked() throws Exception {
        JsonNode response = objectMapper.readTree("{\"promptFeedback\": {\"blockReason\": \"SAFETY\"}}");
        doReturn(response).when(client).generateContent(eq("image-model"), any(ObjectNode.class));

        Optional<GeneratedImage> image = service.generate("Draw", List.of(), GenerationConstraints.image("1:1"));

        assertTrue(image.isEmpty());
    }

    @Test
    void isAvailable_dependsOnApiKey() {
        assertTrue(service.isAvailable());
        GeminiGenerationService withoutKey = new GeminiGenerationService(
                new GeminiClient("http://localhost:9", " ", 5, objectMapper), "image-model");
        assertFalse(withoutKey.isAvailable());
    }
}
