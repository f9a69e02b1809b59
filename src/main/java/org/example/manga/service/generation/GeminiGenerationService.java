package org.example.manga.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.manga.model.GeneratedImage;
import org.example.manga.model.GenerationConstraints;
import org.example.manga.model.ReferenceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Image generation through a Gemini image model. Attachments are sent as labelled inline images
 * after the prompt text.
 */
public class GeminiGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(GeminiGenerationService.class);

    private final GeminiClient client;
    private final String model;

    public GeminiGenerationService(GeminiClient client, String model) {
        this.client = client;
        this.model = model;
        log.info("Gemini generation service initialized: model={}", model);
    }

    @Override
    public Optional<GeneratedImage> generate(String prompt, List<ReferenceImage> attachments,
                                             GenerationConstraints constraints) {
        ObjectNode request = client.newRequest();
        client.addText(request, prompt);
        for (ReferenceImage attachment : attachments) {
            client.addText(request, "Reference: " + attachment.sourceLabel());
            client.addImage(request, attachment);
        }

        ObjectNode generationConfig = request.putObject("generationConfig");
        generationConfig.putArray("responseModalities").addAll(
                constraints.responseModalities().stream()
                        .map(request::textNode)
                        .toList());
        if (constraints.aspectRatio() != null) {
            generationConfig.putObject("imageConfig").put("aspectRatio", constraints.aspectRatio());
        }
        client.addSafetySettings(request, constraints.safetyThresholds());

        log.debug("Requesting image from {} with {} attachments, aspectRatio={}",
                model, attachments.size(), constraints.aspectRatio());
        JsonNode response = client.generateContent(model, request);

        for (JsonNode part : GeminiClient.firstCandidateParts(response)) {
            JsonNode inlineData = part.path("inlineData");
            if (inlineData.has("data")) {
                byte[] data = Base64.getDecoder().decode(inlineData.get("data").asText());
                String mimeType = inlineData.path("mimeType").asText("image/png");
                return Optional.of(new GeneratedImage(data, mimeType));
            }
        }

        String blockReason = response.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isEmpty()) {
            log.warn("Image generation blocked: {}", blockReason);
        } else {
            log.warn("Gemini returned no image. Text: {}", GeminiClient.firstCandidateText(response));
        }
        return Optional.empty();
    }

    @Override
    public boolean isAvailable() {
        return client.hasApiKey();
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }
}
