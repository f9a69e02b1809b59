package org.example.manga.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.example.manga.service.generation.GeminiClient;
import org.example.manga.service.generation.GeminiGenerationService;
import org.example.manga.service.generation.GeminiReviewService;
import org.example.manga.service.generation.GenerationService;
import org.example.manga.service.generation.ReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the image generation and review models.
 */
@Configuration
public class GenerationProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationProviderConfig.class);

    @Value("${gemini.api-key:}")
    private String apiKey;

    @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String baseUrl;

    @Value("${gemini.image-model:gemini-2.5-flash-image}")
    private String imageModel;

    @Value("${gemini.review-model:gemini-2.5-flash}")
    private String reviewModel;

    @Value("${gemini.timeout-seconds:180}")
    private int timeoutSeconds;

    @Bean
    public GeminiClient geminiClient(ObjectMapper objectMapper) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No Gemini API key configured (set GEMINI_API_KEY); generation calls will fail");
        }
        return new GeminiClient(baseUrl, apiKey, timeoutSeconds, objectMapper);
    }

    @Bean
    public GenerationService generationService(GeminiClient geminiClient) {
        return new GeminiGenerationService(geminiClient, imageModel);
    }

    @Bean
    public ReviewService reviewService(GeminiClient geminiClient, ObjectMapper objectMapper) {
        return new GeminiReviewService(geminiClient, reviewModel, objectMapper);
    }
}
