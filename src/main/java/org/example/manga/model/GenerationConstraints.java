package org.example.manga.model;

import java.util.List;
import java.util.Map;

/**
 * Output constraints passed to the generation service.
 */
public record GenerationConstraints(
        List<String> responseModalities,
        String aspectRatio,
        Map<String, String> safetyThresholds
) {

    private static final Map<String, String> BLOCK_ONLY_HIGH = Map.of(
            "HARM_CATEGORY_HARASSMENT", "BLOCK_ONLY_HIGH",
            "HARM_CATEGORY_HATE_SPEECH", "BLOCK_ONLY_HIGH",
            "HARM_CATEGORY_SEXUALLY_EXPLICIT", "BLOCK_ONLY_HIGH",
            "HARM_CATEGORY_DANGEROUS_CONTENT", "BLOCK_ONLY_HIGH"
    );

    public static GenerationConstraints image(String aspectRatio) {
        return new GenerationConstraints(List.of("IMAGE"), aspectRatio, BLOCK_ONLY_HIGH);
    }

    public static GenerationConstraints image(Layout layout) {
        return image(layout.aspectRatio());
    }
}
