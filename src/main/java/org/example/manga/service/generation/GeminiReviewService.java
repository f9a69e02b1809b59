package org.example.manga.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.manga.model.ReferenceImage;
import org.example.manga.model.ReviewResult;
import org.example.manga.model.ReviewScores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Reviews generated pages with a Gemini vision model that answers in JSON.
 */
public class GeminiReviewService implements ReviewService {

    private static final Logger log = LoggerFactory.getLogger(GeminiReviewService.class);
    private static final int MAX_CONTEXT_LENGTH = 6000;

    private final GeminiClient client;
    private final String model;
    private final ObjectMapper objectMapper;

    public GeminiReviewService(GeminiClient client, String model, ObjectMapper objectMapper) {
        this.client = client;
        this.model = model;
        this.objectMapper = objectMapper;
        log.info("Gemini review service initialized: model={}", model);
    }

    @Override
    public ReviewResult review(byte[] candidateImage, List<ReferenceImage> referenceImages,
                               String storyContext, ReviewFlags flags) {
        ObjectNode request = client.newRequest();
        client.addText(request, buildReviewPrompt(referenceImages, storyContext, flags));
        for (ReferenceImage reference : referenceImages) {
            client.addText(request, "Reference Image: " + reference.sourceLabel());
            client.addImage(request, reference);
        }
        client.addText(request, "Candidate Image:");
        client.addImage(request, "image/png", candidateImage);
        request.putObject("generationConfig").put("responseMimeType", "application/json");

        JsonNode response = client.generateContent(model, request);
        String text = GeminiClient.firstCandidateText(response);
        return parseVerdict(text, flags.artPhase());
    }

    String buildReviewPrompt(List<ReferenceImage> referenceImages, String storyContext, ReviewFlags flags) {
        StringBuilder mapping = new StringBuilder();
        for (ReferenceImage reference : referenceImages) {
            mapping.append(String.format("- \"%s\" is shown in Reference Image \"%s\"\n",
                    reference.tag(), reference.sourceLabel()));
        }

        String textCriterion = flags.artPhase()
                ? """
                  3. NO BUBBLES (no_bubbles_score): This is art-only output. Round speech bubbles or dialogue \
                  text must NOT appear. Rectangular captions and sound effects are acceptable."""
                : """
                  3. LETTERING (lettering_score): Every line of dialogue from the script appears, spelled \
                  correctly, in readable speech bubbles attached to the right speaker. Gibberish text fails.""";
        String colorCriterion = flags.color()
                ? "The page must be in full color."
                : "The page must be black and white manga ink with screentones.";
        String letteringField = flags.artPhase() ? "no_bubbles_score" : "lettering_score";

        return String.format("""
                You are a strict manga editor reviewing a generated page.

                [REFERENCE MAPPING]
                %s
                [STORY CONTEXT]
                %s

                Score each criterion from 0 to 100:
                1. LIKENESS (likeness_score): Characters match their reference images (face, hair, outfit).
                2. CONTINUITY (continuity_score): Consistent with the previous page and references. %s
                %s
                4. STORY (story_score): The panels depict the events of the script.

                Respond with JSON only:
                {"likeness_score": 0, "continuity_score": 0, "%s": 0, "story_score": 0,
                 "total_score": 0, "reason": "short explanation of the biggest problem", "pass": false}
                total_score is the sum of the four scores (0-400).
                """,
                mapping.length() == 0 ? "(no references)\n" : mapping,
                truncate(storyContext),
                colorCriterion,
                textCriterion,
                letteringField);
    }

    /**
     * Reads the reviewer's JSON verdict. Missing scores count as 0.
     *
     * @throws ReviewParseException if no JSON object can be read from the text
     */
    ReviewResult parseVerdict(String text, boolean artPhase) {
        if (text == null || text.isBlank()) {
            throw new ReviewParseException("Empty review response", text, null);
        }
        try {
            JsonNode verdict = objectMapper.readTree(extractJson(stripFences(text)));
            String letteringField = artPhase ? "no_bubbles_score" : "lettering_score";
            ReviewScores scores = new ReviewScores(
                    verdict.path("likeness_score").asInt(0),
                    verdict.path("continuity_score").asInt(0),
                    verdict.path(letteringField).asInt(0),
                    verdict.path("story_score").asInt(0));
            return new ReviewResult(
                    scores,
                    verdict.path("total_score").asInt(0),
                    verdict.path("reason").asText(""),
                    verdict.path("pass").asBoolean(false));
        } catch (ReviewParseException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Could not parse review response: {}", text);
            throw new ReviewParseException("Could not parse review response", text, e);
        }
    }

    @Override
    public String getProviderName() {
        return "gemini";
    }

    private String stripFences(String text) {
        return text.replace("```json", "").replace("```", "").trim();
    }

    private String extractJson(String text) {
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return text.substring(start, end + 1);
        }
        throw new ReviewParseException("No JSON found in review response", text, null);
    }

    private String truncate(String text) {
        if (text == null) return "";
        if (text.length() <= MAX_CONTEXT_LENGTH) return text;
        return text.substring(0, MAX_CONTEXT_LENGTH) + "...";
    }
}
