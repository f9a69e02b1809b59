package org.example.manga.service;

import org.example.manga.model.BuiltPrompt;
import org.example.manga.model.EntityDefinition;
import org.example.manga.model.FailureRecord;
import org.example.manga.model.GenerationPhase;
import org.example.manga.model.PageRecord;
import org.example.manga.model.ReferenceImage;
import org.example.manga.model.ReviewResult;
import org.example.manga.model.RunOptions;
import org.example.manga.story.StoryParser;
import org.example.manga.story.StoryParser.DialogueLine;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds generation prompts for pages and reference sheets.
 */
@Service
public class PromptBuilder {

    private static final Pattern LETTERING_OR_COLOR_COMPLAINT = Pattern.compile(
            "colou?r|black[- ]and[- ]white|monochrome|letter|typo|spell|dialogue|bubble",
            Pattern.CASE_INSENSITIVE);

    private static final int MAX_CONTEXT_LENGTH = 8000;

    private final StoryParser storyParser;

    public PromptBuilder(StoryParser storyParser) {
        this.storyParser = storyParser;
    }

    /**
     * Prompt for the given phase. Lettering prompts built here carry no Phase 1 context;
     * use {@link #buildLettering} when the art prompt is known.
     */
    public BuiltPrompt build(PageRecord page, String globalContext, List<ReferenceImage> references,
                             List<FailureRecord> priorFailures, GenerationPhase phase, RunOptions options) {
        if (phase == GenerationPhase.LETTERING && options.twoPhase()) {
            return buildLettering(page, globalContext, null, references, null, null, options);
        }
        return buildArt(page, globalContext, references, priorFailures, options);
    }

    /**
     * Art prompt in two-phase mode, or the full single-pass page prompt otherwise.
     */
    public BuiltPrompt buildArt(PageRecord page, String globalContext, List<ReferenceImage> references,
                                List<FailureRecord> priorFailures, RunOptions options) {
        String textDirective;
        String styleDirective;
        if (options.twoPhase()) {
            textDirective = """
                    [ART ONLY - NO SPEECH BUBBLES]
                    Draw the panels without any round speech bubbles or dialogue text. Leave clean space \
                    where dialogue will be lettered later. Rectangular narration captions and sound \
                    effects are allowed.""";
            styleDirective = "Black and white manga ink with screentones.";
        } else {
            textDirective = lettering(page.content());
            styleDirective = options.color()
                    ? "Full color manga illustration."
                    : "Black and white manga ink with screentones.";
        }

        String text = String.format("""
                %s
                Create a %s manga page. %s
                %s

                %s

                [GLOBAL CONTEXT]
                %s

                [CURRENT PAGE: %s]
                %s

                %s
                """,
                options.scenePrompt(),
                options.style(),
                options.layout().directive(),
                styleDirective,
                referenceMapping(references),
                truncate(globalContext),
                page.header(),
                page.content(),
                textDirective).strip();

        BuiltPrompt prompt = new BuiltPrompt(text, references);
        return prompt.appendText(pastFailures(priorFailures, options.twoPhase()));
    }

    /**
     * Phase 2 prompt: letter (and optionally colorize) the attached Phase 1 art.
     *
     * @param art        the accepted Phase 1 image, attached first; may be null
     * @param artPrompt  prompt the art was generated from, may be null
     * @param artWarning reviewer remark from Phase 1 to fix while lettering, may be null
     */
    public BuiltPrompt buildLettering(PageRecord page, String globalContext, ReferenceImage art,
                                      List<ReferenceImage> references, String artPrompt, String artWarning,
                                      RunOptions options) {
        String colorDirective = options.color()
                ? "Colorize the page in full color, keeping every character's colors consistent with their references."
                : "Keep the page black and white. Do not add color.";

        String text = String.format("""
                Letter the attached manga page (the "Phase 1 Art" image). Keep the artwork, composition \
                and characters exactly as drawn.
                %s
                %s

                %s

                [GLOBAL CONTEXT]
                %s

                [CURRENT PAGE: %s]
                %s

                %s
                """,
                options.layout().directive(),
                colorDirective,
                referenceMapping(references),
                truncate(globalContext),
                page.header(),
                page.content(),
                lettering(page.content())).strip();

        List<ReferenceImage> attachments = new ArrayList<>();
        if (art != null) {
            attachments.add(art.withLabel("Phase 1 Art"));
        }
        attachments.addAll(references);
        BuiltPrompt prompt = new BuiltPrompt(text, attachments);
        if (artPrompt != null && !artPrompt.isBlank()) {
            prompt = prompt.appendText("[PHASE 1 ART PROMPT FOR CONTEXT]\n" + truncate(artPrompt));
        }
        if (artWarning != null && !artWarning.isBlank()) {
            prompt = prompt.appendText("[CORRECTION FROM ART REVIEW]\n" + artWarning
                    + "\nCover or remove any stray text or bubbles while lettering.");
        }
        return prompt;
    }

    public BuiltPrompt withPreviousPage(BuiltPrompt prompt, ReferenceImage previousPage, String previousHeader) {
        return prompt
                .appendText(String.format("""
                        [CONTINUITY]
                        The attached "Previous Page" image is %s. Keep characters, outfits, lighting and \
                        setting consistent with it. Do not copy its panels.""", previousHeader))
                .attach(previousPage.withLabel("Previous Page"));
    }

    public BuiltPrompt withFailedAttempt(BuiltPrompt prompt, ReferenceImage failedAttempt) {
        return prompt
                .appendText("""
                        [PREVIOUS ATTEMPT]
                        The attached "Previous Attempt" image was rejected. Use it only as a layout \
                        reference and do not repeat its mistakes.""")
                .attach(failedAttempt.withLabel("Previous Attempt"));
    }

    /**
     * Correction block for a rejected attempt: a generic rejection notice plus targeted fixes for
     * the problems the reason mentions.
     */
    public String correctionFor(ReviewResult review, GenerationPhase phase, boolean twoPhase) {
        StringBuilder correction = new StringBuilder();
        correction.append("[CRITICAL CORRECTION REQUIRED]\n")
                .append("The previous attempt was rejected (score ").append(review.totalScore()).append("/400).\n")
                .append("FAILURE REASON: ").append(review.reason()).append("\n");

        if (review.mentionsAny("face", "facial", "eyes", "likeness", "look like", "older", "younger")) {
            correction.append("FACE IDENTITY FIX: Match each character's face exactly to their reference image: "
                    + "face shape, eyes, age and expression style.\n");
        }
        if (review.mentionsAny("hair", "hairstyle")) {
            correction.append("HAIR FIX: Copy the hairstyle, length and hair color from the reference image exactly.\n");
        }
        if (review.mentionsAny("style", "rendering")) {
            correction.append("STYLE FIX: Match the line weight and rendering style of the references.\n");
        }
        if (review.mentionsAny("text", "gibberish", "lettering", "spelling")) {
            correction.append("TEXT FIX: Use only the exact dialogue from the script, spelled correctly, "
                    + "in clean readable lettering.\n");
        }
        if (phase == GenerationPhase.ART && twoPhase) {
            correction.append("Fix likeness and ENSURE NO ROUND SPEECH BUBBLES.\n");
        }
        return correction.toString().strip();
    }

    /**
     * Table binding each attached image's tag to its label so the model knows who is who.
     */
    public String referenceMapping(List<ReferenceImage> references) {
        if (references.isEmpty()) {
            return "";
        }
        StringBuilder mapping = new StringBuilder("[STRICT REFERENCE MAPPING]\n");
        for (ReferenceImage reference : references) {
            mapping.append(String.format("- Tag: \"%s\" matches Reference Image: \"%s\"\n",
                    reference.tag(), reference.sourceLabel()));
        }
        mapping.append("Draw each tagged character or place exactly as shown in its reference image.");
        return mapping.toString();
    }

    /**
     * Numbered list of every quoted line in the script, or empty when there is none.
     */
    public String dialogueChecklist(String script) {
        List<DialogueLine> lines = storyParser.extractDialogue(script);
        if (lines.isEmpty()) {
            return "";
        }
        StringBuilder checklist = new StringBuilder("[MANDATORY DIALOGUE CHECKLIST]\n");
        for (int i = 0; i < lines.size(); i++) {
            DialogueLine line = lines.get(i);
            checklist.append(i + 1).append(". ").append(line.speaker()).append(": \"").append(line.line()).append("\"\n");
        }
        checklist.append("Every line above must appear exactly once, spelled exactly as written.");
        return checklist.toString();
    }

    /**
     * Character sheet prompt. The colour variant is conditioned on the monochrome sheet.
     */
    public String characterSheetPrompt(EntityDefinition character, boolean color, boolean hasSourceImage,
                                       RunOptions options) {
        String source = hasSourceImage
                ? "Base the character's face and features on the attached source photo.\n"
                : "";
        if (color) {
            return String.format("""
                    Colorize the attached black and white character sheet of %s.
                    Keep the drawing identical; only add consistent colors.
                    Description: %s
                    """, character.name(), character.description()).strip();
        }
        return String.format("""
                Create a %s manga character reference sheet for %s.
                Black and white ink, front view and three-quarter view, full body and face close-up, \
                plain white background, no text.
                %sDescription: %s
                """, options.style(), character.name(), source, character.description()).strip();
    }

    public String environmentPrompt(EntityDefinition environment, boolean color, boolean hasSourceImage,
                                    RunOptions options) {
        if (color) {
            return String.format("""
                    Colorize the attached black and white environment sheet of %s.
                    Keep the drawing identical; only add consistent colors and lighting.
                    Description: %s
                    """, environment.name(), environment.description()).strip();
        }
        String source = hasSourceImage ? "Use the attached source image as the basis of the location.\n" : "";
        return String.format("""
                Create a %s manga environment reference (Far View, 16:9) of %s.
                Wide establishing shot, black and white ink with screentones, no characters, no text.
                %sDescription: %s
                """, options.style(), environment.name(), source, environment.description()).strip();
    }

    private String lettering(String script) {
        String checklist = dialogueChecklist(script);
        String bubbles = """
                [LETTERING]
                Place each line of dialogue in a speech bubble pointing at its speaker, in reading order. \
                Use clean, legible lettering.""";
        return checklist.isEmpty() ? bubbles : bubbles + "\n" + checklist;
    }

    private String pastFailures(List<FailureRecord> failures, boolean twoPhase) {
        Set<String> reasons = new LinkedHashSet<>();
        for (FailureRecord failure : failures) {
            if (twoPhase && failure.phase() == GenerationPhase.LETTERING.number()
                    && LETTERING_OR_COLOR_COMPLAINT.matcher(failure.reason()).find()) {
                continue;
            }
            reasons.add(failure.reason());
        }
        if (reasons.isEmpty()) {
            return "";
        }
        StringBuilder block = new StringBuilder("[CRITICAL WARNING: PAST FAILURES]\n"
                + "Earlier attempts at this page were rejected for:\n");
        reasons.forEach(reason -> block.append("- ").append(reason).append("\n"));
        block.append("Do not repeat these mistakes.");
        return block.toString();
    }

    private String truncate(String text) {
        if (text == null) return "";
        if (text.length() <= MAX_CONTEXT_LENGTH) return text;
        return text.substring(0, MAX_CONTEXT_LENGTH) + "...";
    }
}
