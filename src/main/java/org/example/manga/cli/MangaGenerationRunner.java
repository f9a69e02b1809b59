package org.example.manga.cli;

import org.example.manga.model.Layout;
import org.example.manga.model.RunOptions;
import org.example.manga.model.RunResult;
import org.example.manga.service.GenerationPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Command-line runner that generates the pages of one story document.
 *
 * Run with: mvn spring-boot:run -Dspring-boot.run.profiles=generate -Dspring-boot.run.arguments=story.md
 * Or: java -jar target/manga-pipeline.jar --spring.profiles.active=generate --manga.run.two-phase=true story.md
 */
@Component
@Profile("generate")
public class MangaGenerationRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(MangaGenerationRunner.class);

    private final GenerationPipeline generationPipeline;

    @Value("${manga.run.story:}")
    private String story;

    @Value("${manga.run.two-phase:false}")
    private boolean twoPhase;

    @Value("${manga.run.retry-count:3}")
    private int retryCount;

    @Value("${manga.run.min-score:8}")
    private int minScore;

    @Value("${manga.run.min-likeness:7}")
    private int minLikeness;

    @Value("${manga.run.min-continuity:7}")
    private int minContinuity;

    @Value("${manga.run.min-story:7}")
    private int minStory;

    @Value("${manga.run.min-lettering:#{null}}")
    private Integer minLettering;

    @Value("${manga.run.min-no-bubbles:#{null}}")
    private Integer minNoBubbles;

    @Value("${manga.run.color:false}")
    private boolean color;

    @Value("${manga.run.layout:square}")
    private String layout;

    @Value("${manga.run.style:shonen}")
    private String style;

    @Value("${manga.run.prompt:}")
    private String scenePrompt;

    @Value("${manga.run.page:}")
    private String page;

    @Value("${manga.run.start-page:}")
    private String startPage;

    @Value("${manga.run.auto-generate-characters:false}")
    private boolean autoGenerateCharacters;

    @Value("${manga.run.auto-generate-environments:false}")
    private boolean autoGenerateEnvironments;

    @Value("${manga.run.character-generation-only:false}")
    private boolean characterGenerationOnly;

    @Value("${manga.run.environment-generation-only:false}")
    private boolean environmentGenerationOnly;

    public MangaGenerationRunner(GenerationPipeline generationPipeline) {
        this.generationPipeline = generationPipeline;
    }

    @Override
    public void run(String... args) throws Exception {
        String storyFile = storyArgument(args);
        if (storyFile == null) {
            log.error("No story file given. Pass it as an argument or set manga.run.story");
            return;
        }

        RunOptions options;
        try {
            options = buildOptions();
        } catch (IllegalArgumentException e) {
            log.error("Invalid run options: {}", e.getMessage());
            return;
        }

        log.info("========================================");
        log.info("Manga Generation Runner");
        log.info("========================================");
        log.info("Story: {}", storyFile);
        log.info("Mode: {}, layout={}, color={}, retries={}",
                options.twoPhase() ? "two-phase" : "single-phase", options.layout(), options.color(), options.retryCount());
        log.info("");

        RunResult result = generationPipeline.run(Path.of(storyFile), options);

        log.info("");
        log.info("========================================");
        log.info("RUN COMPLETE - {}", result.success() ? "OK" : "FAILED");
        log.info("========================================");
        log.info("{}", result.message());
        for (String file : result.generatedFiles()) {
            log.info("  - {}", file);
        }
        if (result.error() != null && !result.success()) {
            log.info("Error: {}", result.error());
        }
        log.info("========================================");
    }

    RunOptions buildOptions() {
        return RunOptions.builder()
                .twoPhase(twoPhase)
                .retryCount(retryCount)
                .minScore(minScore)
                .minLikeness(minLikeness)
                .minContinuity(minContinuity)
                .minStory(minStory)
                .minLettering(minLettering)
                .minNoBubbles(minNoBubbles)
                .color(color)
                .layout(Layout.fromName(layout))
                .style(style)
                .scenePrompt(scenePrompt)
                .pageSelector(page)
                .startPage(startPage)
                .autoGenerateCharacters(autoGenerateCharacters)
                .autoGenerateEnvironments(autoGenerateEnvironments)
                .characterGenerationOnly(characterGenerationOnly)
                .environmentGenerationOnly(environmentGenerationOnly)
                .build();
    }

    private String storyArgument(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return arg;
            }
        }
        return story == null || story.isBlank() ? null : story;
    }
}
