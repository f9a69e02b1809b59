package org.example.manga.service;

import org.example.manga.config.PipelineProperties;
import org.example.manga.model.BuiltPrompt;
import org.example.manga.model.FailureRecord;
import org.example.manga.model.GeneratedImage;
import org.example.manga.model.GenerationAttempt;
import org.example.manga.model.GenerationConstraints;
import org.example.manga.model.GenerationPhase;
import org.example.manga.model.PageMemoryEntry;
import org.example.manga.model.PageRecord;
import org.example.manga.model.PageState;
import org.example.manga.model.PhaseRecord;
import org.example.manga.model.ReferenceImage;
import org.example.manga.model.ReviewResult;
import org.example.manga.model.ReviewScores;
import org.example.manga.model.ReviewThresholds;
import org.example.manga.model.RunOptions;
import org.example.manga.model.RunResult;
import org.example.manga.service.generation.GenerationService;
import org.example.manga.service.generation.GenerationServiceException;
import org.example.manga.service.generation.ReviewFlags;
import org.example.manga.service.generation.ReviewParseException;
import org.example.manga.service.generation.ReviewService;
import org.example.manga.story.StoryParser;
import org.example.manga.story.StoryParser.ParsedStory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates the pages of a story in order. Each page goes through generation and review,
 * in one pass or as art followed by lettering, and is retried with corrections until it
 * passes or the retry budget runs out. Progress is recorded in page memory after every
 * phase so an interrupted run resumes where it stopped.
 */
@Service
public class GenerationPipeline {

    private static final Logger log = LoggerFactory.getLogger(GenerationPipeline.class);

    private static final String NO_IMAGE_REASON = "Generation returned no image";

    private final StoryParser storyParser;
    private final ReferenceResolver referenceResolver;
    private final PromptBuilder promptBuilder;
    private final PageMemoryStore pageMemoryStore;
    private final ReviewGate reviewGate;
    private final PageSelector pageSelector;
    private final ArtifactStore artifactStore;
    private final GenerationService generationService;
    private final ReviewService reviewService;
    private final PipelineProperties properties;

    public GenerationPipeline(StoryParser storyParser,
                              ReferenceResolver referenceResolver,
                              PromptBuilder promptBuilder,
                              PageMemoryStore pageMemoryStore,
                              ReviewGate reviewGate,
                              PageSelector pageSelector,
                              ArtifactStore artifactStore,
                              GenerationService generationService,
                              ReviewService reviewService,
                              PipelineProperties properties) {
        this.storyParser = storyParser;
        this.referenceResolver = referenceResolver;
        this.promptBuilder = promptBuilder;
        this.pageMemoryStore = pageMemoryStore;
        this.reviewGate = reviewGate;
        this.pageSelector = pageSelector;
        this.artifactStore = artifactStore;
        this.generationService = generationService;
        this.reviewService = reviewService;
        this.properties = properties;
    }

    private record PageOutcome(boolean passed, String reason) {
        static PageOutcome success() {
            return new PageOutcome(true, null);
        }

        static PageOutcome failure(String reason) {
            return new PageOutcome(false, reason);
        }
    }

    private record ReviewOutcome(ReviewResult result, boolean passed) {}

    private record GenerationCall(GeneratedImage image, String failure) {}

    public RunResult run(Path storyPath, RunOptions options) {
        if (!artifactStore.exists(storyPath)) {
            return RunResult.failure("Story file not found: " + storyPath);
        }
        RunContext context = new RunContext(storyPath, options, properties, artifactStore);
        log.info("Starting run for {} (twoPhase={}, retries={}, layout={}, color={}, generation={}, review={})",
                context.storyPath(), options.twoPhase(), options.retryCount(), options.layout(), options.color(),
                generationService.getProviderName(), reviewService.getProviderName());

        int totalPages = 0;
        try {
            ParsedStory story = storyParser.parse(artifactStore.readText(context.storyPath()));
            List<ReferenceImage> references = referenceResolver.resolveAll(story, context);

            if (options.referenceGenerationOnly()) {
                List<String> files = context.referenceFiles();
                return RunResult.success("Resolved " + files.size() + " reference images", files);
            }

            List<PageRecord> pages = selectPages(story.pages(), options);
            if (pages.isEmpty()) {
                String target = options.hasPageSelector() ? options.pageSelector() : options.startPage();
                return RunResult.failure("Page(s) \"" + target + "\" not found");
            }
            totalPages = pages.size();

            Map<String, PageMemoryEntry> memory = pageMemoryStore.read(context.storyPath());
            for (PageRecord page : pages) {
                PageOutcome outcome = processPage(page, story, references, memory, context);
                if (!outcome.passed()) {
                    String message = String.format("Generated %d of %d manga pages. '%s' failed after %d attempts",
                            context.generatedFiles().size(), totalPages, page.header(), options.retryCount());
                    log.warn(message);
                    return RunResult.failure(message, context.generatedFiles(), outcome.reason());
                }
            }

            String message = String.format("Successfully generated %d of %d manga pages",
                    context.generatedFiles().size(), totalPages);
            log.info(message);
            return RunResult.success(message, context.generatedFiles());

        } catch (GenerationServiceException e) {
            log.error("Run aborted: {}", e.getMessage());
            return RunResult.failure(aborted(context, totalPages), context.generatedFiles(), e.getMessage());
        } catch (ArtifactStorageException e) {
            log.error("Run aborted, could not store artifact: {}", e.getMessage(), e);
            return RunResult.failure(aborted(context, totalPages), context.generatedFiles(), e.getMessage());
        }
    }

    private PageOutcome processPage(PageRecord page, ParsedStory story, List<ReferenceImage> references,
                                    Map<String, PageMemoryEntry> memory, RunContext context) {
        RunOptions options = context.options();
        String header = page.header();
        PageMemoryEntry entry = PageMemoryStore.lookup(memory, header).orElse(PageMemoryEntry.empty(header));
        boolean useMemory = !options.hasPageSelector();
        GenerationPhase singlePhase = options.twoPhase() ? GenerationPhase.ART : GenerationPhase.LETTERING;
        transition(header, singlePhase, PageState.PENDING);

        Optional<Path> finished = passedArtifact(entry, GenerationPhase.LETTERING);
        if (useMemory && finished.isPresent()) {
            log.info("Skipping {}: already PASSED in memory ({})", header, finished.get());
            context.addGeneratedFile(finished.get());
            context.setPreviousPage(page, finished.get());
            return PageOutcome.success();
        }

        Path art = null;
        String artPrompt = null;
        String artWarning = null;
        if (options.twoPhase() && useMemory) {
            Optional<Path> storedArt = passedArtifact(entry, GenerationPhase.ART);
            if (storedArt.isPresent()) {
                art = storedArt.get();
                artPrompt = storedPrompt(entry.phase1());
                log.info("Resuming {} from stored Phase 1 art: {}", header, art);
            }
        }

        List<ReferenceImage> pageReferences = referenceResolver.pageReferences(page, references, context);
        Optional<ReferenceImage> previous = continuityReference(page, story, memory, context);
        List<ReferenceImage> reviewReferences = new ArrayList<>(pageReferences);
        previous.ifPresent(p -> reviewReferences.add(p.withLabel("Previous Page")));

        String baseName = ArtifactStore.sanitizeBaseName(header);
        String artCorrection = null;
        String letteringCorrection = null;
        String lastReason = null;

        for (int attempt = 1; attempt <= options.retryCount(); attempt++) {
            log.info("{}: attempt {}/{}", header, attempt, options.retryCount());

            if (art == null) {
                BuiltPrompt prompt = promptBuilder.build(page, story.globalContext(), pageReferences,
                        entry.failureLog(), singlePhase, options);
                if (previous.isPresent()) {
                    prompt = promptBuilder.withPreviousPage(prompt, previous.get(), context.previousPageHeader());
                }
                if (artCorrection != null) {
                    prompt = prompt.appendText(artCorrection);
                }

                GenerationAttempt generation = new GenerationAttempt(header, singlePhase, prompt.text(), attempt);
                Path promptRef = audit(context, baseName, generation);
                GenerationCall call = generate(generation, prompt, options);
                if (call.image() == null) {
                    lastReason = call.failure();
                    entry = recordFailure(memory, context, header, singlePhase, lastReason, null);
                    transition(header, singlePhase, PageState.FAILED);
                    continue;
                }

                String suffix = options.twoPhase() ? "_phase_1" : "_final";
                Path candidate = artifactStore.saveImage(context.outputDir(), baseName + suffix, call.image());
                ReviewOutcome review = review(candidate, reviewReferences, page, singlePhase, options);

                if (!options.twoPhase()) {
                    if (review.passed()) {
                        complete(memory, context, page, candidate, promptRef);
                        return PageOutcome.success();
                    }
                    artifactStore.delete(candidate);
                    lastReason = review.result().reason();
                    entry = recordFailure(memory, context, header, GenerationPhase.LETTERING, lastReason, null);
                    artCorrection = promptBuilder.correctionFor(review.result(), GenerationPhase.LETTERING, false);
                    continue;
                }

                if (!review.passed()) {
                    artifactStore.delete(candidate);
                    lastReason = review.result().reason();
                    entry = recordFailure(memory, context, header, GenerationPhase.ART, lastReason, null);
                    artCorrection = promptBuilder.correctionFor(review.result(), GenerationPhase.ART, true);
                    continue;
                }

                art = candidate;
                artPrompt = prompt.text();
                artWarning = review.result().mentionsAny("bubble", "text") ? review.result().reason() : null;
                entry = recordPass(memory, context, header, GenerationPhase.ART, art, promptRef);
            }

            ReferenceImage artImage = ReferenceImage.fromFile(art, artifactStore.readBytes(art));
            BuiltPrompt lettering = promptBuilder.buildLettering(page, story.globalContext(), artImage,
                    pageReferences, artPrompt, artWarning, options);
            Optional<ReferenceImage> failedAttempt = lastFailedArtifact(entry);
            if (failedAttempt.isPresent()) {
                lettering = promptBuilder.withFailedAttempt(lettering, failedAttempt.get());
            }
            if (letteringCorrection != null) {
                lettering = lettering.appendText(letteringCorrection);
            }

            GenerationAttempt generation = new GenerationAttempt(header, GenerationPhase.LETTERING, lettering.text(), attempt);
            Path promptRef = audit(context, baseName, generation);
            GenerationCall call = generate(generation, lettering, options);
            if (call.image() == null) {
                lastReason = call.failure();
                entry = recordFailure(memory, context, header, GenerationPhase.LETTERING, lastReason, null);
                transition(header, GenerationPhase.LETTERING, PageState.FAILED);
                continue;
            }

            Path finalPage = artifactStore.saveImage(context.outputDir(), baseName + "_final", call.image());
            ReviewOutcome review = review(finalPage, reviewReferences, page, GenerationPhase.LETTERING, options);
            if (review.passed()) {
                artifactStore.delete(art);
                complete(memory, context, page, finalPage, promptRef);
                return PageOutcome.success();
            }

            Path failed = artifactStore.retireAsFailed(finalPage);
            lastReason = review.result().reason();
            entry = recordFailure(memory, context, header, GenerationPhase.LETTERING, lastReason, failed);
            letteringCorrection = promptBuilder.correctionFor(review.result(), GenerationPhase.LETTERING, true);
        }

        transition(header, options.twoPhase() && art != null ? GenerationPhase.LETTERING : singlePhase,
                PageState.TERMINAL_FAILURE);
        log.error("{} failed after {} attempts. Last reason: {}", header, options.retryCount(), lastReason);
        return PageOutcome.failure(lastReason);
    }

    private GenerationCall generate(GenerationAttempt attempt, BuiltPrompt prompt, RunOptions options) {
        transition(attempt.pageHeader(), attempt.phase(), PageState.GENERATING);
        try {
            Optional<GeneratedImage> image = generationService.generate(
                    prompt.text(), prompt.attachments(), GenerationConstraints.image(options.layout()));
            if (image.isEmpty()) {
                log.warn("{}: {} (attempt {})", attempt.pageHeader(), NO_IMAGE_REASON, attempt.attemptNumber());
                return new GenerationCall(null, NO_IMAGE_REASON);
            }
            return new GenerationCall(image.get(), null);
        } catch (GenerationServiceException e) {
            if (e.isFatal()) {
                throw e;
            }
            log.warn("{}: generation failed on attempt {}: {}", attempt.pageHeader(), attempt.attemptNumber(), e.getMessage());
            return new GenerationCall(null, "Generation failed: " + e.getMessage());
        } catch (RuntimeException e) {
            if (e instanceof ArtifactStorageException) {
                throw e;
            }
            log.warn("{}: unexpected generation error on attempt {}", attempt.pageHeader(), attempt.attemptNumber(), e);
            return new GenerationCall(null, "Generation failed: " + e.getMessage());
        }
    }

    private ReviewOutcome review(Path candidate, List<ReferenceImage> references, PageRecord page,
                                 GenerationPhase phase, RunOptions options) {
        transition(page.header(), phase, PageState.REVIEWING);
        boolean artPhase = phase == GenerationPhase.ART;
        ReviewThresholds thresholds = ReviewThresholds.forPhase(options, phase);
        try {
            ReviewResult result = reviewService.review(artifactStore.readBytes(candidate), references,
                    storyContext(page), new ReviewFlags(artPhase, options.color() && !artPhase));
            boolean passed = reviewGate.passes(result, thresholds);
            log.info("{} Phase {} review: total={} likeness={} continuity={} text={} story={} -> {} ({})",
                    page.header(), phase.number(), result.totalScore(), result.subScores().likeness(),
                    result.subScores().continuity(), result.subScores().letteringOrNoBubbles(),
                    result.subScores().story(), passed ? "PASS" : "FAIL", result.reason());
            transition(page.header(), phase, passed ? PageState.PASSED : PageState.FAILED);
            return new ReviewOutcome(result, passed);
        } catch (GenerationServiceException e) {
            if (e.isFatal()) {
                throw e;
            }
            if (e instanceof ReviewParseException parseError) {
                log.debug("{} Phase {}: raw review response: {}", page.header(), phase.number(), parseError.getRawResponse());
            }
            String reason = "Review unavailable: " + e.getMessage();
            if (properties.getReview().isPassOnUnparseable()) {
                log.warn("{} Phase {}: {}. Accepting with score 0", page.header(), phase.number(), reason);
                transition(page.header(), phase, PageState.PASSED);
                return new ReviewOutcome(ReviewResult.autoPass(reason), true);
            }
            log.warn("{} Phase {}: {}. Treating as a failed attempt", page.header(), phase.number(), reason);
            transition(page.header(), phase, PageState.FAILED);
            return new ReviewOutcome(new ReviewResult(ReviewScores.zero(), 0, reason, false), false);
        }
    }

    /**
     * Final image of the page before this one in the story: from this run, else from memory,
     * else the newest matching file on disk.
     */
    private Optional<ReferenceImage> continuityReference(PageRecord page, ParsedStory story,
                                                         Map<String, PageMemoryEntry> memory, RunContext context) {
        if (page.index() <= 0) {
            return Optional.empty();
        }
        int previousIndex = page.index() - 1;

        if (context.previousPageIndex() != previousIndex || !artifactStore.exists(context.previousPage())) {
            PageRecord previousPage = story.pages().get(previousIndex);
            PageMemoryEntry entry = PageMemoryStore.lookup(memory, previousPage.header())
                    .orElse(PageMemoryEntry.empty(previousPage.header()));
            Optional<Path> stored = passedArtifact(entry, GenerationPhase.LETTERING)
                    .or(() -> passedArtifact(entry, GenerationPhase.ART))
                    .or(() -> artifactStore.findLatest(context.outputDir(),
                            ArtifactStore.sanitizeBaseName(previousPage.header()) + "_final"));
            if (stored.isEmpty()) {
                log.debug("No continuity reference for {}", page.header());
                return Optional.empty();
            }
            context.setPreviousPage(previousPage, stored.get());
        }

        Path previous = context.previousPage();
        log.info("Using {} as continuity reference for {}", previous.getFileName(), page.header());
        return Optional.of(ReferenceImage.fromFile(previous, artifactStore.readBytes(previous)));
    }

    private Optional<ReferenceImage> lastFailedArtifact(PageMemoryEntry entry) {
        List<FailureRecord> failures = entry.failureLog();
        for (int i = failures.size() - 1; i >= 0; i--) {
            String failedPath = failures.get(i).failedArtifactPath();
            if (failedPath != null) {
                Path path = Path.of(failedPath);
                if (artifactStore.exists(path)) {
                    return Optional.of(ReferenceImage.fromFile(path, artifactStore.readBytes(path)));
                }
            }
        }
        return Optional.empty();
    }

    private List<PageRecord> selectPages(List<PageRecord> pages, RunOptions options) {
        if (options.hasPageSelector()) {
            return pageSelector.select(pages, options.pageSelector());
        }
        if (options.startPage() != null) {
            return pageSelector.startingFrom(pages, options.startPage());
        }
        return pages;
    }

    private Optional<Path> passedArtifact(PageMemoryEntry entry, GenerationPhase phase) {
        return entry.passed(phase)
                .map(record -> Path.of(record.artifactPath()))
                .filter(artifactStore::exists);
    }

    private String storedPrompt(PhaseRecord record) {
        if (record == null || record.promptRef() == null) {
            return null;
        }
        Path promptRef = Path.of(record.promptRef());
        return artifactStore.exists(promptRef) ? artifactStore.readText(promptRef) : null;
    }

    private Path audit(RunContext context, String baseName, GenerationAttempt attempt) {
        String fileName = baseName + "_phase" + attempt.phase().number() + "_attempt" + attempt.attemptNumber() + ".txt";
        return artifactStore.writePromptAudit(context.promptsDir(), fileName, attempt.promptText()).orElse(null);
    }

    private void complete(Map<String, PageMemoryEntry> memory, RunContext context, PageRecord page,
                          Path finalPage, Path promptRef) {
        recordPass(memory, context, page.header(), GenerationPhase.LETTERING, finalPage, promptRef);
        context.addGeneratedFile(finalPage);
        context.setPreviousPage(page, finalPage);
        log.info("{} completed: {}", page.header(), finalPage);
    }

    private PageMemoryEntry recordPass(Map<String, PageMemoryEntry> memory, RunContext context, String header,
                                       GenerationPhase phase, Path artifact, Path promptRef) {
        PageMemoryEntry updated = pageMemoryStore.recordPass(context.storyPath(), header, phase, artifact, promptRef);
        memory.put(header, updated);
        return updated;
    }

    private PageMemoryEntry recordFailure(Map<String, PageMemoryEntry> memory, RunContext context, String header,
                                          GenerationPhase phase, String reason, Path failedArtifact) {
        PageMemoryEntry updated = pageMemoryStore.recordFailure(context.storyPath(), header, phase, reason, failedArtifact);
        memory.put(header, updated);
        return updated;
    }

    private static String storyContext(PageRecord page) {
        return "[" + page.header() + "]\n" + page.content();
    }

    private static void transition(String header, GenerationPhase phase, PageState state) {
        log.debug("{} Phase {} -> {}", header, phase.number(), state);
    }

    private static String aborted(RunContext context, int totalPages) {
        return String.format("Run aborted after generating %d of %d manga pages",
                context.generatedFiles().size(), totalPages);
    }
}
