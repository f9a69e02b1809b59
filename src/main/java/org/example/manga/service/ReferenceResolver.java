package org.example.manga.service;

import org.example.manga.model.EntityDefinition;
import org.example.manga.model.EntityKind;
import org.example.manga.model.GeneratedImage;
import org.example.manga.model.GenerationConstraints;
import org.example.manga.model.PageRecord;
import org.example.manga.model.ReferenceImage;
import org.example.manga.model.RunOptions;
import org.example.manga.service.generation.GenerationService;
import org.example.manga.service.generation.GenerationServiceException;
import org.example.manga.story.StoryParser;
import org.example.manga.story.StoryParser.ParsedStory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds or creates the reference image of every character and environment in a story.
 *
 * <p>Resolution order: an explicit image path in the definition, then an existing sheet at the
 * entity's slug path, then (if enabled) a newly generated monochrome sheet followed by a colour
 * sheet conditioned on it. Failures are logged and the entity is left without a reference;
 * only fatal provider errors propagate.
 */
@Service
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private static final String CHARACTER_ASPECT_RATIO = "1:1";
    private static final String ENVIRONMENT_ASPECT_RATIO = "16:9";

    private final StoryParser storyParser;
    private final PromptBuilder promptBuilder;
    private final GenerationService generationService;
    private final ArtifactStore artifactStore;

    public ReferenceResolver(StoryParser storyParser, PromptBuilder promptBuilder,
                             GenerationService generationService, ArtifactStore artifactStore) {
        this.storyParser = storyParser;
        this.promptBuilder = promptBuilder;
        this.generationService = generationService;
        this.artifactStore = artifactStore;
    }

    /**
     * Resolves all entity references plus any other images linked from the global context,
     * embeds links to generated sheets in the story, and loads everything into the run's cache.
     */
    public List<ReferenceImage> resolveAll(ParsedStory story, RunContext context) {
        RunOptions options = context.options();
        List<EntityDefinition> entities = storyParser.extractEntities(story.globalContext());
        log.info("Found {} entity definitions in global context", entities.size());

        Set<String> entityImagePaths = new HashSet<>();
        for (EntityDefinition entity : entities) {
            entityImagePaths.addAll(storyParser.extractImagePaths(entity.sourceLine() + "\n" + entity.description()));
        }

        List<Path> paths = new ArrayList<>();
        if (!options.referenceGenerationOnly()) {
            for (String linked : storyParser.extractImagePaths(story.globalContext())) {
                if (entityImagePaths.contains(linked)) {
                    continue;
                }
                Optional<Path> located = locate(linked, context);
                if (located.isPresent()) {
                    paths.add(located.get());
                } else {
                    log.warn("Global reference image not found: {}", linked);
                }
            }
        }

        Map<EntityDefinition, Path> resolved = new LinkedHashMap<>();
        for (EntityDefinition entity : entities) {
            if (!inScope(entity, options)) {
                continue;
            }
            resolve(entity, context).ifPresent(path -> {
                resolved.put(entity, path);
                paths.add(path);
                context.addReferenceFile(path);
            });
        }

        embedLinks(context, resolved);
        List<ReferenceImage> references = context.referenceCache().loadAll(paths);
        log.info("Loaded {} reference images", references.size());
        return references;
    }

    /**
     * The run's references plus any images linked from the page itself.
     */
    public List<ReferenceImage> pageReferences(PageRecord page, List<ReferenceImage> references, RunContext context) {
        List<Path> linked = new ArrayList<>();
        for (String path : storyParser.extractImagePaths(page.content())) {
            Optional<Path> located = locate(path, context);
            if (located.isPresent()) {
                linked.add(located.get());
            } else {
                log.warn("Image linked from {} not found: {}", page.header(), path);
            }
        }
        if (linked.isEmpty()) {
            return references;
        }
        List<ReferenceImage> all = new ArrayList<>(references);
        for (ReferenceImage image : context.referenceCache().loadAll(linked)) {
            if (!all.contains(image)) {
                all.add(image);
            }
        }
        return all;
    }

    /**
     * Resolves one entity to an image file.
     */
    public Optional<Path> resolve(EntityDefinition entity, RunContext context) {
        RunOptions options = context.options();
        Optional<Path> explicit = explicitImage(entity, context);
        if (explicit.isPresent() && !options.referenceGenerationOnly()) {
            log.debug("Using explicit reference for {}: {}", entity.name(), explicit.get());
            return explicit;
        }

        Path baseline = sheetPath(entity, context, false);
        Path colored = sheetPath(entity, context, true);
        Path wanted = options.color() ? colored : baseline;
        if (artifactStore.exists(wanted)) {
            return Optional.of(wanted);
        }

        if (!autoGenerate(entity.kind(), options)) {
            if (artifactStore.exists(baseline)) {
                return Optional.of(baseline);
            }
            log.warn("No reference image for {} '{}' and auto-generation is off", kindLabel(entity), entity.name());
            return Optional.empty();
        }

        try {
            if (!artifactStore.exists(baseline)) {
                generateSheet(entity, context, false, explicit.orElse(null), baseline);
            }
            if (artifactStore.exists(baseline) && !artifactStore.exists(colored)) {
                generateSheet(entity, context, true, baseline, colored);
            }
        } catch (GenerationServiceException e) {
            if (e.isFatal()) {
                throw e;
            }
            log.warn("Failed to generate reference for {}: {}", entity.name(), e.getMessage());
        } catch (ArtifactStorageException e) {
            log.warn("Failed to store reference for {}: {}", entity.name(), e.getMessage());
        }

        if (artifactStore.exists(wanted)) {
            return Optional.of(wanted);
        }
        return artifactStore.exists(baseline) ? Optional.of(baseline) : Optional.empty();
    }

    Path sheetPath(EntityDefinition entity, RunContext context, boolean color) {
        String suffix = color ? "_color.png" : ".png";
        if (entity.kind() == EntityKind.ENVIRONMENT) {
            return context.environmentsDir().resolve(entity.slug() + "_env_far" + suffix);
        }
        return context.charactersDir().resolve(entity.slug() + "_portrait" + suffix);
    }

    private void generateSheet(EntityDefinition entity, RunContext context, boolean color, Path source, Path target) {
        RunOptions options = context.options();
        boolean character = entity.kind() == EntityKind.CHARACTER;
        String prompt = character
                ? promptBuilder.characterSheetPrompt(entity, color, source != null, options)
                : promptBuilder.environmentPrompt(entity, color, source != null, options);

        String variant = color ? "color" : "bw";
        String auditName = character
                ? "character_" + entity.slug() + "_" + variant + ".txt"
                : "env_" + entity.slug() + "_far" + (color ? "_color" : "") + ".txt";
        artifactStore.writePromptAudit(context.promptsDir(), auditName, prompt);

        List<ReferenceImage> attachments = new ArrayList<>();
        if (source != null) {
            attachments.add(context.referenceCache().load(source));
        }
        GenerationConstraints constraints = GenerationConstraints.image(
                character ? CHARACTER_ASPECT_RATIO : ENVIRONMENT_ASPECT_RATIO);

        log.info("Generating {} {} reference for '{}'", variant, kindLabel(entity), entity.name());
        Optional<GeneratedImage> image = generationService.generate(prompt, attachments, constraints);
        if (image.isEmpty()) {
            log.warn("No image returned for {} reference of '{}'", variant, entity.name());
            return;
        }
        artifactStore.saveImageAs(target, image.get());
        context.addReferenceFile(target);
    }

    /**
     * Appends {@code ![Name](relative/path)} to list-style definition lines that do not link their
     * sheet yet. The story file is written once, only when a line changed.
     */
    void embedLinks(RunContext context, Map<EntityDefinition, Path> resolved) {
        if (resolved.isEmpty()) {
            return;
        }
        String story = artifactStore.readText(context.storyPath());
        String[] lines = story.split("\n", -1);
        boolean changed = false;

        for (Map.Entry<EntityDefinition, Path> entry : resolved.entrySet()) {
            EntityDefinition entity = entry.getKey();
            Path path = entry.getValue();
            if (entity.headingStyle() || !path.startsWith(context.storyDir())) {
                continue;
            }
            String relative = context.storyDir().relativize(path).toString().replace('\\', '/');
            for (int i = 0; i < lines.length; i++) {
                String line = lines[i];
                boolean carriageReturn = line.endsWith("\r");
                String content = carriageReturn ? line.substring(0, line.length() - 1) : line;
                if (!content.equals(entity.sourceLine())) {
                    continue;
                }
                if (!content.contains(relative)) {
                    lines[i] = content + " ![" + entity.name() + "](" + relative + ")" + (carriageReturn ? "\r" : "");
                    changed = true;
                    log.info("Linked reference for '{}' in story: {}", entity.name(), relative);
                }
                break;
            }
        }

        if (changed) {
            artifactStore.writeTextAtomically(context.storyPath(), String.join("\n", lines));
        }
    }

    /**
     * First image path in the definition that exists and is not one of this entity's own sheets.
     */
    private Optional<Path> explicitImage(EntityDefinition entity, RunContext context) {
        Pattern ownSheet = Pattern.compile(
                "^" + Pattern.quote(entity.slug()) + "_(portrait|env_far)(_color)?\\.\\w+$");
        for (String linked : storyParser.extractImagePaths(entity.sourceLine() + "\n" + entity.description())) {
            Optional<Path> located = locate(linked, context);
            if (located.isEmpty()) {
                log.debug("Linked image for {} not found: {}", entity.name(), linked);
                continue;
            }
            if (!ownSheet.matcher(located.get().getFileName().toString()).matches()) {
                return located;
            }
        }
        return Optional.empty();
    }

    private Optional<Path> locate(String linked, RunContext context) {
        try {
            Path candidate = Path.of(linked);
            List<Path> candidates = candidate.isAbsolute()
                    ? List.of(candidate)
                    : List.of(context.storyDir().resolve(candidate), candidate.toAbsolutePath());
            for (Path path : candidates) {
                if (Files.isRegularFile(path)) {
                    return Optional.of(path.normalize());
                }
            }
        } catch (InvalidPathException e) {
            log.debug("Not a usable path: {}", linked);
        }
        return Optional.empty();
    }

    private static boolean inScope(EntityDefinition entity, RunOptions options) {
        if (!options.referenceGenerationOnly()) {
            return true;
        }
        return entity.kind() == EntityKind.CHARACTER
                ? options.characterGenerationOnly()
                : options.environmentGenerationOnly();
    }

    private static boolean autoGenerate(EntityKind kind, RunOptions options) {
        return kind == EntityKind.CHARACTER
                ? options.autoGenerateCharacters() || options.characterGenerationOnly()
                : options.autoGenerateEnvironments() || options.environmentGenerationOnly();
    }

    private static String kindLabel(EntityDefinition entity) {
        return entity.kind() == EntityKind.CHARACTER ? "character" : "environment";
    }
}
