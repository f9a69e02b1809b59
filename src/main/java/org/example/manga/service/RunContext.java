package org.example.manga.service;

import org.example.manga.config.PipelineProperties;
import org.example.manga.model.PageRecord;
import org.example.manga.model.RunOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * State of one pipeline run: resolved directories, options, the reference cache, the continuity
 * reference and the files produced so far.
 */
public class RunContext {

    private final Path storyPath;
    private final Path storyDir;
    private final Path outputDir;
    private final Path promptsDir;
    private final Path charactersDir;
    private final Path environmentsDir;
    private final RunOptions options;
    private final ReferenceImageCache referenceCache;
    private final List<String> generatedFiles = new ArrayList<>();
    private final List<String> referenceFiles = new ArrayList<>();

    private Path previousPage;
    private String previousPageHeader;
    private int previousPageIndex = -1;

    public RunContext(Path storyPath, RunOptions options, PipelineProperties properties, ArtifactStore artifactStore) {
        this.storyPath = storyPath.toAbsolutePath().normalize();
        this.storyDir = this.storyPath.getParent();
        this.outputDir = storyDir.resolve(properties.getOutputDir()).normalize();
        this.promptsDir = storyDir.resolve(properties.getPromptsDirName());
        this.charactersDir = storyDir.resolve(properties.getCharactersDirName());
        this.environmentsDir = storyDir.resolve(properties.getEnvironmentsDirName());
        this.options = options;
        this.referenceCache = new ReferenceImageCache(artifactStore, properties.getReferenceLoadThreads());
    }

    public Path storyPath() {
        return storyPath;
    }

    public Path storyDir() {
        return storyDir;
    }

    public Path outputDir() {
        return outputDir;
    }

    public Path promptsDir() {
        return promptsDir;
    }

    public Path charactersDir() {
        return charactersDir;
    }

    public Path environmentsDir() {
        return environmentsDir;
    }

    public RunOptions options() {
        return options;
    }

    public ReferenceImageCache referenceCache() {
        return referenceCache;
    }

    public List<String> generatedFiles() {
        return List.copyOf(generatedFiles);
    }

    public void addGeneratedFile(Path file) {
        generatedFiles.add(file.toAbsolutePath().toString());
    }

    public List<String> referenceFiles() {
        return List.copyOf(referenceFiles);
    }

    public void addReferenceFile(Path file) {
        String path = file.toAbsolutePath().toString();
        if (!referenceFiles.contains(path)) {
            referenceFiles.add(path);
        }
    }

    public Path previousPage() {
        return previousPage;
    }

    public String previousPageHeader() {
        return previousPageHeader;
    }

    /**
     * Story index of {@link #previousPage()}, or -1 when none is set.
     */
    public int previousPageIndex() {
        return previousPageIndex;
    }

    public void setPreviousPage(PageRecord page, Path artifact) {
        this.previousPageIndex = page.index();
        this.previousPageHeader = page.header();
        this.previousPage = artifact;
    }
}
