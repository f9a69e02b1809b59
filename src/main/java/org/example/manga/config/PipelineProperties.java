package org.example.manga.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * File layout and review policy of the pipeline. Relative directories resolve against the
 * directory of the story being processed.
 */
@Component
@ConfigurationProperties(prefix = "manga.pipeline")
public class PipelineProperties {

    private String outputDir = "manga-output";
    private String memoryFileName = "manga_memory.md";
    private String promptsDirName = "prompts";
    private String charactersDirName = "characters";
    private String environmentsDirName = "environments";
    private int referenceLoadThreads = 4;
    private Review review = new Review();

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getMemoryFileName() {
        return memoryFileName;
    }

    public void setMemoryFileName(String memoryFileName) {
        this.memoryFileName = memoryFileName;
    }

    public String getPromptsDirName() {
        return promptsDirName;
    }

    public void setPromptsDirName(String promptsDirName) {
        this.promptsDirName = promptsDirName;
    }

    public String getCharactersDirName() {
        return charactersDirName;
    }

    public void setCharactersDirName(String charactersDirName) {
        this.charactersDirName = charactersDirName;
    }

    public String getEnvironmentsDirName() {
        return environmentsDirName;
    }

    public void setEnvironmentsDirName(String environmentsDirName) {
        this.environmentsDirName = environmentsDirName;
    }

    public int getReferenceLoadThreads() {
        return referenceLoadThreads;
    }

    public void setReferenceLoadThreads(int referenceLoadThreads) {
        this.referenceLoadThreads = referenceLoadThreads;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review == null ? new Review() : review;
    }

    public static class Review {
        /**
         * Treat an unreadable or failed review as a pass with score 0.
         */
        private boolean passOnUnparseable = true;

        public boolean isPassOnUnparseable() {
            return passOnUnparseable;
        }

        public void setPassOnUnparseable(boolean passOnUnparseable) {
            this.passOnUnparseable = passOnUnparseable;
        }
    }
}
