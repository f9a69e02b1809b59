package org.example.manga.service;

import org.example.manga.model.GeneratedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * File operations for generated images, prompt audit files and the story document.
 * Failures surface as {@link ArtifactStorageException}.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private static final int MAX_BASE_NAME_LENGTH = 64;
    private static final String DEFAULT_BASE_NAME = "generated_image";

    public boolean exists(Path path) {
        return path != null && Files.isRegularFile(path);
    }

    public byte[] readBytes(Path path) {
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to read " + path, e);
        }
    }

    public String readText(Path path) {
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to read " + path, e);
        }
    }

    /**
     * Replaces the file content through a temporary sibling and a move, so readers never see a partial file.
     */
    public void writeTextAtomically(Path path, String content) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to write " + path, e);
        }
    }

    /**
     * Saves an image as {@code <baseName>.<ext>} in the directory, adding {@code _1}, {@code _2}...
     * when the name is taken.
     */
    public Path saveImage(Path directory, String baseName, GeneratedImage image) {
        try {
            Files.createDirectories(directory);
            String extension = image.extension();
            Path target = directory.resolve(baseName + "." + extension);
            int counter = 1;
            while (Files.exists(target)) {
                target = directory.resolve(baseName + "_" + counter++ + "." + extension);
            }
            Files.write(target, image.data());
            log.info("Saved image: {}", target);
            return target.toAbsolutePath();
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to save image " + baseName + " in " + directory, e);
        }
    }

    /**
     * Writes an image to an exact path, replacing any existing file.
     */
    public Path saveImageAs(Path target, GeneratedImage image) {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            Files.write(target, image.data());
            log.info("Saved image: {}", target);
            return target.toAbsolutePath();
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to save image " + target, e);
        }
    }

    /**
     * Renames a rejected image to {@code <base>_failed_<millis>.<ext>} next to the original.
     */
    public Path retireAsFailed(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        Path target = path.resolveSibling(base + "_failed_" + System.currentTimeMillis() + extension);
        try {
            Files.move(path, target, StandardCopyOption.REPLACE_EXISTING);
            log.info("Kept failed image as {}", target.getFileName());
            return target.toAbsolutePath();
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to rename rejected image " + path, e);
        }
    }

    /**
     * Deletes a file if present. A failed delete leaves a stray file and is only logged.
     */
    public void delete(Path path) {
        if (path == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("Deleted {}", path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    /**
     * Newest image in the directory whose file name starts with the prefix, ignoring retired failures.
     */
    public Optional<Path> findLatest(Path directory, String prefix) {
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(prefix) && !name.contains("_failed_") && isImageName(name);
                    })
                    .max(Comparator.comparingLong(this::lastModified));
        } catch (IOException e) {
            log.warn("Failed to list {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Saves the exact prompt used for an image. Audit files are not required for the run to continue.
     */
    public Optional<Path> writePromptAudit(Path promptsDir, String fileName, String prompt) {
        try {
            Files.createDirectories(promptsDir);
            Path target = promptsDir.resolve(fileName);
            Files.writeString(target, prompt, StandardCharsets.UTF_8);
            log.debug("Saved prompt: {}", target);
            return Optional.of(target);
        } catch (IOException e) {
            log.warn("Failed to save prompt {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Turns free text into a file-system safe base name.
     */
    public static String sanitizeBaseName(String text) {
        if (text == null) {
            return DEFAULT_BASE_NAME;
        }
        String name = text.toLowerCase()
                .replaceAll("[^a-z0-9\\s]", "")
                .trim()
                .replaceAll("\\s+", "_");
        if (name.length() > MAX_BASE_NAME_LENGTH) {
            name = name.substring(0, MAX_BASE_NAME_LENGTH);
        }
        return name.isEmpty() ? DEFAULT_BASE_NAME : name;
    }

    private long lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            log.debug("Cannot read modification time of {}: {}", path, e.getMessage());
            return 0L;
        }
    }

    private static boolean isImageName(String name) {
        String lower = name.toLowerCase();
        return lower.endsWith(".png") || lower.endsWith(".jpg") || lower.endsWith(".jpeg") || lower.endsWith(".webp");
    }
}
