package org.example.manga.service;

import org.example.manga.model.ReferenceImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reference images loaded during one run, keyed by resolved path. Owned by the run context
 * and discarded with it. Only the pipeline thread mutates the cache; {@link #loadAll} reads
 * files on a small pool and inserts the results afterwards.
 */
public class ReferenceImageCache {

    private static final Logger log = LoggerFactory.getLogger(ReferenceImageCache.class);

    private final ArtifactStore artifactStore;
    private final int loadThreads;
    private final Map<Path, ReferenceImage> images = new LinkedHashMap<>();

    public ReferenceImageCache(ArtifactStore artifactStore, int loadThreads) {
        this.artifactStore = artifactStore;
        this.loadThreads = Math.max(1, loadThreads);
    }

    /**
     * Returns the cached image or reads it from disk.
     */
    public ReferenceImage load(Path path) {
        Path key = key(path);
        ReferenceImage cached = images.get(key);
        if (cached != null) {
            return cached;
        }
        ReferenceImage image = ReferenceImage.fromFile(key, artifactStore.readBytes(key));
        images.put(key, image);
        return image;
    }

    /**
     * Loads several images concurrently, preserving input order. Unreadable files are logged
     * and left out.
     */
    public List<ReferenceImage> loadAll(List<Path> paths) {
        List<Path> keys = paths.stream().map(ReferenceImageCache::key).distinct().toList();
        List<Path> missing = keys.stream().filter(k -> !images.containsKey(k)).toList();

        if (!missing.isEmpty()) {
            ExecutorService executor = Executors.newFixedThreadPool(Math.min(loadThreads, missing.size()));
            try {
                List<Future<byte[]>> reads = new ArrayList<>();
                for (Path path : missing) {
                    reads.add(executor.submit(() -> artifactStore.readBytes(path)));
                }
                for (int i = 0; i < missing.size(); i++) {
                    Path path = missing.get(i);
                    try {
                        images.put(path, ReferenceImage.fromFile(path, reads.get(i).get()));
                    } catch (ExecutionException e) {
                        log.warn("Skipping unreadable reference image {}: {}", path, e.getCause().getMessage());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ArtifactStorageException("Interrupted while loading reference images", e);
            } finally {
                executor.shutdown();
            }
        }

        List<ReferenceImage> loaded = new ArrayList<>();
        for (Path key : keys) {
            ReferenceImage image = images.get(key);
            if (image != null) {
                loaded.add(image);
            }
        }
        return loaded;
    }

    private static Path key(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
