package org.example.manga.service;

import org.example.manga.config.PipelineProperties;
import org.example.manga.model.FailureRecord;
import org.example.manga.model.GenerationPhase;
import org.example.manga.model.PageMemoryEntry;
import org.example.manga.model.PhaseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-story ledger of page progress, kept as a Markdown file next to the story:
 *
 * <pre>
 * ## Page 1: Arrival
 * - Phase 1: `/out/page_1_phase_1.png` [PASSED] (prompt: `/story/prompts/page_1_phase1_attempt1.txt`)
 * - Phase 2: `/out/page_1_final.png` [PASSED]
 * - Phase 2 Attempt: FAILED. Reason: missing dialogue [FILE: `/out/page_1_final_failed_1712.png`]
 * </pre>
 *
 * A phase line is overwritten on each pass. Failure lines are only appended, and an identical
 * line is never written twice. Every write replaces the file atomically before returning.
 */
@Service
public class PageMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(PageMemoryStore.class);

    private static final String TITLE = "# Manga Generation Memory";

    private static final Pattern PAGE_HEADER = Pattern.compile("^## (.+)$");
    private static final Pattern PHASE_PASSED = Pattern.compile(
            "^- Phase ([12]): `(.+?)` \\[PASSED\\](?: \\(prompt: `(.+?)`\\))?\\s*$");
    private static final Pattern PHASE_FAILED = Pattern.compile(
            "^- Phase ([12]) Attempt: FAILED\\. Reason: (.*?)(?: \\[FILE: `(.+?)`\\])?\\s*$");

    private final ArtifactStore artifactStore;
    private final PipelineProperties properties;

    public PageMemoryStore(ArtifactStore artifactStore, PipelineProperties properties) {
        this.artifactStore = artifactStore;
        this.properties = properties;
    }

    public Path memoryFile(Path storyPath) {
        return storyPath.toAbsolutePath().getParent().resolve(properties.getMemoryFileName());
    }

    /**
     * Reads all entries in file order. A missing file yields an empty map.
     */
    public Map<String, PageMemoryEntry> read(Path storyPath) {
        Path file = memoryFile(storyPath);
        Map<String, PageMemoryEntry> entries = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return entries;
        }

        String currentHeader = null;
        PhaseRecord phase1 = null;
        PhaseRecord phase2 = null;
        List<FailureRecord> failures = new ArrayList<>();

        for (String line : artifactStore.readText(file).split("\\R")) {
            Matcher header = PAGE_HEADER.matcher(line);
            if (header.matches()) {
                if (currentHeader != null) {
                    entries.put(currentHeader, new PageMemoryEntry(currentHeader, phase1, phase2, failures));
                }
                currentHeader = header.group(1).trim();
                phase1 = null;
                phase2 = null;
                failures = new ArrayList<>();
                continue;
            }
            if (currentHeader == null) {
                continue;
            }
            Matcher passed = PHASE_PASSED.matcher(line);
            if (passed.matches()) {
                PhaseRecord record = new PhaseRecord(passed.group(2), passed.group(3));
                if ("1".equals(passed.group(1))) {
                    phase1 = record;
                } else {
                    phase2 = record;
                }
                continue;
            }
            Matcher failed = PHASE_FAILED.matcher(line);
            if (failed.matches()) {
                FailureRecord failure = new FailureRecord(Integer.parseInt(failed.group(1)), failed.group(2), failed.group(3));
                if (!failures.contains(failure)) {
                    failures.add(failure);
                }
            } else if (!line.isBlank()) {
                log.debug("Ignoring unrecognised memory line under '{}': {}", currentHeader, line);
            }
        }
        if (currentHeader != null) {
            entries.put(currentHeader, new PageMemoryEntry(currentHeader, phase1, phase2, failures));
        }
        return entries;
    }

    public Optional<PageMemoryEntry> find(Path storyPath, String pageHeader) {
        return lookup(read(storyPath), pageHeader);
    }

    /**
     * Stores the entry, replacing any entry with the same header.
     */
    public void write(Path storyPath, PageMemoryEntry entry) {
        Map<String, PageMemoryEntry> entries = read(storyPath);
        String existingKey = lookupKey(entries, entry.pageHeader()).orElse(entry.pageHeader());
        entries.put(existingKey, entry);
        artifactStore.writeTextAtomically(memoryFile(storyPath), render(entries));
    }

    public PageMemoryEntry recordPass(Path storyPath, String pageHeader, GenerationPhase phase,
                                      Path artifact, Path promptRef) {
        PageMemoryEntry entry = find(storyPath, pageHeader).orElse(PageMemoryEntry.empty(pageHeader));
        PhaseRecord record = new PhaseRecord(
                artifact.toAbsolutePath().toString(),
                promptRef == null ? null : promptRef.toAbsolutePath().toString());
        PageMemoryEntry updated = entry.withPass(phase, record);
        write(storyPath, updated);
        log.info("Memory updated: {} Phase {} PASSED", pageHeader, phase.number());
        return updated;
    }

    public PageMemoryEntry recordFailure(Path storyPath, String pageHeader, GenerationPhase phase,
                                         String reason, Path failedArtifact) {
        PageMemoryEntry entry = find(storyPath, pageHeader).orElse(PageMemoryEntry.empty(pageHeader));
        FailureRecord failure = new FailureRecord(
                phase.number(),
                singleLine(reason),
                failedArtifact == null ? null : failedArtifact.toAbsolutePath().toString());
        PageMemoryEntry updated = entry.withFailure(failure);
        if (updated == entry) {
            log.debug("Failure already recorded for {}: {}", pageHeader, failure.reason());
            return entry;
        }
        write(storyPath, updated);
        log.info("Memory updated: {} Phase {} FAILED ({})", pageHeader, phase.number(), failure.reason());
        return updated;
    }

    static Optional<PageMemoryEntry> lookup(Map<String, PageMemoryEntry> entries, String pageHeader) {
        return lookupKey(entries, pageHeader).map(entries::get);
    }

    private static Optional<String> lookupKey(Map<String, PageMemoryEntry> entries, String pageHeader) {
        if (entries.containsKey(pageHeader)) {
            return Optional.of(pageHeader);
        }
        return entries.keySet().stream()
                .filter(key -> key.equalsIgnoreCase(pageHeader))
                .findFirst();
    }

    String render(Map<String, PageMemoryEntry> entries) {
        StringBuilder out = new StringBuilder(TITLE).append("\n");
        for (PageMemoryEntry entry : entries.values()) {
            out.append("\n## ").append(entry.pageHeader()).append("\n");
            entry.passed(GenerationPhase.ART).ifPresent(r -> appendPhase(out, 1, r));
            entry.passed(GenerationPhase.LETTERING).ifPresent(r -> appendPhase(out, 2, r));
            for (FailureRecord failure : entry.failureLog()) {
                out.append("- Phase ").append(failure.phase()).append(" Attempt: FAILED. Reason: ").append(failure.reason());
                if (failure.failedArtifactPath() != null) {
                    out.append(" [FILE: `").append(failure.failedArtifactPath()).append("`]");
                }
                out.append("\n");
            }
        }
        return out.toString();
    }

    private static void appendPhase(StringBuilder out, int phase, PhaseRecord record) {
        out.append("- Phase ").append(phase).append(": `").append(record.artifactPath()).append("` [PASSED]");
        if (record.promptRef() != null) {
            out.append(" (prompt: `").append(record.promptRef()).append("`)");
        }
        out.append("\n");
    }

    private static String singleLine(String reason) {
        if (reason == null || reason.isBlank()) {
            return "No reason given";
        }
        return reason.replaceAll("\\s*\\R\\s*", " ").trim();
    }
}
