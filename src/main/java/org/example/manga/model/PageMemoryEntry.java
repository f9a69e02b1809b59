package org.example.manga.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable state of one page: the passed record of each phase and the append-only failure log.
 */
public record PageMemoryEntry(
        String pageHeader,
        PhaseRecord phase1,
        PhaseRecord phase2,
        List<FailureRecord> failureLog
) {

    public PageMemoryEntry {
        failureLog = failureLog == null ? List.of() : List.copyOf(failureLog);
    }

    public static PageMemoryEntry empty(String pageHeader) {
        return new PageMemoryEntry(pageHeader, null, null, List.of());
    }

    public Optional<PhaseRecord> passed(GenerationPhase phase) {
        return Optional.ofNullable(phase == GenerationPhase.ART ? phase1 : phase2);
    }

    public PageMemoryEntry withPass(GenerationPhase phase, PhaseRecord record) {
        return phase == GenerationPhase.ART
                ? new PageMemoryEntry(pageHeader, record, phase2, failureLog)
                : new PageMemoryEntry(pageHeader, phase1, record, failureLog);
    }

    /**
     * Returns this entry with the failure appended, or this entry unchanged when an identical
     * failure is already logged.
     */
    public PageMemoryEntry withFailure(FailureRecord failure) {
        if (failureLog.contains(failure)) {
            return this;
        }
        List<FailureRecord> log = new ArrayList<>(failureLog);
        log.add(failure);
        return new PageMemoryEntry(pageHeader, phase1, phase2, log);
    }
}
