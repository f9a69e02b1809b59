package org.example.manga.model;

/**
 * Lifecycle of a (page, phase) pair inside a run.
 */
public enum PageState {
    PENDING,
    GENERATING,
    REVIEWING,
    PASSED,
    FAILED,
    TERMINAL_FAILURE
}
