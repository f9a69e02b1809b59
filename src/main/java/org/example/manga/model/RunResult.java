package org.example.manga.model;

import java.util.List;

public record RunResult(boolean success, String message, List<String> generatedFiles, String error) {

    public RunResult {
        generatedFiles = generatedFiles == null ? List.of() : List.copyOf(generatedFiles);
    }

    public static RunResult success(String message, List<String> generatedFiles) {
        return new RunResult(true, message, generatedFiles, null);
    }

    public static RunResult failure(String message, List<String> generatedFiles, String error) {
        return new RunResult(false, message, generatedFiles, error);
    }

    public static RunResult failure(String error) {
        return new RunResult(false, error, List.of(), error);
    }
}
