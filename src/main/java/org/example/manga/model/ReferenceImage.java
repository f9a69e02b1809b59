package org.example.manga.model;

import java.nio.file.Path;

/**
 * An image attached to a generation or review request.
 *
 * @param sourceLabel human readable label used in prompts
 * @param data        raw image bytes
 * @param mimeType    image mime type
 * @param tag         the name the prompt uses to refer to this image
 * @param path        file the image was loaded from, null for synthetic entries
 */
public record ReferenceImage(String sourceLabel, byte[] data, String mimeType, String tag, Path path) {

    private static final String TRAILING_QUALIFIERS =
            "(?i)(\\s+(portrait|sheet|reference|ref|far|view|env|environment|color|colour))+$";

    public static ReferenceImage fromFile(Path path, byte[] data) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String baseName = dot > 0 ? fileName.substring(0, dot) : fileName;
        String label = baseName.replace('_', ' ').trim();
        String tag = label.replaceAll(TRAILING_QUALIFIERS, "").trim();
        return new ReferenceImage(label, data, mimeTypeFor(fileName), tag.isEmpty() ? label : tag, path);
    }

    public ReferenceImage withLabel(String label) {
        return new ReferenceImage(label, data, mimeType, tag, path);
    }

    public static String mimeTypeFor(String fileName) {
        String lower = fileName.toLowerCase();
        if (lower.endsWith(".jpg") || lower.endsWith(".jpeg")) {
            return "image/jpeg";
        }
        if (lower.endsWith(".webp")) {
            return "image/webp";
        }
        return "image/png";
    }
}
