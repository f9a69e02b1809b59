package org.example.manga.model;

public record GeneratedImage(byte[] data, String mimeType) {

    public String extension() {
        if ("image/jpeg".equals(mimeType)) {
            return "jpg";
        }
        if ("image/webp".equals(mimeType)) {
            return "webp";
        }
        return "png";
    }
}
