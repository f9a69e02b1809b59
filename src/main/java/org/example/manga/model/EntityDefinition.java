package org.example.manga.model;

/**
 * A character or environment defined in the global context of a story.
 *
 * @param name         display name as written in the document
 * @param description  appearance text, possibly gathered from nested bullets
 * @param kind         character or environment
 * @param sourceLine   the exact document line the definition starts on
 * @param headingStyle true when defined by a sub-heading rather than a list item
 */
public record EntityDefinition(
        String name,
        String description,
        EntityKind kind,
        String sourceLine,
        boolean headingStyle
) {

    public String slug() {
        return name.toLowerCase().replaceAll("[^a-z0-9]", "_");
    }
}
