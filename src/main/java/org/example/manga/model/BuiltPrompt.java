package org.example.manga.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt text plus the images sent with it, in the order the text refers to them.
 */
public record BuiltPrompt(String text, List<ReferenceImage> attachments) {

    public BuiltPrompt {
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public BuiltPrompt appendText(String block) {
        if (block == null || block.isBlank()) {
            return this;
        }
        return new BuiltPrompt(text + "\n\n" + block.strip(), attachments);
    }

    public BuiltPrompt attach(ReferenceImage image) {
        List<ReferenceImage> all = new ArrayList<>(attachments);
        all.add(image);
        return new BuiltPrompt(text, all);
    }
}
