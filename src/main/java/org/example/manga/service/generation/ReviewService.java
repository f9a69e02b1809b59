package org.example.manga.service.generation;

import org.example.manga.model.ReferenceImage;
import org.example.manga.model.ReviewResult;

import java.util.List;

/**
 * Vision model that scores a generated page against its references and script.
 */
public interface ReviewService {

    /**
     * @throws ReviewParseException if the reviewer's answer cannot be read as a verdict
     */
    ReviewResult review(byte[] candidateImage, List<ReferenceImage> referenceImages, String storyContext, ReviewFlags flags);

    String getProviderName();
}
