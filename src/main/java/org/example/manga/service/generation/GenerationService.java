package org.example.manga.service.generation;

import org.example.manga.model.GeneratedImage;
import org.example.manga.model.GenerationConstraints;
import org.example.manga.model.ReferenceImage;

import java.util.List;
import java.util.Optional;

/**
 * Image generation model.
 */
public interface GenerationService {

    /**
     * Generates one image from a prompt and its reference attachments.
     *
     * @param prompt      the full prompt text
     * @param attachments images sent along with the prompt, in the order the prompt refers to them
     * @param constraints output modality, aspect ratio and safety settings
     * @return the first returned image, or empty if the model answered without one
     * @throws AuthenticationException  if credentials are rejected
     * @throws QuotaExceededException   if the account is out of quota
     * @throws TransientGenerationException for retryable failures
     */
    Optional<GeneratedImage> generate(String prompt, List<ReferenceImage> attachments, GenerationConstraints constraints);

    /**
     * Check if this service is configured and usable.
     */
    boolean isAvailable();

    String getProviderName();
}
