package com.phillippitts.readaloud.presentation.dto;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/sessions}. Exactly one of {@code text} and {@code path} must be set.
 *
 * @param sourceId caller-chosen label for the source, used in logs and progress
 * @param text     inline text to read
 * @param path     path of a UTF-8 text file on the server host
 * @param voice    optional engine voice id, overrides the configured one
 * @param language optional language code, overrides the configured one
 */
public record StartSessionRequest(
        @NotBlank(message = "sourceId must not be blank")
        @Size(max = 200, message = "sourceId must be at most 200 characters")
        String sourceId,
        String text,
        String path,
        String voice,
        String language
) {

    @AssertTrue(message = "exactly one of text or path must be provided")
    public boolean isSingleSource() {
        return hasText() ^ hasPath();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }
}
