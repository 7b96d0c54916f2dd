package com.phillippitts.readaloud.domain;

import java.util.Objects;

/**
 * Voice and language passed to the synthesis engine on every call.
 *
 * @param voice    engine-specific voice id
 * @param language language code such as {@code en-us} or {@code es}
 */
public record VoiceParams(String voice, String language) {

    public VoiceParams {
        Objects.requireNonNull(language, "language must not be null");
        if (language.isBlank()) {
            throw new IllegalArgumentException("language must not be blank");
        }
        if (voice == null || voice.isBlank()) {
            voice = language;
        }
    }

    /**
     * Creates parameters where the language code doubles as the voice id.
     *
     * @param language language code
     * @return voice parameters
     */
    public static VoiceParams forLanguage(String language) {
        return new VoiceParams(null, language);
    }
}
