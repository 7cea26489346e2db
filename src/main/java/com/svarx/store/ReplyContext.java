package com.svarx.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The only context fields kept alongside training pairs and feedback.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplyContext(String tone, String length) {
    public static final String DEFAULT_TONE = "professional";
    public static final String DEFAULT_LENGTH = "medium";

    public ReplyContext {
        tone = tone == null || tone.isBlank() ? DEFAULT_TONE : tone;
        length = length == null || length.isBlank() ? DEFAULT_LENGTH : length;
    }

    public static ReplyContext defaults() {
        return new ReplyContext(DEFAULT_TONE, DEFAULT_LENGTH);
    }
}
