package com.svarx.store;

import java.time.Instant;

public record InteractionFeedback(
        long id,
        Instant createdAt,
        String interactionType,
        String originalEmail,
        String suggestion,
        String feedbackLabel,
        double weight,
        ReplyContext context) {
}
