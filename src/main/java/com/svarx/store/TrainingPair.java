package com.svarx.store;

import java.time.Instant;

public record TrainingPair(
        long id,
        Instant createdAt,
        String originalEmail,
        String chosenReply,
        String tone,
        String length,
        int rating) {
}
