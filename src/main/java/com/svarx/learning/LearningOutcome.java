package com.svarx.learning;

import com.svarx.store.WriteResult;

/**
 * Per-table results of one learning call; a null result means that write was not attempted.
 */
public record LearningOutcome(
        String source,
        WriteResult sample,
        WriteResult trainingPair,
        WriteResult feedback) {

    public boolean anyStored() {
        return stored(sample) || stored(trainingPair) || stored(feedback);
    }

    private static boolean stored(WriteResult result) {
        return result != null && result.isStored();
    }
}
