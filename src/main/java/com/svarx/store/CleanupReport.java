package com.svarx.store;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of one cleanup pass. {@code removedByPolicy} is keyed by policy name in the order the
 * policies ran; {@code compactionError} is empty when compaction succeeded.
 */
public record CleanupReport(
        boolean deep,
        long sizeBeforeBytes,
        long sizeAfterBytes,
        Map<String, Integer> removedByPolicy,
        String compactionError,
        boolean critical) {

    public CleanupReport {
        removedByPolicy = Map.copyOf(removedByPolicy);
        compactionError = compactionError == null ? "" : compactionError;
    }

    @JsonProperty
    public int totalRemoved() {
        return removedByPolicy.values().stream().mapToInt(Integer::intValue).sum();
    }

    public boolean compactionFailed() {
        return !compactionError.isEmpty();
    }

    @JsonProperty
    public long bytesReclaimed() {
        return Math.max(0L, sizeBeforeBytes - sizeAfterBytes);
    }
}
