package com.svarx.store;

import com.fasterxml.jackson.annotation.JsonProperty;

public record StorageStatus(
        long sizeBytes,
        long budgetBytes,
        double usagePercent,
        int samples,
        int trainingPairs,
        int interactions,
        int emailPatterns,
        HealthTier tier) {

    @JsonProperty
    public double sizeMb() {
        return sizeBytes / (1024.0 * 1024.0);
    }

    @JsonProperty
    public double budgetMb() {
        return budgetBytes / (1024.0 * 1024.0);
    }

    public String recommendation() {
        if (usagePercent > 95.0) {
            return "Critical: storage almost full, automatic cleanup will run before the next write.";
        }
        if (usagePercent > 80.0) {
            return "Warning: storage usage high, consider a manual cleanup.";
        }
        if (usagePercent > 60.0) {
            return "Storage usage normal.";
        }
        return "Plenty of storage available.";
    }
}
