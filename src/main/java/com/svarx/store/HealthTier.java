package com.svarx.store;

public enum HealthTier {
    HEALTHY,
    WARNING,
    CRITICAL;

    public static HealthTier fromUsagePercent(double usagePercent) {
        if (usagePercent > 95.0) {
            return CRITICAL;
        }
        if (usagePercent > 80.0) {
            return WARNING;
        }
        return HEALTHY;
    }
}
