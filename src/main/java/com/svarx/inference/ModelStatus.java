package com.svarx.inference;

import com.svarx.resource.PowerMode;

public record ModelStatus(
        boolean modelLoaded,
        ModelState state,
        PowerMode powerMode,
        long loadGeneration,
        long memoryBytes,
        double cpuPercent,
        long idleSeconds,
        long willUnloadInSeconds) {
}
