package com.svarx.resource;

public record ResourceSample(long memoryBytes, double cpuPercent) {
    public static final ResourceSample UNKNOWN = new ResourceSample(-1L, -1.0);

    public double memoryMb() {
        return memoryBytes < 0 ? -1.0 : memoryBytes / (1024.0 * 1024.0);
    }

    public boolean known() {
        return memoryBytes >= 0 && cpuPercent >= 0;
    }

    public boolean exceeds(long maxMemoryMb, double maxCpuPercent) {
        return memoryMb() > maxMemoryMb || cpuPercent > maxCpuPercent;
    }
}
