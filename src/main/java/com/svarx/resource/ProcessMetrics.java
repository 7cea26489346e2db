package com.svarx.resource;

interface ProcessMetrics {
    /**
     * Resident memory in bytes, or -1 when unavailable.
     */
    long residentMemoryBytes();

    /**
     * Cumulative CPU time of this process in nanoseconds, or -1 when unavailable.
     */
    long processCpuTimeNanos();

    long pid();
}
