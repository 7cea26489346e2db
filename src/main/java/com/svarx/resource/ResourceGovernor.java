package com.svarx.resource;

/**
 * Process-level power and footprint control. Every method is best-effort: failures are
 * logged by the implementation and never thrown to the caller.
 */
public interface ResourceGovernor {
    void enterLowPower();

    void enterNormalPower();

    PowerMode powerMode();

    /**
     * Memory is the resident set size; CPU is averaged over a short window, so this call blocks
     * for roughly the window length.
     */
    ResourceSample sample();

    void reclaimMemory();
}
