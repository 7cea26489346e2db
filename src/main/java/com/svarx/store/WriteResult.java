package com.svarx.store;

/**
 * Outcome of a producer write. Rejections are ordinary values, not failures.
 */
public enum WriteResult {
    STORED,
    REJECTED_TOO_SHORT,
    REJECTED_DUPLICATE,
    REJECTED_WEAK_SIGNAL,
    REFUSED_STORAGE_CRITICAL;

    public boolean isStored() {
        return this == STORED;
    }
}
