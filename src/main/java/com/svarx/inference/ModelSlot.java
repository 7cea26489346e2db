package com.svarx.inference;

/**
 * The single process-wide model slot. Mutators are only called with the manager's slot lock held;
 * the volatile fields let the idle monitor poll state and last-use time without that lock.
 * Invariant: {@code handle != null} iff {@code state == LOADED}.
 */
final class ModelSlot {
    private InferenceEngine handle;
    private volatile ModelState state = ModelState.UNLOADED;
    private volatile long lastUsedAtMillis;
    private volatile long loadGeneration;

    InferenceEngine handle() {
        return handle;
    }

    ModelState state() {
        return state;
    }

    long lastUsedAtMillis() {
        return lastUsedAtMillis;
    }

    long loadGeneration() {
        return loadGeneration;
    }

    void touch(long nowMillis) {
        lastUsedAtMillis = nowMillis;
    }

    void beginLoading() {
        requireState(ModelState.UNLOADED);
        state = ModelState.LOADING;
    }

    void loadFailed() {
        requireState(ModelState.LOADING);
        state = ModelState.UNLOADED;
    }

    long loaded(InferenceEngine engine, long nowMillis) {
        requireState(ModelState.LOADING);
        handle = engine;
        loadGeneration++;
        lastUsedAtMillis = nowMillis;
        state = ModelState.LOADED;
        return loadGeneration;
    }

    InferenceEngine beginEvicting() {
        requireState(ModelState.LOADED);
        state = ModelState.EVICTING;
        return handle;
    }

    void evicted() {
        requireState(ModelState.EVICTING);
        handle = null;
        loadGeneration++;
        state = ModelState.UNLOADED;
    }

    private void requireState(ModelState expected) {
        if (state != expected) {
            throw new IllegalStateException("Model slot is " + state + ", expected " + expected);
        }
    }
}
