package com.svarx.inference;

/**
 * A loaded model. Not reentrant: callers must serialize {@link #infer} and {@link #close}.
 */
public interface InferenceEngine extends AutoCloseable {
    String infer(String prompt, GenerationParams params) throws InferenceException;

    @Override
    void close();
}
