package com.svarx.inference;

public class GenerationException extends Exception {
    private final ErrorKind kind;

    public GenerationException(ErrorKind kind, String message) {
        this(kind, message, null);
    }

    public GenerationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * Only a context-window violation can succeed on retry, after the caller shortens the input.
     */
    public boolean isRecoverable() {
        return kind == ErrorKind.CONTEXT_WINDOW_EXCEEDED;
    }

    public enum ErrorKind {
        MODEL_UNAVAILABLE,
        MODEL_LOAD_FAILED,
        CONTEXT_WINDOW_EXCEEDED,
        INFERENCE_FAILED
    }
}
