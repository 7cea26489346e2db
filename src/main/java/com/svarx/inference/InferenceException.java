package com.svarx.inference;

public class InferenceException extends Exception {
    private final boolean contextWindowExceeded;

    public InferenceException(String message) {
        this(message, false, null);
    }

    public InferenceException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public InferenceException(String message, boolean contextWindowExceeded, Throwable cause) {
        super(message, cause);
        this.contextWindowExceeded = contextWindowExceeded;
    }

    public static InferenceException contextWindowExceeded(String message) {
        return new InferenceException(message, true, null);
    }

    public boolean contextWindowExceeded() {
        return contextWindowExceeded;
    }
}
