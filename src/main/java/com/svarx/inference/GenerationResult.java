package com.svarx.inference;

public record GenerationResult(String text, long elapsedMs, boolean retried) {
}
