package com.svarx.store;

public record EmailClassification(String emailType, String formality, String urgency, int wordCount) {
}
