package com.svarx.store;

public record EmailPatternCount(String emailType, String formality, String urgency, int count) {
}
