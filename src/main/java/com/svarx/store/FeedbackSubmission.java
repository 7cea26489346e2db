package com.svarx.store;

public record FeedbackSubmission(
        String interactionType,
        String originalEmail,
        String suggestion,
        String feedbackLabel,
        ReplyContext context) {

    public FeedbackSubmission {
        interactionType = interactionType == null ? "" : interactionType;
        originalEmail = originalEmail == null ? "" : originalEmail;
        suggestion = suggestion == null ? "" : suggestion;
        feedbackLabel = feedbackLabel == null || feedbackLabel.isBlank() ? "neutral" : feedbackLabel;
        context = context == null ? ReplyContext.defaults() : context;
    }
}
