package com.svarx.learning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.store.EmailClassification;
import com.svarx.store.FeedbackSubmission;
import com.svarx.store.PersistenceStore;
import com.svarx.store.ReplyContext;
import com.svarx.store.WriteResult;

/**
 * Turns user reactions into store writes. A selected suggestion is the strongest signal and is
 * kept as a writing sample, a training pair and a feedback row; a thumbs up or down only leaves a
 * feedback row.
 */
public class InteractionLearningService {
    private static final Logger log = LoggerFactory.getLogger(InteractionLearningService.class);

    private final PersistenceStore store;
    private final EmailPatternClassifier classifier;

    public InteractionLearningService(PersistenceStore store) {
        this(store, new EmailPatternClassifier());
    }

    public InteractionLearningService(PersistenceStore store, EmailPatternClassifier classifier) {
        this.store = store;
        this.classifier = classifier;
    }

    public LearningOutcome learn(
            InteractionType type,
            String originalEmail,
            String suggestion,
            String feedbackLabel,
            ReplyContext context) {
        if (type == null) {
            throw new IllegalArgumentException("Interaction type is required");
        }
        if (isBlank(originalEmail) || isBlank(suggestion)) {
            throw new IllegalArgumentException("Both the original email and the suggestion are required");
        }
        ReplyContext effective = context == null ? ReplyContext.defaults() : context;
        FeedbackSubmission submission = new FeedbackSubmission(
                type.wireName(), originalEmail, suggestion, feedbackLabel, effective);

        WriteResult sample = null;
        WriteResult pair = null;
        if (type == InteractionType.SELECTED) {
            sample = store.addSample(suggestion);
            pair = store.addTrainingPair(originalEmail, suggestion, effective);
        }
        WriteResult feedback = store.addFeedback(submission, type.weight());
        LearningOutcome outcome = new LearningOutcome(type.wireName(), sample, pair, feedback);
        log.info("learning.interaction type={} sample={} trainingPair={} feedback={}",
                type.wireName(), sample, pair, feedback);
        return outcome;
    }

    /**
     * Stores a reply the user wrote or kept, and the pair when the email it answered is known.
     */
    public LearningOutcome remember(String text, String originalEmail, ReplyContext context) {
        if (isBlank(text)) {
            throw new IllegalArgumentException("Text is required");
        }
        WriteResult sample = store.addSample(text);
        WriteResult pair = isBlank(originalEmail)
                ? null
                : store.addTrainingPair(originalEmail, text, context == null ? ReplyContext.defaults() : context);
        log.info("learning.remember sample={} trainingPair={}", sample, pair);
        return new LearningOutcome("remember", sample, pair, null);
    }

    /**
     * Passive learning from an incoming email: only its classification is kept.
     */
    public WriteResult observeEmail(String emailText) {
        if (isBlank(emailText)) {
            return WriteResult.REJECTED_TOO_SHORT;
        }
        EmailClassification classification = classifier.classify(emailText);
        WriteResult result = store.recordEmailPattern(emailText, classification);
        log.debug("learning.email-observed type={} formality={} result={}",
                classification.emailType(), classification.formality(), result);
        return result;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
