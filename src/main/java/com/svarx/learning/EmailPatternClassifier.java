package com.svarx.learning;

import java.util.List;
import java.util.Locale;

import com.svarx.store.EmailClassification;
import com.svarx.store.TextSanitizer;

/**
 * Keyword classifier for incoming emails. The first matching type wins, in declaration order.
 */
public class EmailPatternClassifier {
    private static final List<String> SCHEDULING = List.of("meeting", "schedule", "calendar", "appointment");
    private static final List<String> GRATITUDE = List.of("thank", "appreciate", "grateful");
    private static final List<String> URGENT = List.of("urgent", "asap", "immediate", "priority");
    private static final List<String> INQUIRY = List.of("question", "help", "clarify", "explain");
    private static final List<String> UPDATE_REQUEST = List.of("update", "status", "progress", "report");
    private static final List<String> FORMAL = List.of("dear", "sincerely", "regards", "please", "kindly", "would you");
    private static final List<String> CASUAL = List.of("hey", "hi", "thanks", "sure", "ok", "cool");

    public EmailClassification classify(String emailText) {
        String text = TextSanitizer.sanitize(emailText);
        String lower = text.toLowerCase(Locale.ROOT);

        String type = "general";
        String urgency = "normal";
        if (containsAny(lower, SCHEDULING)) {
            type = "scheduling";
        } else if (containsAny(lower, GRATITUDE)) {
            type = "gratitude";
        } else if (containsAny(lower, URGENT)) {
            type = "urgent";
            urgency = "high";
        } else if (containsAny(lower, INQUIRY)) {
            type = "inquiry";
        } else if (containsAny(lower, UPDATE_REQUEST)) {
            type = "update_request";
        }

        long formal = FORMAL.stream().filter(lower::contains).count();
        long casual = CASUAL.stream().filter(lower::contains).count();
        String formality = "medium";
        if (formal > casual) {
            formality = "high";
        } else if (casual > formal) {
            formality = "low";
        }

        int wordCount = text.isEmpty() ? 0 : text.split("\\s+").length;
        return new EmailClassification(type, formality, urgency, wordCount);
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
