package com.svarx.learning;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.svarx.store.EmailPatternCount;
import com.svarx.store.InteractionFeedback;
import com.svarx.store.PersistenceStore;
import com.svarx.store.ReplyContext;
import com.svarx.store.Sample;
import com.svarx.store.TextSanitizer;
import com.svarx.store.TrainingPair;

/**
 * Heuristic read-side analysis of what the store has learned about the user's writing.
 */
public class StyleAnalyzer {
    public static final int DEFAULT_SUMMARY_LENGTH = 300;

    private static final Pattern WORD = Pattern.compile("\\b\\w+\\b", Pattern.UNICODE_CHARACTER_CLASS);
    private static final List<String> FORMAL = List.of("regards", "sincerely", "please", "kindly", "thank you", "best");
    private static final List<String> CASUAL = List.of("thanks", "hey", "sure", "ok", "cool", "awesome");
    private static final int PAIR_WINDOW = 50;
    private static final int SAMPLE_WINDOW = 100;
    private static final int FEEDBACK_WINDOW = 100;
    private static final int TOP_NGRAMS = 10;
    private static final int PREVIEW_CHARS = 50;
    private static final Duration INSIGHT_WINDOW = Duration.ofDays(30);

    private final PersistenceStore store;
    private final Clock clock;

    public StyleAnalyzer(PersistenceStore store) {
        this(store, Clock.systemUTC());
    }

    public StyleAnalyzer(PersistenceStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public UserPatterns analyzePatterns() {
        List<TrainingPair> pairs = store.recentTrainingPairs(PAIR_WINDOW);
        List<Sample> samples = store.listSamples(SAMPLE_WINDOW);
        if (pairs.isEmpty() && samples.isEmpty()) {
            return UserPatterns.EMPTY;
        }

        String preferredTone = ReplyContext.DEFAULT_TONE;
        int averageWords = UserPatterns.DEFAULT_REPLY_WORDS;
        List<String> starters = List.of();
        if (!pairs.isEmpty()) {
            Map<String, Integer> tones = new LinkedHashMap<>();
            Map<String, Integer> starterCounts = new LinkedHashMap<>();
            int totalWords = 0;
            for (TrainingPair pair : pairs) {
                tones.merge(pair.tone() == null ? ReplyContext.DEFAULT_TONE : pair.tone(), 1, Integer::sum);
                String[] words = pair.chosenReply().trim().split("\\s+");
                totalWords += words.length;
                if (words.length >= 3) {
                    starterCounts.merge(String.join(" ", words[0], words[1], words[2]), 1, Integer::sum);
                }
            }
            preferredTone = mostCommon(tones, 1).get(0);
            averageWords = totalWords / pairs.size();
            starters = mostCommon(starterCounts, 3);
        }

        double formality = UserPatterns.DEFAULT_FORMALITY;
        if (!samples.isEmpty()) {
            int formal = 0;
            int casual = 0;
            for (Sample sample : samples) {
                String lower = sample.text().toLowerCase(Locale.ROOT);
                formal += (int) FORMAL.stream().filter(lower::contains).count();
                casual += (int) CASUAL.stream().filter(lower::contains).count();
            }
            formality = formal / (double) Math.max(1, formal + casual);
        }
        return new UserPatterns(false, preferredTone, averageWords, starters, formality);
    }

    /**
     * Most frequent bigrams first, then unigrams, across every stored sample.
     */
    public List<String> topPhrases(int topK) {
        List<String> tokens = new ArrayList<>();
        for (Sample sample : store.listSamples(Integer.MAX_VALUE)) {
            Matcher matcher = WORD.matcher(TextSanitizer.sanitize(sample.text()).toLowerCase(Locale.ROOT));
            while (matcher.find()) {
                tokens.add(matcher.group());
            }
        }
        if (tokens.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> unigrams = new LinkedHashMap<>();
        Map<String, Integer> bigrams = new LinkedHashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            unigrams.merge(tokens.get(i), 1, Integer::sum);
            if (i + 1 < tokens.size()) {
                bigrams.merge(tokens.get(i) + " " + tokens.get(i + 1), 1, Integer::sum);
            }
        }
        List<String> phrases = new ArrayList<>();
        phrases.addAll(mostCommon(bigrams, TOP_NGRAMS));
        phrases.addAll(mostCommon(unigrams, TOP_NGRAMS));
        return phrases.size() <= topK ? phrases : phrases.subList(0, topK);
    }

    public FeedbackPatterns feedbackPatterns() {
        List<FeedbackPattern> positive = new ArrayList<>();
        List<FeedbackPattern> negative = new ArrayList<>();
        Map<String, Integer> preferredTones = new LinkedHashMap<>();
        Map<String, Integer> avoidedTones = new LinkedHashMap<>();
        for (InteractionFeedback feedback : store.recentFeedback(FEEDBACK_WINDOW)) {
            String tone = feedback.context().tone();
            String preview = preview(feedback.suggestion());
            if (feedback.weight() > 0) {
                positive.add(new FeedbackPattern(preview, tone, feedback.weight()));
                preferredTones.merge(tone, 1, Integer::sum);
            } else if (feedback.weight() < 0) {
                negative.add(new FeedbackPattern(preview, tone, Math.abs(feedback.weight())));
                avoidedTones.merge(tone, 1, Integer::sum);
            }
        }
        return new FeedbackPatterns(positive, negative, preferredTones, avoidedTones);
    }

    public EmailInsights emailInsights() {
        Instant since = clock.instant().minus(INSIGHT_WINDOW);
        Map<String, Integer> types = new LinkedHashMap<>();
        Map<String, Integer> formality = new LinkedHashMap<>();
        Map<String, Integer> urgency = new LinkedHashMap<>();
        int total = 0;
        for (EmailPatternCount count : store.emailPatternCounts(since)) {
            types.merge(count.emailType(), count.count(), Integer::sum);
            formality.merge(count.formality(), count.count(), Integer::sum);
            urgency.merge(count.urgency(), count.count(), Integer::sum);
            total += count.count();
        }
        String typicalFormality = formality.isEmpty() ? "medium" : mostCommon(formality, 1).get(0);
        return new EmailInsights(total, types, typicalFormality, urgency);
    }

    public String styleSummary(int maxLength) {
        UserPatterns patterns = analyzePatterns();
        if (patterns.empty()) {
            return "";
        }
        StringBuilder summary = new StringBuilder()
                .append("User prefers ").append(patterns.preferredTone())
                .append(" tone, ").append(patterns.formalityStyle())
                .append(" style (~").append(patterns.averageReplyWords()).append(" words).");
        List<String> phrases = topPhrases(5);
        if (!phrases.isEmpty()) {
            summary.append(" Common phrases: ").append(String.join(", ", phrases.subList(0, Math.min(3, phrases.size())))).append('.');
        }
        if (!patterns.commonStarters().isEmpty()) {
            summary.append(" Often starts with: '").append(patterns.commonStarters().get(0)).append("'.");
        }
        return summary.length() <= maxLength ? summary.toString() : summary.substring(0, maxLength);
    }

    private static String preview(String suggestion) {
        String value = suggestion == null ? "" : suggestion;
        return value.length() <= PREVIEW_CHARS ? value + "..." : value.substring(0, PREVIEW_CHARS) + "...";
    }

    private static List<String> mostCommon(Map<String, Integer> counts, int limit) {
        // stable sort keeps first-seen order among ties
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList();
    }

    public record UserPatterns(
            boolean empty,
            String preferredTone,
            int averageReplyWords,
            List<String> commonStarters,
            double formalityLevel) {
        static final int DEFAULT_REPLY_WORDS = 20;
        static final double DEFAULT_FORMALITY = 0.5;
        static final UserPatterns EMPTY = new UserPatterns(
                true, ReplyContext.DEFAULT_TONE, DEFAULT_REPLY_WORDS, List.of(), DEFAULT_FORMALITY);

        public UserPatterns {
            commonStarters = List.copyOf(commonStarters);
        }

        public String formalityStyle() {
            if (formalityLevel > 0.6) {
                return "formal";
            }
            if (formalityLevel < 0.3) {
                return "casual";
            }
            return "balanced";
        }
    }

    public record FeedbackPattern(String suggestionPreview, String tone, double weight) {
    }

    public record FeedbackPatterns(
            List<FeedbackPattern> positive,
            List<FeedbackPattern> negative,
            Map<String, Integer> preferredTones,
            Map<String, Integer> avoidedTones) {
    }

    public record EmailInsights(
            int analyzed,
            Map<String, Integer> commonEmailTypes,
            String typicalFormality,
            Map<String, Integer> urgencyPatterns) {
    }
}
