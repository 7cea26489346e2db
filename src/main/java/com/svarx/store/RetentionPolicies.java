package com.svarx.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

import com.svarx.runtime.AppConfig;

/**
 * The standard and deep cleanup tiers, in the order they run.
 */
public final class RetentionPolicies {
    private static final double RECENT_SAMPLE_SHARE = 0.8;
    private static final double RECENT_PAIR_SHARE = 0.7;

    private RetentionPolicies() {
    }

    public static List<RetentionPolicy> standard(AppConfig.StorageConfig config) {
        int maxSamples = config.getMaxSamples();
        int recentSamples = (int) (maxSamples * RECENT_SAMPLE_SHARE);
        int maxPairs = config.getMaxTrainingPairs();
        int recentPairs = (int) (maxPairs * RECENT_PAIR_SHARE);
        return List.of(
                new DuplicateRemoval(),
                new StaleNegativeFeedback(config.getStaleFeedbackMaxWeight(), Duration.ofDays(config.getStaleFeedbackDays())),
                new SampleRecencyQuality(maxSamples, recentSamples, maxSamples - recentSamples),
                new TrainingPairRecencyRating(maxPairs, recentPairs, maxPairs - recentPairs, config.getQualityRatingThreshold()),
                new FeedbackWeight("feedback-weight", config.getMaxInteractions(), config.getValuableWeightThreshold(), "retain-feedback"),
                new EmailPatternRecency(config.getMaxEmailPatterns()));
    }

    public static List<RetentionPolicy> deep(AppConfig.StorageConfig config) {
        return List.of(
                new DeepSampleRetention(config.getMaxSamples() / 2, config.getDeepMinSampleChars()),
                new DeepTrainingPairRetention(config.getMaxTrainingPairs() / 2, Duration.ofDays(config.getDeepRecentDays())),
                new FeedbackWeight("deep-feedback-weight", config.getMaxInteractions() / 2, config.getDeepWeightThreshold(), "deep-retain-feedback"),
                new EmailPatternPurge());
    }

    static int count(Connection connection, SqlLoader sql, String name) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql.load(name));
                ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        }
    }

    private static int update(Connection connection, String statementSql, Object... params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(statementSql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            return statement.executeUpdate();
        }
    }

    /**
     * Keeps the earliest row per sample text, per training-pair original and per training-pair reply.
     */
    public record DuplicateRemoval() implements RetentionPolicy {
        @Override
        public String name() {
            return "dedupe";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            return update(connection, sql.load("dedupe-samples"))
                    + update(connection, sql.load("dedupe-training-pairs-by-original"))
                    + update(connection, sql.load("dedupe-training-pairs-by-reply"));
        }
    }

    public record StaleNegativeFeedback(double maxWeight, Duration maxAge) implements RetentionPolicy {
        @Override
        public String name() {
            return "stale-negative-feedback";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            return update(connection, sql.load("delete-stale-feedback"), maxWeight, nowMillis - maxAge.toMillis());
        }
    }

    /**
     * Over the cap, keeps the most recent rows plus the longest of the older remainder.
     */
    public record SampleRecencyQuality(int cap, int recentLimit, int qualityLimit) implements RetentionPolicy {
        @Override
        public String name() {
            return "sample-recency-quality";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            if (count(connection, sql, "count-samples") <= cap) {
                return 0;
            }
            return update(connection, sql.load("retain-samples"), recentLimit, recentLimit, qualityLimit);
        }
    }

    /**
     * Over the cap, keeps the most recent rows plus the best rated ones at or above the threshold.
     */
    public record TrainingPairRecencyRating(int cap, int recentLimit, int ratedLimit, int ratingThreshold)
            implements RetentionPolicy {
        @Override
        public String name() {
            return "training-pair-recency-rating";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            if (count(connection, sql, "count-training-pairs") <= cap) {
                return 0;
            }
            return update(connection, sql.load("retain-training-pairs"), recentLimit, ratingThreshold, ratedLimit);
        }
    }

    /**
     * Over the cap, keeps only heavy or selected interactions, heaviest and most recent first.
     */
    public record FeedbackWeight(String name, int cap, double weightThreshold, String statement)
            implements RetentionPolicy {
        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            if (count(connection, sql, "count-feedback") <= cap) {
                return 0;
            }
            return update(connection, sql.load(statement), weightThreshold, cap);
        }
    }

    public record EmailPatternRecency(int cap) implements RetentionPolicy {
        @Override
        public String name() {
            return "email-pattern-recency";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            if (count(connection, sql, "count-email-patterns") <= cap) {
                return 0;
            }
            return update(connection, sql.load("retain-email-patterns"), cap);
        }
    }

    public record DeepSampleRetention(int cap, int minChars) implements RetentionPolicy {
        @Override
        public String name() {
            return "deep-samples";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            return update(connection, sql.load("deep-retain-samples"), minChars, cap);
        }
    }

    /**
     * Keeps rated pairs and pairs newer than {@code recentWindow}, up to the cap.
     */
    public record DeepTrainingPairRetention(int cap, Duration recentWindow) implements RetentionPolicy {
        @Override
        public String name() {
            return "deep-training-pairs";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            return update(connection, sql.load("deep-retain-training-pairs"), nowMillis - recentWindow.toMillis(), cap);
        }
    }

    public record EmailPatternPurge() implements RetentionPolicy {
        @Override
        public String name() {
            return "deep-email-patterns";
        }

        @Override
        public int apply(Connection connection, SqlLoader sql, long nowMillis) throws SQLException {
            return update(connection, sql.load("clear-email-patterns"));
        }
    }
}
