package com.svarx.store;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.svarx.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RetentionPoliciesTest {

    @TempDir
    Path tempDir;

    private final SqlLoader sql = new SqlLoader();
    private String jdbcUrl;

    @BeforeEach
    void setUp() {
        Path db = tempDir.resolve("retention.db");
        new PersistenceStore(new AppConfig.StorageConfig(), db, Clock.systemUTC());
        jdbcUrl = "jdbc:sqlite:" + db.toAbsolutePath();
    }

    @Test
    void shouldListTiersInExecutionOrder() {
        AppConfig.StorageConfig config = new AppConfig.StorageConfig();

        List<String> standard = RetentionPolicies.standard(config).stream().map(RetentionPolicy::name).collect(Collectors.toList());
        List<String> deep = RetentionPolicies.deep(config).stream().map(RetentionPolicy::name).collect(Collectors.toList());

        assertEquals(List.of("dedupe", "stale-negative-feedback", "sample-recency-quality",
                "training-pair-recency-rating", "feedback-weight", "email-pattern-recency"), standard);
        assertEquals(List.of("deep-samples", "deep-training-pairs", "deep-feedback-weight", "deep-email-patterns"), deep);
    }

    @Test
    void shouldKeepEarliestRowOfDuplicates() throws SQLException {
        try (Connection connection = DriverManager.getConnection(jdbcUrl)) {
            insertSample(connection, 1_000, "Same text twice");
            insertSample(connection, 2_000, "Same text twice");
            insertSample(connection, 3_000, "Different text");
            insertPair(connection, 1_000, "Original A", "Reply A");
            insertPair(connection, 2_000, "Original A", "Reply B");
            insertPair(connection, 3_000, "Original C", "Reply A");

            int removed = new RetentionPolicies.DuplicateRemoval().apply(connection, sql, 10_000);

            assertEquals(3, removed);
            assertEquals(2, RetentionPolicies.count(connection, sql, "count-samples"));
            assertEquals(1, RetentionPolicies.count(connection, sql, "count-training-pairs"));
        }
    }

    @Test
    void shouldPreferHeavyAndSelectedFeedbackOverCap() throws SQLException {
        try (Connection connection = DriverManager.getConnection(jdbcUrl)) {
            insertFeedback(connection, 1_000, "thumbs_up", "neutral", 0.4);
            insertFeedback(connection, 2_000, "thumbs_up", "selected", 0.4);
            insertFeedback(connection, 3_000, "thumbs_down", "neutral", -0.5);
            insertFeedback(connection, 4_000, "selected", "neutral", 1.0);
            insertFeedback(connection, 5_000, "thumbs_up", "neutral", 0.7);

            int removed = new RetentionPolicies.FeedbackWeight("feedback-weight", 3, 0.5, "retain-feedback")
                    .apply(connection, sql, 10_000);

            assertEquals(2, removed);
            assertEquals(3, RetentionPolicies.count(connection, sql, "count-feedback"));
        }
    }

    @Test
    void shouldLeaveTablesUnderCapUntouched() throws SQLException {
        try (Connection connection = DriverManager.getConnection(jdbcUrl)) {
            insertSample(connection, 1_000, "Only sample");

            assertEquals(0, new RetentionPolicies.SampleRecencyQuality(5, 4, 1).apply(connection, sql, 10_000));
            assertEquals(0, new RetentionPolicies.StaleNegativeFeedback(0.5, Duration.ofDays(30)).apply(connection, sql, 10_000));
        }
    }

    private static void insertSample(Connection connection, long createdAt, String text) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO samples (created_at, text) VALUES (?, ?)")) {
            statement.setLong(1, createdAt);
            statement.setString(2, text);
            statement.executeUpdate();
        }
    }

    private static void insertPair(Connection connection, long createdAt, String original, String reply) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO training_pairs (created_at, original_email, chosen_reply, tone, length) VALUES (?, ?, ?, 'professional', 'medium')")) {
            statement.setLong(1, createdAt);
            statement.setString(2, original);
            statement.setString(3, reply);
            statement.executeUpdate();
        }
    }

    private static void insertFeedback(Connection connection, long createdAt, String type, String label, double weight)
            throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO interaction_feedback (created_at, interaction_type, feedback, weight) VALUES (?, ?, ?, ?)")) {
            statement.setLong(1, createdAt);
            statement.setString(2, type);
            statement.setString(3, label);
            statement.setDouble(4, weight);
            statement.executeUpdate();
        }
    }
}
