package com.svarx.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.svarx.runtime.AppConfig;

/**
 * SQLite-backed personalization store with a hard on-disk budget. Every public operation runs
 * under one store-wide lock on its own connection. Writes that would grow the file first bring it
 * back under budget through {@link #cleanup()} and, if that is not enough, {@link #deepCleanup()}.
 */
public class PersistenceStore {
    private static final Logger log = LoggerFactory.getLogger(PersistenceStore.class);
    private static final int EMAIL_SNIPPET_CHARS = 200;
    private static final int MIN_EMAIL_CHARS = 20;

    private final AppConfig.StorageConfig config;
    private final Path dbPath;
    private final Clock clock;
    private final String jdbcUrl;
    private final SqlLoader sql = new SqlLoader();
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final ReentrantLock lock = new ReentrantLock();
    private final List<RetentionPolicy> standardPolicies;
    private final List<RetentionPolicy> deepPolicies;

    public PersistenceStore(AppConfig.StorageConfig config) {
        this(config, Path.of(config.getDbPath()), Clock.systemUTC());
    }

    public PersistenceStore(AppConfig.StorageConfig config, Path dbPath, Clock clock) {
        this.config = config;
        this.dbPath = dbPath.toAbsolutePath();
        this.clock = clock;
        this.jdbcUrl = "jdbc:sqlite:" + this.dbPath;
        this.standardPolicies = RetentionPolicies.standard(config);
        this.deepPolicies = RetentionPolicies.deep(config);
        initializeSchema();
    }

    public Path dbPath() {
        return dbPath;
    }

    public WriteResult addSample(String text) {
        String sanitized = TextSanitizer.sanitize(text);
        if (sanitized.length() < config.getMinSampleChars()) {
            return WriteResult.REJECTED_TOO_SHORT;
        }
        lock.lock();
        try {
            if (!ensureCapacity()) {
                return WriteResult.REFUSED_STORAGE_CRITICAL;
            }
            try (Connection connection = connect()) {
                if (exists(connection, "exists-sample", sanitized)) {
                    log.debug("store.sample.rejected reason=duplicate chars={}", sanitized.length());
                    return WriteResult.REJECTED_DUPLICATE;
                }
                try (PreparedStatement statement = connection.prepareStatement(sql.load("insert-sample"))) {
                    statement.setLong(1, clock.millis());
                    statement.setString(2, sanitized);
                    statement.executeUpdate();
                }
            }
            log.debug("store.sample.stored chars={}", sanitized.length());
            return WriteResult.STORED;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to store sample", e);
        } finally {
            lock.unlock();
        }
    }

    public WriteResult addTrainingPair(String originalEmail, String chosenReply, ReplyContext context) {
        String original = TextSanitizer.sanitize(originalEmail);
        String reply = TextSanitizer.sanitize(chosenReply);
        if (original.length() < config.getMinOriginalChars() || reply.length() < config.getMinReplyChars()) {
            return WriteResult.REJECTED_TOO_SHORT;
        }
        ReplyContext effective = context == null ? ReplyContext.defaults() : context;
        lock.lock();
        try {
            if (!ensureCapacity()) {
                return WriteResult.REFUSED_STORAGE_CRITICAL;
            }
            try (Connection connection = connect()) {
                if (exists(connection, "exists-training-pair", original, reply)) {
                    log.debug("store.training-pair.rejected reason=duplicate");
                    return WriteResult.REJECTED_DUPLICATE;
                }
                try (PreparedStatement statement = connection.prepareStatement(sql.load("insert-training-pair"))) {
                    statement.setLong(1, clock.millis());
                    statement.setString(2, original);
                    statement.setString(3, reply);
                    statement.setString(4, effective.tone());
                    statement.setString(5, effective.length());
                    statement.executeUpdate();
                }
            }
            log.debug("store.training-pair.stored tone={} length={}", effective.tone(), effective.length());
            return WriteResult.STORED;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to store training pair", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores one interaction signal. Negative weights weaker than the configured threshold are
     * dropped; text fields are capped before storage.
     *
     * @throws IllegalArgumentException if {@code weight} is outside [-1, 1]
     */
    public WriteResult addFeedback(FeedbackSubmission submission, double weight) {
        if (Double.isNaN(weight) || weight < -1.0 || weight > 1.0) {
            throw new IllegalArgumentException("Feedback weight must be within [-1, 1]: " + weight);
        }
        if (weight < 0 && Math.abs(weight) < config.getWeakSignalThreshold()) {
            log.debug("store.feedback.rejected reason=weak-signal weight={}", weight);
            return WriteResult.REJECTED_WEAK_SIGNAL;
        }
        int cap = config.getFeedbackTextCap();
        lock.lock();
        try {
            if (!ensureCapacity()) {
                return WriteResult.REFUSED_STORAGE_CRITICAL;
            }
            try (Connection connection = connect();
                    PreparedStatement statement = connection.prepareStatement(sql.load("insert-feedback"))) {
                statement.setLong(1, clock.millis());
                statement.setString(2, submission.interactionType());
                statement.setString(3, TextSanitizer.truncate(submission.originalEmail(), cap));
                statement.setString(4, TextSanitizer.truncate(submission.suggestion(), cap));
                statement.setString(5, submission.feedbackLabel());
                statement.setDouble(6, weight);
                statement.setString(7, mapper.writeValueAsString(submission.context()));
                statement.executeUpdate();
            }
            log.debug("store.feedback.stored type={} weight={}", submission.interactionType(), weight);
            return WriteResult.STORED;
        } catch (SQLException | JsonProcessingException e) {
            throw new PersistenceException("Unable to store feedback", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a classified incoming email and trims the table to the most recent
     * {@code maxEmailPatterns} rows.
     */
    public WriteResult recordEmailPattern(String emailText, EmailClassification classification) {
        String sanitized = TextSanitizer.sanitize(emailText);
        if (sanitized.length() < MIN_EMAIL_CHARS) {
            return WriteResult.REJECTED_TOO_SHORT;
        }
        lock.lock();
        try {
            if (!ensureCapacity()) {
                return WriteResult.REFUSED_STORAGE_CRITICAL;
            }
            try (Connection connection = connect()) {
                try (PreparedStatement statement = connection.prepareStatement(sql.load("insert-email-pattern"))) {
                    statement.setLong(1, clock.millis());
                    statement.setString(2, TextSanitizer.truncate(sanitized, EMAIL_SNIPPET_CHARS));
                    statement.setString(3, classification.emailType());
                    statement.setString(4, classification.formality());
                    statement.setString(5, classification.urgency());
                    statement.setInt(6, classification.wordCount());
                    statement.executeUpdate();
                }
                new RetentionPolicies.EmailPatternRecency(config.getMaxEmailPatterns()).apply(connection, sql, clock.millis());
            }
            return WriteResult.STORED;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to record email pattern", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sets the user rating (1-5) of a training pair. Returns false when no pair has that id.
     */
    public boolean rateTrainingPair(long id, int rating) {
        if (rating < 1 || rating > 5) {
            throw new IllegalArgumentException("Rating must be between 1 and 5: " + rating);
        }
        lock.lock();
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql.load("update-pair-rating"))) {
            statement.setInt(1, rating);
            statement.setLong(2, id);
            return statement.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to rate training pair " + id, e);
        } finally {
            lock.unlock();
        }
    }

    public List<Sample> listSamples(int limit) {
        lock.lock();
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql.load("select-recent-samples"))) {
            statement.setInt(1, Math.max(0, limit));
            List<Sample> samples = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    samples.add(new Sample(rs.getLong("id"), Instant.ofEpochMilli(rs.getLong("created_at")), rs.getString("text")));
                }
            }
            return samples;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to list samples", e);
        } finally {
            lock.unlock();
        }
    }

    public List<TrainingPair> recentTrainingPairs(int limit) {
        lock.lock();
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql.load("select-recent-training-pairs"))) {
            statement.setInt(1, Math.max(0, limit));
            List<TrainingPair> pairs = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    pairs.add(new TrainingPair(
                            rs.getLong("id"),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            rs.getString("original_email"),
                            rs.getString("chosen_reply"),
                            rs.getString("tone"),
                            rs.getString("length"),
                            rs.getInt("user_rating")));
                }
            }
            return pairs;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to list training pairs", e);
        } finally {
            lock.unlock();
        }
    }

    public List<InteractionFeedback> recentFeedback(int limit) {
        lock.lock();
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql.load("select-recent-feedback"))) {
            statement.setInt(1, Math.max(0, limit));
            List<InteractionFeedback> feedback = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    feedback.add(new InteractionFeedback(
                            rs.getLong("id"),
                            Instant.ofEpochMilli(rs.getLong("created_at")),
                            rs.getString("interaction_type"),
                            rs.getString("original_email"),
                            rs.getString("suggestion"),
                            rs.getString("feedback"),
                            rs.getDouble("weight"),
                            readContext(rs.getString("context"))));
                }
            }
            return feedback;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to list feedback", e);
        } finally {
            lock.unlock();
        }
    }

    public List<EmailPatternCount> emailPatternCounts(Instant since) {
        lock.lock();
        try (Connection connection = connect();
                PreparedStatement statement = connection.prepareStatement(sql.load("select-email-pattern-counts"))) {
            statement.setLong(1, since.toEpochMilli());
            List<EmailPatternCount> counts = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    counts.add(new EmailPatternCount(
                            rs.getString("email_type"),
                            rs.getString("formality"),
                            rs.getString("urgency"),
                            rs.getInt("pattern_count")));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new PersistenceException("Unable to count email patterns", e);
        } finally {
            lock.unlock();
        }
    }

    public StorageStatus getStatus() {
        lock.lock();
        try (Connection connection = connect()) {
            long size = sizeBytes();
            long budget = config.budgetBytes();
            double usagePercent = budget <= 0 ? 0.0 : size * 100.0 / budget;
            return new StorageStatus(
                    size,
                    budget,
                    usagePercent,
                    RetentionPolicies.count(connection, sql, "count-samples"),
                    RetentionPolicies.count(connection, sql, "count-training-pairs"),
                    RetentionPolicies.count(connection, sql, "count-feedback"),
                    RetentionPolicies.count(connection, sql, "count-email-patterns"),
                    HealthTier.fromUsagePercent(usagePercent));
        } catch (SQLException e) {
            throw new PersistenceException("Unable to read storage status", e);
        } finally {
            lock.unlock();
        }
    }

    public CleanupReport cleanup() {
        lock.lock();
        try {
            return runPolicies(standardPolicies, false);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Aggressive pass used when {@link #cleanup()} leaves the store above the deep-cleanup ratio.
     * The report is critical when the file is still over budget afterwards.
     */
    public CleanupReport deepCleanup() {
        lock.lock();
        try {
            CleanupReport report = runPolicies(deepPolicies, true);
            if (report.critical()) {
                log.error("store.storage-critical sizeBytes={} budgetBytes={}", report.sizeAfterBytes(), config.budgetBytes());
            }
            return report;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs cleanup, then deep cleanup, only as far as needed to get back under budget. Returns the
     * last report, or null when the store was already within budget.
     */
    public CleanupReport enforceBudget() {
        lock.lock();
        try {
            long budget = config.budgetBytes();
            long size = sizeBytes();
            if (size <= budget) {
                return null;
            }
            log.warn("store.budget.exceeded sizeBytes={} budgetBytes={}", size, budget);
            CleanupReport report = cleanup();
            if (report.sizeAfterBytes() > budget * config.getDeepCleanupRatio()) {
                report = deepCleanup();
            }
            return report;
        } finally {
            lock.unlock();
        }
    }

    public void clearAll() {
        lock.lock();
        try (Connection connection = connect()) {
            connection.setAutoCommit(false);
            try (Statement statement = connection.createStatement()) {
                statement.executeUpdate(sql.load("clear-samples"));
                statement.executeUpdate(sql.load("clear-training-pairs"));
                statement.executeUpdate(sql.load("clear-feedback"));
                statement.executeUpdate(sql.load("clear-email-patterns"));
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
            log.info("store.cleared path={}", dbPath);
        } catch (SQLException e) {
            throw new PersistenceException("Unable to clear store", e);
        } finally {
            lock.unlock();
        }
    }

    long sizeBytes() {
        try {
            return Files.exists(dbPath) ? Files.size(dbPath) : 0L;
        } catch (IOException e) {
            throw new PersistenceException("Unable to read size of " + dbPath, e);
        }
    }

    private boolean ensureCapacity() {
        CleanupReport report = enforceBudget();
        return report == null || !report.critical();
    }

    private CleanupReport runPolicies(List<RetentionPolicy> policies, boolean deep) {
        long before = sizeBytes();
        long now = clock.millis();
        Map<String, Integer> removed = new LinkedHashMap<>();
        try (Connection connection = connect()) {
            connection.setAutoCommit(false);
            try {
                for (RetentionPolicy policy : policies) {
                    removed.put(policy.name(), policy.apply(connection, sql, now));
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new PersistenceException("Cleanup failed", e);
        }

        String compactionError = compact();
        long after = sizeBytes();
        boolean critical = deep && after > config.budgetBytes();
        CleanupReport report = new CleanupReport(deep, before, after, removed, compactionError, critical);
        log.info("store.cleanup.complete deep={} removed={} sizeBeforeBytes={} sizeAfterBytes={} compactionFailed={}",
                deep, report.totalRemoved(), before, after, report.compactionFailed());
        return report;
    }

    private String compact() {
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            statement.executeUpdate("VACUUM");
            return "";
        } catch (SQLException e) {
            log.warn("store.compaction.failed reason={}", e.getMessage());
            return String.valueOf(e.getMessage());
        }
    }

    private boolean exists(Connection connection, String statementName, String... params) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(sql.load(statementName))) {
            for (int i = 0; i < params.length; i++) {
                statement.setString(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next();
            }
        }
    }

    private ReplyContext readContext(String json) {
        if (json == null || json.isBlank()) {
            return ReplyContext.defaults();
        }
        try {
            return mapper.readValue(json, ReplyContext.class);
        } catch (JsonProcessingException e) {
            log.debug("store.feedback.context-unreadable reason={}", e.getMessage());
            return ReplyContext.defaults();
        }
    }

    private void initializeSchema() {
        try {
            if (dbPath.getParent() != null) {
                Files.createDirectories(dbPath.getParent());
            }
        } catch (IOException e) {
            throw new PersistenceException("Unable to create directory for " + dbPath, e);
        }
        try (Connection connection = connect(); Statement statement = connection.createStatement()) {
            for (String ddl : sql.statements("schema")) {
                statement.executeUpdate(ddl);
            }
        } catch (SQLException e) {
            throw new PersistenceException("Unable to initialize schema at " + dbPath, e);
        }
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }
}
