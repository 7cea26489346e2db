package com.svarx.learning;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.svarx.runtime.AppConfig;
import com.svarx.store.InteractionFeedback;
import com.svarx.store.PersistenceStore;
import com.svarx.store.ReplyContext;
import com.svarx.store.StorageStatus;
import com.svarx.store.WriteResult;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractionLearningServiceTest {

    private static final String EMAIL = "Hi, could you send me the slides from Tuesday's review?";
    private static final String REPLY = "Sure, I'll send them over this afternoon.";

    @TempDir
    Path tempDir;

    private PersistenceStore store;
    private InteractionLearningService service;

    @BeforeEach
    void setUp() {
        store = new PersistenceStore(new AppConfig.StorageConfig(), tempDir.resolve("learn.db"), Clock.systemUTC());
        service = new InteractionLearningService(store);
    }

    @Test
    void shouldStoreSampleTrainingPairAndFeedbackForSelectedSuggestion() {
        LearningOutcome outcome = service.learn(InteractionType.SELECTED, EMAIL, REPLY, "selected", new ReplyContext("casual", "short"));

        assertEquals(WriteResult.STORED, outcome.sample());
        assertEquals(WriteResult.STORED, outcome.trainingPair());
        assertEquals(WriteResult.STORED, outcome.feedback());
        StorageStatus status = store.getStatus();
        assertEquals(1, status.samples());
        assertEquals(1, status.trainingPairs());
        assertEquals("casual", store.recentTrainingPairs(1).get(0).tone());
        assertEquals(1.0, store.recentFeedback(1).get(0).weight(), 0.0001);
    }

    @Test
    void shouldOnlyRecordFeedbackForThumbs() {
        LearningOutcome up = service.learn(InteractionType.THUMBS_UP, EMAIL, REPLY, null, null);
        LearningOutcome down = service.learn(InteractionType.THUMBS_DOWN, EMAIL, "No.", "too_short", null);

        assertNull(up.sample());
        assertNull(down.trainingPair());
        assertTrue(down.anyStored());
        List<InteractionFeedback> feedback = store.recentFeedback(10);
        assertEquals(2, feedback.size());
        assertEquals(-0.5, feedback.get(0).weight(), 0.0001);
        assertEquals("thumbs_down", feedback.get(0).interactionType());
        assertEquals(ReplyContext.defaults(), feedback.get(1).context());
        assertEquals(0, store.getStatus().samples());
    }

    @Test
    void shouldReportDuplicateSelectionWithoutFailing() {
        service.learn(InteractionType.SELECTED, EMAIL, REPLY, "selected", null);

        LearningOutcome again = service.learn(InteractionType.SELECTED, EMAIL, REPLY, "selected", null);

        assertEquals(WriteResult.REJECTED_DUPLICATE, again.sample());
        assertEquals(WriteResult.REJECTED_DUPLICATE, again.trainingPair());
        assertEquals(WriteResult.STORED, again.feedback());
    }

    @Test
    void shouldRejectMissingInput() {
        assertThrows(IllegalArgumentException.class, () -> service.learn(InteractionType.SELECTED, " ", REPLY, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.learn(null, EMAIL, REPLY, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.remember("", EMAIL, null));
    }

    @Test
    void shouldRememberTextWithAndWithoutOriginal() {
        LearningOutcome alone = service.remember("Happy to help with the migration plan.", null, null);
        LearningOutcome paired = service.remember(REPLY, EMAIL, null);

        assertEquals("remember", alone.source());
        assertNull(alone.trainingPair());
        assertEquals(WriteResult.STORED, paired.trainingPair());
        assertEquals(2, store.getStatus().samples());
    }

    @Test
    void shouldClassifyAndRecordObservedEmails() {
        assertEquals(WriteResult.REJECTED_TOO_SHORT, service.observeEmail("Hi!"));
        assertEquals(WriteResult.REJECTED_TOO_SHORT, service.observeEmail(null));
        assertEquals(WriteResult.STORED, service.observeEmail("Can we schedule a meeting to go over the roadmap?"));

        assertEquals(1, store.getStatus().emailPatterns());
    }

    @Test
    void shouldParseWireNames() {
        assertEquals(InteractionType.THUMBS_UP, InteractionType.fromWireName(" Thumbs-Up ").orElseThrow());
        assertTrue(InteractionType.fromWireName("maybe").isEmpty());
        assertTrue(InteractionType.fromWireName(null).isEmpty());
    }
}
