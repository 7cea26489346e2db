package com.svarx.learning;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.svarx.MutableClock;
import com.svarx.runtime.AppConfig;
import com.svarx.store.PersistenceStore;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StyleSummaryCacheTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldServeCachedSummaryUntilRefreshed() {
        MutableClock clock = new MutableClock(Instant.parse("2026-05-10T12:00:00Z"));
        PersistenceStore store = new PersistenceStore(new AppConfig.StorageConfig(), tempDir.resolve("cache.db"), clock);
        StyleSummaryCache cache = new StyleSummaryCache(new StyleAnalyzer(store, clock), clock);
        assertTrue(cache.current().isEmpty());

        assertEquals("", cache.summary());
        store.addSample("Thanks for the update on the launch.");
        assertEquals("", cache.summary());

        clock.advance(Duration.ofMinutes(2));
        StyleSummaryCache.CachedSummary refreshed = cache.refresh();

        assertNotEquals("", refreshed.summary());
        assertEquals(refreshed.summary(), cache.summary());
        assertEquals(clock.instant(), cache.current().orElseThrow().computedAt());
    }
}
