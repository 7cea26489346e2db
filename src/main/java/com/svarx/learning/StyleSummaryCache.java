package com.svarx.learning;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last computed style summary, refreshed off the request path by the background scheduler.
 */
public class StyleSummaryCache {
    private final StyleAnalyzer analyzer;
    private final Clock clock;
    private final AtomicReference<CachedSummary> current = new AtomicReference<>();

    public StyleSummaryCache(StyleAnalyzer analyzer) {
        this(analyzer, Clock.systemUTC());
    }

    public StyleSummaryCache(StyleAnalyzer analyzer, Clock clock) {
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public CachedSummary refresh() {
        CachedSummary summary = new CachedSummary(
                analyzer.styleSummary(StyleAnalyzer.DEFAULT_SUMMARY_LENGTH),
                analyzer.analyzePatterns(),
                clock.instant());
        current.set(summary);
        return summary;
    }

    public Optional<CachedSummary> current() {
        return Optional.ofNullable(current.get());
    }

    /**
     * Cached summary text, computing it on first use.
     */
    public String summary() {
        CachedSummary cached = current.get();
        return cached == null ? refresh().summary() : cached.summary();
    }

    public record CachedSummary(String summary, StyleAnalyzer.UserPatterns patterns, Instant computedAt) {
    }
}
