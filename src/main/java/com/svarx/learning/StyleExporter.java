package com.svarx.learning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.svarx.store.PersistenceStore;
import com.svarx.store.Sample;
import com.svarx.store.TrainingPair;

/**
 * Writes the learned style and the raw material it came from to a JSON file.
 */
public class StyleExporter {
    private static final int SAMPLE_LIMIT = 500;
    private static final int PAIR_LIMIT = 100;

    private final PersistenceStore store;
    private final StyleAnalyzer analyzer;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public StyleExporter(PersistenceStore store, StyleAnalyzer analyzer) {
        this(store, analyzer, Clock.systemUTC());
    }

    public StyleExporter(PersistenceStore store, StyleAnalyzer analyzer, Clock clock) {
        this.store = store;
        this.analyzer = analyzer;
        this.clock = clock;
    }

    public StyleExport export(Path target) throws IOException {
        StyleExport export = new StyleExport(
                analyzer.styleSummary(StyleAnalyzer.DEFAULT_SUMMARY_LENGTH),
                analyzer.analyzePatterns(),
                analyzer.emailInsights(),
                store.listSamples(SAMPLE_LIMIT),
                store.recentTrainingPairs(PAIR_LIMIT),
                clock.instant());
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), export);
        return export;
    }

    public record StyleExport(
            String summary,
            StyleAnalyzer.UserPatterns patterns,
            StyleAnalyzer.EmailInsights emailInsights,
            List<Sample> samples,
            List<TrainingPair> trainingPairs,
            Instant exportedAt) {
    }
}
