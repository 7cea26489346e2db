package com.svarx;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.svarx.inference.GenerationException;
import com.svarx.runtime.AppConfig;
import com.svarx.store.PersistenceStore;
import com.svarx.store.StorageStatus;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReportStorageStatusWithDefaultsWhenConfigMissing() {
        int exitCode = execute("--mode", "storage-status");

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(Files.exists(dbPath()));
    }

    @Test
    void shouldPrintSizesInMegabytesForStorageStatus() throws IOException {
        String output = captureStdout(() -> assertEquals(Main.EXIT_OK, execute("--mode", "storage-status")));

        JsonNode storage = new ObjectMapper().readTree(output).path("storage");
        assertEquals(5120.0, storage.path("budgetMb").asDouble(), 0.001);
        assertTrue(storage.path("sizeMb").asDouble() > 0.0);
        assertEquals("HEALTHY", storage.path("tier").asText());
    }

    @Test
    void shouldPrintReclaimedBytesForCleanup() throws IOException {
        execute("--mode", "remember", "--text", "Happy to review the draft before Friday.");

        String output = captureStdout(() -> assertEquals(Main.EXIT_OK, execute("--mode", "cleanup")));

        JsonNode report = new ObjectMapper().readTree(output);
        assertTrue(report.has("bytesReclaimed"));
        assertTrue(report.path("bytesReclaimed").asLong() >= 0L);
        assertEquals(0, report.path("totalRemoved").asInt());
        assertFalse(report.path("deep").asBoolean());
    }

    @Test
    void shouldRejectUnknownMode() {
        assertEquals(Main.EXIT_USAGE_ERROR, execute("--mode", "benchmark"));
    }

    @Test
    void shouldRequirePromptForGenerate() {
        assertEquals(Main.EXIT_USAGE_ERROR, execute("--mode", "generate"));
    }

    @Test
    void shouldExitWithModelUnavailableWhenWeightsMissing() {
        int exitCode = execute("--mode", "generate",
                "--prompt", "Can we move our sync to Thursday?",
                "--model-path", tempDir.resolve("missing.gguf").toString());

        assertEquals(Main.EXIT_MODEL_UNAVAILABLE, exitCode);
    }

    @Test
    void shouldLearnSelectedSuggestion() {
        int exitCode = execute("--mode", "learn",
                "--interaction", "selected",
                "--email", "Could you share the onboarding checklist with the new hire?",
                "--text", "Sure, sending it over right now.",
                "--tone", "casual");

        assertEquals(Main.EXIT_OK, exitCode);
        StorageStatus status = openStore().getStatus();
        assertEquals(1, status.samples());
        assertEquals(1, status.trainingPairs());
        assertEquals(1, status.interactions());
        assertEquals("casual", openStore().recentTrainingPairs(1).get(0).tone());
    }

    @Test
    void shouldRejectLearnWithoutInteraction() {
        int exitCode = execute("--mode", "learn",
                "--email", "Could you share the onboarding checklist?",
                "--text", "Sure, sending it over.");

        assertEquals(Main.EXIT_USAGE_ERROR, exitCode);
    }

    @Test
    void shouldRememberAndClear() {
        assertEquals(Main.EXIT_OK, execute("--mode", "remember", "--text", "Happy to jump on a call this afternoon."));
        assertEquals(1, openStore().getStatus().samples());
        assertEquals(Main.EXIT_OK, execute("--mode", "samples", "--limit", "5"));

        assertEquals(Main.EXIT_OK, execute("--mode", "clear"));

        assertEquals(0, openStore().getStatus().samples());
    }

    @Test
    void shouldExportStyle() {
        execute("--mode", "remember", "--text", "Thanks for the update on the launch.");
        Path output = tempDir.resolve("out").resolve("style.json");

        int exitCode = execute("--mode", "export-style", "--output", output.toString());

        assertEquals(Main.EXIT_OK, exitCode);
        assertTrue(Files.exists(output));
    }

    @Test
    void shouldSignalCriticalStorageAfterDeepCleanup() throws IOException {
        Path config = tempDir.resolve("tiny.yml");
        Files.writeString(config, """
                storage:
                  maxDbSizeBytes: 1
                """);

        int exitCode = new CommandLine(new Main()).execute(
                "--mode", "deep-cleanup",
                "--config", config.toString(),
                "--db-path", dbPath().toString());

        assertEquals(Main.EXIT_STORAGE_CRITICAL, exitCode);
    }

    @Test
    void shouldLoadYamlConfig() throws IOException {
        Path config = tempDir.resolve("app.yml");
        Files.writeString(config, """
                lifecycle:
                  unloadAfterMs: 5000
                learning:
                  enabled: false
                """);

        AppConfig loaded = new Main().loadConfig(config);

        assertEquals(5000, loaded.getLifecycle().getUnloadAfterMs());
        assertFalse(loaded.getLearning().isEnabled());
        assertEquals(50_000, loaded.getStorage().getMaxSamples());
    }

    @Test
    void shouldMapGenerationErrorsToExitCodes() {
        assertEquals(Main.EXIT_MODEL_UNAVAILABLE, Main.exitCodeFor(
                new GenerationException(GenerationException.ErrorKind.MODEL_UNAVAILABLE, "missing")));
        assertEquals(Main.EXIT_CONTEXT_EXCEEDED, Main.exitCodeFor(
                new GenerationException(GenerationException.ErrorKind.CONTEXT_WINDOW_EXCEEDED, "too long")));
        assertEquals(Main.EXIT_FAILURE, Main.exitCodeFor(
                new GenerationException(GenerationException.ErrorKind.MODEL_LOAD_FAILED, "bad weights")));
    }

    private int execute(String... args) {
        String[] full = new String[args.length + 4];
        System.arraycopy(args, 0, full, 0, args.length);
        full[args.length] = "--config";
        full[args.length + 1] = tempDir.resolve("missing.yml").toString();
        full[args.length + 2] = "--db-path";
        full[args.length + 3] = dbPath().toString();
        return new CommandLine(new Main()).execute(full);
    }

    private static String captureStdout(Runnable action) {
        PrintStream original = System.out;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        System.setOut(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setOut(original);
        }
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path dbPath() {
        return tempDir.resolve("personalization.db");
    }

    private PersistenceStore openStore() {
        return new PersistenceStore(new AppConfig.StorageConfig(), dbPath(), Clock.systemUTC());
    }
}
