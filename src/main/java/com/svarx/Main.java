package com.svarx;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.svarx.inference.GenerationException;
import com.svarx.inference.GenerationParams;
import com.svarx.inference.GenerationResult;
import com.svarx.inference.LlamaServerModelLoader;
import com.svarx.inference.ModelLifecycleManager;
import com.svarx.inference.ModelLoader;
import com.svarx.inference.ModelProfile;
import com.svarx.learning.BackgroundLearningScheduler;
import com.svarx.learning.InteractionLearningService;
import com.svarx.learning.InteractionType;
import com.svarx.learning.LearningOutcome;
import com.svarx.learning.StyleAnalyzer;
import com.svarx.learning.StyleExporter;
import com.svarx.learning.StyleSummaryCache;
import com.svarx.resource.ResourceGovernor;
import com.svarx.resource.ResourceGovernors;
import com.svarx.runtime.AppConfig;
import com.svarx.runtime.ModelPathResolver;
import com.svarx.store.CleanupReport;
import com.svarx.store.PersistenceStore;
import com.svarx.store.ReplyContext;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "svarx",
        mixinStandardHelpOptions = true,
        version = "svarx 0.1.0",
        description = "Local on-demand model runtime with a bounded personalization store.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_MODEL_UNAVAILABLE = 3;
    static final int EXIT_CONTEXT_EXCEEDED = 4;
    static final int EXIT_STORAGE_CRITICAL = 5;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: serve, generate, status, storage-status, cleanup, deep-cleanup, clear, remember, learn, samples, export-style",
            defaultValue = "serve", converter = ModeConverter.class)
    Mode mode;

    @Option(names = "--db-path", description = "Personalization database file (overrides storage.dbPath)")
    Path dbPath;

    @Option(names = "--model-path", description = "Model weights file (overrides model.path)")
    Path modelPath;

    @Option(names = "--prompt", description = "Prompt text for generate mode")
    String prompt;

    @Option(names = "--email", description = "Original email the reply answers")
    String email;

    @Option(names = "--text", description = "Reply text for remember mode, or the suggestion in learn mode")
    String text;

    @Option(names = "--interaction", description = "Interaction for learn mode: selected, thumbs_up, thumbs_down")
    String interaction;

    @Option(names = "--feedback", description = "Free-form feedback label stored with the interaction", defaultValue = "neutral")
    String feedbackLabel;

    @Option(names = "--tone", description = "Reply tone recorded with training pairs and feedback")
    String tone;

    @Option(names = "--length", description = "Reply length recorded with training pairs and feedback")
    String length;

    @Option(names = "--limit", description = "Row limit for samples mode", defaultValue = "50")
    int limit;

    @Option(names = "--output", description = "Target file for export-style mode", defaultValue = "style_export.json")
    Path outputPath;

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    enum Mode {
        serve,
        generate,
        status,
        storage_status,
        cleanup,
        deep_cleanup,
        clear,
        remember,
        learn,
        samples,
        export_style
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        if (dbPath != null) {
            config.getStorage().setDbPath(dbPath.toString());
        }
        if (modelPath != null) {
            config.getModel().setPath(modelPath.toString());
        }
        log.info("Starting svarx in {} mode", mode);
        log.info("Using config file: {}", configPath);

        switch (mode) {
            case serve:
                return runServe(config);
            case generate:
                return runGenerate(config);
            case status:
                return runStatus(config);
            default:
                return runStoreMode(config, createStore(config));
        }
    }

    AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    PersistenceStore createStore(AppConfig config) {
        return new PersistenceStore(config.getStorage());
    }

    ResourceGovernor createGovernor() {
        return ResourceGovernors.forCurrentPlatform();
    }

    ModelLoader createLoader(AppConfig config) {
        return new LlamaServerModelLoader(config.getModel());
    }

    ModelLifecycleManager createManager(AppConfig config, ResourceGovernor governor) {
        return new ModelLifecycleManager(
                new ModelPathResolver(config.getModel()),
                createLoader(config),
                governor,
                config.getLifecycle(),
                ModelProfile.fromConfig(config.getModel()));
    }

    private int runGenerate(AppConfig config) throws JsonProcessingException {
        if (isBlank(prompt)) {
            log.error("--prompt is required in generate mode");
            return EXIT_USAGE_ERROR;
        }
        try (ModelLifecycleManager manager = createManager(config, createGovernor())) {
            GenerationResult result = manager.generate(prompt, GenerationParams.fromConfig(config.getModel()));
            printJson(result);
            return EXIT_OK;
        } catch (GenerationException e) {
            log.error("Generation failed kind={} reason={}", e.kind(), e.getMessage());
            return exitCodeFor(e);
        }
    }

    private int runStatus(AppConfig config) throws JsonProcessingException {
        ModelPathResolver.ResolvedModel resolved = new ModelPathResolver(config.getModel()).resolve();
        try (ModelLifecycleManager manager = createManager(config, createGovernor())) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("model", manager.status());
            status.put("modelPath", resolved.path().toString());
            status.put("modelAvailable", resolved.available());
            status.put("modelUnavailableReason", resolved.reason());
            printJson(status);
        }
        return EXIT_OK;
    }

    int runStoreMode(AppConfig config, PersistenceStore store) throws IOException {
        switch (mode) {
            case storage_status: {
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("storage", store.getStatus());
                status.put("recommendation", store.getStatus().recommendation());
                printJson(status);
                return EXIT_OK;
            }
            case cleanup: {
                CleanupReport report = store.cleanup();
                printJson(report);
                return EXIT_OK;
            }
            case deep_cleanup: {
                CleanupReport report = store.deepCleanup();
                printJson(report);
                return report.critical() ? EXIT_STORAGE_CRITICAL : EXIT_OK;
            }
            case clear:
                store.clearAll();
                System.out.println("Personalization data cleared.");
                return EXIT_OK;
            case remember: {
                if (isBlank(text)) {
                    log.error("--text is required in remember mode");
                    return EXIT_USAGE_ERROR;
                }
                LearningOutcome outcome = new InteractionLearningService(store).remember(text, email, replyContext());
                printJson(outcome);
                return EXIT_OK;
            }
            case learn:
                return runLearn(store);
            case samples:
                printJson(store.listSamples(limit));
                return EXIT_OK;
            case export_style: {
                StyleAnalyzer analyzer = new StyleAnalyzer(store);
                new StyleExporter(store, analyzer).export(outputPath);
                log.info("Exported style to {}", outputPath.toAbsolutePath());
                return EXIT_OK;
            }
            default:
                log.error("Unsupported mode {}", mode);
                return EXIT_USAGE_ERROR;
        }
    }

    private int runLearn(PersistenceStore store) throws JsonProcessingException {
        Optional<InteractionType> type = InteractionType.fromWireName(interaction);
        if (type.isEmpty() || isBlank(email) || isBlank(text)) {
            log.error("--interaction (selected, thumbs_up, thumbs_down), --email and --text are required in learn mode");
            return EXIT_USAGE_ERROR;
        }
        LearningOutcome outcome = new InteractionLearningService(store)
                .learn(type.get(), email, text, feedbackLabel, replyContext());
        printJson(outcome);
        return EXIT_OK;
    }

    private int runServe(AppConfig config) throws IOException {
        PersistenceStore store = createStore(config);
        CleanupReport startupReport = store.enforceBudget();
        if (startupReport != null && startupReport.critical()) {
            log.error("Personalization store is over budget; new samples will be refused until space is freed");
        }
        ResourceGovernor governor = createGovernor();
        StyleAnalyzer analyzer = new StyleAnalyzer(store);
        StyleSummaryCache summaryCache = new StyleSummaryCache(analyzer);
        InteractionLearningService learning = new InteractionLearningService(store);
        GenerationParams params = GenerationParams.fromConfig(config.getModel());

        try (ModelLifecycleManager manager = createManager(config, governor)) {
            BackgroundLearningScheduler scheduler = new BackgroundLearningScheduler(
                    store, analyzer, summaryCache, governor, config.getLearning(), manager);
            scheduler.start();
            try {
                serveConsole(manager, store, learning, params);
            } finally {
                scheduler.stop();
            }
        }
        return EXIT_OK;
    }

    private void serveConsole(
            ModelLifecycleManager manager,
            PersistenceStore store,
            InteractionLearningService learning,
            GenerationParams params) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String lastPrompt = null;
        String lastReply = null;

        System.out.println("svarx ready. End multiline input with a single '.' line. Type /help for commands.");
        while (true) {
            System.out.print("you> ");
            System.out.flush();
            String input = readMultilinePrompt(reader);
            if (input == null || "/exit".equals(input) || "/quit".equals(input)) {
                break;
            }
            if (input.isBlank()) {
                continue;
            }
            if ("/help".equals(input)) {
                System.out.println("Commands: /status, /storage, /unload, /reload, /cleanup, /select, /up, /down, /exit. End multiline with '.'");
                continue;
            }
            if ("/status".equals(input)) {
                printJson(manager.status());
                continue;
            }
            if ("/storage".equals(input)) {
                printJson(store.getStatus());
                continue;
            }
            if ("/unload".equals(input)) {
                manager.unload();
                System.out.println("Model unloaded.");
                continue;
            }
            if ("/reload".equals(input)) {
                try {
                    manager.forceReload();
                    System.out.println("Model reloaded.");
                } catch (GenerationException e) {
                    System.out.println("Reload failed: " + e.getMessage());
                }
                continue;
            }
            if ("/cleanup".equals(input)) {
                printJson(store.cleanup());
                continue;
            }
            Optional<InteractionType> reaction = reactionFor(input);
            if (reaction.isPresent()) {
                if (lastReply == null) {
                    System.out.println("No reply to react to yet.");
                } else {
                    printJson(learning.learn(reaction.get(), lastPrompt, lastReply, feedbackLabel, replyContext()));
                }
                continue;
            }

            learning.observeEmail(input);
            try {
                GenerationResult result = manager.generate(input, params);
                System.out.println("assistant> " + result.text());
                log.info("serve.telemetry elapsedMs={} retried={} replyChars={}",
                        result.elapsedMs(), result.retried(), result.text().length());
                lastPrompt = input;
                lastReply = result.text();
            } catch (GenerationException e) {
                System.out.println("assistant> (generation unavailable: " + e.kind().name().toLowerCase(Locale.ROOT) + ")");
                log.warn("serve.generate.failed kind={} recoverable={} reason={}", e.kind(), e.isRecoverable(), e.getMessage());
            }
        }
    }

    private static Optional<InteractionType> reactionFor(String input) {
        switch (input) {
            case "/select":
                return Optional.of(InteractionType.SELECTED);
            case "/up":
                return Optional.of(InteractionType.THUMBS_UP);
            case "/down":
                return Optional.of(InteractionType.THUMBS_DOWN);
            default:
                return Optional.empty();
        }
    }

    private static String readMultilinePrompt(BufferedReader reader) throws IOException {
        StringBuilder builder = new StringBuilder();
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return builder.length() == 0 ? null : builder.toString().trim();
            }
            if (".".equals(line)) {
                break;
            }
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(line);
            if (builder.toString().startsWith("/")) {
                break;
            }
        }
        return builder.toString().trim();
    }

    static int exitCodeFor(GenerationException e) {
        switch (e.kind()) {
            case MODEL_UNAVAILABLE:
                return EXIT_MODEL_UNAVAILABLE;
            case CONTEXT_WINDOW_EXCEEDED:
                return EXIT_CONTEXT_EXCEEDED;
            default:
                return EXIT_FAILURE;
        }
    }

    private ReplyContext replyContext() {
        return new ReplyContext(tone, length);
    }

    private void printJson(Object value) throws JsonProcessingException {
        System.out.println(jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static class ModeConverter implements CommandLine.ITypeConverter<Mode> {
        @Override
        public Mode convert(String value) {
            try {
                return Mode.valueOf(value.trim().toLowerCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException("Unknown mode '" + value + "'");
            }
        }
    }
}
