package com.svarx.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Locates the model weights: explicit config path, then the per-OS program directory,
 * then a local {@code models/} directory. A candidate only counts when it exists and is
 * larger than the configured minimum size.
 */
public class ModelPathResolver {
    private static final String PRODUCT_DIR = "GmailAIPro";

    private final AppConfig.ModelConfig config;
    private final SystemInspector inspector;
    private final Path localModelsDir;

    public ModelPathResolver(AppConfig.ModelConfig config) {
        this(config, new DefaultSystemInspector(), Path.of("models"));
    }

    public ModelPathResolver(AppConfig.ModelConfig config, SystemInspector inspector, Path localModelsDir) {
        this.config = config;
        this.inspector = inspector;
        this.localModelsDir = localModelsDir;
    }

    public ResolvedModel resolve() {
        List<Path> candidates = candidates();
        for (Path candidate : candidates) {
            if (isUsable(candidate)) {
                return new ResolvedModel(candidate, true, "");
            }
        }
        Path primary = candidates.get(0);
        String reason = inspector.exists(primary)
                ? "Model file too small (<= " + config.getMinSizeBytes() + " bytes): " + primary
                : "Model not found at " + primary;
        return new ResolvedModel(primary, false, reason);
    }

    List<Path> candidates() {
        List<Path> candidates = new ArrayList<>();
        if (config.getPath() != null && !config.getPath().isBlank()) {
            candidates.add(Path.of(config.getPath()));
        }
        candidates.add(programModelDir().resolve(config.getFileName()));
        candidates.add(localModelsDir.resolve(config.getFileName()));
        return candidates;
    }

    Path programModelDir() {
        String os = inspector.osName().toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            String programFiles = inspector.env("ProgramFiles");
            Path base = Path.of(programFiles == null || programFiles.isBlank() ? "C:\\Program Files" : programFiles);
            return base.resolve(PRODUCT_DIR).resolve("models");
        }
        if (os.contains("mac") || os.contains("darwin")) {
            return Path.of("/Applications", PRODUCT_DIR, "models");
        }
        return Path.of("/opt", PRODUCT_DIR, "models");
    }

    private boolean isUsable(Path candidate) {
        return inspector.exists(candidate) && inspector.size(candidate) > config.getMinSizeBytes();
    }

    public record ResolvedModel(Path path, boolean available, String reason) {
    }

    public interface SystemInspector {
        String osName();

        String env(String key);

        boolean exists(Path path);

        long size(Path path);
    }

    static class DefaultSystemInspector implements SystemInspector {
        @Override
        public String osName() {
            return System.getProperty("os.name", "");
        }

        @Override
        public String env(String key) {
            return System.getenv(key);
        }

        @Override
        public boolean exists(Path path) {
            return Files.isRegularFile(path);
        }

        @Override
        public long size(Path path) {
            try {
                return Files.size(path);
            } catch (IOException e) {
                return -1L;
            }
        }
    }
}
