package com.svarx.runtime;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelPathResolverTest {

    @Test
    void shouldPreferConfiguredPathWhenLargeEnough() {
        AppConfig.ModelConfig config = new AppConfig.ModelConfig();
        config.setPath("/data/custom.gguf");
        StubInspector inspector = new StubInspector("Linux");
        inspector.files.put(Path.of("/data/custom.gguf"), 5_000L);
        inspector.files.put(Path.of("/opt/GmailAIPro/models").resolve(config.getFileName()), 5_000L);

        ModelPathResolver.ResolvedModel resolved = new ModelPathResolver(config, inspector, Path.of("models")).resolve();

        assertTrue(resolved.available());
        assertEquals(Path.of("/data/custom.gguf"), resolved.path());
    }

    @Test
    void shouldFallBackToLocalModelsDirectory() {
        AppConfig.ModelConfig config = new AppConfig.ModelConfig();
        StubInspector inspector = new StubInspector("Mac OS X");
        Path local = Path.of("models").resolve(config.getFileName());
        inspector.files.put(local, 2_000_000L);

        ModelPathResolver resolver = new ModelPathResolver(config, inspector, Path.of("models"));

        assertEquals(Path.of("/Applications", "GmailAIPro", "models"), resolver.programModelDir());
        assertEquals(local, resolver.resolve().path());
    }

    @Test
    void shouldRejectTruncatedWeightsAndReportPrimaryCandidate() {
        AppConfig.ModelConfig config = new AppConfig.ModelConfig();
        config.setPath("/data/broken.gguf");
        StubInspector inspector = new StubInspector("Linux");
        inspector.files.put(Path.of("/data/broken.gguf"), 10L);

        ModelPathResolver.ResolvedModel resolved = new ModelPathResolver(config, inspector, Path.of("models")).resolve();

        assertFalse(resolved.available());
        assertEquals(Path.of("/data/broken.gguf"), resolved.path());
        assertTrue(resolved.reason().contains("too small"));
    }

    @Test
    void shouldReportMissingModel() {
        AppConfig.ModelConfig config = new AppConfig.ModelConfig();

        ModelPathResolver.ResolvedModel resolved = new ModelPathResolver(config, new StubInspector("Linux"), Path.of("models")).resolve();

        assertFalse(resolved.available());
        assertTrue(resolved.reason().startsWith("Model not found"));
    }

    @Test
    void shouldUseProgramFilesOnWindows() {
        StubInspector inspector = new StubInspector("Windows 11");
        inspector.env.put("ProgramFiles", "D:\\Apps");

        Path dir = new ModelPathResolver(new AppConfig.ModelConfig(), inspector, Path.of("models")).programModelDir();

        assertEquals(Path.of("D:\\Apps").resolve("GmailAIPro").resolve("models"), dir);
    }

    private static final class StubInspector implements ModelPathResolver.SystemInspector {
        private final String osName;
        private final Map<Path, Long> files = new HashMap<>();
        private final Map<String, String> env = new HashMap<>();

        private StubInspector(String osName) {
            this.osName = osName;
        }

        @Override
        public String osName() {
            return osName;
        }

        @Override
        public String env(String key) {
            return env.get(key);
        }

        @Override
        public boolean exists(Path path) {
            return files.containsKey(path);
        }

        @Override
        public long size(Path path) {
            return files.getOrDefault(path, -1L);
        }
    }
}
