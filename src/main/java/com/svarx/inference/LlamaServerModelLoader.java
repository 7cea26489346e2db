package com.svarx.inference;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.runtime.AppConfig;

import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

/**
 * Loads the model by starting a dedicated llama.cpp {@code llama-server} child process and waiting
 * for its health endpoint. Closing the returned engine stops the process.
 */
public class LlamaServerModelLoader implements ModelLoader {
    private static final Logger log = LoggerFactory.getLogger(LlamaServerModelLoader.class);
    private static final long HEALTH_POLL_MS = 250;

    private final AppConfig.ModelConfig config;
    private final OkHttpClient httpClient;
    private final ServerLauncher launcher;

    public LlamaServerModelLoader(AppConfig.ModelConfig config) {
        this(config, new OkHttpClient.Builder()
                .callTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getRequestTimeoutMs()))
                .build(), new DefaultServerLauncher());
    }

    LlamaServerModelLoader(AppConfig.ModelConfig config, OkHttpClient httpClient, ServerLauncher launcher) {
        this.config = config;
        this.httpClient = httpClient;
        this.launcher = launcher;
    }

    @Override
    public InferenceEngine load(Path modelPath, ModelProfile profile) throws InferenceException {
        List<String> command = buildCommand(modelPath, profile);
        log.info("llama.server.start command={}", String.join(" ", command));

        Process process;
        try {
            process = launcher.launch(command);
        } catch (IOException e) {
            throw new InferenceException("Unable to start " + config.getServerBinary() + ": " + e.getMessage(), e);
        }

        HttpUrl baseUrl = baseUrl();
        try {
            awaitHealthy(baseUrl, process);
        } catch (InferenceException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            throw e;
        }
        return new LlamaServerInferenceEngine(httpClient, baseUrl, process);
    }

    List<String> buildCommand(Path modelPath, ModelProfile profile) {
        List<String> command = new ArrayList<>();
        command.add(config.getServerBinary());
        command.add("-m");
        command.add(modelPath.toString());
        command.add("-c");
        command.add(String.valueOf(profile.contextWindowTokens()));
        command.add("-t");
        command.add(String.valueOf(profile.threads()));
        command.add("-b");
        command.add(String.valueOf(profile.batchSize()));
        command.add("-ngl");
        command.add(String.valueOf(profile.gpuLayers()));
        if (!profile.useMmap()) {
            command.add("--no-mmap");
        }
        command.add("--host");
        command.add(config.getServerHost());
        command.add("--port");
        command.add(String.valueOf(config.getServerPort()));
        return command;
    }

    HttpUrl baseUrl() {
        return new HttpUrl.Builder()
                .scheme("http")
                .host(config.getServerHost())
                .port(config.getServerPort())
                .addPathSegment("")
                .build();
    }

    private void awaitHealthy(HttpUrl baseUrl, Process process) throws InferenceException {
        long deadline = System.currentTimeMillis() + config.getStartupTimeoutMs();
        Request health = new Request.Builder().url(baseUrl.resolve("health")).get().build();
        while (System.currentTimeMillis() < deadline) {
            if (process != null && !process.isAlive()) {
                throw new InferenceException("llama-server exited during startup with code " + process.exitValue());
            }
            try (Response response = httpClient.newCall(health).execute()) {
                if (response.isSuccessful()) {
                    return;
                }
            } catch (IOException e) {
                log.debug("llama.server.health.pending reason={}", e.getMessage());
            }
            try {
                Thread.sleep(HEALTH_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InferenceException("Interrupted while waiting for llama-server", e);
            }
        }
        throw new InferenceException("llama-server did not become healthy within " + config.getStartupTimeoutMs() + " ms");
    }

    interface ServerLauncher {
        Process launch(List<String> command) throws IOException;
    }

    static class DefaultServerLauncher implements ServerLauncher {
        @Override
        public Process launch(List<String> command) throws IOException {
            return new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        }
    }
}
