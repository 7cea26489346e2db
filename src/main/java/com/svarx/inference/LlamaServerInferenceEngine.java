package com.svarx.inference;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Talks to a running llama.cpp server over its native {@code /completion} endpoint.
 */
public class LlamaServerInferenceEngine implements InferenceEngine {
    private static final Logger log = LoggerFactory.getLogger(LlamaServerInferenceEngine.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final long SHUTDOWN_GRACE_MS = 5_000;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;
    private final Process serverProcess;

    public LlamaServerInferenceEngine(OkHttpClient httpClient, HttpUrl baseUrl, Process serverProcess) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.serverProcess = serverProcess;
    }

    @Override
    public String infer(String prompt, GenerationParams params) throws InferenceException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", prompt);
        payload.put("n_predict", params.maxTokens());
        payload.put("temperature", params.temperature());
        payload.put("top_p", params.topP());
        payload.put("top_k", params.topK());
        payload.put("repeat_penalty", params.repeatPenalty());
        payload.put("stop", params.stop());
        payload.put("stream", false);

        Request request;
        try {
            request = new Request.Builder()
                    .url(baseUrl.resolve("completion"))
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                    .build();
        } catch (IOException e) {
            throw new InferenceException("Unable to encode completion request", e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() == null ? "" : response.body().string();
            if (!response.isSuccessful()) {
                if (isContextWindowError(response.code(), body)) {
                    throw InferenceException.contextWindowExceeded("Prompt exceeds the model context window: " + summarize(body));
                }
                throw new InferenceException("Completion request failed status=" + response.code() + " body=" + summarize(body));
            }
            JsonNode content = mapper.readTree(body).path("content");
            if (!content.isTextual()) {
                throw new InferenceException("Completion response has no content field");
            }
            return content.asText();
        } catch (IOException e) {
            throw new InferenceException("Completion request failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (serverProcess == null || !serverProcess.isAlive()) {
            return;
        }
        serverProcess.destroy();
        try {
            if (!serverProcess.waitFor(SHUTDOWN_GRACE_MS, TimeUnit.MILLISECONDS)) {
                log.warn("llama.server.stop.forced pid={}", serverProcess.pid());
                serverProcess.destroyForcibly();
            }
        } catch (InterruptedException e) {
            serverProcess.destroyForcibly();
            Thread.currentThread().interrupt();
        }
    }

    static boolean isContextWindowError(int status, String body) {
        if (status != 400 && status != 413) {
            return false;
        }
        String lower = body == null ? "" : body.toLowerCase(Locale.ROOT);
        return lower.contains("context") || lower.contains("n_ctx");
    }

    private static String summarize(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
