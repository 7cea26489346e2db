package com.svarx.inference;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LlamaServerInferenceEngineTest {

    private MockWebServer server;
    private LlamaServerInferenceEngine engine;
    private final GenerationParams params = new GenerationParams(50, 0.5, 0.8, 15, 1.05, List.of("###"));

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        engine = new LlamaServerInferenceEngine(new OkHttpClient(), server.url("/"), null);
    }

    @AfterEach
    void tearDown() throws IOException {
        engine.close();
        server.shutdown();
    }

    @Test
    void shouldFlagContextWindowViolation() {
        server.enqueue(new MockResponse().setResponseCode(400)
                .setBody("{\"error\":{\"message\":\"the request exceeds the available context size\"}}"));

        InferenceException error = assertThrows(InferenceException.class, () -> engine.infer("long email", params));

        assertTrue(error.contextWindowExceeded());
    }

    @Test
    void shouldTreatOtherFailuresAsOpaque() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("{\"error\":\"slot unavailable\"}"));

        InferenceException error = assertThrows(InferenceException.class, () -> engine.infer("hello", params));

        assertFalse(error.contextWindowExceeded());
        assertTrue(error.getMessage().contains("status=500"));
    }

    @Test
    void shouldRejectResponseWithoutContent() {
        server.enqueue(new MockResponse().setBody("{\"tokens_predicted\":0}"));

        assertThrows(InferenceException.class, () -> engine.infer("hello", params));
    }

    @Test
    void shouldRecognizeContextErrorsByStatusAndBody() {
        assertTrue(LlamaServerInferenceEngine.isContextWindowError(400, "prompt is longer than n_ctx"));
        assertTrue(LlamaServerInferenceEngine.isContextWindowError(413, "Context size exceeded"));
        assertFalse(LlamaServerInferenceEngine.isContextWindowError(500, "context"));
        assertFalse(LlamaServerInferenceEngine.isContextWindowError(400, "invalid json"));
        assertFalse(LlamaServerInferenceEngine.isContextWindowError(400, null));
    }
}
