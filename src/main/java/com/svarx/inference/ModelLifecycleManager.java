package com.svarx.inference;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.resource.ResourceGovernor;
import com.svarx.resource.ResourceSample;
import com.svarx.runtime.AppConfig;
import com.svarx.runtime.ModelPathResolver;

/**
 * Owns the single model slot. Loading, inference, reload and eviction all run under one exclusive
 * lock, so the engine is never entered concurrently and at most one load is in flight. The idle
 * monitor polls without the lock and only takes it to evict.
 */
public class ModelLifecycleManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ModelLifecycleManager.class);
    private static final int RETRY_PROMPT_CHARS = 100;

    private final ModelPathResolver pathResolver;
    private final ModelLoader loader;
    private final ResourceGovernor governor;
    private final AppConfig.LifecycleConfig lifecycle;
    private final ModelProfile profile;
    private final Clock clock;
    private final ThreadFactory monitorThreadFactory;

    private final ReentrantLock slotLock = new ReentrantLock(true);
    private final ModelSlot slot = new ModelSlot();
    private IdleMonitor activeMonitor;

    public ModelLifecycleManager(
            ModelPathResolver pathResolver,
            ModelLoader loader,
            ResourceGovernor governor,
            AppConfig.LifecycleConfig lifecycle,
            ModelProfile profile) {
        this(pathResolver, loader, governor, lifecycle, profile, Clock.systemUTC(), runnable -> {
            Thread thread = new Thread(runnable, "svarx-idle-monitor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ModelLifecycleManager(
            ModelPathResolver pathResolver,
            ModelLoader loader,
            ResourceGovernor governor,
            AppConfig.LifecycleConfig lifecycle,
            ModelProfile profile,
            Clock clock,
            ThreadFactory monitorThreadFactory) {
        this.pathResolver = Objects.requireNonNull(pathResolver, "pathResolver");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.governor = Objects.requireNonNull(governor, "governor");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.monitorThreadFactory = Objects.requireNonNull(monitorThreadFactory, "monitorThreadFactory");
    }

    public boolean ensureLoaded() {
        try {
            loadIfNeeded();
            return true;
        } catch (GenerationException e) {
            log.warn("model.ensure-loaded.failed kind={} reason={}", e.kind(), e.getMessage());
            return false;
        }
    }

    public void forceReload() throws GenerationException {
        slotLock.lock();
        try {
            evictLocked("reload");
            loadIfNeeded();
        } finally {
            slotLock.unlock();
        }
    }

    public GenerationResult generate(String prompt, GenerationParams params) throws GenerationException {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt must not be blank");
        }
        Objects.requireNonNull(params, "params");

        slotLock.lock();
        try {
            loadIfNeeded();
            InferenceEngine engine = slot.handle();
            long start = System.nanoTime();
            try {
                String reply = cleanReply(engine.infer(prompt, params));
                boolean retried = false;
                if (reply.length() < lifecycle.getMinReplyChars()) {
                    retried = true;
                    reply = retryWithSimplifiedPrompt(engine, prompt, params, reply);
                }
                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                log.info("model.generate.success promptChars={} replyChars={} elapsedMs={} retried={}",
                        prompt.length(), reply.length(), elapsedMs, retried);
                return new GenerationResult(reply, elapsedMs, retried);
            } catch (InferenceException e) {
                if (e.contextWindowExceeded()) {
                    log.warn("model.generate.context-exceeded promptChars={} contextWindowTokens={}",
                            prompt.length(), profile.contextWindowTokens());
                    throw new GenerationException(GenerationException.ErrorKind.CONTEXT_WINDOW_EXCEEDED, e.getMessage(), e);
                }
                log.error("model.generate.failed reason={}", e.getMessage(), e);
                throw new GenerationException(GenerationException.ErrorKind.INFERENCE_FAILED, e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("model.generate.failed reason={}", e.toString(), e);
                throw new GenerationException(GenerationException.ErrorKind.INFERENCE_FAILED,
                        "Inference failed: " + e, e);
            } finally {
                slot.touch(clock.millis());
            }
        } finally {
            slotLock.unlock();
        }
    }

    public void unload() {
        slotLock.lock();
        try {
            evictLocked("manual");
        } finally {
            slotLock.unlock();
        }
    }

    public ModelState state() {
        return slot.state();
    }

    public boolean isLoaded() {
        return slot.state() == ModelState.LOADED;
    }

    public long loadGeneration() {
        return slot.loadGeneration();
    }

    public ModelStatus status() {
        ResourceSample sample = governor.sample();
        ModelState state = slot.state();
        boolean loaded = state == ModelState.LOADED;
        long idleMs = idleMillis();
        long willUnloadInMs = loaded ? Math.max(0L, lifecycle.getUnloadAfterMs() - idleMs) : 0L;
        return new ModelStatus(
                loaded,
                state,
                governor.powerMode(),
                slot.loadGeneration(),
                sample.memoryBytes(),
                sample.cpuPercent(),
                idleMs / 1000,
                willUnloadInMs / 1000);
    }

    @Override
    public void close() {
        unload();
    }

    long idleMillis() {
        long lastUsed = slot.lastUsedAtMillis();
        if (lastUsed <= 0) {
            return 0L;
        }
        return Math.max(0L, clock.millis() - lastUsed);
    }

    /**
     * One idle-monitor pass. Returns false when the monitor for {@code generation} should stop.
     */
    boolean monitorCycle(long generation) {
        if (!isCurrent(generation)) {
            return false;
        }
        try {
            long idleMs = idleMillis();
            if (idleMs > lifecycle.getUnloadAfterMs()) {
                if (evictIfIdle(generation)) {
                    return false;
                }
                return isCurrent(generation);
            }
            if (idleMs > lifecycle.getSoftIdleMs()) {
                enforceIdleCeilings(idleMs);
            }
        } catch (RuntimeException e) {
            log.debug("model.monitor.cycle-error generation={} reason={}", generation, e.getMessage());
        }
        return isCurrent(generation);
    }

    private boolean isCurrent(long generation) {
        return slot.state() == ModelState.LOADED && slot.loadGeneration() == generation;
    }

    private boolean evictIfIdle(long generation) {
        slotLock.lock();
        try {
            if (!isCurrent(generation)) {
                return false;
            }
            long idleMs = idleMillis();
            if (idleMs <= lifecycle.getUnloadAfterMs()) {
                return false;
            }
            log.info("model.idle.unload idleMs={} generation={}", idleMs, generation);
            evictLocked("idle");
            return true;
        } finally {
            slotLock.unlock();
        }
    }

    private void enforceIdleCeilings(long idleMs) {
        ResourceSample sample = governor.sample();
        if (!sample.known()) {
            return;
        }
        if (sample.memoryMb() > lifecycle.getMaxIdleMemoryMb()) {
            log.info("model.idle.memory-high memoryMb={} limitMb={} idleMs={}",
                    String.format(Locale.ROOT, "%.0f", sample.memoryMb()), lifecycle.getMaxIdleMemoryMb(), idleMs);
            governor.reclaimMemory();
        }
        if (sample.cpuPercent() > lifecycle.getMaxIdleCpuPercent()) {
            log.info("model.idle.cpu-high cpuPercent={} limitPercent={} throttleMs={}",
                    String.format(Locale.ROOT, "%.1f", sample.cpuPercent()), lifecycle.getMaxIdleCpuPercent(), lifecycle.getCpuThrottleMs());
            try {
                Thread.sleep(lifecycle.getCpuThrottleMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void loadIfNeeded() throws GenerationException {
        slotLock.lock();
        try {
            if (slot.state() == ModelState.LOADED) {
                slot.touch(clock.millis());
                return;
            }

            ModelPathResolver.ResolvedModel resolved = pathResolver.resolve();
            if (!resolved.available()) {
                log.warn("model.unavailable reason={}", resolved.reason());
                throw new GenerationException(GenerationException.ErrorKind.MODEL_UNAVAILABLE, resolved.reason());
            }

            slot.beginLoading();
            long start = System.nanoTime();
            InferenceEngine engine;
            boolean loaded = false;
            try {
                engine = loader.load(resolved.path(), profile);
                loaded = true;
            } catch (InferenceException | RuntimeException e) {
                log.error("model.load.failed path={} reason={}", resolved.path(), e.getMessage(), e);
                throw new GenerationException(GenerationException.ErrorKind.MODEL_LOAD_FAILED,
                        "Model load failed: " + e.getMessage(), e);
            } finally {
                // errors such as OutOfMemoryError propagate, but never leave the slot LOADING
                if (!loaded) {
                    slot.loadFailed();
                }
            }
            long generation = slot.loaded(engine, clock.millis());
            log.info("model.load.success path={} generation={} elapsedMs={} contextWindowTokens={} threads={}",
                    resolved.path(), generation, (System.nanoTime() - start) / 1_000_000,
                    profile.contextWindowTokens(), profile.threads());

            governor.enterLowPower();
            startMonitor(generation);
        } finally {
            slotLock.unlock();
        }
    }

    private void startMonitor(long generation) {
        if (activeMonitor != null && activeMonitor.generation() == generation) {
            return;
        }
        IdleMonitor monitor = new IdleMonitor(this, generation, Duration.ofMillis(lifecycle.getMonitorIntervalMs()));
        activeMonitor = monitor;
        monitorThreadFactory.newThread(monitor).start();
    }

    private void evictLocked(String reason) {
        if (slot.state() != ModelState.LOADED) {
            return;
        }
        long generation = slot.loadGeneration();
        InferenceEngine engine = slot.beginEvicting();
        if (activeMonitor != null) {
            activeMonitor.cancel();
            activeMonitor = null;
        }
        try {
            engine.close();
        } catch (RuntimeException e) {
            log.warn("model.evict.close-failed generation={} reason={}", generation, e.getMessage());
        }
        slot.evicted();
        governor.enterNormalPower();
        governor.reclaimMemory();
        log.info("model.evicted reason={} generation={}", reason, generation);
    }

    private String retryWithSimplifiedPrompt(InferenceEngine engine, String prompt, GenerationParams params, String shortReply) {
        String simplePrompt = "Reply to: " + prompt.substring(0, Math.min(RETRY_PROMPT_CHARS, prompt.length())) + "\n\n";
        try {
            String retryReply = cleanReply(engine.infer(simplePrompt,
                    params.simplifiedRetry(lifecycle.getRetryMaxTokens(), lifecycle.getRetryTemperature())));
            if (retryReply.length() >= lifecycle.getMinReplyChars()) {
                return retryReply;
            }
        } catch (InferenceException | RuntimeException e) {
            log.debug("model.generate.retry-failed reason={}", e.toString());
        }
        return shortReply;
    }

    static String cleanReply(String raw) {
        if (raw == null) {
            return "";
        }
        String reply = raw.trim();
        for (String artefact : new String[] { "Reply:", "Email received:", "Email:" }) {
            reply = reply.replace(artefact, "");
        }
        reply = stripEdges(reply.trim(), "\"':-").trim();
        if (!reply.isEmpty() && Character.isLowerCase(reply.charAt(0))) {
            reply = Character.toUpperCase(reply.charAt(0)) + reply.substring(1);
        }
        return reply;
    }

    private static String stripEdges(String value, String characters) {
        int start = 0;
        int end = value.length();
        while (start < end && characters.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && characters.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
