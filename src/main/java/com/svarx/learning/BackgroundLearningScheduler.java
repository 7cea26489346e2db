package com.svarx.learning;

import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.inference.ModelLifecycleManager;
import com.svarx.inference.ModelState;
import com.svarx.resource.ResourceGovernor;
import com.svarx.resource.ResourceSample;
import com.svarx.runtime.AppConfig;
import com.svarx.store.CleanupReport;
import com.svarx.store.PersistenceStore;

/**
 * Rotates through maintenance tasks on a fixed period, one task per period, and only while the
 * model is unloaded and the process is quiet. A period that fails the gate is skipped, not queued.
 */
public class BackgroundLearningScheduler {
    private static final Logger log = LoggerFactory.getLogger(BackgroundLearningScheduler.class);
    private static final long STOP_JOIN_MS = 5_000;

    private final PersistenceStore store;
    private final StyleAnalyzer analyzer;
    private final StyleSummaryCache summaryCache;
    private final ResourceGovernor governor;
    private final AppConfig.LearningConfig config;
    private final Supplier<ModelState> modelState;
    private final ThreadFactory threadFactory;
    private final AtomicLong cycles = new AtomicLong();

    private CountDownLatch stopSignal;
    private Thread worker;

    public BackgroundLearningScheduler(
            PersistenceStore store,
            StyleAnalyzer analyzer,
            StyleSummaryCache summaryCache,
            ResourceGovernor governor,
            AppConfig.LearningConfig config,
            ModelLifecycleManager manager) {
        this(store, analyzer, summaryCache, governor, config, manager::state, runnable -> {
            Thread thread = new Thread(runnable, "svarx-background-learning");
            thread.setDaemon(true);
            return thread;
        });
    }

    BackgroundLearningScheduler(
            PersistenceStore store,
            StyleAnalyzer analyzer,
            StyleSummaryCache summaryCache,
            ResourceGovernor governor,
            AppConfig.LearningConfig config,
            Supplier<ModelState> modelState,
            ThreadFactory threadFactory) {
        this.store = store;
        this.analyzer = analyzer;
        this.summaryCache = summaryCache;
        this.governor = governor;
        this.config = config;
        this.modelState = modelState;
        this.threadFactory = threadFactory;
    }

    public synchronized void start() {
        if (!config.isEnabled()) {
            log.info("learning.scheduler.disabled");
            return;
        }
        if (worker != null && worker.isAlive()) {
            return;
        }
        if (config.getPeriodMs() <= 0) {
            throw new IllegalArgumentException("learning.periodMs must be > 0");
        }
        CountDownLatch signal = new CountDownLatch(1);
        stopSignal = signal;
        worker = threadFactory.newThread(() -> runLoop(signal));
        worker.start();
        log.info("learning.scheduler.started periodMs={} maxMemoryMb={} maxCpuPercent={}",
                config.getPeriodMs(), config.getMaxMemoryMb(), config.getMaxCpuPercent());
    }

    public synchronized void stop() {
        if (stopSignal == null) {
            return;
        }
        stopSignal.countDown();
        Thread current = worker;
        stopSignal = null;
        worker = null;
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(STOP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("learning.scheduler.stopped cycles={}", cycles.get());
    }

    public synchronized boolean isRunning() {
        return worker != null && worker.isAlive();
    }

    private void runLoop(CountDownLatch signal) {
        try {
            while (!signal.await(config.getPeriodMs(), TimeUnit.MILLISECONDS)) {
                runCycle();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One period: advances the rotation and runs its task if the gate allows.
     */
    CycleResult runCycle() {
        long cycle = cycles.getAndIncrement();
        Task task = Task.values()[(int) (cycle % Task.values().length)];

        ModelState state = modelState.get();
        if (state != ModelState.UNLOADED) {
            log.debug("learning.cycle.skipped cycle={} task={} reason=model-{}", cycle, task, state);
            return CycleResult.skipped(task, "model " + state.name().toLowerCase(Locale.ROOT));
        }
        ResourceSample sample = governor.sample();
        if (!sample.known() || sample.exceeds(config.getMaxMemoryMb(), config.getMaxCpuPercent())) {
            log.debug("learning.cycle.skipped cycle={} task={} reason=resources memoryMb={} cpuPercent={}",
                    cycle, task, String.format(Locale.ROOT, "%.0f", sample.memoryMb()),
                    String.format(Locale.ROOT, "%.1f", sample.cpuPercent()));
            return CycleResult.skipped(task, "resources elevated");
        }

        try {
            String detail = runTask(task);
            log.info("learning.cycle.complete cycle={} task={} {}", cycle, task, detail);
            return CycleResult.completed(task, detail);
        } catch (RuntimeException e) {
            log.warn("learning.cycle.failed cycle={} task={} reason={}", cycle, task, e.getMessage(), e);
            return CycleResult.error(task, String.valueOf(e.getMessage()));
        }
    }

    long cycles() {
        return cycles.get();
    }

    private String runTask(Task task) {
        switch (task) {
            case PATTERN_ANALYSIS: {
                StyleAnalyzer.UserPatterns patterns = analyzer.analyzePatterns();
                return "preferredTone=" + patterns.preferredTone() + " formality=" + patterns.formalityStyle();
            }
            case STORAGE_MAINTENANCE: {
                CleanupReport report = store.cleanup();
                return "removed=" + report.totalRemoved() + " sizeAfterBytes=" + report.sizeAfterBytes();
            }
            case FEEDBACK_AGGREGATION: {
                StyleAnalyzer.FeedbackPatterns patterns = analyzer.feedbackPatterns();
                return "positive=" + patterns.positive().size() + " negative=" + patterns.negative().size();
            }
            case SUMMARY_WARMUP: {
                StyleSummaryCache.CachedSummary summary = summaryCache.refresh();
                return "summaryChars=" + summary.summary().length();
            }
            default:
                throw new IllegalStateException("Unknown task " + task);
        }
    }

    public enum Task {
        PATTERN_ANALYSIS,
        STORAGE_MAINTENANCE,
        FEEDBACK_AGGREGATION,
        SUMMARY_WARMUP
    }

    public record CycleResult(Task task, boolean ran, boolean failed, String detail) {
        static CycleResult completed(Task task, String detail) {
            return new CycleResult(task, true, false, detail);
        }

        static CycleResult skipped(Task task, String reason) {
            return new CycleResult(task, false, false, reason);
        }

        static CycleResult error(Task task, String reason) {
            return new CycleResult(task, false, true, reason);
        }
    }
}
