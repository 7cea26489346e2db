package com.svarx.resource;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProcessResourceGovernor implements ResourceGovernor {
    private static final Logger log = LoggerFactory.getLogger(ProcessResourceGovernor.class);

    private final ProcessMetrics metrics;
    private final PowerController powerController;
    private final Duration cpuWindow;
    private final AtomicReference<PowerMode> powerMode = new AtomicReference<>(PowerMode.NORMAL);
    private final AtomicReference<ResourceSample> lastSample = new AtomicReference<>(ResourceSample.UNKNOWN);

    ProcessResourceGovernor(ProcessMetrics metrics, PowerController powerController, Duration cpuWindow) {
        this.metrics = metrics;
        this.powerController = powerController;
        this.cpuWindow = cpuWindow;
    }

    @Override
    public void enterLowPower() {
        try {
            boolean applied = powerController.applyLowPower(metrics.pid());
            powerMode.set(PowerMode.LOW);
            log.info("resource.power.low applied={}", applied);
        } catch (RuntimeException e) {
            log.warn("resource.power.low.failed reason={}", e.getMessage());
        }
    }

    @Override
    public void enterNormalPower() {
        try {
            boolean applied = powerController.applyNormalPower(metrics.pid());
            powerMode.set(PowerMode.NORMAL);
            log.info("resource.power.normal applied={}", applied);
        } catch (RuntimeException e) {
            log.warn("resource.power.normal.failed reason={}", e.getMessage());
        }
    }

    @Override
    public PowerMode powerMode() {
        return powerMode.get();
    }

    @Override
    public ResourceSample sample() {
        try {
            double cpu = sampleCpuPercent();
            ResourceSample sample = new ResourceSample(metrics.residentMemoryBytes(), cpu);
            lastSample.set(sample);
            return sample;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return lastSample.get();
        } catch (RuntimeException e) {
            log.debug("resource.sample.failed reason={}", e.getMessage());
            return ResourceSample.UNKNOWN;
        }
    }

    @Override
    public void reclaimMemory() {
        System.gc();
    }

    private double sampleCpuPercent() throws InterruptedException {
        long cpuStart = metrics.processCpuTimeNanos();
        long wallStart = System.nanoTime();
        if (cpuStart < 0) {
            return -1.0;
        }
        Thread.sleep(cpuWindow.toMillis());
        long cpuEnd = metrics.processCpuTimeNanos();
        long wallElapsed = System.nanoTime() - wallStart;
        return cpuPercent(cpuEnd - cpuStart, wallElapsed);
    }

    /**
     * Relative to a single core: a process keeping two cores busy reports 200.
     */
    static double cpuPercent(long cpuNanos, long wallNanos) {
        if (cpuNanos < 0 || wallNanos <= 0) {
            return 0.0;
        }
        return cpuNanos * 100.0 / wallNanos;
    }
}
