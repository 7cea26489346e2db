package com.svarx.inference;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the slot of one load generation. Stops on cancel, when the generation moves on, or once
 * the manager reports that the slot was evicted.
 */
final class IdleMonitor implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(IdleMonitor.class);

    private final ModelLifecycleManager manager;
    private final long generation;
    private final Duration interval;
    private final CountDownLatch cancelled = new CountDownLatch(1);

    IdleMonitor(ModelLifecycleManager manager, long generation, Duration interval) {
        this.manager = manager;
        this.generation = generation;
        this.interval = interval;
    }

    @Override
    public void run() {
        log.debug("model.monitor.start generation={}", generation);
        try {
            while (!cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS)) {
                if (!manager.monitorCycle(generation)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("model.monitor.stop generation={}", generation);
    }

    void cancel() {
        cancelled.countDown();
    }

    long generation() {
        return generation;
    }
}
