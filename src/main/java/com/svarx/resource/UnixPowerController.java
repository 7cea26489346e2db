package com.svarx.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.runtime.CommandResult;
import com.svarx.runtime.CommandRunner;

/**
 * Uses {@code renice} for priority and, where present, {@code taskset} to pin the process to a
 * single core. Raising priority back to normal usually needs privileges the service does not have.
 */
class UnixPowerController implements PowerController {
    private static final Logger log = LoggerFactory.getLogger(UnixPowerController.class);
    private static final int LOW_PRIORITY_NICE = 19;
    private static final int NORMAL_PRIORITY_NICE = 0;

    private final CommandRunner commandRunner;
    private final int processorCount;
    private Boolean tasksetAvailable;

    UnixPowerController(CommandRunner commandRunner, int processorCount) {
        this.commandRunner = commandRunner;
        this.processorCount = Math.max(1, processorCount);
    }

    @Override
    public boolean applyLowPower(long pid) {
        boolean reniced = renice(pid, LOW_PRIORITY_NICE);
        boolean pinned = pin(pid, "0");
        return reniced && pinned;
    }

    @Override
    public boolean applyNormalPower(long pid) {
        boolean reniced = renice(pid, NORMAL_PRIORITY_NICE);
        boolean pinned = pin(pid, processorCount == 1 ? "0" : "0-" + (processorCount - 1));
        return reniced && pinned;
    }

    private boolean renice(long pid, int nice) {
        CommandResult result = commandRunner.run("renice", "-n", Integer.toString(nice), "-p", Long.toString(pid));
        if (!result.isSuccess()) {
            log.warn("resource.renice.failed pid={} nice={} result={}", pid, nice, result.describe());
            return false;
        }
        return true;
    }

    private boolean pin(long pid, String cpuList) {
        if (!tasksetAvailable()) {
            return true;
        }
        CommandResult result = commandRunner.run("taskset", "-a", "-p", "-c", cpuList, Long.toString(pid));
        if (!result.isSuccess()) {
            log.warn("resource.taskset.failed pid={} cpus={} result={}", pid, cpuList, result.describe());
            return false;
        }
        return true;
    }

    private synchronized boolean tasksetAvailable() {
        if (tasksetAvailable == null) {
            tasksetAvailable = commandRunner.isInstalled("taskset");
        }
        return tasksetAvailable;
    }
}
