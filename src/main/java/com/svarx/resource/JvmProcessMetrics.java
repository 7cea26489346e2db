package com.svarx.resource;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JvmProcessMetrics implements ProcessMetrics {
    private static final Logger log = LoggerFactory.getLogger(JvmProcessMetrics.class);
    private static final Path PROC_STATUS = Path.of("/proc/self/status");

    @Override
    public long residentMemoryBytes() {
        if (Files.isReadable(PROC_STATUS)) {
            try {
                long rss = parseVmRss(Files.readAllLines(PROC_STATUS));
                if (rss >= 0) {
                    return rss;
                }
            } catch (IOException e) {
                log.debug("resource.rss.unreadable path={} reason={}", PROC_STATUS, e.getMessage());
            }
        }
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }

    @Override
    public long processCpuTimeNanos() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            return sunOs.getProcessCpuTime();
        }
        return -1L;
    }

    @Override
    public long pid() {
        return ProcessHandle.current().pid();
    }

    static long parseVmRss(List<String> statusLines) {
        for (String line : statusLines) {
            if (!line.startsWith("VmRSS:")) {
                continue;
            }
            String[] parts = line.substring("VmRSS:".length()).trim().split("\\s+");
            try {
                return Long.parseLong(parts[0]) * 1024L;
            } catch (NumberFormatException e) {
                return -1L;
            }
        }
        return -1L;
    }
}
