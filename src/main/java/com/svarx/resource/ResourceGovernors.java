package com.svarx.resource;

import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.runtime.CommandRunner;

public final class ResourceGovernors {
    private static final Logger log = LoggerFactory.getLogger(ResourceGovernors.class);

    private ResourceGovernors() {
    }

    public static ResourceGovernor forCurrentPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        ProcessMetrics metrics = new JvmProcessMetrics();
        PowerController power;
        if (os.contains("linux") || os.contains("mac") || os.contains("darwin")) {
            power = new UnixPowerController(new CommandRunner(Duration.ofSeconds(5)), Runtime.getRuntime().availableProcessors());
        } else {
            log.info("resource.governor.power-hints unsupported os={}; priority changes disabled", os);
            power = new NoopPowerController();
        }
        return new ProcessResourceGovernor(metrics, power, Duration.ofMillis(500));
    }

    static final class NoopPowerController implements PowerController {
        @Override
        public boolean applyLowPower(long pid) {
            return false;
        }

        @Override
        public boolean applyNormalPower(long pid) {
            return false;
        }
    }
}
