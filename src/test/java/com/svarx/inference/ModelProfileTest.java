package com.svarx.inference;

import org.junit.jupiter.api.Test;

import com.svarx.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelProfileTest {

    @Test
    void shouldKeepSingleThreadAndCpuOnlyWhenConfigRaisesThem() {
        AppConfig.ModelConfig config = new AppConfig.ModelConfig();
        config.setThreads(8);
        config.setGpuLayers(35);
        config.setContextWindowTokens(512);

        ModelProfile profile = ModelProfile.fromConfig(config);

        assertEquals(1, profile.threads());
        assertEquals(0, profile.gpuLayers());
        assertEquals(512, profile.contextWindowTokens());
    }

    @Test
    void shouldCarryTunableSettingsFromDefaults() {
        ModelProfile profile = ModelProfile.fromConfig(new AppConfig.ModelConfig());

        assertEquals(new ModelProfile(256, 1, 32, true, 0), profile);
        assertTrue(profile.useMmap());
    }
}
