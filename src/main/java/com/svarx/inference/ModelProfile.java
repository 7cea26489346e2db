package com.svarx.inference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.svarx.runtime.AppConfig;

/**
 * Fixed load-time footprint of the model: small context, one thread, mmap'd weights, CPU only.
 * Thread count and GPU offload are not tunable; config values other than 1 and 0 are ignored.
 */
public record ModelProfile(
        int contextWindowTokens,
        int threads,
        int batchSize,
        boolean useMmap,
        int gpuLayers) {

    static final int INFERENCE_THREADS = 1;
    static final int GPU_LAYERS = 0;

    private static final Logger log = LoggerFactory.getLogger(ModelProfile.class);

    public static ModelProfile fromConfig(AppConfig.ModelConfig config) {
        if (config.getThreads() != INFERENCE_THREADS) {
            log.warn("model.profile.override-ignored setting=threads configured={} applied={}",
                    config.getThreads(), INFERENCE_THREADS);
        }
        if (config.getGpuLayers() != GPU_LAYERS) {
            log.warn("model.profile.override-ignored setting=gpuLayers configured={} applied={}",
                    config.getGpuLayers(), GPU_LAYERS);
        }
        return new ModelProfile(
                config.getContextWindowTokens(),
                INFERENCE_THREADS,
                config.getBatchSize(),
                config.isUseMmap(),
                GPU_LAYERS);
    }
}
