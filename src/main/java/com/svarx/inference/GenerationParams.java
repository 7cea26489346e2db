package com.svarx.inference;

import java.util.List;

import com.svarx.runtime.AppConfig;

public record GenerationParams(
        int maxTokens,
        double temperature,
        double topP,
        int topK,
        double repeatPenalty,
        List<String> stop) {

    public GenerationParams {
        stop = stop == null ? List.of() : List.copyOf(stop);
    }

    public static GenerationParams fromConfig(AppConfig.ModelConfig config) {
        return new GenerationParams(
                config.getMaxTokens(),
                config.getTemperature(),
                config.getTopP(),
                config.getTopK(),
                config.getRepeatPenalty(),
                config.getStop());
    }

    GenerationParams simplifiedRetry(int retryMaxTokens, double retryTemperature) {
        return new GenerationParams(retryMaxTokens, retryTemperature, topP, topK, repeatPenalty, List.of("\n"));
    }
}
