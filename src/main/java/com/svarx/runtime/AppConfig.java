package com.svarx.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ModelConfig model = new ModelConfig();
    private LifecycleConfig lifecycle = new LifecycleConfig();
    private StorageConfig storage = new StorageConfig();
    private LearningConfig learning = new LearningConfig();

    public ModelConfig getModel() {
        return model;
    }

    public void setModel(ModelConfig model) {
        this.model = model == null ? new ModelConfig() : model;
    }

    public LifecycleConfig getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(LifecycleConfig lifecycle) {
        this.lifecycle = lifecycle == null ? new LifecycleConfig() : lifecycle;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage == null ? new StorageConfig() : storage;
    }

    public LearningConfig getLearning() {
        return learning;
    }

    public void setLearning(LearningConfig learning) {
        this.learning = learning == null ? new LearningConfig() : learning;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelConfig {
        private String path;
        private String fileName = "Llama-3.2-3B-Instruct-Q4_K_M.gguf";
        private long minSizeBytes = 1000;
        private int contextWindowTokens = 256;
        private int threads = 1;
        private int batchSize = 32;
        private boolean useMmap = true;
        private int gpuLayers = 0;
        private String serverBinary = "llama-server";
        private String serverHost = "127.0.0.1";
        private int serverPort = 8082;
        private long startupTimeoutMs = 60000;
        private long requestTimeoutMs = 120000;
        private int maxTokens = 50;
        private double temperature = 0.5;
        private double topP = 0.8;
        private int topK = 15;
        private double repeatPenalty = 1.05;
        private List<String> stop = List.of("\n\nEmail:", "\n\nReply:", "\n---", "###", "\n\n\n");

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public String getFileName() {
            return fileName;
        }

        public void setFileName(String fileName) {
            this.fileName = fileName;
        }

        public long getMinSizeBytes() {
            return minSizeBytes;
        }

        public void setMinSizeBytes(long minSizeBytes) {
            this.minSizeBytes = minSizeBytes;
        }

        public int getContextWindowTokens() {
            return contextWindowTokens;
        }

        public void setContextWindowTokens(int contextWindowTokens) {
            this.contextWindowTokens = contextWindowTokens;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isUseMmap() {
            return useMmap;
        }

        public void setUseMmap(boolean useMmap) {
            this.useMmap = useMmap;
        }

        public int getGpuLayers() {
            return gpuLayers;
        }

        public void setGpuLayers(int gpuLayers) {
            this.gpuLayers = gpuLayers;
        }

        public String getServerBinary() {
            return serverBinary;
        }

        public void setServerBinary(String serverBinary) {
            this.serverBinary = serverBinary;
        }

        public String getServerHost() {
            return serverHost;
        }

        public void setServerHost(String serverHost) {
            this.serverHost = serverHost;
        }

        public int getServerPort() {
            return serverPort;
        }

        public void setServerPort(int serverPort) {
            this.serverPort = serverPort;
        }

        public long getStartupTimeoutMs() {
            return startupTimeoutMs;
        }

        public void setStartupTimeoutMs(long startupTimeoutMs) {
            this.startupTimeoutMs = startupTimeoutMs;
        }

        public long getRequestTimeoutMs() {
            return requestTimeoutMs;
        }

        public void setRequestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public double getTopP() {
            return topP;
        }

        public void setTopP(double topP) {
            this.topP = topP;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getRepeatPenalty() {
            return repeatPenalty;
        }

        public void setRepeatPenalty(double repeatPenalty) {
            this.repeatPenalty = repeatPenalty;
        }

        public List<String> getStop() {
            return stop;
        }

        public void setStop(List<String> stop) {
            this.stop = stop == null ? List.of() : stop;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LifecycleConfig {
        private long unloadAfterMs = 60000;
        private long softIdleMs = 30000;
        private long monitorIntervalMs = 15000;
        private long maxIdleMemoryMb = 500;
        private double maxIdleCpuPercent = 5.0;
        private long cpuThrottleMs = 2000;
        private int minReplyChars = 5;
        private int retryMaxTokens = 60;
        private double retryTemperature = 0.9;

        public long getUnloadAfterMs() {
            return unloadAfterMs;
        }

        public void setUnloadAfterMs(long unloadAfterMs) {
            this.unloadAfterMs = unloadAfterMs;
        }

        public long getSoftIdleMs() {
            return softIdleMs;
        }

        public void setSoftIdleMs(long softIdleMs) {
            this.softIdleMs = softIdleMs;
        }

        public long getMonitorIntervalMs() {
            return monitorIntervalMs;
        }

        public void setMonitorIntervalMs(long monitorIntervalMs) {
            this.monitorIntervalMs = monitorIntervalMs;
        }

        public long getMaxIdleMemoryMb() {
            return maxIdleMemoryMb;
        }

        public void setMaxIdleMemoryMb(long maxIdleMemoryMb) {
            this.maxIdleMemoryMb = maxIdleMemoryMb;
        }

        public double getMaxIdleCpuPercent() {
            return maxIdleCpuPercent;
        }

        public void setMaxIdleCpuPercent(double maxIdleCpuPercent) {
            this.maxIdleCpuPercent = maxIdleCpuPercent;
        }

        public long getCpuThrottleMs() {
            return cpuThrottleMs;
        }

        public void setCpuThrottleMs(long cpuThrottleMs) {
            this.cpuThrottleMs = cpuThrottleMs;
        }

        public int getMinReplyChars() {
            return minReplyChars;
        }

        public void setMinReplyChars(int minReplyChars) {
            this.minReplyChars = minReplyChars;
        }

        public int getRetryMaxTokens() {
            return retryMaxTokens;
        }

        public void setRetryMaxTokens(int retryMaxTokens) {
            this.retryMaxTokens = retryMaxTokens;
        }

        public double getRetryTemperature() {
            return retryTemperature;
        }

        public void setRetryTemperature(double retryTemperature) {
            this.retryTemperature = retryTemperature;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StorageConfig {
        private String dbPath = "personalization.db";
        private long maxDbSizeMb = 5120;
        private long maxDbSizeBytes = 0;
        private int maxSamples = 50000;
        private int maxTrainingPairs = 25000;
        private int maxInteractions = 100000;
        private int maxEmailPatterns = 100;
        private int minSampleChars = 10;
        private int minOriginalChars = 20;
        private int minReplyChars = 10;
        private int feedbackTextCap = 200;
        private double weakSignalThreshold = 0.3;
        private int staleFeedbackDays = 30;
        private double staleFeedbackMaxWeight = 0.5;
        private int qualityRatingThreshold = 4;
        private double valuableWeightThreshold = 0.5;
        private double deepWeightThreshold = 0.7;
        private int deepRecentDays = 7;
        private int deepMinSampleChars = 30;
        private double deepCleanupRatio = 0.9;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }

        public long getMaxDbSizeMb() {
            return maxDbSizeMb;
        }

        public void setMaxDbSizeMb(long maxDbSizeMb) {
            this.maxDbSizeMb = maxDbSizeMb;
        }

        public long getMaxDbSizeBytes() {
            return maxDbSizeBytes;
        }

        public void setMaxDbSizeBytes(long maxDbSizeBytes) {
            this.maxDbSizeBytes = maxDbSizeBytes;
        }

        public long budgetBytes() {
            return maxDbSizeBytes > 0 ? maxDbSizeBytes : maxDbSizeMb * 1024L * 1024L;
        }

        public int getMaxSamples() {
            return maxSamples;
        }

        public void setMaxSamples(int maxSamples) {
            this.maxSamples = maxSamples;
        }

        public int getMaxTrainingPairs() {
            return maxTrainingPairs;
        }

        public void setMaxTrainingPairs(int maxTrainingPairs) {
            this.maxTrainingPairs = maxTrainingPairs;
        }

        public int getMaxInteractions() {
            return maxInteractions;
        }

        public void setMaxInteractions(int maxInteractions) {
            this.maxInteractions = maxInteractions;
        }

        public int getMaxEmailPatterns() {
            return maxEmailPatterns;
        }

        public void setMaxEmailPatterns(int maxEmailPatterns) {
            this.maxEmailPatterns = maxEmailPatterns;
        }

        public int getMinSampleChars() {
            return minSampleChars;
        }

        public void setMinSampleChars(int minSampleChars) {
            this.minSampleChars = minSampleChars;
        }

        public int getMinOriginalChars() {
            return minOriginalChars;
        }

        public void setMinOriginalChars(int minOriginalChars) {
            this.minOriginalChars = minOriginalChars;
        }

        public int getMinReplyChars() {
            return minReplyChars;
        }

        public void setMinReplyChars(int minReplyChars) {
            this.minReplyChars = minReplyChars;
        }

        public int getFeedbackTextCap() {
            return feedbackTextCap;
        }

        public void setFeedbackTextCap(int feedbackTextCap) {
            this.feedbackTextCap = feedbackTextCap;
        }

        public double getWeakSignalThreshold() {
            return weakSignalThreshold;
        }

        public void setWeakSignalThreshold(double weakSignalThreshold) {
            this.weakSignalThreshold = weakSignalThreshold;
        }

        public int getStaleFeedbackDays() {
            return staleFeedbackDays;
        }

        public void setStaleFeedbackDays(int staleFeedbackDays) {
            this.staleFeedbackDays = staleFeedbackDays;
        }

        public double getStaleFeedbackMaxWeight() {
            return staleFeedbackMaxWeight;
        }

        public void setStaleFeedbackMaxWeight(double staleFeedbackMaxWeight) {
            this.staleFeedbackMaxWeight = staleFeedbackMaxWeight;
        }

        public int getQualityRatingThreshold() {
            return qualityRatingThreshold;
        }

        public void setQualityRatingThreshold(int qualityRatingThreshold) {
            this.qualityRatingThreshold = qualityRatingThreshold;
        }

        public double getValuableWeightThreshold() {
            return valuableWeightThreshold;
        }

        public void setValuableWeightThreshold(double valuableWeightThreshold) {
            this.valuableWeightThreshold = valuableWeightThreshold;
        }

        public double getDeepWeightThreshold() {
            return deepWeightThreshold;
        }

        public void setDeepWeightThreshold(double deepWeightThreshold) {
            this.deepWeightThreshold = deepWeightThreshold;
        }

        public int getDeepRecentDays() {
            return deepRecentDays;
        }

        public void setDeepRecentDays(int deepRecentDays) {
            this.deepRecentDays = deepRecentDays;
        }

        public int getDeepMinSampleChars() {
            return deepMinSampleChars;
        }

        public void setDeepMinSampleChars(int deepMinSampleChars) {
            this.deepMinSampleChars = deepMinSampleChars;
        }

        public double getDeepCleanupRatio() {
            return deepCleanupRatio;
        }

        public void setDeepCleanupRatio(double deepCleanupRatio) {
            this.deepCleanupRatio = deepCleanupRatio;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LearningConfig {
        private boolean enabled = true;
        private long periodMs = 120000;
        private long maxMemoryMb = 400;
        private double maxCpuPercent = 2.0;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getPeriodMs() {
            return periodMs;
        }

        public void setPeriodMs(long periodMs) {
            this.periodMs = periodMs;
        }

        public long getMaxMemoryMb() {
            return maxMemoryMb;
        }

        public void setMaxMemoryMb(long maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
        }

        public double getMaxCpuPercent() {
            return maxCpuPercent;
        }

        public void setMaxCpuPercent(double maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
        }
    }
}
