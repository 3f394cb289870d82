package com.kmg.receipts.config;

import com.kmg.receipts.model.ProcessingStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "receipts")
public class ReceiptsProperties {
    @NotBlank
    private String baseDir;
    @NotNull
    private Storage storage = new Storage();
    @NotNull
    private State state = new State();
    @NotNull
    private Logs logs = new Logs();
    @Valid
    @NotNull
    private Queue queue = new Queue();
    @Valid
    @NotNull
    private Worker worker = new Worker();
    @Valid
    private Map<String, Provider> providers = new LinkedHashMap<>();
    @Valid
    private List<Model> models = new ArrayList<>();
    @Valid
    @NotNull
    private Defaults defaults = new Defaults();
    @Valid
    @NotNull
    private Extraction extraction = new Extraction();
    @Valid
    @NotNull
    private Batch batch = new Batch();

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public List<Model> getModels() {
        return models;
    }

    public void setModels(List<Model> models) {
        this.models = models;
    }

    public Defaults getDefaults() {
        return defaults;
    }

    public void setDefaults(Defaults defaults) {
        this.defaults = defaults;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public static class Storage {
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class State {
        private String dbPath;

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        private String dir;

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Queue {
        @Min(0)
        private int maxRetries = 3;
        @Min(1)
        private long backoffBaseMs = 5000;
        @DecimalMin("1.0")
        private double backoffMultiplier = 1.5;
        @Min(1)
        private long backoffMaxMs = 30000;
        @Min(1)
        private int retentionDays = 7;
        @Min(1)
        private int metricRetentionDays = 30;

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getBackoffBaseMs() {
            return backoffBaseMs;
        }

        public void setBackoffBaseMs(long backoffBaseMs) {
            this.backoffBaseMs = backoffBaseMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public long getBackoffMaxMs() {
            return backoffMaxMs;
        }

        public void setBackoffMaxMs(long backoffMaxMs) {
            this.backoffMaxMs = backoffMaxMs;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public int getMetricRetentionDays() {
            return metricRetentionDays;
        }

        public void setMetricRetentionDays(int metricRetentionDays) {
            this.metricRetentionDays = metricRetentionDays;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        @Min(1)
        private int count = 2;
        @Min(1)
        private int capacity = 3;
        @NotBlank
        private String idPrefix = "worker";
        @Min(1)
        private long pollIntervalMs = 5000;
        @Min(1)
        private long heartbeatIntervalMs = 10000;
        @Min(1)
        private long staleAfterMs = 60000;
        @Min(0)
        private long admissionBackoffMs = 2000;
        @Min(1)
        private long maintenanceIntervalMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public String getIdPrefix() {
            return idPrefix;
        }

        public void setIdPrefix(String idPrefix) {
            this.idPrefix = idPrefix;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getHeartbeatIntervalMs() {
            return heartbeatIntervalMs;
        }

        public void setHeartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
        }

        public long getStaleAfterMs() {
            return staleAfterMs;
        }

        public void setStaleAfterMs(long staleAfterMs) {
            this.staleAfterMs = staleAfterMs;
        }

        public long getAdmissionBackoffMs() {
            return admissionBackoffMs;
        }

        public void setAdmissionBackoffMs(long admissionBackoffMs) {
            this.admissionBackoffMs = admissionBackoffMs;
        }

        public long getMaintenanceIntervalMs() {
            return maintenanceIntervalMs;
        }

        public void setMaintenanceIntervalMs(long maintenanceIntervalMs) {
            this.maintenanceIntervalMs = maintenanceIntervalMs;
        }
    }

    public static class Provider {
        @NotBlank
        private String baseUrl;
        private String apiKey;
        @Min(1)
        private int connectTimeoutMs = 5000;
        @Min(1)
        private int readTimeoutMs = 60000;
        @Min(1)
        private int requestsPerMinute = 60;
        @Min(1)
        private long tokensPerMinute = 100000;
        @Min(1)
        private long windowMs = 60000;
        @Min(0)
        private long cooldownMs = 60000;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public int getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getReadTimeoutMs() {
            return readTimeoutMs;
        }

        public void setReadTimeoutMs(int readTimeoutMs) {
            this.readTimeoutMs = readTimeoutMs;
        }

        public int getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(int requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public long getTokensPerMinute() {
            return tokensPerMinute;
        }

        public void setTokensPerMinute(long tokensPerMinute) {
            this.tokensPerMinute = tokensPerMinute;
        }

        public long getWindowMs() {
            return windowMs;
        }

        public void setWindowMs(long windowMs) {
            this.windowMs = windowMs;
        }

        public long getCooldownMs() {
            return cooldownMs;
        }

        public void setCooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
        }
    }

    public static class Model {
        @NotBlank
        private String id;
        private String name;
        @NotBlank
        private String provider;
        private String providerModel;
        private double temperature = 0.2;
        @Min(1)
        private int maxTokens = 2048;
        private boolean supportsText = true;
        private boolean supportsVision = false;
        private boolean supportsEmbedding = false;
        private String fallbackModel;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getProviderModel() {
            return providerModel;
        }

        public void setProviderModel(String providerModel) {
            this.providerModel = providerModel;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public boolean isSupportsText() {
            return supportsText;
        }

        public void setSupportsText(boolean supportsText) {
            this.supportsText = supportsText;
        }

        public boolean isSupportsVision() {
            return supportsVision;
        }

        public void setSupportsVision(boolean supportsVision) {
            this.supportsVision = supportsVision;
        }

        public boolean isSupportsEmbedding() {
            return supportsEmbedding;
        }

        public void setSupportsEmbedding(boolean supportsEmbedding) {
            this.supportsEmbedding = supportsEmbedding;
        }

        public String getFallbackModel() {
            return fallbackModel;
        }

        public void setFallbackModel(String fallbackModel) {
            this.fallbackModel = fallbackModel;
        }
    }

    public static class Defaults {
        @NotBlank
        private String textModel = "gemini-2.0-flash-lite";
        @NotBlank
        private String visionModel = "gemini-2.0-flash-lite";
        @NotBlank
        private String embeddingModel = "text-embedding-004";

        public String getTextModel() {
            return textModel;
        }

        public void setTextModel(String textModel) {
            this.textModel = textModel;
        }

        public String getVisionModel() {
            return visionModel;
        }

        public void setVisionModel(String visionModel) {
            this.visionModel = visionModel;
        }

        public String getEmbeddingModel() {
            return embeddingModel;
        }

        public void setEmbeddingModel(String embeddingModel) {
            this.embeddingModel = embeddingModel;
        }
    }

    public static class Extraction {
        @NotBlank
        private String defaultCurrency = "MYR";
        @Min(0)
        private int defaultCurrencyConfidence = 50;
        @Min(1)
        private long estimatedTokens = 1500;

        public String getDefaultCurrency() {
            return defaultCurrency;
        }

        public void setDefaultCurrency(String defaultCurrency) {
            this.defaultCurrency = defaultCurrency;
        }

        public int getDefaultCurrencyConfidence() {
            return defaultCurrencyConfidence;
        }

        public void setDefaultCurrencyConfidence(int defaultCurrencyConfidence) {
            this.defaultCurrencyConfidence = defaultCurrencyConfidence;
        }

        public long getEstimatedTokens() {
            return estimatedTokens;
        }

        public void setEstimatedTokens(long estimatedTokens) {
            this.estimatedTokens = estimatedTokens;
        }
    }

    public static class Batch {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double failureThreshold = 0.5;
        @NotNull
        private ProcessingStrategy defaultStrategy = ProcessingStrategy.BALANCED;

        public double getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(double failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public ProcessingStrategy getDefaultStrategy() {
            return defaultStrategy;
        }

        public void setDefaultStrategy(ProcessingStrategy defaultStrategy) {
            this.defaultStrategy = defaultStrategy;
        }
    }
}
