package com.ytarchive.config;

import com.ytarchive.recovery.RetryConfig;
import com.ytarchive.recovery.strategy.StrategyType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "ytarchive")
public class YtArchiveProperties {

    private final Storage storage = new Storage();
    private final BackgroundJobServer backgroundJobServer = new BackgroundJobServer();
    private final Batch batch = new Batch();
    private final Recovery recovery = new Recovery();

    public Storage getStorage() {
        return storage;
    }

    public BackgroundJobServer getBackgroundJobServer() {
        return backgroundJobServer;
    }

    public Batch getBatch() {
        return batch;
    }

    public Recovery getRecovery() {
        return recovery;
    }

    public static class Storage {
        private String baseDir = "ytarchive-data";
        private String jobsDir = "jobs";
        private String reportsDir = "logs/error_reports";
        private String recoveryPlanFile = "recovery_plan.json";

        public String getBaseDir() {
            return baseDir;
        }

        public void setBaseDir(String baseDir) {
            this.baseDir = baseDir;
        }

        public String getJobsDir() {
            return jobsDir;
        }

        public void setJobsDir(String jobsDir) {
            this.jobsDir = jobsDir;
        }

        public String getReportsDir() {
            return reportsDir;
        }

        public void setReportsDir(String reportsDir) {
            this.reportsDir = reportsDir;
        }

        public String getRecoveryPlanFile() {
            return recoveryPlanFile;
        }

        public void setRecoveryPlanFile(String recoveryPlanFile) {
            this.recoveryPlanFile = recoveryPlanFile;
        }
    }

    public static class BackgroundJobServer {
        private boolean enabled = true;
        private int workerCount = 10;
        private int jobRunnerCount = 2;
        private String deleteSucceededJobsAfter = "36h";
        private String deleteFailedJobsAfter = "72h";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public int getJobRunnerCount() {
            return jobRunnerCount;
        }

        public void setJobRunnerCount(int jobRunnerCount) {
            this.jobRunnerCount = jobRunnerCount;
        }

        public String getDeleteSucceededJobsAfter() {
            return deleteSucceededJobsAfter;
        }

        public void setDeleteSucceededJobsAfter(String deleteSucceededJobsAfter) {
            this.deleteSucceededJobsAfter = deleteSucceededJobsAfter;
        }

        public String getDeleteFailedJobsAfter() {
            return deleteFailedJobsAfter;
        }

        public void setDeleteFailedJobsAfter(String deleteFailedJobsAfter) {
            this.deleteFailedJobsAfter = deleteFailedJobsAfter;
        }
    }

    public static class Batch {
        private int defaultConcurrency = 3;
        private int largeBatchConcurrency = 5;
        private int largeBatchThreshold = 100;
        private int maxConcurrency = 10;
        private int minChunkSize = 10;
        private int maxChunkSize = 50;
        private int chunkDivisor = 5;

        public int getDefaultConcurrency() {
            return defaultConcurrency;
        }

        public void setDefaultConcurrency(int defaultConcurrency) {
            this.defaultConcurrency = defaultConcurrency;
        }

        public int getLargeBatchConcurrency() {
            return largeBatchConcurrency;
        }

        public void setLargeBatchConcurrency(int largeBatchConcurrency) {
            this.largeBatchConcurrency = largeBatchConcurrency;
        }

        public int getLargeBatchThreshold() {
            return largeBatchThreshold;
        }

        public void setLargeBatchThreshold(int largeBatchThreshold) {
            this.largeBatchThreshold = largeBatchThreshold;
        }

        public int getMaxConcurrency() {
            return maxConcurrency;
        }

        public void setMaxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
        }

        public int getMinChunkSize() {
            return minChunkSize;
        }

        public void setMinChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
        }

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public int getChunkDivisor() {
            return chunkDivisor;
        }

        public void setChunkDivisor(int chunkDivisor) {
            this.chunkDivisor = chunkDivisor;
        }
    }

    public static class Recovery {
        private final Service metadata = new Service(StrategyType.ADAPTIVE);
        private final Service download = new Service(StrategyType.EXPONENTIAL_BACKOFF);
        private final Service storage = new Service(StrategyType.CIRCUIT_BREAKER);
        private int adaptiveWindowSize = 10;
        private int adaptiveMinSamples = 5;
        private double adaptiveSuccessFloor = 0.1;
        private Duration planRetryAfter = Duration.ofHours(24);

        public Service getMetadata() {
            return metadata;
        }

        public Service getDownload() {
            return download;
        }

        public Service getStorage() {
            return storage;
        }

        public int getAdaptiveWindowSize() {
            return adaptiveWindowSize;
        }

        public void setAdaptiveWindowSize(int adaptiveWindowSize) {
            this.adaptiveWindowSize = adaptiveWindowSize;
        }

        public int getAdaptiveMinSamples() {
            return adaptiveMinSamples;
        }

        public void setAdaptiveMinSamples(int adaptiveMinSamples) {
            this.adaptiveMinSamples = adaptiveMinSamples;
        }

        public double getAdaptiveSuccessFloor() {
            return adaptiveSuccessFloor;
        }

        public void setAdaptiveSuccessFloor(double adaptiveSuccessFloor) {
            this.adaptiveSuccessFloor = adaptiveSuccessFloor;
        }

        public Duration getPlanRetryAfter() {
            return planRetryAfter;
        }

        public void setPlanRetryAfter(Duration planRetryAfter) {
            this.planRetryAfter = planRetryAfter;
        }

        public RetryConfig toRetryConfig(Service service) {
            return RetryConfig.builder()
                    .maxAttempts(service.getMaxAttempts())
                    .baseDelay(service.getBaseDelay())
                    .maxDelay(service.getMaxDelay())
                    .backoffFactor(service.getBackoffFactor())
                    .jitterFraction(service.getJitterFraction())
                    .failureThreshold(service.getFailureThreshold())
                    .resetTimeout(service.getResetTimeout())
                    .windowSize(adaptiveWindowSize)
                    .minSamples(adaptiveMinSamples)
                    .successFloor(adaptiveSuccessFloor)
                    .build();
        }
    }

    /**
     * Retry tuning for one collaborator.
     */
    public static class Service {
        private StrategyType strategy;
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofMinutes(5);
        private double backoffFactor = 2.0;
        private double jitterFraction = 0.2;
        private int failureThreshold = 5;
        private Duration resetTimeout = Duration.ofSeconds(60);

        public Service() {
            this(StrategyType.EXPONENTIAL_BACKOFF);
        }

        Service(StrategyType strategy) {
            this.strategy = strategy;
        }

        public StrategyType getStrategy() {
            return strategy;
        }

        public void setStrategy(StrategyType strategy) {
            this.strategy = strategy;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getBackoffFactor() {
            return backoffFactor;
        }

        public void setBackoffFactor(double backoffFactor) {
            this.backoffFactor = backoffFactor;
        }

        public double getJitterFraction() {
            return jitterFraction;
        }

        public void setJitterFraction(double jitterFraction) {
            this.jitterFraction = jitterFraction;
        }

        public int getFailureThreshold() {
            return failureThreshold;
        }

        public void setFailureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
        }

        public Duration getResetTimeout() {
            return resetTimeout;
        }

        public void setResetTimeout(Duration resetTimeout) {
            this.resetTimeout = resetTimeout;
        }
    }
}
