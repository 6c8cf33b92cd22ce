package com.example.shorts_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configures pipeline concurrency and the analyzer pool.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int maxActivePipelines = 2;
    private int executorThreads = 4;
    private int executorQueueCapacity = 50;
    private int analyzerThreads = 5;
    private int analyzerQueueCapacity = 50;
    private long analyzerTimeoutSeconds = 600;

    public int getMaxActivePipelines() {
        return maxActivePipelines;
    }

    public void setMaxActivePipelines(int maxActivePipelines) {
        this.maxActivePipelines = maxActivePipelines;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    public void setExecutorThreads(int executorThreads) {
        this.executorThreads = executorThreads;
    }

    public int getExecutorQueueCapacity() {
        return executorQueueCapacity;
    }

    public void setExecutorQueueCapacity(int executorQueueCapacity) {
        this.executorQueueCapacity = executorQueueCapacity;
    }

    public int getAnalyzerThreads() {
        return analyzerThreads;
    }

    public void setAnalyzerThreads(int analyzerThreads) {
        this.analyzerThreads = analyzerThreads;
    }

    public int getAnalyzerQueueCapacity() {
        return analyzerQueueCapacity;
    }

    public void setAnalyzerQueueCapacity(int analyzerQueueCapacity) {
        this.analyzerQueueCapacity = analyzerQueueCapacity;
    }

    public long getAnalyzerTimeoutSeconds() {
        return analyzerTimeoutSeconds;
    }

    public void setAnalyzerTimeoutSeconds(long analyzerTimeoutSeconds) {
        this.analyzerTimeoutSeconds = analyzerTimeoutSeconds;
    }
}
