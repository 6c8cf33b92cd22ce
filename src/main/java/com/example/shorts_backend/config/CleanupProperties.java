package com.example.shorts_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Controls retention of finished jobs and their files.
 */
@ConfigurationProperties(prefix = "cleanup")
public class CleanupProperties {
    private long retentionHours = 24;
    private boolean deleteFiles = true;
    private boolean purgeOnShutdown = true;
    private long sweepIntervalMs = 3_600_000;

    public long getRetentionHours() {
        return retentionHours;
    }

    public void setRetentionHours(long retentionHours) {
        this.retentionHours = retentionHours;
    }

    public boolean isDeleteFiles() {
        return deleteFiles;
    }

    public void setDeleteFiles(boolean deleteFiles) {
        this.deleteFiles = deleteFiles;
    }

    public boolean isPurgeOnShutdown() {
        return purgeOnShutdown;
    }

    public void setPurgeOnShutdown(boolean purgeOnShutdown) {
        this.purgeOnShutdown = purgeOnShutdown;
    }

    public long getSweepIntervalMs() {
        return sweepIntervalMs;
    }

    public void setSweepIntervalMs(long sweepIntervalMs) {
        this.sweepIntervalMs = sweepIntervalMs;
    }
}
