package com.example.shorts_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "storage.local")
public class StorageProperties {
    private String baseDir = "./temp";
    private String downloadsPrefix = "downloads";
    private String outputsPrefix = "outputs";

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public String getDownloadsPrefix() { return downloadsPrefix; }
    public void setDownloadsPrefix(String downloadsPrefix) { this.downloadsPrefix = downloadsPrefix; }

    public String getOutputsPrefix() { return outputsPrefix; }
    public void setOutputsPrefix(String outputsPrefix) { this.outputsPrefix = outputsPrefix; }
}
