package com.taskqueue.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot properties under {@code taskqueue.*}.
 * Queue behavior itself (name, empty-queue mode, initial capacity) lives in
 * the YAML file these properties point at.
 */
@ConfigurationProperties(prefix = "taskqueue")
public class TaskQueueProperties {

    /**
     * Whether to register the queue beans. When false the auto-configuration
     * backs off entirely.
     */
    private boolean enabled = true;

    /**
     * Location of the queue YAML read by ConfigLoader: a filesystem path, or
     * a classpath resource with the classpath: prefix. A missing or invalid
     * file fails context startup.
     */
    private String configPath = "classpath:taskqueue.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
