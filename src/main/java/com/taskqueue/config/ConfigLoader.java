package com.taskqueue.config;

import com.taskqueue.core.EmptyQueueMode;
import com.taskqueue.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.Map;

/**
 * Loads queue configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String ROOT_SECTION = "task-queue";

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static QueueConfig load(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Configuration path cannot be blank");
        }
        log.info("Loading queue configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parseYaml(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static QueueConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration is not valid YAML", e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Settings may sit at the root or under 'task-queue'
        Object section = root.getOrDefault(ROOT_SECTION, root);
        if (!(section instanceof Map)) {
            throw new ConfigurationException("'" + ROOT_SECTION + "' must be a mapping");
        }
        Map<String, Object> queueMap = (Map<String, Object>) section;

        String name = getString(queueMap, "name", QueueConfig.DEFAULT_NAME);
        EmptyQueueMode mode = parseMode(getString(queueMap, "empty-queue-mode", null));
        int initialCapacity = getInt(queueMap, "initial-capacity", QueueConfig.DEFAULT_INITIAL_CAPACITY);

        QueueConfig config = new QueueConfig(name, mode, initialCapacity);
        log.info("Loaded queue configuration: name={}, mode={}, initialCapacity={}",
                name, mode, initialCapacity);
        return config;
    }

    private static EmptyQueueMode parseMode(String value) {
        if (value == null) {
            return EmptyQueueMode.OPTIONAL;
        }
        try {
            return EmptyQueueMode.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid empty-queue-mode '" + value
                    + "'. Use OPTIONAL or STRICT.", e);
        }
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        if (value instanceof Long || value instanceof BigInteger) {
            throw new ConfigurationException("'" + key + "' is out of range, got " + value);
        }
        if (value instanceof Number) {
            throw new ConfigurationException("'" + key + "' must be an integer, got " + value);
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}
