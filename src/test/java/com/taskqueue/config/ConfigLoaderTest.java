package com.taskqueue.config;

import com.taskqueue.core.EmptyQueueMode;
import com.taskqueue.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Load bundled default configuration")
    void loadDefaultConfig() {
        QueueConfig config = ConfigLoader.load("classpath:taskqueue.yaml");

        assertEquals("default-queue", config.name());
        assertEquals(EmptyQueueMode.OPTIONAL, config.emptyQueueMode());
        assertEquals(64, config.initialCapacity());
    }

    @Test
    @DisplayName("Load STRICT configuration under the task-queue section")
    void loadStrictConfig() {
        QueueConfig config = ConfigLoader.load("classpath:taskqueue-strict.yaml");

        assertEquals("strict-queue", config.name());
        assertEquals(EmptyQueueMode.STRICT, config.emptyQueueMode());
        assertEquals(16, config.initialCapacity());
    }

    @Test
    @DisplayName("Load root-level keys and fall back to defaults")
    void loadFlatConfig() {
        QueueConfig config = ConfigLoader.load("classpath:taskqueue-flat.yaml");

        assertEquals("flat-queue", config.name());
        assertEquals(EmptyQueueMode.OPTIONAL, config.emptyQueueMode());
        assertEquals(QueueConfig.DEFAULT_INITIAL_CAPACITY, config.initialCapacity());
    }

    @Test
    @DisplayName("Load from the filesystem")
    void loadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("queue.yaml");
        Files.writeString(file, """
                task-queue:
                  name: file-queue
                  empty-queue-mode: STRICT
                  initial-capacity: "32"
                """);

        QueueConfig config = ConfigLoader.load(file.toString());

        assertEquals("file-queue", config.name());
        assertEquals(EmptyQueueMode.STRICT, config.emptyQueueMode());
        assertEquals(32, config.initialCapacity());
    }

    @Test
    @DisplayName("Fail fast on missing file")
    void failOnMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/no/such/dir/queue.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(" "));
    }

    @Test
    @DisplayName("Fail fast on empty file")
    void failOnEmptyFile() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:taskqueue-empty.yaml"));
        assertTrue(ex.getMessage().contains("empty"));
    }

    @Test
    @DisplayName("Fail fast on unknown empty-queue-mode")
    void failOnBadMode() {
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:taskqueue-bad-mode.yaml"));
        assertTrue(ex.getMessage().contains("SOMETIMES"));
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    @DisplayName("Fail fast on non-positive initial capacity")
    void failOnBadCapacity() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:taskqueue-bad-capacity.yaml"));
    }

    @Test
    @DisplayName("Fail fast on non-numeric initial capacity")
    void failOnNonNumericCapacity() {
        String yaml = "initial-capacity: lots\n";
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @ParameterizedTest
    @ValueSource(strings = {"4294967297", "10000000000", "99999999999999999999999", "2.9", "64.0", "1e3"})
    @DisplayName("Fail fast on initial capacity that is not an int")
    void failOnCapacityOutsideIntRange(String capacity) {
        String yaml = "initial-capacity: " + capacity + "\n";
        ConfigurationException ex = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(ex.getMessage().contains("initial-capacity"));
    }

    @Test
    @DisplayName("Fail fast on initial capacity above the bound")
    void failOnCapacityAboveBound() {
        String yaml = "initial-capacity: " + (QueueConfig.MAX_INITIAL_CAPACITY + 1) + "\n";
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertThrows(ConfigurationException.class,
                () -> new QueueConfig("big", EmptyQueueMode.OPTIONAL, Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Accept initial capacity at the bound")
    void acceptCapacityAtBound() {
        String yaml = "initial-capacity: " + QueueConfig.MAX_INITIAL_CAPACITY + "\n";
        QueueConfig config = ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals(QueueConfig.MAX_INITIAL_CAPACITY, config.initialCapacity());
    }

    @Test
    @DisplayName("Fail fast when the root is not a mapping")
    void failOnScalarRoot() {
        String yaml = "- just\n- a list\n";
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.parseYaml(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    @DisplayName("QueueConfig rejects blank names")
    void rejectBlankName() {
        assertThrows(ConfigurationException.class,
                () -> new QueueConfig(" ", EmptyQueueMode.OPTIONAL, 8));
        assertThrows(ConfigurationException.class,
                () -> QueueConfig.defaults().withEmptyQueueMode(null));
    }
}
