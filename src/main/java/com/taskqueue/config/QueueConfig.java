package com.taskqueue.config;

import com.taskqueue.core.EmptyQueueMode;
import com.taskqueue.exception.ConfigurationException;

/**
 * Configuration for a priority task queue.
 *
 * @param name            Queue name (used in logs and errors)
 * @param emptyQueueMode  Behavior of take/peek on an empty queue
 * @param initialCapacity Initial heap capacity (the queue itself is unbounded)
 */
public record QueueConfig(
        String name,
        EmptyQueueMode emptyQueueMode,
        int initialCapacity
) {
    public static final String DEFAULT_NAME = "default-queue";
    public static final int DEFAULT_INITIAL_CAPACITY = 64;
    public static final int MAX_INITIAL_CAPACITY = 1 << 16;

    public QueueConfig {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Queue name cannot be blank");
        }
        if (emptyQueueMode == null) {
            throw new ConfigurationException("Queue '" + name + "' has no empty-queue-mode");
        }
        if (initialCapacity <= 0) {
            throw new ConfigurationException("Queue '" + name + "' initial-capacity must be positive, got "
                    + initialCapacity);
        }
        if (initialCapacity > MAX_INITIAL_CAPACITY) {
            throw new ConfigurationException("Queue '" + name + "' initial-capacity must be at most "
                    + MAX_INITIAL_CAPACITY + ", got " + initialCapacity);
        }
    }

    /**
     * Default config: OPTIONAL mode, default name and capacity.
     */
    public static QueueConfig defaults() {
        return new QueueConfig(DEFAULT_NAME, EmptyQueueMode.OPTIONAL, DEFAULT_INITIAL_CAPACITY);
    }

    public QueueConfig withName(String name) {
        return new QueueConfig(name, emptyQueueMode, initialCapacity);
    }

    public QueueConfig withEmptyQueueMode(EmptyQueueMode emptyQueueMode) {
        return new QueueConfig(name, emptyQueueMode, initialCapacity);
    }
}
