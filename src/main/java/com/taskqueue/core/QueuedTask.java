package com.taskqueue.core;

import com.taskqueue.priority.Priority;
import com.taskqueue.priority.TaskKey;

import java.util.Objects;

/**
 * Payload wrapper with the ordering key assigned by the queue.
 *
 * @param <T> Payload type
 */
final class QueuedTask<T> implements Comparable<QueuedTask<?>> {

    private final T payload;
    private final TaskKey key;

    QueuedTask(T payload, TaskKey key) {
        this.payload = payload;
        this.key = Objects.requireNonNull(key, "key cannot be null");
    }

    T getPayload() {
        return payload;
    }

    TaskKey getKey() {
        return key;
    }

    Priority getPriority() {
        return key.getPriority();
    }

    @Override
    public int compareTo(QueuedTask<?> other) {
        return this.key.compareTo(other.key);
    }

    @Override
    public String toString() {
        return "QueuedTask{" +
                "priority=" + key.getPriority() +
                ", sequence=" + key.getSequence() +
                '}';
    }
}
