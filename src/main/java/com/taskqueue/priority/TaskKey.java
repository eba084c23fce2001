package com.taskqueue.priority;

import java.util.Objects;

/**
 * Ordering key for a queued task.
 * <p>
 * Comparison order:
 * 1. Priority level (lower = served first)
 * 2. Sequence (FIFO fallback: earlier insertion wins)
 * <p>
 * The sequence is a logical counter assigned by the queue, never a timestamp,
 * so two insertions can never collide.
 */
public final class TaskKey implements Comparable<TaskKey> {

    private final Priority priority;
    private final long sequence;

    public TaskKey(Priority priority, long sequence) {
        this.priority = Objects.requireNonNull(priority, "priority cannot be null");
        this.sequence = sequence;
    }

    public Priority getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public int compareTo(TaskKey other) {
        int priorityCmp = Integer.compare(this.priority.level(), other.priority.level());
        if (priorityCmp != 0) {
            return priorityCmp;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskKey that = (TaskKey) o;
        return sequence == that.sequence && priority == that.priority;
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, sequence);
    }

    @Override
    public String toString() {
        return "TaskKey{" +
                "priority=" + priority +
                ", sequence=" + sequence +
                '}';
    }
}
