package com.taskqueue.core;

import com.taskqueue.priority.Priority;

import java.util.List;
import java.util.Optional;

/**
 * Thread-safe priority task queue.
 * <p>
 * Tasks are served highest priority first (HIGH, then MEDIUM, then LOW); tasks
 * sharing a priority are served in insertion order. Every operation is atomic
 * with respect to every other, and none of them blocks waiting for work.
 *
 * @param <T> Payload type
 */
public interface TaskQueue<T> {

    /**
     * Add a payload at the given priority.
     *
     * @throws com.taskqueue.exception.InvalidPriorityException if priority is null
     * @throws com.taskqueue.exception.InvalidTaskException     if the payload is rejected
     */
    void add(T payload, Priority priority);

    /**
     * Add a payload at a numeric priority level (1=HIGH, 2=MEDIUM, 3=LOW).
     *
     * @throws com.taskqueue.exception.InvalidPriorityException if the level is outside the fixed set
     * @throws com.taskqueue.exception.InvalidTaskException     if the payload is rejected
     */
    void add(T payload, int level);

    /**
     * Add a payload at {@link Priority#MEDIUM}.
     */
    void add(T payload);

    /**
     * Remove and return the next task.
     *
     * @return the next payload, or empty if the queue is empty in OPTIONAL mode
     * @throws com.taskqueue.exception.EmptyQueueException if the queue is empty in STRICT mode
     */
    Optional<T> take();

    /**
     * Return the task the next {@link #take()} would return, without removing it.
     * Same empty-queue contract as take.
     */
    Optional<T> peek();

    /**
     * Remove every resident task and return them in take order.
     * Returns an empty list when nothing is resident, regardless of mode.
     */
    List<T> drain();

    /**
     * Current resident task count.
     */
    int size();

    /**
     * Whether no task is resident.
     */
    boolean isEmpty();

    /**
     * Discard every resident task and reset insertion ordering.
     */
    void clear();

    /**
     * Consistent snapshot of the queue's counters.
     */
    QueueStats stats();

    /**
     * Queue name (used in logs and errors).
     */
    String getName();

    /**
     * Empty-queue behavior selected at construction.
     */
    EmptyQueueMode getEmptyQueueMode();
}
