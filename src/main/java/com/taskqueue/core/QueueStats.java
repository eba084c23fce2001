package com.taskqueue.core;

import com.taskqueue.priority.Priority;

import java.util.Map;

/**
 * Point-in-time snapshot of a queue.
 *
 * @param name           Queue name
 * @param mode           Empty-queue mode
 * @param size           Resident task count
 * @param sizeByPriority Resident task count per priority (every priority present)
 * @param added          Tasks accepted over the queue's lifetime
 * @param taken          Tasks delivered by take or drain
 * @param discarded      Tasks dropped by clear
 */
public record QueueStats(
        String name,
        EmptyQueueMode mode,
        int size,
        Map<Priority, Integer> sizeByPriority,
        long added,
        long taken,
        long discarded
) {
    public QueueStats {
        sizeByPriority = Map.copyOf(sizeByPriority);
    }

    /**
     * Resident task count at one priority.
     */
    public int size(Priority priority) {
        return sizeByPriority.getOrDefault(priority, 0);
    }
}
