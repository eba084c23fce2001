package com.taskqueue.priority;

import com.taskqueue.exception.InvalidPriorityException;

/**
 * Fixed priority levels. Lower level = served first.
 */
public enum Priority {

    HIGH(1),
    MEDIUM(2),
    LOW(3);

    private final int level;

    Priority(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Resolve a numeric level to its priority.
     *
     * @param level 1 (HIGH), 2 (MEDIUM) or 3 (LOW)
     * @return the matching priority
     * @throws InvalidPriorityException if the level is not one of the fixed set
     */
    public static Priority of(int level) {
        for (Priority priority : values()) {
            if (priority.level == level) {
                return priority;
            }
        }
        throw new InvalidPriorityException(level);
    }
}
