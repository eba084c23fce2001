package com.taskqueue.exception;

/**
 * Exception thrown when a task is added with a priority outside the fixed set.
 * The queue is left unchanged.
 */
public class InvalidPriorityException extends TaskQueueException {

    private final Integer level;

    public InvalidPriorityException(String message) {
        super(message);
        this.level = null;
    }

    public InvalidPriorityException(int level) {
        super("Invalid priority: " + level + ". Must be 1 (HIGH), 2 (MEDIUM) or 3 (LOW)");
        this.level = level;
    }

    /**
     * The rejected numeric level, or null when the priority itself was missing.
     */
    public Integer getLevel() {
        return level;
    }
}
