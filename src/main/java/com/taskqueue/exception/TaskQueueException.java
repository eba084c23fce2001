package com.taskqueue.exception;

/**
 * Base exception for the task queue.
 */
public class TaskQueueException extends RuntimeException {

    public TaskQueueException(String message) {
        super(message);
    }

    public TaskQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
