package com.taskqueue.exception;

/**
 * Exception thrown by take/peek on an empty queue running in STRICT mode.
 * Safe to retry once another task has been added.
 */
public class EmptyQueueException extends TaskQueueException {

    public EmptyQueueException(String queueName) {
        super("Queue '" + queueName + "' is empty");
    }
}
