package com.taskqueue.exception;

/**
 * Exception thrown when a payload is rejected by the queue's payload policy
 * (null or empty text).
 */
public class InvalidTaskException extends TaskQueueException {

    public InvalidTaskException(String message) {
        super(message);
    }
}
