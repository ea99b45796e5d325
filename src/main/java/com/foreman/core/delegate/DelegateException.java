package com.foreman.core.delegate;

/**
 * A delegate could not complete a task. Recoverable by retrying the task.
 */
public class DelegateException extends RuntimeException {

    public DelegateException(String message) {
        super(message);
    }

    public DelegateException(String message, Throwable cause) {
        super(message, cause);
    }
}
