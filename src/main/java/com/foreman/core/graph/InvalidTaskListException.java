package com.foreman.core.graph;

/**
 * Thrown when a raw task list is malformed in a way that cannot be corrected by
 * removing dependency edges (missing or duplicate ids, missing owner).
 */
public class InvalidTaskListException extends RuntimeException {

    public InvalidTaskListException(String message) {
        super(message);
    }

    public InvalidTaskListException(String message, Throwable cause) {
        super(message, cause);
    }
}
