package com.foreman.core.delegate;

/**
 * No worker is registered for a task's owner.
 */
public class UnknownOwnerException extends DelegateException {

    public UnknownOwnerException(String owner) {
        super("No worker registered for owner " + owner);
    }
}
