package com.foreman.core.scheduler;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Stop signal for a running schedule. Once cancelled, the scheduler lets in-flight
 * delegate calls of the current pass finish, dispatches nothing new and marks the
 * remaining tasks CANCELLED.
 */
public class RunCancellation {

    private final AtomicReference<String> reason = new AtomicReference<>();

    public void cancel() {
        cancel("run cancelled");
    }

    /** First reason wins; later calls are ignored. */
    public void cancel(String why) {
        reason.compareAndSet(null, why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
