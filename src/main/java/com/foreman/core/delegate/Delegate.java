package com.foreman.core.delegate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;

/**
 * The capability that performs a task's work. The scheduler calls it once per attempt
 * and treats any thrown exception as a failed attempt.
 * <p>
 * Calls may block for a long time. The scheduler stops waiting after the configured
 * per-task timeout but cannot stop the call itself; implementations that need real
 * cancellation must react to thread interruption or carry their own deadline.
 */
@FunctionalInterface
public interface Delegate {

    TaskResult execute(Task task) throws Exception;
}
