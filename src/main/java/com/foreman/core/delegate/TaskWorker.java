package com.foreman.core.delegate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;

import java.util.Set;

/**
 * Performs tasks for one or more owner types (e.g. "Carpenter", "Plumber").
 */
public interface TaskWorker {

    /** Owner tags this worker handles, matched case-insensitively. */
    Set<String> owners();

    TaskResult perform(Task task) throws Exception;
}
