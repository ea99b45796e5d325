package com.foreman.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Successful outcome returned by a delegate.
 *
 * @param summary human-readable summary of the work done
 * @param details structured output (materials ordered, permit ids, ...); opaque to the scheduler
 */
public record TaskResult(
    String summary,
    Map<String, Object> details
) implements Serializable {

    public TaskResult {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static TaskResult of(String summary) {
        return new TaskResult(summary, Map.of());
    }
}
