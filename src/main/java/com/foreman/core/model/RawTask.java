package com.foreman.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An unvalidated task record, as produced by a project template or an external planner.
 * Dependencies may reference ids that do not exist or form cycles; the graph builder
 * corrects both.
 *
 * @param id           unique identifier (e.g. "3")
 * @param owner        worker type that executes the task (e.g. "Carpenter"); opaque to the scheduler
 * @param description  what the task should accomplish
 * @param phase        informational grouping label (e.g. "framing")
 * @param dependencies ids of tasks that must complete first
 * @param requirements free-form parameters handed to the worker
 * @param materials    materials the worker needs
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawTask(
    @JsonAlias("task_id") String id,
    @JsonAlias("agent") String owner,
    String description,
    String phase,
    List<String> dependencies,
    Map<String, Object> requirements,
    List<String> materials
) implements Serializable {

    public RawTask {
        dependencies = dependencies != null
                ? dependencies.stream().filter(Objects::nonNull).toList()
                : List.of();
        requirements = requirements != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(requirements))
                : Map.of();
        materials = materials != null ? materials.stream().filter(Objects::nonNull).toList() : List.of();
    }

    public RawTask(String id, String owner, String description, String phase, List<String> dependencies) {
        this(id, owner, description, phase, dependencies, Map.of(), List.of());
    }
}
