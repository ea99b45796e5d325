package com.foreman.core.model;

import com.foreman.core.graph.TaskGraph;

import java.util.List;

/**
 * A validated task graph plus every correction applied while building it.
 */
public record BuildResult(
    TaskGraph graph,
    List<ValidationWarning> warnings
) {
}
