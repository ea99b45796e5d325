package com.foreman.core.template;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foreman.core.graph.InvalidTaskListException;
import com.foreman.core.model.RawTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads a planner's task list from JSON.
 * <p>
 * Accepts either a bare array of tasks or an object with a {@code tasks} array, which
 * is what the external planner emits. Field names {@code task_id} and {@code agent}
 * are accepted as aliases for {@code id} and {@code owner}; unknown fields are ignored.
 * Dependencies are not checked here; that is the graph builder's job.
 */
@Component
public class PlanFileReader {

    private static final Logger log = LoggerFactory.getLogger(PlanFileReader.class);
    private static final TypeReference<List<RawTask>> TASK_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public PlanFileReader() {
        this(new ObjectMapper());
    }

    public PlanFileReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<RawTask> read(Path file) {
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new InvalidTaskListException("Cannot read plan file " + file + ": " + e.getMessage(), e);
        }
        List<RawTask> tasks = parse(json);
        log.info("Read {} task(s) from plan file {}", tasks.size(), file);
        return tasks;
    }

    public List<RawTask> parse(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root != null && root.isObject() && root.has("tasks")) {
                root = root.get("tasks");
            }
            if (root == null || !root.isArray()) {
                throw new InvalidTaskListException("Plan must be a JSON array of tasks or an object with a 'tasks' array");
            }
            return objectMapper.convertValue(root, TASK_LIST);
        } catch (JsonProcessingException e) {
            throw new InvalidTaskListException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InvalidTaskListException("Plan contains a malformed task: " + e.getMessage(), e);
        }
    }
}
