package com.foreman.core.template;

import com.foreman.core.model.RawTask;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Task ids grouped by phase and task counts per owner.
 *
 * @param byPhase phase label -> task ids, in canonical phase order; unknown phases follow
 *                in order of first appearance, tasks without a phase under "unassigned"
 * @param byOwner owner -> number of tasks, sorted by owner
 */
public record TaskBreakdown(
    Map<String, List<String>> byPhase,
    Map<String, Integer> byOwner
) implements Serializable {

    public static final List<String> PHASE_ORDER = List.of(
            "planning", "permitting", "demolition", "foundation", "framing",
            "rough_in", "inspection", "finishing", "final_inspection");

    static final String UNASSIGNED = "unassigned";

    public static TaskBreakdown of(List<RawTask> tasks) {
        var grouped = new LinkedHashMap<String, List<String>>();
        var owners = new TreeMap<String, Integer>();
        for (RawTask task : tasks) {
            add(grouped, owners, task.id(), task.owner(), task.phase());
        }
        return ordered(grouped, owners);
    }

    /** Position of {@code phase} in {@link #PHASE_ORDER}; unknown or missing phases sort last. */
    public static int phaseRank(String phase) {
        int index = phase == null ? -1 : PHASE_ORDER.indexOf(phase);
        return index >= 0 ? index : PHASE_ORDER.size();
    }

    private static void add(Map<String, List<String>> grouped, Map<String, Integer> owners,
                            String id, String owner, String phase) {
        String key = phase == null || phase.isBlank() ? UNASSIGNED : phase;
        grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(id);
        owners.merge(owner, 1, Integer::sum);
    }

    private static TaskBreakdown ordered(Map<String, List<String>> grouped, Map<String, Integer> owners) {
        var byPhase = new LinkedHashMap<String, List<String>>();
        for (String phase : PHASE_ORDER) {
            if (grouped.containsKey(phase)) {
                byPhase.put(phase, List.copyOf(grouped.remove(phase)));
            }
        }
        grouped.forEach((phase, ids) -> byPhase.put(phase, List.copyOf(ids)));

        return new TaskBreakdown(Collections.unmodifiableMap(byPhase), Collections.unmodifiableMap(owners));
    }
}
