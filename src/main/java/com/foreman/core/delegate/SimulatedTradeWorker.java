package com.foreman.core.delegate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stand-in crew for every configured trade. Waits a fixed latency and reports the
 * task as done; owners listed as failing always throw, which is how cascades are
 * demonstrated from the CLI.
 */
@Component
public class SimulatedTradeWorker implements TaskWorker {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTradeWorker.class);

    private final Set<String> owners;
    private final Set<String> failingOwners;
    private final long latencyMs;

    @Autowired
    public SimulatedTradeWorker(WorkerProperties properties) {
        this(new LinkedHashSet<>(properties.getSimulated().getOwners()),
                new LinkedHashSet<>(properties.getSimulated().getFailingOwners()),
                properties.getSimulated().getLatencyMs());
    }

    SimulatedTradeWorker(Set<String> owners, Set<String> failingOwners, long latencyMs) {
        this.owners = Set.copyOf(owners);
        this.failingOwners = failingOwners.stream()
                .map(o -> o.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.latencyMs = latencyMs;
    }

    @Override
    public Set<String> owners() {
        return owners;
    }

    @Override
    public TaskResult perform(Task task) throws InterruptedException {
        log.info("{} working on task {}: {}", task.owner(), task.id(), task.description());
        if (latencyMs > 0) {
            Thread.sleep(latencyMs);
        }
        if (failingOwners.contains(task.owner().toUpperCase(Locale.ROOT))) {
            throw new DelegateException(task.owner() + " crew unavailable for task " + task.id());
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("owner", task.owner());
        if (task.phase() != null) {
            details.put("phase", task.phase());
        }
        if (!task.materials().isEmpty()) {
            details.put("materialsUsed", task.materials());
        }
        if (!task.requirements().isEmpty()) {
            details.put("requirements", task.requirements());
        }
        return new TaskResult(task.owner() + " completed: " + task.description(), details);
    }
}
