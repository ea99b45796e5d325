package com.foreman.core.delegate;

import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Routes each task to the {@link TaskWorker} registered for its owner. The scheduler
 * never looks at owners; this registry is the only place they mean anything.
 */
@Service
public class OwnerRegistryDelegate implements Delegate {

    private static final Logger log = LoggerFactory.getLogger(OwnerRegistryDelegate.class);

    private final Map<String, TaskWorker> workers = new TreeMap<>();

    public OwnerRegistryDelegate(List<TaskWorker> workers) {
        for (TaskWorker worker : workers) {
            for (String owner : worker.owners()) {
                TaskWorker previous = this.workers.put(key(owner), worker);
                if (previous != null && previous != worker) {
                    throw new IllegalStateException("Owner " + owner + " is registered by both "
                            + previous.getClass().getSimpleName() + " and " + worker.getClass().getSimpleName());
                }
            }
        }
        log.info("Registered workers for owners: {}", this.workers.keySet());
    }

    @Override
    public TaskResult execute(Task task) throws Exception {
        TaskWorker worker = task.owner() != null ? workers.get(key(task.owner())) : null;
        if (worker == null) {
            throw new UnknownOwnerException(task.owner());
        }
        log.debug("Routing task {} to {}", task.id(), worker.getClass().getSimpleName());
        return worker.perform(task);
    }

    public boolean supports(String owner) {
        return owner != null && workers.containsKey(key(owner));
    }

    /** Registered owner tags, upper-cased and sorted. */
    public List<String> registeredOwners() {
        return List.copyOf(workers.keySet());
    }

    private static String key(String owner) {
        return owner.trim().toUpperCase(Locale.ROOT);
    }
}
