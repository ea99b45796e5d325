package com.foreman.dispatch.cli;

import com.foreman.core.model.RawTask;
import com.foreman.core.template.ProjectTemplateCatalog;
import com.foreman.core.template.TaskBreakdown;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman templates [name]
 * <p>
 * Lists the project templates, or shows the tasks of one template grouped by phase.
 */
@Command(name = "templates", mixinStandardHelpOptions = true, description = "List project templates or show one")
@Component
public class TemplatesCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Template to show")
    private String name;

    @Option(names = {"--param", "-p"}, description = "Template parameter, e.g. -p has_foundation=false")
    private Map<String, String> params = new LinkedHashMap<>();

    private final ProjectTemplateCatalog catalog;

    public TemplatesCommand(ProjectTemplateCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (name == null) {
            ConsoleOutput.info("Available templates:");
            for (String template : catalog.names()) {
                int count = catalog.create(template, Map.of()).size();
                System.out.printf("  %-20s %d tasks%n", template, count);
            }
            return 0;
        }

        List<RawTask> tasks;
        try {
            tasks = catalog.create(name, params);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Template " + name + ": " + tasks.size() + " tasks");
        var byId = new LinkedHashMap<String, RawTask>();
        tasks.forEach(t -> byId.put(t.id(), t));

        TaskBreakdown breakdown = TaskBreakdown.of(tasks);
        breakdown.byPhase().forEach((phase, ids) -> {
            System.out.println();
            System.out.println(phase.toUpperCase() + ":");
            for (String id : ids) {
                RawTask task = byId.get(id);
                String deps = task.dependencies().isEmpty() ? "" : "  (after " + String.join(", ", task.dependencies()) + ")";
                System.out.printf("  %3s. [%-11s] %s%s%n", task.id(), task.owner(), task.description(), deps);
            }
        });

        System.out.println();
        ConsoleOutput.info("Crews: " + breakdown.byOwner());
        return 0;
    }
}
