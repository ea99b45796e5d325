package com.foreman.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.foreman.core.engine.ProjectEngine;
import com.foreman.core.events.EventBus;
import com.foreman.core.model.FinalReport;
import com.foreman.core.model.RawTask;
import com.foreman.core.model.RunStatus;
import com.foreman.core.model.SchedulerConfig;
import com.foreman.core.scheduler.RunCancellation;
import com.foreman.core.template.PlanFileReader;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: foreman run --template &lt;name&gt; | --plan &lt;file.json&gt;
 * <p>
 * Builds the task graph, runs it with the simulated trade crews and prints the
 * final report. Exits 0 only when every task completed. Ctrl-C cancels the run and
 * still prints the report.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a project template or a plan file")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--template", "-t"}, description = "Project template name (see 'foreman templates')")
    private String template;

    @Option(names = {"--param", "-p"}, description = "Template parameter, e.g. -p width=8 -p has_electrical=true")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = {"--plan"}, description = "JSON plan file produced by an external planner")
    private Path plan;

    @Option(names = {"--max-retries"}, description = "Retries per task after the first attempt")
    private Integer maxRetries;

    @Option(names = {"--timeout"}, description = "Per-task timeout in seconds")
    private Integer timeoutSeconds;

    @Option(names = {"--max-iterations"}, description = "Scheduling pass ceiling")
    private Integer maxIterations;

    @Option(names = {"--max-parallel"}, description = "Delegate calls in flight per pass")
    private Integer maxParallel;

    @Option(names = {"--json"}, description = "Print the final report as JSON instead of a table")
    private boolean json;

    private final ProjectEngine engine;
    private final PlanFileReader planReader;
    private final EventBus eventBus;

    public RunCommand(ProjectEngine engine, PlanFileReader planReader, EventBus eventBus) {
        this.engine = engine;
        this.planReader = planReader;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if ((template == null) == (plan == null)) {
            ConsoleOutput.error("Specify exactly one of --template or --plan");
            return 1;
        }

        SchedulerConfig config;
        try {
            config = config();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid scheduler settings: " + e.getMessage());
            return 1;
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info(template != null ? "Running template " + template : "Running plan " + plan);
        }

        try (var shutdown = ShutdownCancellation.register(new RunCancellation())) {
            return execute(config, shutdown.cancellation());
        }
    }

    private int execute(SchedulerConfig config, RunCancellation cancellation) {
        FinalReport report;
        EventBus.Subscription progress = json ? null : eventBus.subscribeAll(ConsoleOutput::event);
        try {
            if (template != null) {
                report = engine.runTemplate(template, params, config, cancellation);
            } else {
                List<RawTask> tasks = planReader.read(plan);
                report = engine.runPlan(tasks, config, cancellation);
            }
        } catch (RuntimeException e) {
            ConsoleOutput.error("Run failed: " + rootCauseMessage(e));
            return 1;
        } finally {
            if (progress != null) {
                progress.unsubscribe();
            }
        }

        if (json) {
            try {
                System.out.println(toJson(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot render report as JSON: " + e.getOriginalMessage());
                return 1;
            }
        } else {
            ConsoleOutput.report(report);
        }
        return report.status() == RunStatus.COMPLETED ? 0 : 1;
    }

    private SchedulerConfig config() {
        SchedulerConfig config = engine.defaultConfig();
        if (maxRetries != null) config = config.withMaxRetries(maxRetries);
        if (timeoutSeconds != null) config = config.withPerTaskTimeout(Duration.ofSeconds(timeoutSeconds));
        if (maxIterations != null) config = config.withMaxTotalIterations(maxIterations);
        if (maxParallel != null) config = config.withMaxParallel(maxParallel);
        return config;
    }

    static String toJson(FinalReport report) throws JsonProcessingException {
        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        var document = new LinkedHashMap<String, Object>();
        document.put("status", report.status());
        document.put("report", report);
        return mapper.writeValueAsString(document);
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
