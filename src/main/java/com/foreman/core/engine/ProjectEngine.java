package com.foreman.core.engine;

import com.foreman.core.delegate.Delegate;
import com.foreman.core.events.EventBus;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.graph.TaskGraphBuilder;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.model.BuildResult;
import com.foreman.core.model.FinalReport;
import com.foreman.core.model.RawTask;
import com.foreman.core.model.SchedulerConfig;
import com.foreman.core.scheduler.RunCancellation;
import com.foreman.core.scheduler.SchedulerLoop;
import com.foreman.core.scheduler.SchedulerProperties;
import com.foreman.core.template.ProjectTemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a task graph from a template or a plan and runs it to completion.
 * <p>
 * Generates the run id, validates the task list, hands the graph to the
 * {@link SchedulerLoop} and returns its report with the build corrections in front.
 */
@Service
public class ProjectEngine {

    private static final Logger log = LoggerFactory.getLogger(ProjectEngine.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final TaskGraphBuilder builder;
    private final SchedulerLoop scheduler;
    private final Delegate delegate;
    private final ProjectTemplateCatalog templates;
    private final SchedulerProperties schedulerProperties;
    private final EventBus eventBus;

    public ProjectEngine(TaskGraphBuilder builder, SchedulerLoop scheduler, Delegate delegate,
                         ProjectTemplateCatalog templates, SchedulerProperties schedulerProperties,
                         EventBus eventBus) {
        this.builder = builder;
        this.scheduler = scheduler;
        this.delegate = delegate;
        this.templates = templates;
        this.schedulerProperties = schedulerProperties;
        this.eventBus = eventBus;
    }

    public FinalReport runTemplate(String templateName, Map<String, String> params) {
        return runTemplate(templateName, params, defaultConfig(), new RunCancellation());
    }

    /**
     * Runs one of the fixed project templates.
     *
     * @throws IllegalArgumentException if the template is unknown or a parameter is malformed
     */
    public FinalReport runTemplate(String templateName, Map<String, String> params,
                                   SchedulerConfig config, RunCancellation cancellation) {
        List<RawTask> tasks = templates.create(templateName, params);
        log.info("Template {} produced {} task(s)", templateName, tasks.size());
        return runPlan(generateRunId(), tasks, config, cancellation, templateName);
    }

    public FinalReport runPlan(List<RawTask> rawTasks) {
        return runPlan(rawTasks, defaultConfig(), new RunCancellation());
    }

    public FinalReport runPlan(List<RawTask> rawTasks, SchedulerConfig config, RunCancellation cancellation) {
        return runPlan(generateRunId(), rawTasks, config, cancellation, "plan");
    }

    private FinalReport runPlan(String runId, List<RawTask> rawTasks, SchedulerConfig config,
                                RunCancellation cancellation, String source) {
        MdcContext.setRun(runId);
        try {
            BuildResult built = builder.build(rawTasks);
            log.info("Run {}: built graph of {} task(s) with {} correction(s)",
                    runId, built.graph().size(), built.warnings().size());
            eventBus.publish(ForemanEvent.of("run.created", runId, null, Map.of(
                    "source", source,
                    "totalTasks", built.graph().size(),
                    "corrections", built.warnings().size())));

            FinalReport report = scheduler.run(runId, built.graph(), delegate, config, cancellation);
            return report.withLeadingWarnings(built.warnings());
        } finally {
            MdcContext.clear();
        }
    }

    public SchedulerConfig defaultConfig() {
        return schedulerProperties.toConfig();
    }

    /**
     * Generates a unique run ID in the format FRMN-YYYY-NNNN.
     */
    public String generateRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("FRMN-%d-%04d", year, count);
    }
}
