package org.neuralchilli.dagrun.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.dagrun.domain.ExecutionOptions;
import org.neuralchilli.dagrun.domain.ExecutionRecord;
import org.neuralchilli.dagrun.domain.ExecutionResult;
import org.neuralchilli.dagrun.domain.RunStatus;
import org.neuralchilli.dagrun.domain.TaskRun;
import org.neuralchilli.dagrun.domain.TaskStatus;
import org.neuralchilli.dagrun.domain.WorkflowFailure;
import org.neuralchilli.dagrun.monitoring.AlertSink;
import org.neuralchilli.dagrun.task.Task;
import org.neuralchilli.dagrun.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs a {@link DependencyGraph} level by level.
 * <p>
 * Each run computes the task scope from the start/end/subset filters, feeds every task the
 * results of its direct upstream tasks, and appends an {@link ExecutionRecord} to the
 * history whether it succeeds or not. With fail-fast (the default) the first task failure
 * stops dispatching and is rethrown as a {@link TaskExecutionException}; otherwise the
 * remaining tasks still run and the result carries a {@code FAILED} record.
 * <p>
 * Tasks inside one level run on a bounded pool when more than one worker thread is
 * configured. A level always finishes before the next one starts.
 */
@ApplicationScoped
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    @Inject
    AlertSink alertSink;

    @ConfigProperty(name = "dagrun.engine.worker-threads", defaultValue = "1")
    int workerThreads;

    private final List<ExecutionRecord> history = new CopyOnWriteArrayList<>();

    public ExecutionEngine() {
    }

    public ExecutionEngine(AlertSink alertSink, int workerThreads) {
        this.alertSink = alertSink;
        this.workerThreads = workerThreads;
    }

    public ExecutionEngine(AlertSink alertSink) {
        this(alertSink, 1);
    }

    /**
     * Run every task of {@code graph}, fail fast
     */
    public ExecutionResult execute(DependencyGraph graph, ParameterStore store) {
        return execute(graph, store, ExecutionOptions.defaults());
    }

    /**
     * Run the part of {@code graph} selected by {@code options}.
     *
     * @return results keyed by task id, with the recorded run
     * @throws CycleDetectedException  if the graph has a cycle; nothing runs
     * @throws UnknownTaskException    if a scope filter names a missing task; nothing runs
     * @throws TaskExecutionException  on the first task failure when fail-fast is on
     */
    public ExecutionResult execute(DependencyGraph graph, ParameterStore store, ExecutionOptions options) {
        if (graph == null) {
            throw new IllegalArgumentException("Graph cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("Parameter store cannot be null");
        }
        return new Run(graph, store, options != null ? options : ExecutionOptions.defaults()).execute();
    }

    /**
     * Every recorded run, oldest first
     */
    public List<ExecutionRecord> history() {
        return List.copyOf(history);
    }

    public Optional<ExecutionRecord> lastRecord() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /**
     * Tasks in scope for {@code options}, in graph insertion order.
     */
    Set<String> scopeOf(DependencyGraph graph, ExecutionOptions options) {
        if (options.hasTaskSubset()) {
            for (String id : options.onlyTasks()) {
                requireTask(graph, id, "onlyTasks");
            }
            if (options.startFrom() != null || options.endAt() != null) {
                log.info("Task subset given, ignoring startFrom={} and endAt={}",
                        options.startFrom(), options.endAt());
            }
            Set<String> subset = new LinkedHashSet<>(options.onlyTasks());
            Set<String> scope = new LinkedHashSet<>();
            for (String id : graph.taskIds()) {
                if (subset.contains(id)) {
                    scope.add(id);
                }
            }
            return scope;
        }

        Set<String> scope = new LinkedHashSet<>(graph.taskIds());

        if (options.startFrom() != null) {
            requireTask(graph, options.startFrom(), "startFrom");
            Set<String> allowed = new LinkedHashSet<>(graph.downstreamClosure(options.startFrom()));
            allowed.add(options.startFrom());
            scope.retainAll(allowed);
        }

        if (options.endAt() != null) {
            requireTask(graph, options.endAt(), "endAt");
            Set<String> allowed = new LinkedHashSet<>(graph.upstreamClosure(options.endAt()));
            allowed.add(options.endAt());
            scope.retainAll(allowed);
        }

        return scope;
    }

    private static void requireTask(DependencyGraph graph, String id, String filter) {
        if (!graph.contains(id)) {
            throw new UnknownTaskException(
                    "Graph '" + graph.name() + "' has no task '" + id + "' (" + filter + ")"
            );
        }
    }

    private void record(ExecutionRecord record) {
        history.add(record);

        if (record.status() == RunStatus.FAILED && alertSink != null) {
            try {
                alertSink.workflowFailed(WorkflowFailure.from(record));
            } catch (RuntimeException e) {
                log.warn("Alert sink failed for workflow '{}': {}", record.workflowName(), e.getMessage(), e);
            }
        }
    }

    /**
     * State of one run. Everything written by task threads is guarded by {@code lock}.
     */
    private class Run {

        private final UUID id = UUID.randomUUID();
        private final DependencyGraph graph;
        private final ParameterStore store;
        private final ExecutionOptions options;
        private final Instant startedAt = Instant.now();

        private final Object lock = new Object();
        private final Map<String, Object> results = new LinkedHashMap<>();
        private final List<String> completed = new ArrayList<>();
        private final Map<String, TaskRun> taskRuns = new LinkedHashMap<>();
        private Set<String> planned = Set.of();
        private String failedTaskId;
        private String errorMessage;
        private Throwable firstFailure;
        private volatile boolean aborted = false;

        Run(DependencyGraph graph, ParameterStore store, ExecutionOptions options) {
            this.graph = graph;
            this.store = store;
            this.options = options;
        }

        ExecutionResult execute() {
            log.info("Starting run {} of workflow '{}'{}", id, graph.name(),
                    options.datePoint() != null ? " for " + options.datePoint() : "");

            List<Set<String>> levels;
            try {
                levels = graph.levels();
                planned = scopeOf(graph, options);
            } catch (CycleDetectedException | UnknownTaskException e) {
                log.error("Run {} of workflow '{}' rejected: {}", id, graph.name(), e.getMessage());
                errorMessage = e.getMessage();
                record(buildRecord(RunStatus.FAILED));
                throw e;
            }

            for (String taskId : planned) {
                taskRuns.put(taskId, TaskRun.pending(taskId));
            }
            log.info("Workflow '{}': {} of {} tasks in scope across {} levels",
                    graph.name(), planned.size(), graph.size(), levels.size());

            try {
                dispatch(levels);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                aborted = true;
                synchronized (lock) {
                    if (errorMessage == null) {
                        errorMessage = "Run interrupted";
                    }
                }
                skipUnstarted("Run interrupted");
                record(buildRecord(RunStatus.FAILED));
                throw new IllegalStateException("Run " + id + " of workflow '" + graph.name() + "' was interrupted", e);
            } catch (RuntimeException | Error e) {
                // An Error raised by a task, or a failure of the engine itself: record, then rethrow
                aborted = true;
                synchronized (lock) {
                    if (errorMessage == null) {
                        errorMessage = messageOf(e);
                    }
                }
                skipUnstarted("Not started: run aborted by " + e.getClass().getSimpleName());
                log.error("Run {} of workflow '{}' aborted: {}", id, graph.name(), messageOf(e));
                record(buildRecord(RunStatus.FAILED));
                throw e;
            }

            skipUnstarted("Not started: run aborted after failure of task '" + failedTaskId + "'");

            RunStatus status = failedTaskId == null ? RunStatus.SUCCESS : RunStatus.FAILED;
            ExecutionRecord record = buildRecord(status);
            record(record);

            if (status == RunStatus.SUCCESS) {
                log.info("Workflow '{}' completed: {} tasks in {} ms",
                        graph.name(), completed.size(), record.duration().toMillis());
            } else {
                log.error("Workflow '{}' failed at task '{}': {}", graph.name(), failedTaskId, errorMessage);
                if (options.failFast()) {
                    throw new TaskExecutionException(failedTaskId, errorMessage, firstFailure);
                }
            }

            return new ExecutionResult(new LinkedHashMap<>(results), record);
        }

        private void dispatch(List<Set<String>> levels) throws InterruptedException {
            ExecutorService pool = null;
            try {
                for (int i = 0; i < levels.size(); i++) {
                    List<String> batch = levels.get(i).stream().filter(planned::contains).toList();
                    if (batch.isEmpty()) {
                        continue;
                    }
                    if (aborted) {
                        return;
                    }

                    log.debug("Workflow '{}': level {} of {}: {}", graph.name(), i + 1, levels.size(), batch);

                    if (workerThreads <= 1 || batch.size() == 1) {
                        for (String taskId : batch) {
                            if (aborted) {
                                return;
                            }
                            runTask(taskId);
                        }
                    } else {
                        if (pool == null) {
                            pool = Executors.newFixedThreadPool(workerThreads, new NamedThreadFactory("dagrun-" + graph.name()));
                        }
                        runLevel(pool, batch);
                    }
                }
            } finally {
                if (pool != null) {
                    pool.shutdownNow();
                }
            }
        }

        /**
         * Submit the whole level and wait for every task of it
         */
        private void runLevel(ExecutorService pool, List<String> batch) throws InterruptedException {
            List<Future<?>> futures = new ArrayList<>(batch.size());
            for (String taskId : batch) {
                futures.add(pool.submit(() -> runTask(taskId)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    // runTask records task failures itself, anything arriving here is a bug or an Error
                    Throwable cause = e.getCause();
                    if (cause instanceof Error error) {
                        throw error;
                    }
                    throw new IllegalStateException("Unexpected failure while running a level", cause);
                }
            }
        }

        private void runTask(String taskId) {
            if (aborted) {
                return;
            }

            Task task = graph.task(taskId);
            Map<String, Object> upstream = upstreamResultsFor(taskId);

            TaskRun running;
            synchronized (lock) {
                running = taskRuns.get(taskId).start();
                taskRuns.put(taskId, running);
            }
            log.debug("[{}] Running {} task", taskId, task.type());

            try {
                task.resolveParams(store);
                Object result = task.execute(upstream);

                synchronized (lock) {
                    if (aborted) {
                        taskRuns.put(taskId, running.skip("Result discarded: run aborted"));
                        log.warn("[{}] Finished after the run was aborted, result discarded", taskId);
                        return;
                    }
                    results.put(taskId, result);
                    completed.add(taskId);
                    taskRuns.put(taskId, running.succeed());
                }
                log.info("[{}] Task succeeded", taskId);
            } catch (Exception e) {
                fail(taskId, running, e, options.failFast());
            } catch (Error e) {
                fail(taskId, running, e, true);
                throw e;
            }
        }

        private void fail(String taskId, TaskRun running, Throwable e, boolean abort) {
            String message = messageOf(e);
            synchronized (lock) {
                taskRuns.put(taskId, running.fail(message));
                if (failedTaskId == null) {
                    failedTaskId = taskId;
                    errorMessage = message;
                    firstFailure = e;
                }
                if (abort) {
                    aborted = true;
                }
            }
            log.error("[{}] Task failed: {}", taskId, message, e);
        }

        private Map<String, Object> upstreamResultsFor(String taskId) {
            Map<String, Object> upstream = new LinkedHashMap<>();
            synchronized (lock) {
                for (String upstreamId : graph.directUpstreamOf(taskId)) {
                    if (results.containsKey(upstreamId)) {
                        upstream.put(upstreamId, results.get(upstreamId));
                    }
                }
            }
            return Collections.unmodifiableMap(upstream);
        }

        private void skipUnstarted(String reason) {
            synchronized (lock) {
                taskRuns.replaceAll((taskId, run) ->
                        run.status() == TaskStatus.PENDING ? run.skip(reason) : run);
            }
        }

        private ExecutionRecord buildRecord(RunStatus status) {
            synchronized (lock) {
                List<String> uncompleted = planned.stream()
                        .filter(taskId -> !completed.contains(taskId))
                        .filter(taskId -> !taskId.equals(failedTaskId))
                        .sorted()
                        .toList();

                return new ExecutionRecord(
                        id,
                        graph.name(),
                        startedAt,
                        Instant.now(),
                        status,
                        store.snapshot(),
                        options.startFrom(),
                        options.endAt(),
                        options.onlyTasks(),
                        options.failFast(),
                        planned,
                        completed,
                        failedTaskId,
                        errorMessage,
                        uncompleted,
                        taskRuns,
                        options.datePoint()
                );
            }
        }
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
