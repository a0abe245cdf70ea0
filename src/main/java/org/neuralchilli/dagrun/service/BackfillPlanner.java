package org.neuralchilli.dagrun.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.dagrun.core.DateExpression;
import org.neuralchilli.dagrun.core.ExecutionEngine;
import org.neuralchilli.dagrun.core.ParameterStore;
import org.neuralchilli.dagrun.core.Workflow;
import org.neuralchilli.dagrun.domain.BackfillRequest;
import org.neuralchilli.dagrun.domain.BackfillResult;
import org.neuralchilli.dagrun.domain.DatePoint;
import org.neuralchilli.dagrun.domain.DateSpec;
import org.neuralchilli.dagrun.domain.ExecutionOptions;
import org.neuralchilli.dagrun.domain.ExecutionRecord;
import org.neuralchilli.dagrun.domain.ExecutionResult;
import org.neuralchilli.dagrun.util.DateFormats;
import org.neuralchilli.dagrun.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Re-runs a workflow once per logical date.
 * <p>
 * Each date point gets its own workflow from the {@link GraphFactory}, its own
 * {@link ParameterStore} and its own engine run. A failing date is recorded and the
 * loop moves on; the backfill as a whole succeeds only when no date failed.
 */
@ApplicationScoped
public class BackfillPlanner {

    private static final Logger log = LoggerFactory.getLogger(BackfillPlanner.class);

    // A template value that is nothing but one date expression, e.g. "${yyyyMMdd-1}"
    private static final Pattern DATE_TEMPLATE = Pattern.compile("^\\$\\{([^}]+)}$");

    private static final String UNNAMED = "unnamed-workflow";

    private static final DateTimeFormatter DEFAULT_FORMAT = DateFormats.formatter(DateFormats.DEFAULT_PATTERN);

    @Inject
    ExecutionEngine engine;

    @ConfigProperty(name = "dagrun.backfill.parallel-dates", defaultValue = "1")
    int parallelDates;

    @ConfigProperty(name = "dagrun.params.max-depth", defaultValue = "32")
    int maxParameterDepth;

    ConfirmationPrompt confirmationPrompt = ConfirmationPrompt.console();

    Clock clock = Clock.systemDefaultZone();

    public BackfillPlanner() {
    }

    public BackfillPlanner(ExecutionEngine engine, int parallelDates, ConfirmationPrompt confirmationPrompt) {
        this.engine = engine;
        this.parallelDates = parallelDates;
        this.maxParameterDepth = ParameterStore.DEFAULT_MAX_DEPTH;
        this.confirmationPrompt = confirmationPrompt;
    }

    public BackfillPlanner(ExecutionEngine engine) {
        this(engine, 1, ConfirmationPrompt.console());
    }

    /**
     * Expand a date specification into ordered logical dates.
     * <ul>
     *   <li>explicit list: as given</li>
     *   <li>DAY: every date from start to end</li>
     *   <li>WEEK: Mondays, starting from the Monday of the start date's week</li>
     *   <li>MONTH: first days of months, starting from the start date's month</li>
     * </ul>
     *
     * @throws InvalidDateRangeException if a date is not ISO {@code yyyy-MM-dd} or end precedes start
     */
    public List<LocalDate> plan(DateSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Date specification cannot be null");
        }

        if (spec instanceof DateSpec.Explicit explicit) {
            return explicit.dates().stream().map(BackfillPlanner::parseDate).toList();
        }

        DateSpec.Range range = (DateSpec.Range) spec;
        LocalDate start = parseDate(range.start());
        LocalDate end = parseDate(range.end());
        if (end.isBefore(start)) {
            throw new InvalidDateRangeException("End date " + end + " is before start date " + start);
        }

        List<LocalDate> dates = new ArrayList<>();
        switch (range.granularity()) {
            case DAY -> {
                for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
                    dates.add(d);
                }
            }
            case WEEK -> {
                LocalDate monday = start.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
                for (LocalDate d = monday; !d.isAfter(end); d = d.plusWeeks(1)) {
                    dates.add(d);
                }
            }
            case MONTH -> {
                LocalDate first = start.withDayOfMonth(1);
                for (LocalDate d = first; !d.isAfter(end); d = d.plusMonths(1)) {
                    dates.add(d);
                }
            }
        }
        return dates;
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException("Invalid date '" + text + "', expected yyyy-MM-dd", e);
        }
    }

    /**
     * Date-derived parameters for one date: every configured name in its format plus
     * a {@code <name>_no_dash} variant.
     */
    public DatePoint datePoint(LocalDate date, BackfillRequest request) {
        return datePoint(date, request.dateParamNames(), formattersFor(request));
    }

    private DatePoint datePoint(LocalDate date, List<String> names, Map<String, DateTimeFormatter> formatters) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String name : names) {
            params.put(name, date.atStartOfDay().format(formatters.getOrDefault(name, DEFAULT_FORMAT)));
        }
        // An explicitly formatted *_no_dash name keeps its own value
        for (String name : names) {
            params.putIfAbsent(name + "_no_dash", params.get(name).replace("-", ""));
        }
        return new DatePoint(date, params.get(names.get(0)), params);
    }

    /**
     * Validate the configured formats once; an unusable one falls back to {@code yyyy-MM-dd}.
     */
    private Map<String, DateTimeFormatter> formattersFor(BackfillRequest request) {
        Map<String, DateTimeFormatter> formatters = new LinkedHashMap<>();
        for (String name : request.dateParamNames()) {
            String format = request.dateParamFormats().get(name);
            if (format == null) {
                continue;
            }
            try {
                DateTimeFormatter formatter = DateFormats.formatter(format);
                // Probe: patterns with zone or offset fields only fail when formatting
                LocalDate.of(2000, 1, 1).atStartOfDay().format(formatter);
                formatters.put(name, formatter);
            } catch (IllegalArgumentException | DateTimeException e) {
                log.warn("Invalid date format '{}' for parameter '{}', using {}: {}",
                        format, name, DateFormats.DEFAULT_PATTERN, e.getMessage());
            }
        }
        return formatters;
    }

    /**
     * Re-evaluate {@code ${<format><+|-><days>}} templates against {@code date} instead of today.
     * Other values are returned unchanged and resolve through the store as usual.
     */
    Map<String, Object> rewriteTemplates(Map<String, Object> templates, LocalDate date) {
        Map<String, Object> rewritten = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : templates.entrySet()) {
            String key = entry.getKey();
            Optional<DateExpression> expression = dateTemplate(entry.getValue());
            if (expression.isEmpty()) {
                rewritten.put(key, entry.getValue());
                continue;
            }

            String value = expression.get().apply(date);
            rewritten.put(key, value);
            if (value.contains("-")) {
                rewritten.put(key + "_no_dash", value.replace("-", ""));
            }
            log.debug("Template {} = {} for {} (was {})", key, value, date, entry.getValue());
        }
        return rewritten;
    }

    private static Optional<DateExpression> dateTemplate(Object value) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        Matcher matcher = DATE_TEMPLATE.matcher(text.trim());
        return matcher.matches() ? DateExpression.parse(matcher.group(1)) : Optional.empty();
    }

    /**
     * Run a backfill, asking the configured confirmation prompt when required
     */
    public BackfillResult run(BackfillRequest request, GraphFactory factory) {
        return run(request, factory, confirmationPrompt);
    }

    /**
     * Run a backfill.
     * <p>
     * Unless the request is a dry run or auto-confirmed, {@code prompt} is asked once
     * before any date executes; a refusal returns a declined result and runs nothing.
     */
    public BackfillResult run(BackfillRequest request, GraphFactory factory, ConfirmationPrompt prompt) {
        if (request == null) {
            throw new IllegalArgumentException("Backfill request cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Graph factory cannot be null");
        }

        List<LocalDate> dates = plan(request.dates());

        // Factories that cannot name their workflow up front build the first date's one here
        Workflow firstWorkflow = null;
        String workflowName = factory.name();
        if (workflowName == null && !dates.isEmpty()) {
            try {
                firstWorkflow = factory.create();
                workflowName = firstWorkflow.name();
            } catch (VirtualMachineError e) {
                throw e;
            } catch (RuntimeException | Error e) {
                log.warn("Could not build a workflow to name the backfill: {}", messageOf(e));
            }
        }
        if (workflowName == null) {
            workflowName = UNNAMED;
        }

        log.info("Backfill of '{}': {} date point(s){}", workflowName, dates.size(),
                dates.isEmpty() ? "" : " from " + dates.get(0) + " to " + dates.get(dates.size() - 1));
        log.info("  date parameters: {}, formats: {}", request.dateParamNames(), request.dateParamFormats());
        if (!request.onlyTasks().isEmpty()) {
            log.info("  only tasks: {}", request.onlyTasks());
        } else if (request.startFrom() != null) {
            log.info("  starting from task: {}", request.startFrom());
        }

        if (request.dryRun()) {
            log.info("Dry run: parameters are built but no task executes");
        } else if (request.autoConfirm()) {
            log.info("Backfill plan auto-confirmed");
        } else if (prompt == null || !prompt.confirm(workflowName, dates)) {
            log.warn("Backfill of '{}' declined, nothing executed", workflowName);
            return BackfillResult.declined(dates);
        }

        Map<String, DateTimeFormatter> formatters = formattersFor(request);
        DateOutcome[] outcomes = new DateOutcome[dates.size()];
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger failures = new AtomicInteger();

        int threads = Math.min(Math.max(parallelDates, 1), Math.max(dates.size(), 1));
        if (threads <= 1) {
            for (int i = 0; i < dates.size(); i++) {
                outcomes[i] = runDate(dates.get(i), request, factory, formatters, i == 0 ? firstWorkflow : null);
                (outcomes[i].success() ? successes : failures).incrementAndGet();
            }
        } else {
            runConcurrently(dates, request, factory, firstWorkflow, formatters, outcomes, successes, failures, threads);
        }

        List<LocalDate> failedDates = new ArrayList<>();
        List<ExecutionRecord> records = new ArrayList<>();
        for (DateOutcome outcome : outcomes) {
            if (!outcome.success()) {
                failedDates.add(outcome.date());
            }
            if (outcome.record() != null) {
                records.add(outcome.record());
            }
        }

        BackfillResult result = new BackfillResult(
                dates, successes.get(), failures.get(), failedDates, records, request.dryRun(), false
        );

        if (result.isSuccess()) {
            log.info("Backfill of '{}' finished: all {} date point(s) succeeded", workflowName, dates.size());
        } else {
            log.error("Backfill of '{}' finished: {} succeeded, {} failed", workflowName, successes.get(), failures.get());
            log.error("  failed dates: {} (re-run them with an explicit date list)", failedDates);
        }
        return result;
    }

    private void runConcurrently(
            List<LocalDate> dates,
            BackfillRequest request,
            GraphFactory factory,
            Workflow firstWorkflow,
            Map<String, DateTimeFormatter> formatters,
            DateOutcome[] outcomes,
            AtomicInteger successes,
            AtomicInteger failures,
            int threads
    ) {
        log.info("Running {} date points on {} threads", dates.size(), threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads, new NamedThreadFactory("dagrun-backfill"));
        try {
            List<Future<DateOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < dates.size(); i++) {
                LocalDate date = dates.get(i);
                Workflow prepared = i == 0 ? firstWorkflow : null;
                futures.add(pool.submit(() -> {
                    DateOutcome outcome = runDate(date, request, factory, formatters, prepared);
                    (outcome.success() ? successes : failures).incrementAndGet();
                    return outcome;
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                outcomes[i] = futures.get(i).get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Backfill interrupted", e);
        } catch (ExecutionException e) {
            // runDate catches everything but JVM errors
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Unexpected backfill failure", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    private DateOutcome runDate(
            LocalDate date,
            BackfillRequest request,
            GraphFactory factory,
            Map<String, DateTimeFormatter> formatters,
            Workflow prepared
    ) {
        DatePoint point = datePoint(date, request.dateParamNames(), formatters);
        log.info("Backfill date point {}", point);

        Workflow workflow;
        ParameterStore store;
        try {
            workflow = prepared != null ? prepared : factory.create();

            Map<String, Object> templates = new LinkedHashMap<>(workflow.params());
            templates.putAll(request.templateParams());

            Map<String, Object> params = new LinkedHashMap<>(point.params());
            params.putAll(rewriteTemplates(templates, date));
            params.putAll(request.customParams());

            store = new ParameterStore(clock, maxParameterDepth).set(params);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Could not prepare date point {}: {}", date, messageOf(e), e);
            return new DateOutcome(date, false, null);
        }

        if (request.dryRun()) {
            log.info("[dry-run] {}: would run '{}' with {}", date, workflow.name(), store.snapshot());
            return new DateOutcome(date, true, null);
        }

        ExecutionOptions options = ExecutionOptions.builder()
                .startFrom(request.onlyTasks().isEmpty() ? request.startFrom() : null)
                .onlyTasks(request.onlyTasks())
                .failFast(workflow.failFast())
                .datePoint(date)
                .build();

        try {
            ExecutionResult result = engine.execute(workflow.graph(), store, options);
            if (!result.isSuccess()) {
                log.error("Date point {} failed at task '{}'", date, result.record().failedTaskId());
            }
            return new DateOutcome(date, result.isSuccess(), result.record());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            log.error("Date point {} failed: {}", date, messageOf(e));
            return new DateOutcome(date, false, recordFor(workflow.name(), date));
        }
    }

    /**
     * The run the engine recorded before rethrowing, if it got that far
     */
    private ExecutionRecord recordFor(String workflowName, LocalDate date) {
        List<ExecutionRecord> history = engine.history();
        for (int i = history.size() - 1; i >= 0; i--) {
            ExecutionRecord record = history.get(i);
            if (date.equals(record.datePoint()) && workflowName.equals(record.workflowName())) {
                return record;
            }
        }
        return null;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private record DateOutcome(LocalDate date, boolean success, ExecutionRecord record) {
    }
}
