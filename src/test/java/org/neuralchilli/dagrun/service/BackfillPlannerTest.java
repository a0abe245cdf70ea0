package org.neuralchilli.dagrun.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.dagrun.core.DependencyGraph;
import org.neuralchilli.dagrun.core.ExecutionEngine;
import org.neuralchilli.dagrun.core.Workflow;
import org.neuralchilli.dagrun.domain.BackfillRequest;
import org.neuralchilli.dagrun.domain.BackfillResult;
import org.neuralchilli.dagrun.domain.DatePoint;
import org.neuralchilli.dagrun.domain.DateSpec;
import org.neuralchilli.dagrun.domain.ExecutionRecord;
import org.neuralchilli.dagrun.domain.Granularity;
import org.neuralchilli.dagrun.monitoring.AlertSink;
import org.neuralchilli.dagrun.task.CallableTask;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BackfillPlannerTest {

    private ExecutionEngine engine;
    private BackfillPlanner planner;

    // Parameters each date point's "capture" task saw, in execution order
    private List<Map<String, Object>> captured;

    @BeforeEach
    void setup() {
        engine = new ExecutionEngine(AlertSink.NO_OP);
        planner = new BackfillPlanner(engine, 1, ConfirmationPrompt.ACCEPT);
        captured = Collections.synchronizedList(new ArrayList<>());
    }

    private static List<LocalDate> dates(String... isoDates) {
        return Arrays.stream(isoDates).map(LocalDate::parse).toList();
    }

    /**
     * prepare -> capture; capture records its resolved params, and fails for {@code failOn}
     */
    private GraphFactory factory(Map<String, Object> declaredParams, Map<String, Object> taskParams, String failOn) {
        return () -> {
            DependencyGraph graph = new DependencyGraph("daily-etl")
                    .addNode(new CallableTask("prepare", (params, upstream) -> "ready"))
                    .addNode(new CallableTask("capture", taskParams, (params, upstream) -> {
                        if (failOn != null && failOn.equals(params.get("day"))) {
                            throw new IllegalStateException("bad data for " + failOn);
                        }
                        captured.add(new LinkedHashMap<>(params));
                        return params;
                    }))
                    .addEdge("prepare", "capture");
            return new Workflow(graph, declaredParams, true);
        };
    }

    private GraphFactory simpleFactory() {
        return factory(Map.of(), Map.of("day", "${day_id}"), null);
    }

    // --- planning ---

    @Test
    void shouldPlanDailyRangeInclusive() {
        List<LocalDate> planned = planner.plan(DateSpec.daily("2024-01-30", "2024-02-02"));

        assertThat(planned).isEqualTo(dates("2024-01-30", "2024-01-31", "2024-02-01", "2024-02-02"));
    }

    @Test
    void shouldRollWeeklyRangeBackToMonday() {
        // Given: 2024-01-03 is a Wednesday
        List<LocalDate> planned = planner.plan(DateSpec.range("2024-01-03", "2024-01-20", Granularity.WEEK));

        assertThat(planned).isEqualTo(dates("2024-01-01", "2024-01-08", "2024-01-15"));
    }

    @Test
    void shouldRollMonthlyRangeBackToFirstDay() {
        List<LocalDate> planned = planner.plan(DateSpec.range("2024-01-15", "2024-03-02", Granularity.MONTH));

        assertThat(planned).isEqualTo(dates("2024-01-01", "2024-02-01", "2024-03-01"));
    }

    @Test
    void shouldUseExplicitDatesVerbatim() {
        List<LocalDate> planned = planner.plan(DateSpec.of(List.of("2024-03-05", "2024-01-01", "2024-03-05")));

        assertThat(planned).isEqualTo(dates("2024-03-05", "2024-01-01", "2024-03-05"));
    }

    @Test
    void shouldPlanSingleDayRange() {
        assertThat(planner.plan(DateSpec.daily("2024-02-29", "2024-02-29"))).isEqualTo(dates("2024-02-29"));
    }

    @Test
    void shouldRejectInvertedOrUnparsableRanges() {
        assertThatThrownBy(() -> planner.plan(DateSpec.daily("2024-01-10", "2024-01-09")))
                .isInstanceOf(InvalidDateRangeException.class)
                .hasMessageContaining("before");
        assertThatThrownBy(() -> planner.plan(DateSpec.daily("2024-13-01", "2024-12-31")))
                .isInstanceOf(InvalidDateRangeException.class);
        assertThatThrownBy(() -> planner.plan(DateSpec.of(List.of("2024-01-01", "01/02/2024"))))
                .isInstanceOf(InvalidDateRangeException.class)
                .hasMessageContaining("01/02/2024");
    }

    // --- date parameters ---

    @Test
    void shouldBuildDateParametersWithFormatsAndNoDashVariants() {
        // Given
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-03-01", "2024-03-01"))
                .dateParamNames(List.of("day_id", "dt", "month"))
                .dateParamFormats(Map.of("dt", "%Y%m%d", "month", "yyyy-MM"))
                .build();

        // When
        DatePoint point = planner.datePoint(LocalDate.of(2024, 3, 1), request);

        // Then
        assertThat(point.value()).isEqualTo("2024-03-01");
        assertThat(point.params())
                .containsEntry("day_id", "2024-03-01")
                .containsEntry("day_id_no_dash", "20240301")
                .containsEntry("dt", "20240301")
                .containsEntry("dt_no_dash", "20240301")
                .containsEntry("month", "2024-03")
                .containsEntry("month_no_dash", "202403");
    }

    @Test
    void shouldFallBackToDefaultFormatWhenInvalid() {
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-03-01", "2024-03-01"))
                .dateParamNames(List.of("day_id", "zoned"))
                .dateParamFormats(Map.of("day_id", "%Q", "zoned", "yyyy-MM-dd VV"))
                .build();

        DatePoint point = planner.datePoint(LocalDate.of(2024, 3, 1), request);

        assertThat(point.params())
                .containsEntry("day_id", "2024-03-01")
                .containsEntry("zoned", "2024-03-01");
    }

    @Test
    void explicitNoDashNameShouldKeepItsOwnFormat() {
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-03-01", "2024-03-01"))
                .dateParamNames(List.of("day_id", "day_id_no_dash"))
                .dateParamFormats(Map.of("day_id_no_dash", "yyyy/MM/dd"))
                .build();

        DatePoint point = planner.datePoint(LocalDate.of(2024, 3, 1), request);

        assertThat(point.params()).containsEntry("day_id_no_dash", "2024/03/01");
    }

    @Test
    void shouldRewriteDateTemplatesAgainstDatePoint() {
        // Given
        Map<String, Object> templates = new LinkedHashMap<>();
        templates.put("prev_day", "${yyyyMMdd-1}");
        templates.put("next_week", "${yyyy-MM-dd+7}");
        templates.put("path", "/data/${day_id}");
        templates.put("retries", 3);

        // When
        Map<String, Object> rewritten = planner.rewriteTemplates(templates, LocalDate.of(2024, 3, 1));

        // Then
        assertThat(rewritten)
                .containsEntry("prev_day", "20240229")
                .containsEntry("next_week", "2024-03-08")
                .containsEntry("next_week_no_dash", "20240308")
                .containsEntry("path", "/data/${day_id}")
                .containsEntry("retries", 3)
                .doesNotContainKey("prev_day_no_dash");
    }

    // --- running ---

    @Test
    void shouldRunEachDatePointWithItsOwnParameters() {
        // Given
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03"))
                .build();

        // When
        BackfillResult result = planner.run(request, simpleFactory());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.successCount()).isEqualTo(3);
        assertThat(result.failureCount()).isZero();
        assertThat(captured).extracting(params -> params.get("day"))
                .containsExactly("2024-01-01", "2024-01-02", "2024-01-03");
        assertThat(result.records()).extracting(ExecutionRecord::datePoint)
                .containsExactlyElementsOf(dates("2024-01-01", "2024-01-02", "2024-01-03"));
        assertThat(engine.history()).hasSize(3);
    }

    @Test
    void failingDatePointShouldNotBlockOthers() {
        // Given: the second date fails
        GraphFactory factory = factory(Map.of(), Map.of("day", "${day_id}"), "2024-01-02");
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        // When
        BackfillResult result = planner.run(request, factory);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.failedDates()).containsExactly(LocalDate.of(2024, 1, 2));
        assertThat(captured).extracting(params -> params.get("day"))
                .containsExactly("2024-01-01", "2024-01-03");

        // the failed date's record is still reported
        assertThat(result.records()).hasSize(3);
        assertThat(result.records().get(1).failedTaskId()).isEqualTo("capture");
        assertThat(result.retrySpec()).isEqualTo(DateSpec.of(List.of("2024-01-02")));
    }

    @Test
    void shouldMergeDateBundleThenTemplatesThenCustomParams() {
        // Given: the workflow declares templates, the request overrides one of them
        Map<String, Object> declared = new LinkedHashMap<>();
        declared.put("prev_day", "${yyyy-MM-dd-1}");
        declared.put("region", "eu");
        declared.put("day_id", "overridden-by-custom");

        Map<String, Object> taskParams = new LinkedHashMap<>();
        taskParams.put("day", "${day_id}");
        taskParams.put("prev", "${prev_day}");
        taskParams.put("prev_compact", "${prev_day_no_dash}");
        taskParams.put("region", "${region}");

        BackfillRequest request = BackfillRequest.builder(DateSpec.of(List.of("2024-03-01")))
                .customParams(Map.of("region", "us", "day_id", "2024-03-01"))
                .build();

        // When
        planner.run(request, factory(declared, taskParams, null));

        // Then
        assertThat(captured).hasSize(1);
        assertThat(captured.get(0))
                .containsEntry("day", "2024-03-01")
                .containsEntry("prev", "2024-02-29")
                .containsEntry("prev_compact", "20240229")
                .containsEntry("region", "us");
    }

    @Test
    void requestTemplatesShouldOverrideDeclaredTemplates() {
        Map<String, Object> taskParams = Map.of("day", "${day_id}", "ref", "${ref_day}");
        BackfillRequest request = BackfillRequest.builder(DateSpec.of(List.of("2024-03-01")))
                .templateParams(Map.of("ref_day", "${yyyyMMdd+1}"))
                .build();

        planner.run(request, factory(Map.of("ref_day", "${yyyyMMdd-1}"), taskParams, null));

        assertThat(captured.get(0)).containsEntry("ref", "20240302");
    }

    @Test
    void eachDatePointShouldGetFreshGraph() {
        // Given: a factory that counts calls and hands out new task instances
        AtomicInteger created = new AtomicInteger();
        Set<Object> taskInstances = Collections.newSetFromMap(new IdentityHashMap<>());
        GraphFactory base = simpleFactory();
        GraphFactory counting = () -> {
            created.incrementAndGet();
            Workflow workflow = base.create();
            taskInstances.add(workflow.graph().task("capture"));
            return workflow;
        };
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        // When
        planner.run(request, counting);

        // Then: exactly one workflow per date, the first one also names the backfill
        assertThat(created.get()).isEqualTo(3);
        assertThat(taskInstances).hasSize(3);
    }

    @Test
    void shouldHonourOnlyTasksAndStartFrom() {
        BackfillRequest onlyCapture = BackfillRequest.builder(DateSpec.of(List.of("2024-01-01")))
                .onlyTasks(List.of("capture"))
                .build();
        BackfillRequest fromCapture = BackfillRequest.builder(DateSpec.of(List.of("2024-01-02")))
                .startFrom("capture")
                .build();

        BackfillResult first = planner.run(onlyCapture, simpleFactory());
        BackfillResult second = planner.run(fromCapture, simpleFactory());

        assertThat(first.records().get(0).completedTasks()).containsExactly("capture");
        assertThat(second.records().get(0).completedTasks()).containsExactly("capture");
        assertThat(second.records().get(0).startFrom()).isEqualTo("capture");
    }

    @Test
    void unknownTaskFilterShouldFailEveryDateButKeepGoing() {
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-02"))
                .startFrom("missing")
                .build();

        BackfillResult result = planner.run(request, simpleFactory());

        assertThat(result.failedDates()).isEqualTo(dates("2024-01-01", "2024-01-02"));
        assertThat(result.successCount()).isZero();
        assertThat(captured).isEmpty();
    }

    @Test
    void dryRunShouldExecuteNothing() {
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-05"))
                .dryRun(true)
                .build();
        ConfirmationPrompt prompt = mock(ConfirmationPrompt.class);

        BackfillResult result = planner.run(request, simpleFactory(), prompt);

        assertThat(result.dryRun()).isTrue();
        assertThat(result.plannedDates()).hasSize(5);
        assertThat(result.successCount()).isEqualTo(5);
        assertThat(result.records()).isEmpty();
        assertThat(captured).isEmpty();
        assertThat(engine.history()).isEmpty();
        verifyNoInteractions(prompt);
    }

    @Test
    void declinedConfirmationShouldExecuteNothing() {
        // Given
        ConfirmationPrompt prompt = mock(ConfirmationPrompt.class);
        when(prompt.confirm(any(), anyList())).thenReturn(false);
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        // When
        BackfillResult result = planner.run(request, simpleFactory(), prompt);

        // Then
        assertThat(result.declined()).isTrue();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.plannedDates()).hasSize(3);
        assertThat(captured).isEmpty();
        assertThat(engine.history()).isEmpty();
        verify(prompt, times(1)).confirm(eq("daily-etl"), eq(dates("2024-01-01", "2024-01-02", "2024-01-03")));
    }

    @Test
    void autoConfirmShouldSkipPrompt() {
        ConfirmationPrompt prompt = mock(ConfirmationPrompt.class);
        BackfillRequest request = BackfillRequest.builder(DateSpec.of(List.of("2024-01-01")))
                .autoConfirm(true)
                .build();

        BackfillResult result = planner.run(request, simpleFactory(), prompt);

        assertThat(result.isSuccess()).isTrue();
        verifyNoInteractions(prompt);
    }

    @Test
    void shouldRunDatePointsConcurrently() {
        // Given
        BackfillPlanner parallel = new BackfillPlanner(engine, 3, ConfirmationPrompt.ACCEPT);
        GraphFactory factory = factory(Map.of(), Map.of("day", "${day_id}"), "2024-01-04");
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-06")).build();

        // When
        BackfillResult result = parallel.run(request, factory);

        // Then: counters and failed list are complete and in plan order
        assertThat(result.successCount()).isEqualTo(5);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.failedDates()).containsExactly(LocalDate.of(2024, 1, 4));
        assertThat(captured).extracting(params -> params.get("day"))
                .containsExactlyInAnyOrder("2024-01-01", "2024-01-02", "2024-01-03", "2024-01-05", "2024-01-06");
        assertThat(result.records()).extracting(ExecutionRecord::datePoint)
                .containsExactlyElementsOf(dates("2024-01-01", "2024-01-02", "2024-01-03",
                        "2024-01-04", "2024-01-05", "2024-01-06"));
    }

    @Test
    void failingFactoryShouldFailOnlyThatDate() {
        AtomicInteger calls = new AtomicInteger();
        GraphFactory base = simpleFactory();
        GraphFactory flaky = new GraphFactory() {
            @Override
            public Workflow create() {
                // call 1 = first date, call 2 = second date
                if (calls.incrementAndGet() == 2) {
                    throw new IllegalStateException("config unavailable");
                }
                return base.create();
            }

            @Override
            public String name() {
                return "daily-etl";
            }
        };
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        BackfillResult result = planner.run(request, flaky);

        assertThat(result.failedDates()).containsExactly(LocalDate.of(2024, 1, 2));
        assertThat(result.successCount()).isEqualTo(2);
        assertThat(result.records()).hasSize(2);
    }

    @Test
    void alwaysFailingFactoryShouldFailEveryDateWithoutThrowing() {
        // Given: a plain lambda factory that never builds a workflow
        GraphFactory broken = () -> {
            throw new IllegalStateException("config unavailable");
        };
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        // When
        BackfillResult result = planner.run(request, broken);

        // Then
        assertThat(result.failedDates()).isEqualTo(dates("2024-01-01", "2024-01-02", "2024-01-03"));
        assertThat(result.successCount()).isZero();
        assertThat(result.records()).isEmpty();
    }

    @Test
    void errorInOneDateShouldNotStopLaterDates() {
        // Given: the first date's task raises an AssertionError
        GraphFactory factory = () -> new Workflow(new DependencyGraph("asserting")
                .addNode(new CallableTask("check", Map.of("day", "${day_id}"), (params, upstream) -> {
                    if ("2024-01-01".equals(params.get("day"))) {
                        throw new AssertionError("row count mismatch");
                    }
                    captured.add(new LinkedHashMap<>(params));
                    return "ok";
                })));
        BackfillRequest request = BackfillRequest.builder(DateSpec.daily("2024-01-01", "2024-01-03")).build();

        // When
        BackfillResult result = planner.run(request, factory);

        // Then: the failing date is recorded and the others still ran
        assertThat(result.failedDates()).containsExactly(LocalDate.of(2024, 1, 1));
        assertThat(result.successCount()).isEqualTo(2);
        assertThat(captured).hasSize(2);
        assertThat(result.records()).hasSize(3);
        assertThat(result.records().get(0).errorMessage()).isEqualTo("row count mismatch");
    }
}
