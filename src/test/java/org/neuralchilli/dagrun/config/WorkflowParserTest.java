package org.neuralchilli.dagrun.config;

import org.junit.jupiter.api.Test;
import org.neuralchilli.dagrun.domain.BackfillRequest;
import org.neuralchilli.dagrun.domain.DateSpec;
import org.neuralchilli.dagrun.domain.Granularity;

import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkflowParserTest {

    private final WorkflowParser parser = new WorkflowParser();

    @Test
    void shouldParseWorkflowFromClasspath() throws Exception {
        // Given
        WorkflowDefinition definition;
        try (InputStream in = getClass().getResourceAsStream("/workflows/daily-report.yaml")) {
            // When
            definition = parser.parseWorkflow(in);
        }

        // Then
        assertThat(definition.name()).isEqualTo("daily-report");
        assertThat(definition.description()).startsWith("Extract");
        assertThat(definition.failFast()).isTrue();
        assertThat(definition.params())
                .containsEntry("day_id", "${yyyy-MM-dd-1}")
                .containsEntry("region", "eu");

        assertThat(definition.tasks()).extracting(TaskDefinition::id)
                .containsExactly("extract", "check", "publish");

        TaskDefinition extract = definition.tasks().get(0);
        assertThat(extract.type()).isEqualTo(TaskDefinition.COMMAND);
        assertThat(extract.timeoutSeconds()).isEqualTo(60);
        assertThat(extract.params()).containsEntry("day", "${day_id}");

        TaskDefinition check = definition.tasks().get(1);
        assertThat(check.type()).isEqualTo(TaskDefinition.EXPRESSION);
        assertThat(check.assertion()).isTrue();
        assertThat(check.dependsOn()).containsExactly("extract");

        // publish has no type and defaults to command
        assertThat(definition.tasks().get(2).type()).isEqualTo(TaskDefinition.COMMAND);

        assertThat(definition.allDependencies()).containsExactly(
                new WorkflowDefinition.Dependency("check", "publish"),
                new WorkflowDefinition.Dependency("extract", "check")
        );
    }

    @Test
    void shouldParseMinimalWorkflow() {
        String yaml = """
                name: minimal
                tasks:
                  - id: only
                    command: "true"
                """;

        WorkflowDefinition definition = parser.parseWorkflow(yaml);

        assertThat(definition.failFast()).isTrue();
        assertThat(definition.params()).isEmpty();
        assertThat(definition.dependencies()).isEmpty();
    }

    @Test
    void shouldAcceptNameAsTaskIdAlias() {
        String yaml = """
                name: legacy
                fail_fast: false
                tasks:
                  - name: old-style
                    command: echo hi
                """;

        WorkflowDefinition definition = parser.parseWorkflow(yaml);

        assertThat(definition.tasks().get(0).id()).isEqualTo("old-style");
        assertThat(definition.failFast()).isFalse();
    }

    @Test
    void shouldRejectInvalidWorkflows() {
        assertThatThrownBy(() -> parser.parseWorkflow("tasks: []"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("name");

        assertThatThrownBy(() -> parser.parseWorkflow("name: empty\ntasks: []"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one task");

        assertThatThrownBy(() -> parser.parseWorkflow("""
                name: bad-type
                tasks:
                  - id: t
                    type: sql
                    command: select 1
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sql");

        assertThatThrownBy(() -> parser.parseWorkflow("""
                name: dangling
                tasks:
                  - id: t
                    command: echo
                    depends_on: [ghost]
                """))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("ghost");

        assertThatThrownBy(() -> parser.parseWorkflow(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldParseBackfillRangeFromClasspath() throws Exception {
        BackfillRequest request;
        try (InputStream in = getClass().getResourceAsStream("/workflows/daily-report-backfill.yaml")) {
            request = parser.parseBackfill(in);
        }

        // unquoted and quoted dates both come back as ISO text
        assertThat(request.dates()).isEqualTo(DateSpec.range("2024-01-03", "2024-01-20", Granularity.WEEK));
        assertThat(request.dateParamNames()).containsExactly("day_id", "dt");
        assertThat(request.dateParamFormats()).containsEntry("dt", "%Y%m%d");
        assertThat(request.customParams()).containsEntry("region", "us");
        assertThat(request.onlyTasks()).containsExactly("extract", "check");
        assertThat(request.dryRun()).isFalse();
        assertThat(request.autoConfirm()).isTrue();
    }

    @Test
    void shouldParseCustomDatesAndLegacyParamName() {
        String yaml = """
                custom_dates: [2024-02-01, "2024-02-15"]
                date_param_name: biz_date
                start_from: load
                dry_run: true
                template_params:
                  prev: "${yyyyMMdd-1}"
                """;

        BackfillRequest request = parser.parseBackfill(yaml);

        assertThat(request.dates()).isEqualTo(DateSpec.of(List.of("2024-02-01", "2024-02-15")));
        assertThat(request.dateParamNames()).containsExactly("biz_date");
        assertThat(request.startFrom()).isEqualTo("load");
        assertThat(request.dryRun()).isTrue();
        assertThat(request.templateParams()).containsEntry("prev", "${yyyyMMdd-1}");
    }

    @Test
    void shouldDefaultDateParamNameAndRequireRange() {
        BackfillRequest request = parser.parseBackfill("start_date: 2024-01-01\nend_date: 2024-01-02");

        assertThat(request.dateParamNames()).containsExactly(BackfillRequest.DEFAULT_DATE_PARAM);
        assertThat(request.dates()).isEqualTo(DateSpec.daily("2024-01-01", "2024-01-02"));

        assertThatThrownBy(() -> parser.parseBackfill("start_date: 2024-01-01"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("end_date");
        assertThatThrownBy(() -> parser.parseBackfill("start_date: 2024-01-01\nend_date: 2024-01-02\ndate_granularity: hourly"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("hourly");
    }

    @Test
    void shouldRejectEmptyDateFormat() {
        String yaml = """
                start_date: 2024-01-01
                end_date: 2024-01-02
                date_param_formats:
                  day_id: ~
                """;

        assertThatThrownBy(() -> parser.parseBackfill(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("date_param_formats")
                .hasMessageContaining("day_id");
    }
}
