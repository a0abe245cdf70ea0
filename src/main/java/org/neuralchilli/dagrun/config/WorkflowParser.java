package org.neuralchilli.dagrun.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.dagrun.domain.BackfillRequest;
import org.neuralchilli.dagrun.domain.DateSpec;
import org.neuralchilli.dagrun.domain.Granularity;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses workflow and backfill YAML documents.
 */
@ApplicationScoped
public class WorkflowParser {

    private final Yaml yaml = new Yaml();

    /**
     * Parse a workflow definition from YAML string
     */
    public WorkflowDefinition parseWorkflow(String yamlContent) {
        return parseWorkflowFromMap(load(yamlContent));
    }

    public WorkflowDefinition parseWorkflow(InputStream inputStream) {
        return parseWorkflowFromMap(yaml.load(inputStream));
    }

    public WorkflowDefinition parseWorkflow(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parseWorkflow(in);
        }
    }

    /**
     * Parse a backfill request from YAML string
     */
    public BackfillRequest parseBackfill(String yamlContent) {
        return parseBackfillFromMap(load(yamlContent));
    }

    public BackfillRequest parseBackfill(InputStream inputStream) {
        return parseBackfillFromMap(yaml.load(inputStream));
    }

    public BackfillRequest parseBackfill(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parseBackfill(in);
        }
    }

    private Map<String, Object> load(String yamlContent) {
        if (yamlContent == null || yamlContent.isBlank()) {
            throw new IllegalArgumentException("YAML content is empty");
        }
        return yaml.load(yamlContent);
    }

    @SuppressWarnings("unchecked")
    private WorkflowDefinition parseWorkflowFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Workflow document is empty");
        }

        String name = getString(data, "name", true);
        String description = getString(data, "description", false);
        boolean failFast = getBoolean(data, "fail_fast", true);
        Map<String, Object> params = getParams(data, "params");

        Object tasksValue = data.get("tasks");
        if (!(tasksValue instanceof List<?> tasksList) || tasksList.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + name + "' must have at least one task");
        }

        List<TaskDefinition> tasks = new ArrayList<>();
        for (Object taskData : tasksList) {
            tasks.add(parseTask((Map<String, Object>) taskData));
        }

        List<WorkflowDefinition.Dependency> dependencies = new ArrayList<>();
        Object depsValue = data.get("dependencies");
        if (depsValue instanceof List<?> depsList) {
            for (Object dep : depsList) {
                Map<String, Object> depData = (Map<String, Object>) dep;
                dependencies.add(new WorkflowDefinition.Dependency(
                        getString(depData, "upstream", true),
                        getString(depData, "downstream", true)
                ));
            }
        }

        return new WorkflowDefinition(name, description, failFast, params, tasks, dependencies);
    }

    private TaskDefinition parseTask(Map<String, Object> data) {
        // "name" is accepted as an alias for older configs
        String id = getString(data, "id", false);
        if (id == null) {
            id = getString(data, "name", true);
        }

        return new TaskDefinition(
                id,
                getString(data, "type", false),
                getString(data, "command", false),
                getString(data, "expression", false),
                getInt(data, "timeout", 3600),
                getString(data, "working_dir", false),
                getBoolean(data, "assert", false),
                getParams(data, "params"),
                getStringList(data, "depends_on", List.of())
        );
    }

    private BackfillRequest parseBackfillFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Backfill document is empty");
        }

        DateSpec dates;
        List<String> customDates = getStringList(data, "custom_dates", List.of());
        if (!customDates.isEmpty()) {
            dates = DateSpec.of(customDates);
        } else {
            dates = DateSpec.range(
                    getString(data, "start_date", true),
                    getString(data, "end_date", true),
                    Granularity.fromString(getString(data, "date_granularity", false))
            );
        }

        List<String> names = getStringList(data, "date_param_names", List.of());
        if (names.isEmpty()) {
            names = List.of(getString(data, "date_param_name", false) != null
                    ? getString(data, "date_param_name", false)
                    : BackfillRequest.DEFAULT_DATE_PARAM);
        }

        return BackfillRequest.builder(dates)
                .dateParamNames(names)
                .dateParamFormats(getStringMap(data, "date_param_formats", Map.of()))
                .templateParams(getParams(data, "template_params"))
                .customParams(getParams(data, "params"))
                .onlyTasks(getStringList(data, "only_tasks", List.of()))
                .startFrom(getString(data, "start_from", false))
                .dryRun(getBoolean(data, "dry_run", false))
                .autoConfirm(getBoolean(data, "auto_confirm", false))
                .build();
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return scalar(value).toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    private List<String> getStringList(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(item -> scalar(item).toString())
                    .toList();
        }
        // A single value where a list is expected
        return List.of(scalar(value).toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key, Map<String, String> defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map) {
            Map<String, String> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> {
                if (v == null) {
                    throw new IllegalArgumentException("Field '" + key + "' has no value for '" + k + "'");
                }
                result.put(k.toString(), scalar(v).toString());
            });
            return result;
        }
        throw new IllegalArgumentException("Field '" + key + "' must be a mapping");
    }

    private Map<String, Object> getParams(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Field '" + key + "' must be a mapping");
        }
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(k.toString(), v != null ? scalar(v) : null));
        return result;
    }

    /**
     * SnakeYAML reads unquoted dates such as {@code 2024-01-01} as {@link Date} at UTC midnight;
     * they are turned back into ISO dates here.
     */
    private static Object scalar(Object value) {
        if (value instanceof Date date) {
            return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate().toString();
        }
        return value;
    }
}
