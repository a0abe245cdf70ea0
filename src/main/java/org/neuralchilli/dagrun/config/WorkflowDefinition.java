package org.neuralchilli.dagrun.config;

import org.neuralchilli.dagrun.core.DependencyGraph;
import org.neuralchilli.dagrun.core.Workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable workflow configuration: the source every fresh {@link Workflow} is built from.
 */
public record WorkflowDefinition(
        String name,
        String description,
        boolean failFast,
        Map<String, Object> params,
        List<TaskDefinition> tasks,
        List<Dependency> dependencies
) {

    /**
     * {@code downstream} depends on {@code upstream}
     */
    public record Dependency(String upstream, String downstream) {
        public Dependency {
            if (upstream == null || upstream.isBlank() || downstream == null || downstream.isBlank()) {
                throw new IllegalArgumentException("Dependency needs both upstream and downstream");
            }
        }
    }

    public WorkflowDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Workflow name is required");
        }
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Workflow '" + name + "' must have at least one task");
        }
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
        tasks = List.copyOf(tasks);
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();

        Set<String> ids = new LinkedHashSet<>();
        tasks.forEach(task -> ids.add(task.id()));
        for (Dependency dependency : allDependencies(tasks, dependencies)) {
            if (!ids.contains(dependency.upstream()) || !ids.contains(dependency.downstream())) {
                throw new IllegalArgumentException(String.format(
                        "Workflow '%s': dependency %s -> %s references an undefined task",
                        name, dependency.upstream(), dependency.downstream()
                ));
            }
        }
    }

    /**
     * Explicit dependencies followed by those declared through {@code depends_on}
     */
    public List<Dependency> allDependencies() {
        return allDependencies(tasks, dependencies);
    }

    private static List<Dependency> allDependencies(List<TaskDefinition> tasks, List<Dependency> dependencies) {
        Set<Dependency> all = new LinkedHashSet<>(dependencies);
        for (TaskDefinition task : tasks) {
            for (String upstream : task.dependsOn()) {
                all.add(new Dependency(upstream, task.id()));
            }
        }
        return List.copyOf(all);
    }

    /**
     * Build a new graph with new task instances
     */
    public Workflow toWorkflow() {
        DependencyGraph graph = new DependencyGraph(name);
        for (TaskDefinition task : tasks) {
            graph.addNode(task.id(), task.toTask());
        }
        for (Dependency dependency : allDependencies()) {
            graph.addEdge(dependency.upstream(), dependency.downstream());
        }
        return new Workflow(graph, params, failFast);
    }
}
