package org.neuralchilli.dagrun.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A graph ready to run together with the parameters it declares.
 *
 * @param params   workflow-level parameters; string values may be {@code ${...}} templates
 * @param failFast failure policy the workflow asks for
 */
public record Workflow(DependencyGraph graph, Map<String, Object> params, boolean failFast) {

    public Workflow {
        if (graph == null) {
            throw new IllegalArgumentException("Workflow graph cannot be null");
        }
        params = params != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(params))
                : Map.of();
    }

    public Workflow(DependencyGraph graph) {
        this(graph, Map.of(), true);
    }

    public String name() {
        return graph.name();
    }
}
