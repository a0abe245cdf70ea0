package org.neuralchilli.dagrun.task;

import org.neuralchilli.dagrun.core.ParameterStore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class holding a task's own parameter map.
 * Parameter values are plain objects; only strings take part in resolution.
 * The declared values are kept apart from the resolved ones, so resolving again
 * always starts from the original templates.
 */
public abstract class AbstractTask implements Task {

    private final String id;
    private final String type;
    private final Map<String, Object> declared;
    private final Map<String, Object> params;

    protected AbstractTask(String id, String type, Map<String, Object> params) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        this.id = id;
        this.type = type;
        this.declared = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        this.params = new LinkedHashMap<>(declared);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public void resolveParams(ParameterStore store) {
        for (Map.Entry<String, Object> entry : declared.entrySet()) {
            Object value = entry.getValue();
            params.put(entry.getKey(), value instanceof String text ? store.resolve(text) : value);
        }
    }

    public AbstractTask setParam(String key, Object value) {
        declared.put(key, value);
        params.put(key, value);
        return this;
    }

    public Object param(String key) {
        return params.get(key);
    }

    public Object param(String key, Object defaultValue) {
        return params.getOrDefault(key, defaultValue);
    }

    /**
     * Read-only view of the current (possibly resolved) parameters
     */
    public Map<String, Object> params() {
        return Collections.unmodifiableMap(params);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[id=" + id + ", params=" + params + ']';
    }
}
