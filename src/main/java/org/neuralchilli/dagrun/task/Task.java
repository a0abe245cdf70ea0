package org.neuralchilli.dagrun.task;

import org.neuralchilli.dagrun.core.ParameterStore;

import java.util.Map;

/**
 * A runnable unit of work placed in a dependency graph.
 * <p>
 * The engine only ever calls {@link #resolveParams(ParameterStore)} followed by
 * {@link #execute(Map)}, so new kinds of work are added by implementing this interface.
 */
public interface Task {

    /**
     * Identifier, unique within one graph
     */
    String id();

    /**
     * Short kind name used in logs ("command", "callable", "expression", ...)
     */
    String type();

    /**
     * Replace every string-valued parameter with {@code store.resolve(value)}.
     * Must be idempotent for an unchanged store.
     */
    void resolveParams(ParameterStore store);

    /**
     * Perform the work.
     *
     * @param upstreamResults results of the direct upstream tasks that ran in this run, keyed by task id
     * @return caller-defined result, may be {@code null}
     * @throws Exception any failure; the engine records its message and wraps it
     */
    Object execute(Map<String, Object> upstreamResults) throws Exception;
}
