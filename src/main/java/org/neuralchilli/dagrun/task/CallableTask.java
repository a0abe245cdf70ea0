package org.neuralchilli.dagrun.task;

import java.util.Map;

/**
 * In-process task backed by a function of its resolved parameters and the
 * upstream results.
 */
public class CallableTask extends AbstractTask {

    /**
     * The work itself. May throw any exception to signal failure.
     */
    @FunctionalInterface
    public interface Body {
        Object call(Map<String, Object> params, Map<String, Object> upstreamResults) throws Exception;
    }

    private final Body body;

    public CallableTask(String id, Map<String, Object> params, Body body) {
        super(id, "callable", params);
        if (body == null) {
            throw new IllegalArgumentException("Callable task '" + id + "' needs a body");
        }
        this.body = body;
    }

    public CallableTask(String id, Body body) {
        this(id, Map.of(), body);
    }

    @Override
    public Object execute(Map<String, Object> upstreamResults) throws Exception {
        return body.call(params(), upstreamResults != null ? upstreamResults : Map.of());
    }
}
