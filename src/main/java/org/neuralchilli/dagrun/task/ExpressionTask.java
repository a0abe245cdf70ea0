package org.neuralchilli.dagrun.task;

import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates a JEXL expression in-process.
 * <p>
 * The expression sees {@code params} (this task's resolved parameters), {@code upstream}
 * (direct upstream results keyed by task id) and {@code Math}. In assertion mode a result
 * other than {@code true} fails the task, which makes the kind usable for data checks
 * between steps.
 */
public class ExpressionTask extends AbstractTask {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTask.class);

    private static final JexlEngine jexl = new JexlBuilder()
            .cache(256)
            .strict(false)
            .silent(false)
            .permissions(JexlPermissions.UNRESTRICTED)
            .create();

    private final String expression;
    private final boolean assertion;

    public ExpressionTask(String id, String expression, Map<String, Object> params, boolean assertion) {
        super(id, "expression", params);
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression task '" + id + "' needs an expression");
        }
        this.expression = expression;
        this.assertion = assertion;
    }

    public ExpressionTask(String id, String expression) {
        this(id, expression, Map.of(), false);
    }

    @Override
    public Object execute(Map<String, Object> upstreamResults) {
        JexlExpression compiled;
        try {
            compiled = jexl.createExpression(expression);
        } catch (JexlException e) {
            throw new ExpressionException("Invalid expression in task '" + id() + "': " + expression, e);
        }

        Object result;
        try {
            result = compiled.evaluate(createContext(upstreamResults));
        } catch (JexlException e) {
            String msg = String.format("Failed to evaluate expression: %s - %s", expression, e.getMessage());
            log.error(msg, e);
            throw new ExpressionException(msg, e);
        }

        log.debug("[{}] {} => {}", id(), expression, result);

        if (assertion && !Boolean.TRUE.equals(result)) {
            throw new ExpressionException("Assertion failed in task '" + id() + "': " + expression + " => " + result);
        }
        return result;
    }

    private JexlContext createContext(Map<String, Object> upstreamResults) {
        MapContext context = new MapContext();
        context.set("params", params());
        context.set("upstream", upstreamResults != null ? upstreamResults : Map.of());
        context.set("Math", Math.class);
        return context;
    }

    public String expression() {
        return expression;
    }

    public boolean isAssertion() {
        return assertion;
    }
}
