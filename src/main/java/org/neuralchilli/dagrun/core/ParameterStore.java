package org.neuralchilli.dagrun.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named parameter values plus resolution of {@code ${...}} references.
 * <p>
 * For every {@code ${name}} in a text:
 * <ol>
 *   <li>a date expression such as {@code yyyy-MM-dd-1} is evaluated against today</li>
 *   <li>a known key is substituted, recursively resolving string values</li>
 *   <li>anything else is left as written</li>
 * </ol>
 * A reference chain that re-enters itself, or grows deeper than {@code maxDepth},
 * fails with {@link CyclicParameterException}.
 * <p>
 * Writes are not synchronised. Stores are filled before a run and only read during it.
 */
public class ParameterStore {

    private static final Logger log = LoggerFactory.getLogger(ParameterStore.class);

    public static final int DEFAULT_MAX_DEPTH = 32;

    private static final Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)}");

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final Clock clock;
    private final int maxDepth;

    public ParameterStore() {
        this(Clock.systemDefaultZone(), DEFAULT_MAX_DEPTH);
    }

    public ParameterStore(Clock clock) {
        this(clock, DEFAULT_MAX_DEPTH);
    }

    public ParameterStore(Clock clock, int maxDepth) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Max resolution depth must be positive, got: " + maxDepth);
        }
        this.clock = clock;
        this.maxDepth = maxDepth;
    }

    /**
     * Store seeded with {@code values}, wall clock, default depth
     */
    public static ParameterStore of(Map<String, ?> values) {
        return new ParameterStore().set(values);
    }

    /**
     * Merge {@code entries} into the store; later keys overwrite earlier ones.
     */
    public ParameterStore set(Map<String, ?> entries) {
        if (entries != null) {
            values.putAll(entries);
        }
        return this;
    }

    public ParameterStore set(String name, Object value) {
        values.put(name, value);
        return this;
    }

    public Object get(String name, Object defaultValue) {
        return values.containsKey(name) ? values.get(name) : defaultValue;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * Copy of the raw (unresolved) values, in insertion order
     */
    public Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Clock clock() {
        return clock;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * Resolve every {@code ${...}} reference in {@code text}.
     *
     * @return the resolved text, or {@code null} for {@code null} input
     * @throws CyclicParameterException if a reference chain loops or is too deep
     */
    public String resolve(String text) {
        if (text == null) {
            return null;
        }
        return resolve(text, new ArrayList<>());
    }

    private String resolve(String text, List<String> chain) {
        if (text.indexOf("${") < 0) {
            return text;
        }

        Matcher matcher = REFERENCE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String replacement = resolveReference(matcher.group(1), matcher.group(0), chain);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private String resolveReference(String name, String token, List<String> chain) {
        Optional<DateExpression> date = DateExpression.parse(name);
        if (date.isPresent()) {
            return date.get().apply(LocalDateTime.now(clock));
        }

        if (!values.containsKey(name)) {
            log.trace("Leaving unresolved reference {}", token);
            return token;
        }

        Object value = values.get(name);
        if (!(value instanceof String text)) {
            return String.valueOf(value);
        }

        if (chain.contains(name)) {
            throw new CyclicParameterException(
                    "Cyclic parameter reference: " + String.join(" -> ", chain) + " -> " + name
            );
        }
        if (chain.size() >= maxDepth) {
            throw new CyclicParameterException(
                    "Parameter resolution exceeded depth " + maxDepth + ": " + String.join(" -> ", chain)
            );
        }

        chain.add(name);
        try {
            return resolve(text, chain);
        } finally {
            chain.remove(chain.size() - 1);
        }
    }

    @Override
    public String toString() {
        return "ParameterStore" + values;
    }
}
