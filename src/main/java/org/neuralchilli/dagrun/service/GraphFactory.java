package org.neuralchilli.dagrun.service;

import org.neuralchilli.dagrun.core.Workflow;

/**
 * Source of brand-new workflows for a backfill.
 * <p>
 * Each call to {@link #create()} must return a graph with its own task instances;
 * nothing mutable may be shared between two returned workflows.
 */
@FunctionalInterface
public interface GraphFactory {

    Workflow create();

    /**
     * Name of the workflows this factory builds, or {@code null} when it is only known
     * from a created workflow
     */
    default String name() {
        return null;
    }
}
