package org.neuralchilli.dagrun.config;

import org.neuralchilli.dagrun.core.Workflow;
import org.neuralchilli.dagrun.service.GraphFactory;

/**
 * Graph factory over a parsed workflow definition.
 * Every call rebuilds the workflow from the immutable definition.
 */
public class ConfigGraphFactory implements GraphFactory {

    private final WorkflowDefinition definition;

    public ConfigGraphFactory(WorkflowDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Workflow definition cannot be null");
        }
        this.definition = definition;
    }

    @Override
    public Workflow create() {
        return definition.toWorkflow();
    }

    @Override
    public String name() {
        return definition.name();
    }

    public WorkflowDefinition definition() {
        return definition;
    }
}
