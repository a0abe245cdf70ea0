package org.neuralchilli.dagrun.domain;

import javax.annotation.Nonnull;

/**
 * Shape of a dependency graph: how many tasks, how deep, how wide.
 * Logged before a run so the level structure is visible without rendering the graph.
 */
public record GraphStatistics(
        int totalTasks,
        int totalEdges,
        int rootTasks,
        int leafTasks,
        int levels,
        int maxLevelWidth
) {
    public GraphStatistics {
        if (totalTasks < 0 || totalEdges < 0 || rootTasks < 0 || leafTasks < 0) {
            throw new IllegalArgumentException("Graph counts cannot be negative");
        }
        if (levels < 0 || maxLevelWidth < 0) {
            throw new IllegalArgumentException("Level counts cannot be negative");
        }
    }

    /**
     * True when at least one level holds more than one task
     */
    public boolean hasParallelism() {
        return maxLevelWidth > 1;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "GraphStatistics[tasks=%d, edges=%d, levels=%d, widest=%d, roots=%d, leaves=%d]",
                totalTasks, totalEdges, levels, maxLevelWidth, rootTasks, leafTasks
        );
    }
}
