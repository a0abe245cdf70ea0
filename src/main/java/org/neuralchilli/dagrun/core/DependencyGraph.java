package org.neuralchilli.dagrun.core;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.EdgeReversedGraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.neuralchilli.dagrun.domain.GraphStatistics;
import org.neuralchilli.dagrun.task.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tasks keyed by id plus the edges between them. An edge {@code u -> d} means
 * {@code d} depends on {@code u}.
 * <p>
 * Cycles, self loops included, are accepted while building and only reported by
 * {@link #levels()}. Built once before execution and not changed during a run.
 */
public class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final String name;
    private final Map<String, Task> nodes = new LinkedHashMap<>();
    private final Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);

    public DependencyGraph(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Graph name cannot be null or empty");
        }
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Add a task under {@code id}. An existing task with the same id is replaced;
     * its edges are kept.
     */
    public DependencyGraph addNode(String id, Task task) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be null or empty");
        }
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null for id: " + id);
        }

        if (nodes.put(id, task) != null) {
            log.warn("Graph '{}': task '{}' already exists and will be replaced", name, id);
        }
        graph.addVertex(id);
        return this;
    }

    /**
     * Add a task under its own id
     */
    public DependencyGraph addNode(Task task) {
        if (task == null) {
            throw new IllegalArgumentException("Task cannot be null");
        }
        return addNode(task.id(), task);
    }

    /**
     * Declare that {@code downstream} depends on {@code upstream}.
     * Adding an edge that already exists has no effect.
     *
     * @throws UnknownNodeException if either id was never added
     */
    public DependencyGraph addEdge(String upstream, String downstream) {
        requireNode(upstream);
        requireNode(downstream);

        if (graph.addEdge(upstream, downstream) != null) {
            log.debug("Graph '{}': {} -> {}", name, upstream, downstream);
        }
        return this;
    }

    /**
     * Partition all tasks into topological levels (Kahn's algorithm).
     * Every edge's upstream lands in a strictly earlier level than its downstream.
     * Ids within a level keep insertion order.
     *
     * @throws CycleDetectedException if the edges contain a cycle
     */
    public List<Set<String>> levels() {
        Map<String, Integer> inDegree = new HashMap<>();
        List<String> ready = new ArrayList<>();
        for (String id : nodes.keySet()) {
            int degree = graph.inDegreeOf(id);
            inDegree.put(id, degree);
            if (degree == 0) {
                ready.add(id);
            }
        }

        List<Set<String>> levels = new ArrayList<>();
        int placed = 0;

        while (!ready.isEmpty()) {
            levels.add(Collections.unmodifiableSet(new LinkedHashSet<>(ready)));
            placed += ready.size();

            Set<String> next = new HashSet<>();
            for (String id : ready) {
                for (String downstream : Graphs.successorListOf(graph, id)) {
                    if (inDegree.merge(downstream, -1, Integer::sum) == 0) {
                        next.add(downstream);
                    }
                }
            }
            ready = nodes.keySet().stream().filter(next::contains).toList();
        }

        if (placed < nodes.size()) {
            throw new CycleDetectedException(String.format(
                    "Graph '%s' contains a cycle: only %d of %d tasks could be ordered",
                    name, placed, nodes.size()
            ));
        }

        log.debug("Graph '{}' has {} execution levels", name, levels.size());
        return levels;
    }

    /**
     * Every task that depends on {@code id}, directly or transitively
     */
    public Set<String> downstreamClosure(String id) {
        requireNode(id);
        return reachableFrom(graph, id);
    }

    /**
     * Every task {@code id} depends on, directly or transitively
     */
    public Set<String> upstreamClosure(String id) {
        requireNode(id);
        return reachableFrom(new EdgeReversedGraph<>(graph), id);
    }

    public Set<String> directUpstreamOf(String id) {
        requireNode(id);
        return new LinkedHashSet<>(Graphs.predecessorListOf(graph, id));
    }

    public Set<String> directDownstreamOf(String id) {
        requireNode(id);
        return new LinkedHashSet<>(Graphs.successorListOf(graph, id));
    }

    private static Set<String> reachableFrom(Graph<String, DefaultEdge> g, String start) {
        Set<String> reachable = new LinkedHashSet<>();
        BreadthFirstIterator<String, DefaultEdge> iterator = new BreadthFirstIterator<>(g, start);
        while (iterator.hasNext()) {
            reachable.add(iterator.next());
        }
        reachable.remove(start);
        return reachable;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @throws UnknownNodeException if no task has this id
     */
    public Task task(String id) {
        requireNode(id);
        return nodes.get(id);
    }

    /**
     * Task ids in insertion order
     */
    public Set<String> taskIds() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public int edgeCount() {
        return graph.edgeSet().size();
    }

    /**
     * Upstream id to the ids that depend on it. Tasks without dependants are omitted.
     */
    public Map<String, Set<String>> dependencies() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            Set<String> downstream = directDownstreamOf(id);
            if (!downstream.isEmpty()) {
                result.put(id, Collections.unmodifiableSet(downstream));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Counts describing the graph's shape.
     *
     * @throws CycleDetectedException if the edges contain a cycle
     */
    public GraphStatistics statistics() {
        List<Set<String>> levels = levels();
        int roots = (int) nodes.keySet().stream().filter(id -> graph.inDegreeOf(id) == 0).count();
        int leaves = (int) nodes.keySet().stream().filter(id -> graph.outDegreeOf(id) == 0).count();
        int widest = levels.stream().mapToInt(Set::size).max().orElse(0);

        return new GraphStatistics(nodes.size(), edgeCount(), roots, leaves, levels.size(), widest);
    }

    private void requireNode(String id) {
        if (id == null || !nodes.containsKey(id)) {
            throw new UnknownNodeException("Graph '" + name + "' has no task with id: " + id);
        }
    }

    @Override
    public String toString() {
        return "DependencyGraph[name=" + name + ", tasks=" + nodes.size() + ", edges=" + edgeCount() + ']';
    }
}
