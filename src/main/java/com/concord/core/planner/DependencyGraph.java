package com.concord.core.planner;

import com.concord.core.model.DependencyEdge;
import com.concord.core.model.TaskPlan;
import com.concord.core.model.TaskUnit;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph over task ids. Node order is declaration order and every traversal is
 * stable with respect to it.
 */
public final class DependencyGraph {

    private final Map<String, List<DependencyEdge>> outgoing = new LinkedHashMap<>();
    private final Map<String, List<DependencyEdge>> incoming = new LinkedHashMap<>();

    /**
     * @throws IllegalArgumentException if an edge references an unknown node
     */
    public DependencyGraph(Collection<String> nodes, Collection<DependencyEdge> edges) {
        for (String node : nodes) {
            outgoing.put(node, new ArrayList<>());
            incoming.put(node, new ArrayList<>());
        }
        for (DependencyEdge edge : edges) {
            if (!outgoing.containsKey(edge.fromTaskId()) || !incoming.containsKey(edge.toTaskId())) {
                throw new IllegalArgumentException("Edge references unknown task: " + edge);
            }
            outgoing.get(edge.fromTaskId()).add(edge);
            incoming.get(edge.toTaskId()).add(edge);
        }
    }

    public static DependencyGraph of(TaskPlan plan) {
        return new DependencyGraph(plan.tasks().stream().map(TaskUnit::id).toList(), plan.edges());
    }

    public Set<String> nodes() {
        return outgoing.keySet();
    }

    public List<DependencyEdge> incoming(String node) {
        return incoming.getOrDefault(node, List.of());
    }

    public List<DependencyEdge> outgoing(String node) {
        return outgoing.getOrDefault(node, List.of());
    }

    public boolean isAcyclic() {
        return kahn().size() == outgoing.size();
    }

    /**
     * Nodes ordered so every edge points forward; ties keep declaration order.
     *
     * @throws IllegalStateException if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        List<String> order = kahn();
        if (order.size() != outgoing.size()) {
            var stuck = new LinkedHashSet<>(outgoing.keySet());
            order.forEach(stuck::remove);
            throw new IllegalStateException("Dependency cycle among " + stuck);
        }
        return order;
    }

    /** Longest sum of durations along any path. */
    public Duration criticalPath(Map<String, Duration> durations) {
        var finish = new HashMap<String, Duration>();
        Duration longest = Duration.ZERO;
        for (String node : topologicalOrder()) {
            Duration start = Duration.ZERO;
            for (DependencyEdge edge : incoming(node)) {
                Duration pred = finish.get(edge.fromTaskId());
                if (pred.compareTo(start) > 0) {
                    start = pred;
                }
            }
            Duration end = start.plus(durations.getOrDefault(node, Duration.ZERO));
            finish.put(node, end);
            if (end.compareTo(longest) > 0) {
                longest = end;
            }
        }
        return longest;
    }

    /** Length of the longest chain of edges leading to each node (roots are 0). */
    public Map<String, Integer> depths() {
        var depth = new LinkedHashMap<String, Integer>();
        for (String node : topologicalOrder()) {
            int d = 0;
            for (DependencyEdge edge : incoming(node)) {
                d = Math.max(d, depth.get(edge.fromTaskId()) + 1);
            }
            depth.put(node, d);
        }
        return depth;
    }

    /** The graph induced by {@code keep}. */
    public DependencyGraph subgraph(Set<String> keep) {
        var nodes = outgoing.keySet().stream().filter(keep::contains).toList();
        var edges = outgoing.values().stream()
                .flatMap(List::stream)
                .filter(e -> keep.contains(e.fromTaskId()) && keep.contains(e.toTaskId()))
                .toList();
        return new DependencyGraph(nodes, edges);
    }

    private List<String> kahn() {
        var remaining = new HashMap<String, Integer>();
        incoming.forEach((node, edges) -> remaining.put(node, edges.size()));
        var ready = new ArrayDeque<String>();
        for (String node : outgoing.keySet()) {
            if (remaining.get(node) == 0) {
                ready.add(node);
            }
        }
        var order = new ArrayList<String>(outgoing.size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (DependencyEdge edge : outgoing.get(node)) {
                if (remaining.merge(edge.toTaskId(), -1, Integer::sum) == 0) {
                    ready.add(edge.toTaskId());
                }
            }
        }
        return order;
    }
}
