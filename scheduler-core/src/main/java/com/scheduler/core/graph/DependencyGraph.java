package com.scheduler.core.graph;

import com.scheduler.core.exception.CyclicDependencyException;
import com.scheduler.core.exception.TaskValidationException;
import com.scheduler.core.model.DependencyEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Dependency DAGs between tasks, one per named job.
 *
 * Edges are only ever added in whole batches: a batch that would close a cycle
 * is rejected and nothing from it is kept. Readiness counts predecessors from
 * every job, so the cycle check runs over the edges of all jobs together.
 *
 * This class only checks ordering constraints; it never changes task state.
 */
public class DependencyGraph {

    // jobName -> (predecessor -> successors)
    private final Map<String, Map<Long, Set<Long>>> jobs = new LinkedHashMap<>();

    // successor -> predecessors, across all jobs
    private final Map<Long, Set<Long>> predecessors = new HashMap<>();

    /**
     * Rebuild a graph from edges already accepted earlier.
     */
    public static DependencyGraph fromEdges(Collection<DependencyEdge> edges) {
        DependencyGraph graph = new DependencyGraph();
        for (DependencyEdge edge : edges) {
            graph.commit(edge.jobName(), edge.predecessorId(), edge.successorId());
        }
        return graph;
    }

    /**
     * Validate and add a batch of edges to a job.
     *
     * @param jobName The job the edges belong to
     * @param taskIds Tasks the batch may reference, besides those already in the job
     * @param edges The batch
     * @throws TaskValidationException if an edge references an unknown task
     * @throws CyclicDependencyException if the job, or the edges of all jobs
     *         taken together, would contain a cycle
     */
    public synchronized void addEdges(String jobName, Collection<Long> taskIds,
                                      Collection<DependencyEdge> edges) {
        Map<Long, Set<Long>> existing = jobs.getOrDefault(jobName, Map.of());

        Set<Long> known = new HashSet<>(taskIds);
        known.addAll(nodesOf(existing));

        Map<Long, Set<Long>> candidate = copy(existing);
        for (DependencyEdge edge : edges) {
            if (!jobName.equals(edge.jobName())) {
                throw new TaskValidationException("dependencies",
                    "edge " + describe(edge) + " belongs to job '" + edge.jobName()
                        + "', not '" + jobName + "'");
            }
            if (!known.contains(edge.predecessorId()) || !known.contains(edge.successorId())) {
                throw new TaskValidationException("dependencies",
                    "edge " + describe(edge) + " references a task outside job '" + jobName + "'");
            }
            candidate.computeIfAbsent(edge.predecessorId(), k -> new LinkedHashSet<>())
                .add(edge.successorId());
            candidate.computeIfAbsent(edge.successorId(), k -> new LinkedHashSet<>());
        }

        List<Long> order = kahn(candidate);
        if (order.size() < candidate.size()) {
            Set<Long> unresolved = new TreeSet<>(candidate.keySet());
            order.forEach(unresolved::remove);
            throw new CyclicDependencyException(jobName, new ArrayList<>(unresolved));
        }

        Map<Long, Set<Long>> combined = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Long, Set<Long>>> job : jobs.entrySet()) {
            merge(combined, job.getKey().equals(jobName) ? candidate : job.getValue());
        }
        if (!jobs.containsKey(jobName)) {
            merge(combined, candidate);
        }
        List<Long> combinedOrder = kahn(combined);
        if (combinedOrder.size() < combined.size()) {
            Set<Long> unresolved = new TreeSet<>(combined.keySet());
            combinedOrder.forEach(unresolved::remove);
            throw new CyclicDependencyException(jobName, new ArrayList<>(unresolved));
        }

        for (DependencyEdge edge : edges) {
            commit(jobName, edge.predecessorId(), edge.successorId());
        }
    }

    /**
     * Check if every predecessor of a task is in the completed set.
     * Tasks without predecessors are always ready.
     */
    public synchronized boolean ready(long taskId, Set<Long> completed) {
        Set<Long> required = predecessors.get(taskId);
        return required == null || completed.containsAll(required);
    }

    /**
     * Direct predecessors of a task across all jobs.
     */
    public synchronized Set<Long> predecessors(long taskId) {
        Set<Long> required = predecessors.get(taskId);
        return required == null ? Set.of() : Set.copyOf(required);
    }

    /**
     * Tasks of a job in an order where every predecessor precedes its successors.
     */
    public synchronized List<Long> topologicalOrder(String jobName) {
        Map<Long, Set<Long>> adjacency = jobs.get(jobName);
        if (adjacency == null) {
            return List.of();
        }
        return Collections.unmodifiableList(kahn(adjacency));
    }

    public synchronized Set<String> jobNames() {
        return Set.copyOf(jobs.keySet());
    }

    // ========== Helper Methods ==========

    private void commit(String jobName, long predecessorId, long successorId) {
        Map<Long, Set<Long>> adjacency = jobs.computeIfAbsent(jobName, k -> new LinkedHashMap<>());
        adjacency.computeIfAbsent(predecessorId, k -> new LinkedHashSet<>()).add(successorId);
        adjacency.computeIfAbsent(successorId, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(successorId, k -> new HashSet<>()).add(predecessorId);
    }

    /**
     * Kahn's algorithm. Nodes on or behind a cycle are left out of the result.
     */
    private static List<Long> kahn(Map<Long, Set<Long>> adjacency) {
        Map<Long, Integer> inDegree = new HashMap<>();
        for (Long node : adjacency.keySet()) {
            inDegree.putIfAbsent(node, 0);
            for (Long successor : adjacency.get(node)) {
                inDegree.merge(successor, 1, Integer::sum);
            }
        }

        Deque<Long> ready = new ArrayDeque<>();
        new TreeSet<>(adjacency.keySet()).forEach(node -> {
            if (inDegree.get(node) == 0) {
                ready.add(node);
            }
        });

        List<Long> order = new ArrayList<>(adjacency.size());
        while (!ready.isEmpty()) {
            Long node = ready.poll();
            order.add(node);
            for (Long successor : adjacency.getOrDefault(node, Set.of())) {
                if (inDegree.merge(successor, -1, Integer::sum) == 0) {
                    ready.add(successor);
                }
            }
        }
        return order;
    }

    private static void merge(Map<Long, Set<Long>> target, Map<Long, Set<Long>> adjacency) {
        adjacency.forEach((node, successors) -> {
            target.computeIfAbsent(node, k -> new LinkedHashSet<>()).addAll(successors);
            successors.forEach(successor -> target.computeIfAbsent(successor, k -> new LinkedHashSet<>()));
        });
    }

    private static Set<Long> nodesOf(Map<Long, Set<Long>> adjacency) {
        Set<Long> nodes = new HashSet<>(adjacency.keySet());
        adjacency.values().forEach(nodes::addAll);
        return nodes;
    }

    private static Map<Long, Set<Long>> copy(Map<Long, Set<Long>> adjacency) {
        Map<Long, Set<Long>> copy = new LinkedHashMap<>();
        adjacency.forEach((node, successors) -> copy.put(node, new LinkedHashSet<>(successors)));
        return copy;
    }

    private static String describe(DependencyEdge edge) {
        return edge.predecessorId() + "->" + edge.successorId();
    }
}
