package com.scheduler.core.graph;

import com.scheduler.core.exception.CyclicDependencyException;
import com.scheduler.core.exception.TaskValidationException;
import com.scheduler.core.model.DependencyEdge;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final long A = 1, B = 2, C = 3, D = 4, E = 5;

    @Test
    void cyclicBatch_shouldBeRejectedWithoutPartialEdges() {
        DependencyGraph graph = new DependencyGraph();

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, () ->
            graph.addEdges("etl", List.of(A, B, C), List.of(
                DependencyEdge.of("etl", A, B),
                DependencyEdge.of("etl", B, C),
                DependencyEdge.of("etl", C, A))));

        assertEquals("etl", e.getJobName());
        assertEquals(List.of(A, B, C), e.getUnresolvedTasks());
        assertTrue(graph.predecessors(B).isEmpty());
        assertTrue(graph.topologicalOrder("etl").isEmpty());
    }

    @Test
    void unrelatedJob_shouldRegisterAfterRejectedCycle() {
        DependencyGraph graph = new DependencyGraph();
        assertThrows(CyclicDependencyException.class, () ->
            graph.addEdges("bad", List.of(A, B), List.of(
                DependencyEdge.of("bad", A, B),
                DependencyEdge.of("bad", B, A))));

        graph.addEdges("good", List.of(C, D, E), List.of(
            DependencyEdge.of("good", C, D),
            DependencyEdge.of("good", D, E)));

        assertEquals(List.of(C, D, E), graph.topologicalOrder("good"));
        assertEquals(Set.of("good"), graph.jobNames());
    }

    @Test
    void selfEdge_shouldBeCycle() {
        DependencyGraph graph = new DependencyGraph();

        assertThrows(CyclicDependencyException.class, () ->
            graph.addEdges("job", List.of(A), List.of(DependencyEdge.of("job", A, A))));
    }

    @Test
    void laterBatch_closingCycleWithExistingEdges_shouldBeRejected() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges("job", List.of(A, B), List.of(DependencyEdge.of("job", A, B)));

        assertThrows(CyclicDependencyException.class, () ->
            graph.addEdges("job", List.of(C), List.of(
                DependencyEdge.of("job", B, C),
                DependencyEdge.of("job", C, A))));

        assertEquals(Set.of(), graph.predecessors(C));
        assertEquals(List.of(A, B), graph.topologicalOrder("job"));
    }

    @Test
    void cycleAcrossJobs_shouldBeRejected() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges("etl", List.of(A, B), List.of(DependencyEdge.of("etl", A, B)));
        graph.addEdges("load", List.of(B, C), List.of(DependencyEdge.of("load", B, C)));

        CyclicDependencyException e = assertThrows(CyclicDependencyException.class, () ->
            graph.addEdges("report", List.of(A, C), List.of(DependencyEdge.of("report", C, A))));

        assertEquals("report", e.getJobName());
        assertEquals(List.of(A, B, C), e.getUnresolvedTasks());
        assertEquals(Set.of(), graph.predecessors(A));
        assertEquals(Set.of("etl", "load"), graph.jobNames());
    }

    @Test
    void unknownTask_shouldBeRejected() {
        DependencyGraph graph = new DependencyGraph();

        assertThrows(TaskValidationException.class, () ->
            graph.addEdges("job", List.of(A), List.of(DependencyEdge.of("job", A, B))));
    }

    @Test
    void ready_shouldRequireAllPredecessors() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdges("job", List.of(A, B, C), List.of(
            DependencyEdge.of("job", A, C),
            DependencyEdge.of("job", B, C)));

        assertTrue(graph.ready(A, Set.of()));
        assertFalse(graph.ready(C, Set.of(A)));
        assertTrue(graph.ready(C, Set.of(A, B)));
        assertTrue(graph.ready(99, Set.of()));
    }

    @Test
    void topologicalOrder_shouldPlacePredecessorsFirst() {
        DependencyGraph graph = DependencyGraph.fromEdges(List.of(
            DependencyEdge.of("job", D, B),
            DependencyEdge.of("job", B, A),
            DependencyEdge.of("job", C, A)));

        List<Long> order = graph.topologicalOrder("job");

        assertEquals(4, order.size());
        assertTrue(order.indexOf(D) < order.indexOf(B));
        assertTrue(order.indexOf(B) < order.indexOf(A));
        assertTrue(order.indexOf(C) < order.indexOf(A));
    }
}
