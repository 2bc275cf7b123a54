package com.adlens.engine.schedule;

import com.adlens.ledger.RecordingDiagnostics;
import com.adlens.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskGraphSchedulerTest {

    private RecordingDiagnostics diagnostics;
    private TaskGraphScheduler scheduler;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        scheduler = new TaskGraphScheduler(diagnostics);
    }

    @Test
    void order_independentTasksFollowPriorityThenId() {
        List<Task> ordered = scheduler.order(List.of(
                new Task("c", 2, null),
                new Task("b", 1, null),
                new Task("a", 2, null)));

        assertEquals(List.of("b", "a", "c"), ids(ordered));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void order_dependencyRunsBeforeDependentEvenWithLowerPriority() {
        List<Task> ordered = scheduler.order(List.of(
                new Task("t1", 1, List.of("t3")),
                new Task("t2", 2, null),
                new Task("t3", 9, null)));

        assertEquals(List.of("t3", "t1", "t2"), ids(ordered));
    }

    @Test
    void order_twoTaskCycleEmitsBothOnceAndWarns() {
        List<Task> ordered = scheduler.order(List.of(
                new Task("A", 1, List.of("B")),
                new Task("B", 1, List.of("A"))));

        assertEquals(2, ordered.size());
        assertEquals(Set.of("A", "B"), new HashSet<>(ids(ordered)));
        assertEquals(List.of("B", "A"), ids(ordered));
        assertEquals(1, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).message().contains("Cycle detected"));
    }

    @Test
    void order_selfDependencyIsDroppedAsCycle() {
        List<Task> ordered = scheduler.order(List.of(new Task("solo", 1, List.of("solo"))));

        assertEquals(List.of("solo"), ids(ordered));
        assertEquals(1, diagnostics.warnings().size());
    }

    @Test
    void order_danglingDependencyIsIgnoredWithWarning() {
        List<Task> ordered = scheduler.order(List.of(
                new Task("t1", 1, List.of("ghost")),
                new Task("t2", 2, List.of("t1"))));

        assertEquals(List.of("t1", "t2"), ids(ordered));
        assertEquals(1, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).message().contains("ghost"));
    }

    @Test
    void order_emptyOrNullInputYieldsEmptyList() {
        assertEquals(List.of(), scheduler.order(List.of()));
        assertEquals(List.of(), scheduler.order(null));
    }

    @Test
    void order_rejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.order(List.of(
                new Task("x", 1, null), new Task("x", 2, null))));
    }

    @Test
    void order_randomGraphsArePermutationsAndRespectAcyclicEdges() {
        Random random = new Random(7);
        for (int round = 0; round < 200; round++) {
            int n = 1 + random.nextInt(12);
            boolean acyclic = round % 2 == 0;
            List<Task> tasks = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                List<String> deps = new ArrayList<>();
                for (int j = 0; j < n; j++) {
                    if (j == i || random.nextInt(4) != 0) continue;
                    // acyclic graphs only point to lower indices
                    if (acyclic && j > i) continue;
                    deps.add("t" + j);
                }
                if (random.nextInt(10) == 0) deps.add("missing" + i);
                tasks.add(new Task("t" + i, random.nextInt(4), deps));
            }

            List<Task> ordered = scheduler.order(tasks);

            assertEquals(n, ordered.size());
            assertEquals(n, new HashSet<>(ids(ordered)).size());
            assertEquals(new HashSet<>(ids(tasks)), new HashSet<>(ids(ordered)));
            if (acyclic) {
                Map<String, Integer> position = new HashMap<>();
                for (int i = 0; i < ordered.size(); i++) position.put(ordered.get(i).id(), i);
                for (Task t : tasks) {
                    for (String dep : t.dependsOn()) {
                        if (!position.containsKey(dep)) continue;
                        assertTrue(position.get(dep) < position.get(t.id()),
                                "dependency " + dep + " must precede " + t.id());
                    }
                }
            }
        }
    }

    private static List<String> ids(List<Task> tasks) {
        List<String> ids = new ArrayList<>();
        for (Task t : tasks) ids.add(t.id());
        return ids;
    }
}
