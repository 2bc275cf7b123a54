package com.adlens.engine.schedule;

import com.adlens.ledger.Diagnostics;
import com.adlens.model.Task;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Orders analysis tasks so every task runs after the tasks it depends on.
 * <p>
 * Depth-first topological sort. Roots and each task's dependencies are visited in ascending (priority, id) order,
 * so the output is reproducible. A task is appended only after all of its resolvable dependencies.
 * <ul>
 *   <li>Dependency ids that name no task of the input are ignored (warning).</li>
 *   <li>A dependency that points back into the current visitation path closes a cycle: that edge is dropped
 *       (warning) and ordering continues.</li>
 * </ul>
 * The result is always a permutation of the input: every task exactly once.
 */
public final class TaskGraphScheduler {

    private static final String SOURCE = TaskGraphScheduler.class.getName();

    static final Comparator<Task> PRIORITY_ORDER = Comparator.comparingInt(Task::priority).thenComparing(Task::id);

    private final Diagnostics diagnostics;

    public TaskGraphScheduler(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * @throws IllegalArgumentException if two tasks share an id
     */
    public List<Task> order(Collection<Task> tasks) {
        if (tasks == null || tasks.isEmpty()) return List.of();
        Map<String, Task> byId = new LinkedHashMap<>();
        for (Task task : tasks) {
            Objects.requireNonNull(task, "task");
            if (byId.putIfAbsent(task.id(), task) != null) {
                throw new IllegalArgumentException("duplicate task id: " + task.id());
            }
        }
        List<Task> roots = new ArrayList<>(byId.values());
        roots.sort(PRIORITY_ORDER);

        Visit visit = new Visit(byId);
        for (Task task : roots) {
            visit.visit(task);
        }
        diagnostics.info(SOURCE, "Scheduled " + visit.ordered.size() + " task(s) | order=" + ids(visit.ordered)
                + " | cyclesBroken=" + visit.cyclesBroken);
        return List.copyOf(visit.ordered);
    }

    private final class Visit {
        private final Map<String, Task> byId;
        private final Set<String> done = new HashSet<>();
        private final Set<String> inProgress = new HashSet<>();
        private final List<Task> ordered = new ArrayList<>();
        private int cyclesBroken;

        Visit(Map<String, Task> byId) {
            this.byId = byId;
        }

        void visit(Task task) {
            if (done.contains(task.id())) return;
            inProgress.add(task.id());
            for (Task dep : resolvedDependencies(task)) {
                if (inProgress.contains(dep.id())) {
                    cyclesBroken++;
                    diagnostics.warn(SOURCE, "Cycle detected involving " + task.id() + " -> " + dep.id()
                            + "; dropping edge and continuing");
                    continue;
                }
                visit(dep);
            }
            inProgress.remove(task.id());
            done.add(task.id());
            ordered.add(task);
        }

        private List<Task> resolvedDependencies(Task task) {
            List<Task> deps = new ArrayList<>(task.dependsOn().size());
            for (String depId : task.dependsOn()) {
                Task dep = byId.get(depId);
                if (dep == null) {
                    diagnostics.warn(SOURCE, "Task " + task.id() + " depends on unknown task " + depId + "; ignoring edge");
                    continue;
                }
                deps.add(dep);
            }
            deps.sort(PRIORITY_ORDER);
            return deps;
        }
    }

    private static List<String> ids(List<Task> tasks) {
        List<String> ids = new ArrayList<>(tasks.size());
        for (Task t : tasks) ids.add(t.id());
        return ids;
    }
}
