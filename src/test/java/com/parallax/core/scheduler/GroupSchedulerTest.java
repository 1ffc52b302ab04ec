package com.parallax.core.scheduler;

import com.parallax.core.model.TaskCategory;
import com.parallax.core.model.TaskGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GroupSchedulerTest {

    private GroupScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new GroupScheduler();
    }

    private static TaskGroup group(String id, int priority, String... deps) {
        return new TaskGroup(id, List.of("Task for " + id), TaskCategory.FEATURE, priority, List.of(deps), 10);
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("rejects duplicate group ids")
        void rejectsDuplicates() {
            var e = assertThrows(SchedulingException.class,
                    () -> scheduler.register(List.of(group("a", 1), group("a", 2))));
            assertEquals(SchedulingException.DUPLICATE_GROUP, e.getErrorCode());
        }

        @Test
        @DisplayName("rejects dependencies on unknown groups")
        void rejectsUnknownDependency() {
            var e = assertThrows(SchedulingException.class,
                    () -> scheduler.register(List.of(group("a", 1, "ghost"))));
            assertEquals(SchedulingException.UNKNOWN_DEPENDENCY, e.getErrorCode());
            assertTrue(e.getMessage().contains("ghost"));
        }

        @Test
        @DisplayName("rejects cycles and names the groups involved")
        void rejectsCycles() {
            var e = assertThrows(CycleDetectedException.class, () -> scheduler.register(List.of(
                    group("a", 1, "c"), group("b", 1, "a"), group("c", 1, "b"), group("d", 1))));
            assertEquals(CycleDetectedException.CYCLIC_DEPENDENCY, e.getErrorCode());
            assertEquals(Set.of("a", "b", "c"), e.getCycleGroups());
        }

        @Test
        @DisplayName("a rejected registration leaves the previous set untouched")
        void rejectedRegistrationKeepsState() {
            scheduler.register(List.of(group("a", 1)));
            assertThrows(SchedulingException.class, () -> scheduler.register(List.of(group("x", 1, "y"))));
            assertEquals(List.of("a"), scheduler.allGroups().stream().map(TaskGroup::id).toList());
        }
    }

    @Nested
    @DisplayName("readyGroups")
    class ReadyTests {

        @Test
        @DisplayName("returns only groups whose predecessors are completed, highest priority first")
        void readyOrderedByPriority() {
            scheduler.register(List.of(
                    group("low", 2), group("high", 9), group("mid", 5), group("blocked", 10, "high")));

            assertEquals(List.of("high", "mid", "low"), ids(scheduler.readyGroups(10)));
            scheduler.markCompleted("high");
            assertEquals(List.of("blocked", "mid", "low"), ids(scheduler.readyGroups(10)));
        }

        @Test
        @DisplayName("truncates to the requested count and keeps registration order for ties")
        void truncatesAndIsStable() {
            scheduler.register(List.of(group("first", 5), group("second", 5), group("third", 5)));
            assertEquals(List.of("first", "second"), ids(scheduler.readyGroups(2)));
            assertTrue(scheduler.readyGroups(0).isEmpty());
        }

        @Test
        @DisplayName("every ready group has all predecessors completed at every step")
        void readySubsetProperty() {
            scheduler.register(List.of(
                    group("setup", 10), group("f0", 7, "setup"), group("f1", 7, "setup"),
                    group("bug", 9), group("tests", 6, "f0", "f1"), group("opt", 3, "setup", "f0", "f1", "bug", "tests")));

            Set<String> done = new HashSet<>();
            while (!scheduler.isAllCompleted()) {
                List<TaskGroup> ready = scheduler.readyGroups(3);
                assertFalse(ready.isEmpty(), "acyclic graph must always have a ready group");
                for (TaskGroup g : ready) {
                    assertTrue(done.containsAll(g.dependencies()), g.id() + " admitted too early");
                    assertFalse(done.contains(g.id()));
                }
                TaskGroup next = ready.get(0);
                scheduler.markCompleted(next.id());
                done.add(next.id());
            }
            assertEquals(6, done.size());
        }
    }

    @Nested
    @DisplayName("completion")
    class CompletionTests {

        @Test
        @DisplayName("markCompleted is idempotent and ignores unknown ids")
        void idempotent() {
            scheduler.register(List.of(group("a", 1), group("b", 1)));
            scheduler.markCompleted("a");
            scheduler.markCompleted("a");
            scheduler.markCompleted("unknown");

            assertTrue(scheduler.isCompleted("a"));
            assertFalse(scheduler.isAllCompleted());
            assertEquals(50, scheduler.progressPercent());
            assertEquals(List.of("b"), ids(scheduler.pendingGroups()));
        }

        @Test
        @DisplayName("progress is 100 for an empty set")
        void emptyProgress() {
            scheduler.register(List.of());
            assertTrue(scheduler.isAllCompleted());
            assertEquals(100, scheduler.progressPercent());
        }

        @Test
        @DisplayName("topological order respects every predecessor edge")
        void topologicalOrder() {
            scheduler.register(List.of(group("c", 1, "b"), group("b", 1, "a"), group("a", 1)));
            assertEquals(List.of("a", "b", "c"), scheduler.topologicalOrder());
        }

        @Test
        @DisplayName("reset forgets groups and completion state")
        void reset() {
            scheduler.register(List.of(group("a", 1)));
            scheduler.markCompleted("a");
            scheduler.reset();
            assertTrue(scheduler.allGroups().isEmpty());
            assertFalse(scheduler.isCompleted("a"));
        }
    }

    private static List<String> ids(List<TaskGroup> groups) {
        return groups.stream().map(TaskGroup::id).toList();
    }
}
