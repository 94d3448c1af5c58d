package takeoff.tasks.model;

import java.util.List;

/**
 * One page of task views plus aggregate counts for the whole filtered set.
 */
public record TaskPage(
        List<TaskView> tasks,
        int total,
        int running,
        int completed,
        int failed,
        int cancelled) {

    public static TaskPage of(List<TaskView> tasks, TaskCounts counts) {
        return new TaskPage(List.copyOf(tasks), counts.total(), counts.running(),
                counts.completed(), counts.failed(), counts.cancelled());
    }
}
