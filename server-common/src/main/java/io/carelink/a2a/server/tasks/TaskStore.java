package io.carelink.a2a.server.tasks;

import io.carelink.a2a.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * Owns the mapping from task id to the latest version of each {@link Task}. Implementations
 * must be safe for concurrent use by independent requests.
 */
public interface TaskStore {

    /**
     * Stores a task, replacing any previous version with the same id.
     *
     * @param task the task
     */
    void save(Task task);

    @Nullable Task get(String taskId);

    void delete(String taskId);

    /**
     * Returns the number of stored tasks.
     *
     * @return the count
     */
    int size();
}
