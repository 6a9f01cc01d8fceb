package io.carelink.a2a.server.tasks;

import io.carelink.a2a.spec.A2AServerException;
import org.jspecify.annotations.Nullable;

/**
 * Base exception for failures of the task store and the task lifecycle.
 */
public class TaskStoreException extends A2AServerException {

    @Nullable
    private final String taskId;

    public TaskStoreException() {
        super();
        this.taskId = null;
    }

    public TaskStoreException(final String msg) {
        super(msg);
        this.taskId = null;
    }

    public TaskStoreException(final Throwable cause) {
        super(cause);
        this.taskId = null;
    }

    public TaskStoreException(final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = null;
    }

    public TaskStoreException(@Nullable final String taskId, final String msg) {
        super(msg);
        this.taskId = taskId;
    }

    public TaskStoreException(@Nullable final String taskId, final String msg, final Throwable cause) {
        super(msg, cause);
        this.taskId = taskId;
    }

    @Nullable
    public String getTaskId() {
        return taskId;
    }
}
