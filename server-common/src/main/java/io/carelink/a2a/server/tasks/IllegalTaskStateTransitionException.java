package io.carelink.a2a.server.tasks;

import io.carelink.a2a.spec.TaskState;

/**
 * A task was asked to move to a state it cannot reach from its current one, most often
 * because it already is in a terminal state.
 */
public class IllegalTaskStateTransitionException extends TaskStoreException {

    private final TaskState from;
    private final TaskState to;

    public IllegalTaskStateTransitionException(String taskId, TaskState from, TaskState to) {
        super(taskId, "Task " + taskId + " cannot move from " + from.asString() + " to " + to.asString());
        this.from = from;
        this.to = to;
    }

    public TaskState getFrom() {
        return from;
    }

    public TaskState getTo() {
        return to;
    }
}
