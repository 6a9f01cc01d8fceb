package io.carelink.a2a.server.tasks;

import static io.carelink.a2a.util.Assert.checkNotNullParam;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.carelink.a2a.spec.DataPart;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Part;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.spec.TaskState;
import io.carelink.a2a.spec.TaskStatus;
import io.carelink.a2a.spec.TextPart;
import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives tasks through their lifecycle and persists every new version in the
 * {@link TaskStore}.
 * <p>
 * A task starts as {@code submitted}, may move to {@code working} any number of times and
 * ends as {@code completed} or {@code failed}. The history only ever grows, and every
 * transition that carries a message appends it, so the last history entry is always the
 * message held by the current status. Once terminal, a task refuses further transitions.
 */
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore taskStore;

    public TaskManager(TaskStore taskStore) {
        this.taskStore = checkNotNullParam("taskStore", taskStore);
    }

    /**
     * Creates and stores a {@code submitted} task for an inbound message. The task reuses the
     * message's context id when it has one.
     *
     * @param inbound the message that requested the work
     * @return the new task, whose history holds the inbound message stamped with the task ids
     */
    public Task createTask(Message inbound) {
        checkNotNullParam("inbound", inbound);
        String taskId = UUID.randomUUID().toString();
        String contextId = inbound.contextId() != null ? inbound.contextId() : UUID.randomUUID().toString();
        Message stamped = Message.builder(inbound)
                .taskId(taskId)
                .contextId(contextId)
                .build();
        Task task = Task.builder()
                .id(taskId)
                .contextId(contextId)
                .status(new TaskStatus(TaskState.SUBMITTED))
                .history(List.of(stamped))
                .build();
        taskStore.save(task);
        LOGGER.debug("Created task {} in context {}", taskId, contextId);
        return task;
    }

    public Task startWork(Task task) {
        return startWork(task, null);
    }

    /**
     * Moves a task to {@code working}.
     *
     * @param task the task
     * @param progress an optional progress message, appended to the history
     * @return the updated task
     * @throws IllegalTaskStateTransitionException if the task is not submitted or working
     */
    public Task startWork(Task task, @Nullable Message progress) {
        return transition(task, TaskState.WORKING, progress);
    }

    /**
     * Completes a task with the agent's reply.
     *
     * @param task the task
     * @param reply the reply
     * @return the completed task
     * @throws IllegalTaskStateTransitionException if the task is already terminal
     */
    public Task completeTask(Task task, Message reply) {
        return transition(task, TaskState.COMPLETED, checkNotNullParam("reply", reply));
    }

    public Task failTask(Task task, String errorDescription) {
        return failTask(task, errorDescription, null);
    }

    /**
     * Fails a task. The status carries a synthesized agent reply holding the error text and,
     * when {@code details} is given, a data part with them.
     *
     * @param task the task
     * @param errorDescription the text shown to the caller
     * @param details structured failure details, may be {@code null}
     * @return the failed task
     * @throws IllegalTaskStateTransitionException if the task is already terminal
     */
    public Task failTask(Task task, String errorDescription, @Nullable Map<String, Object> details) {
        checkNotNullParam("errorDescription", errorDescription);
        List<Part<?>> parts = new ArrayList<>();
        parts.add(new TextPart(errorDescription));
        if (details != null) {
            parts.add(new DataPart(details));
        }
        Message reply = Message.builder()
                .role(Message.Role.AGENT)
                .parts(parts)
                .build();
        return transition(task, TaskState.FAILED, reply);
    }

    public @Nullable Task getTask(String taskId) {
        return taskStore.get(taskId);
    }

    private Task transition(Task task, TaskState newState, @Nullable Message message) {
        checkNotNullParam("task", task);
        Task current = Utils.defaultIfNull(taskStore.get(task.id()), task);
        TaskState state = current.status().state();
        if (state.isFinal()
                || (newState == TaskState.WORKING && state != TaskState.SUBMITTED && state != TaskState.WORKING)) {
            throw new IllegalTaskStateTransitionException(current.id(), state, newState);
        }

        Task.Builder builder = Task.builder(current);
        @Nullable Message statusMessage = null;
        if (message != null) {
            statusMessage = Message.builder(message)
                    .taskId(current.id())
                    .contextId(current.contextId())
                    .build();
            builder.history(Utils.appendToHistory(current, statusMessage));
        }
        Task updated = builder.status(new TaskStatus(newState, statusMessage)).build();
        taskStore.save(updated);
        LOGGER.debug("Task {} moved from {} to {}", current.id(), state.asString(), newState.asString());
        return updated;
    }
}
