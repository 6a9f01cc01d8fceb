package io.carelink.a2a.spec;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import io.carelink.a2a.util.Assert;

/**
 * A progress notification for a streaming task. Exactly one event of a stream has
 * {@code final = true}, and it is always the last one.
 *
 * @param taskId the task the update belongs to
 * @param contextId the conversation the task belongs to
 * @param status the new status
 * @param isFinal whether this is the terminal event of the stream
 */
@JsonTypeName(TaskStatusUpdateEvent.KIND)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatusUpdateEvent(@JsonProperty("taskId") String taskId,
                                    @JsonProperty("contextId") String contextId,
                                    @JsonProperty("status") TaskStatus status,
                                    @JsonProperty("final") boolean isFinal) implements StreamingEventKind {

    public static final String KIND = "status-update";

    @JsonCreator
    public TaskStatusUpdateEvent {
        Assert.checkNotNullParam("taskId", taskId);
        Assert.checkNotNullParam("contextId", contextId);
        Assert.checkNotNullParam("status", status);
    }

    /**
     * Creates an event describing the current status of the task.
     *
     * @param task the task
     * @param isFinal whether this is the terminal event of the stream
     * @return the event
     */
    public static TaskStatusUpdateEvent of(Task task, boolean isFinal) {
        return new TaskStatusUpdateEvent(task.id(), task.contextId(), task.status(), isFinal);
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
        return KIND;
    }
}
