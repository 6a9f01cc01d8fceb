package io.carelink.a2a.spec;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The result carried by one streaming response envelope: a {@link Task} snapshot, a
 * {@link Message}, or a {@link TaskStatusUpdateEvent}. The concrete type is selected by the
 * {@code kind} property.
 */
@JsonTypeInfo(
        use = JsonTypeInfo.Id.NAME,
        include = JsonTypeInfo.As.EXISTING_PROPERTY,
        property = "kind",
        visible = true
)
@JsonSubTypes({
        @JsonSubTypes.Type(value = Task.class, name = Task.KIND),
        @JsonSubTypes.Type(value = Message.class, name = Message.KIND),
        @JsonSubTypes.Type(value = TaskStatusUpdateEvent.class, name = TaskStatusUpdateEvent.KIND)
})
public sealed interface StreamingEventKind permits Message, Task, TaskStatusUpdateEvent {

    /**
     * Returns the wire discriminator of this event.
     *
     * @return the kind
     */
    String kind();
}
