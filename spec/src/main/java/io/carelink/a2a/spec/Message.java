package io.carelink.a2a.spec;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.annotation.JsonValue;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A single turn of communication between a user and an agent.
 * <p>
 * Messages are immutable. Their identity is {@link #messageId()}; once appended to the
 * history of a {@link Task} they are never modified or reordered. A message sent by a client
 * may name the {@code contextId} of an earlier conversation so that the receiving agent can
 * correlate the new task with it.
 *
 * @param role who sent the message
 * @param parts the ordered content parts, never empty
 * @param messageId the unique message identifier
 * @param taskId the task this message belongs to, if known
 * @param contextId the conversation this message belongs to, if known
 * @param metadata optional opaque metadata
 * @see Part
 * @see Task
 */
@JsonTypeName(Message.KIND)
@JsonInclude(JsonInclude.Include.NON_ABSENT)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message(@JsonProperty("role") Role role,
                      @JsonProperty("parts") List<Part<?>> parts,
                      @JsonProperty("messageId") String messageId,
                      @JsonProperty("taskId") @Nullable String taskId,
                      @JsonProperty("contextId") @Nullable String contextId,
                      @JsonProperty("metadata") @Nullable Map<String, Object> metadata) implements StreamingEventKind {

    public static final String KIND = "message";

    @JsonCreator
    public Message {
        Assert.checkNotNullParam("role", role);
        Assert.checkNotNullParam("parts", parts);
        Assert.checkNotNullParam("messageId", messageId);
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Parts cannot be empty");
        }
        parts = List.copyOf(parts);
        metadata = (metadata != null) ? Map.copyOf(metadata) : null;
    }

    @Override
    @JsonProperty("kind")
    public String kind() {
        return KIND;
    }

    /**
     * Creates a new {@link Builder}.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder initialised from an existing message.
     *
     * @param message the message to copy
     * @return a new builder instance
     */
    public static Builder builder(Message message) {
        return new Builder()
                .role(message.role)
                .parts(message.parts)
                .messageId(message.messageId)
                .taskId(message.taskId)
                .contextId(message.contextId)
                .metadata(message.metadata);
    }

    /**
     * The sender of a message.
     */
    public enum Role {
        USER("user"),
        AGENT("agent");

        private final String role;

        Role(String role) {
            this.role = role;
        }

        @JsonValue
        public String asString() {
            return this.role;
        }
    }

    /**
     * Builder for {@link Message}. A random {@code messageId} is generated when none is set.
     */
    public static class Builder {
        private @Nullable Role role;
        private @Nullable List<Part<?>> parts;
        private @Nullable String messageId;
        private @Nullable String taskId;
        private @Nullable String contextId;
        private @Nullable Map<String, Object> metadata;

        private Builder() {
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder parts(List<Part<?>> parts) {
            this.parts = parts;
            return this;
        }

        public Builder parts(Part<?>... parts) {
            this.parts = List.of(parts);
            return this;
        }

        public Builder messageId(String messageId) {
            this.messageId = messageId;
            return this;
        }

        public Builder taskId(@Nullable String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder contextId(@Nullable String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Message build() {
            return new Message(
                    Assert.checkNotNullParam("role", role),
                    Assert.checkNotNullParam("parts", parts),
                    messageId == null ? UUID.randomUUID().toString() : messageId,
                    taskId,
                    contextId,
                    metadata);
        }
    }
}
