package io.carelink.a2a.server.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.carelink.a2a.server.agentexecution.RequestContext;
import io.carelink.a2a.spec.DataPart;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Part;
import io.carelink.a2a.spec.TextPart;
import org.jspecify.annotations.Nullable;

/**
 * Helpers for building agent messages and reading message content.
 */
public final class MessageUtils {

    private MessageUtils() {
        // Utility class
    }

    /**
     * Creates an agent message holding one text part.
     *
     * @param text the text
     * @param contextId the conversation id, may be {@code null}
     * @param taskId the task id, may be {@code null}
     * @return the message
     */
    public static Message newAgentTextMessage(String text, @Nullable String contextId, @Nullable String taskId) {
        return newAgentMessage(List.of(new TextPart(text)), contextId, taskId);
    }

    public static Message newAgentMessage(List<Part<?>> parts, @Nullable String contextId, @Nullable String taskId) {
        return Message.builder()
                .role(Message.Role.AGENT)
                .parts(parts)
                .contextId(contextId)
                .taskId(taskId)
                .build();
    }

    /**
     * Creates a text reply bound to the task of a request.
     *
     * @param context the request
     * @param text the reply text
     * @return the reply
     */
    public static Message reply(RequestContext context, String text) {
        return newAgentTextMessage(text, context.getContextId(), context.getTaskId());
    }

    /**
     * Creates a reply bound to the task of a request holding the text followed by a data part.
     *
     * @param context the request
     * @param text the reply text
     * @param data the structured payload
     * @return the reply
     */
    public static Message reply(RequestContext context, String text, Map<String, Object> data) {
        return newAgentMessage(List.of(new TextPart(text), new DataPart(data)), context.getContextId(), context.getTaskId());
    }

    public static List<String> getTextParts(List<Part<?>> parts) {
        List<String> texts = new ArrayList<>();
        for (Part<?> part : parts) {
            if (part instanceof TextPart textPart) {
                texts.add(textPart.text());
            }
        }
        return texts;
    }

    /**
     * Returns the payload of the first data part of a message.
     *
     * @param message the message
     * @return the payload, or {@code null} if the message has no data part
     */
    public static @Nullable Map<String, Object> getFirstData(Message message) {
        for (Part<?> part : message.parts()) {
            if (part instanceof DataPart dataPart) {
                return dataPart.data();
            }
        }
        return null;
    }
}
