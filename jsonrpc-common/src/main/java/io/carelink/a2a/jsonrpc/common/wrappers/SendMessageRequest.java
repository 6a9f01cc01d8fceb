package io.carelink.a2a.jsonrpc.common.wrappers;

import java.util.UUID;

import io.carelink.a2a.spec.MessageSendParams;
import org.jspecify.annotations.Nullable;

/**
 * The {@code message/send} request: hand one message to the agent and wait for the task
 * holding its outcome.
 */
public final class SendMessageRequest extends A2ARequest<MessageSendParams> {

    public static final String METHOD = "message/send";

    public SendMessageRequest(@Nullable String jsonrpc, Object id, MessageSendParams params) {
        super(jsonrpc, id, METHOD, params);
    }

    public SendMessageRequest(Object id, MessageSendParams params) {
        this(null, id, params);
    }

    /**
     * Creates a request with a random id.
     *
     * @param params the parameters
     * @return the request
     */
    public static SendMessageRequest of(MessageSendParams params) {
        return new SendMessageRequest(UUID.randomUUID().toString(), params);
    }
}
