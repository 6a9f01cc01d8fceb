package io.carelink.a2a.jsonrpc.common.wrappers;

import java.util.UUID;

import io.carelink.a2a.spec.MessageSendParams;
import org.jspecify.annotations.Nullable;

/**
 * The {@code message/stream} request: hand one message to a streaming agent and receive its
 * progress as a sequence of response envelopes.
 */
public final class SendStreamingMessageRequest extends A2ARequest<MessageSendParams> {

    public static final String METHOD = "message/stream";

    public SendStreamingMessageRequest(@Nullable String jsonrpc, Object id, MessageSendParams params) {
        super(jsonrpc, id, METHOD, params);
    }

    public SendStreamingMessageRequest(Object id, MessageSendParams params) {
        this(null, id, params);
    }

    public static SendStreamingMessageRequest of(MessageSendParams params) {
        return new SendStreamingMessageRequest(UUID.randomUUID().toString(), params);
    }
}
