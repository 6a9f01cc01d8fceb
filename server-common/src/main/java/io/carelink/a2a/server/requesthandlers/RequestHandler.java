package io.carelink.a2a.server.requesthandlers;

import java.util.concurrent.Flow;

import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.spec.MessageSendParams;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.Task;

/**
 * Protocol-independent handling of the A2A message methods.
 */
public interface RequestHandler {

    /**
     * Handles {@code message/send}: creates a task, runs the agent and returns the terminal
     * task. Agent failures produce a failed task, not an exception.
     *
     * @param params the request parameters
     * @param context the call context
     * @return the completed or failed task
     */
    Task onMessageSend(MessageSendParams params, ServerCallContext context);

    /**
     * Handles {@code message/stream}.
     *
     * @param params the request parameters
     * @param context the call context
     * @return the publisher of the stream's events
     * @throws io.carelink.a2a.spec.MethodNotFoundError if the agent does not stream
     */
    Flow.Publisher<StreamingEventKind> onMessageSendStream(MessageSendParams params, ServerCallContext context);
}
