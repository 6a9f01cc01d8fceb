package io.carelink.a2a.server.agentexecution;

import io.carelink.a2a.spec.Message;

/**
 * The capability of an agent: turns the inbound message of a task into the agent's reply.
 * <p>
 * Implementations are invoked concurrently for independent requests and must not keep
 * mutable state that is shared between requests unless it is safe for concurrent use. The
 * task lifecycle is handled by the caller: returning a reply completes the task, throwing
 * {@link AgentExecutionException} fails it.
 */
@FunctionalInterface
public interface AgentExecutor {

    /**
     * Handles one request.
     *
     * @param context the inbound message, its task and the call context
     * @return the reply, sent by the agent
     * @throws AgentExecutionException if the request cannot be handled
     */
    Message execute(RequestContext context) throws AgentExecutionException;
}
