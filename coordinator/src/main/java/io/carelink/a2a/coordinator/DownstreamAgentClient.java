package io.carelink.a2a.coordinator;

import java.util.concurrent.CompletableFuture;

import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.Task;

/**
 * Sends {@code message/send} requests to other agents.
 */
@FunctionalInterface
public interface DownstreamAgentClient {

    /**
     * Sends one message.
     *
     * @param agentUrl the RPC endpoint of the agent
     * @param message the message
     * @return the task the agent answered with; fails with an
     * {@link io.carelink.a2a.spec.A2AClientException} on transport problems or an error envelope
     */
    CompletableFuture<Task> send(String agentUrl, Message message);
}
