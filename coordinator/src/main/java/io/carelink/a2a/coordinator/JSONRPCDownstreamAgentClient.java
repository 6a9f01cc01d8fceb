package io.carelink.a2a.coordinator;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import io.carelink.a2a.client.transport.jsonrpc.JSONRPCTransport;
import io.carelink.a2a.server.http.HttpClientManager;
import io.carelink.a2a.spec.Message;
import io.carelink.a2a.spec.MessageSendParams;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DownstreamAgentClient} speaking JSON-RPC over HTTP. One transport is kept per agent
 * URL; transports to the same host and port share their {@link io.carelink.a2a.client.http.HttpClient}.
 */
public class JSONRPCDownstreamAgentClient implements DownstreamAgentClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCDownstreamAgentClient.class);

    private final HttpClientManager httpClientManager;
    private final @Nullable Map<String, String> headers;
    private final Map<String, JSONRPCTransport> transports = new ConcurrentHashMap<>();

    public JSONRPCDownstreamAgentClient() {
        this(new HttpClientManager(), null);
    }

    /**
     * @param httpClientManager source of the HTTP clients
     * @param headers headers sent with every request, such as credentials of a protected agent
     */
    public JSONRPCDownstreamAgentClient(HttpClientManager httpClientManager, @Nullable Map<String, String> headers) {
        this.httpClientManager = Assert.checkNotNullParam("httpClientManager", httpClientManager);
        this.headers = headers == null ? null : Map.copyOf(headers);
    }

    @Override
    public CompletableFuture<Task> send(String agentUrl, Message message) {
        Assert.checkNotNullParam("agentUrl", agentUrl);
        Assert.checkNotNullParam("message", message);
        LOGGER.debug("Sending message {} to {}", message.messageId(), agentUrl);
        return transport(agentUrl).sendMessage(new MessageSendParams(message));
    }

    private JSONRPCTransport transport(String agentUrl) {
        return transports.computeIfAbsent(agentUrl,
                url -> new JSONRPCTransport(httpClientManager.getOrCreate(url), null, url, headers));
    }
}
