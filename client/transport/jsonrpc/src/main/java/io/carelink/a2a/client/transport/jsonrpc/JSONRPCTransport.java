package io.carelink.a2a.client.transport.jsonrpc;

import static io.carelink.a2a.util.Assert.checkNotNullParam;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.carelink.a2a.client.http.A2ACardResolver;
import io.carelink.a2a.client.http.HttpClient;
import io.carelink.a2a.client.http.HttpResponse;
import io.carelink.a2a.client.transport.jsonrpc.sse.SSEEventListener;
import io.carelink.a2a.jsonrpc.common.json.JSONRPCUtils;
import io.carelink.a2a.jsonrpc.common.wrappers.A2ARequest;
import io.carelink.a2a.jsonrpc.common.wrappers.A2AResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageRequest;
import io.carelink.a2a.spec.A2AClientError;
import io.carelink.a2a.spec.A2AClientException;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.AgentCard;
import io.carelink.a2a.spec.MessageSendParams;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the JSON-RPC binding: sends {@code message/send} and {@code message/stream}
 * requests to one agent endpoint and fetches the agent's card.
 * <p>
 * Every failure is reported as an {@link A2AClientException}; when the agent answered with an
 * error envelope, the decoded {@link A2AError} is available from
 * {@link A2AClientException#getError()}.
 */
public class JSONRPCTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCTransport.class);

    /**
     * Path of the RPC endpoint relative to the agent's base URL.
     */
    public static final String RPC_PATH = "/a2a/v1";

    private static final TypeReference<SendMessageResponse> SEND_MESSAGE_RESPONSE_REFERENCE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final String agentPath;
    private final @Nullable Map<String, String> headers;
    private volatile @Nullable AgentCard agentCard;

    public JSONRPCTransport(String agentUrl) {
        this(null, null, agentUrl, null);
    }

    /**
     * @param httpClient the client to use, or {@code null} for the default one
     * @param agentCard the agent's card when already known
     * @param agentUrl the agent's RPC endpoint, such as {@code http://localhost:8001/a2a/v1}
     * @param headers headers sent with every request, typically credentials
     */
    public JSONRPCTransport(@Nullable HttpClient httpClient, @Nullable AgentCard agentCard,
                            String agentUrl, @Nullable Map<String, String> headers) {
        checkNotNullParam("agentUrl", agentUrl);
        this.httpClient = httpClient == null ? HttpClient.createHttpClient(agentUrl) : httpClient;
        this.agentCard = agentCard;
        this.headers = headers;

        String sAgentPath = URI.create(agentUrl).getPath();
        // Strip the last slash if one is provided
        if (sAgentPath.endsWith("/")) {
            this.agentPath = sAgentPath.substring(0, sAgentPath.length() - 1);
        } else {
            this.agentPath = sAgentPath;
        }
    }

    /**
     * Sends one message and returns the task the agent created for it. A task in the
     * {@code failed} state is a successful call; only envelope errors and transport problems
     * fail the returned future.
     *
     * @param request the message parameters
     * @return the task
     */
    public CompletableFuture<Task> sendMessage(MessageSendParams request) {
        checkNotNullParam("request", request);
        SendMessageRequest sendMessageRequest = SendMessageRequest.of(request);

        return sendPostRequest(sendMessageRequest)
                .thenCompose(httpResponseBody -> {
                    try {
                        return CompletableFuture.completedFuture(
                                unmarshalResponse(httpResponseBody, SEND_MESSAGE_RESPONSE_REFERENCE).getResult());
                    } catch (A2AClientException e) {
                        return CompletableFuture.failedFuture(e);
                    }
                });
    }

    /**
     * Sends one message to a streaming agent. Events are handed to the consumer in the order
     * the agent sent them. The returned future completes once the stream has ended.
     *
     * @param request the message parameters
     * @param eventConsumer receives every event
     * @param errorConsumer receives an error envelope or a transport failure
     * @return a future completing when the stream is over
     */
    public CompletableFuture<Void> sendMessageStreaming(MessageSendParams request, Consumer<StreamingEventKind> eventConsumer,
                                                       Consumer<Throwable> errorConsumer) {
        checkNotNullParam("request", request);
        checkNotNullParam("eventConsumer", eventConsumer);
        checkNotNullParam("errorConsumer", errorConsumer);
        SendStreamingMessageRequest sendStreamingMessageRequest = SendStreamingMessageRequest.of(request);

        CompletableFuture<Void> done = new CompletableFuture<>();
        SSEEventListener sseEventListener = new SSEEventListener(eventConsumer, errorConsumer);
        createPostBuilder(sendStreamingMessageRequest)
                .asSSE()
                .send()
                .whenComplete((httpResponse, throwable) -> {
                    if (httpResponse != null) {
                        httpResponse.bodyAsSse(
                                sseEventListener::onMessage,
                                cause -> {
                                    sseEventListener.onError(toClientException("Streaming request failed", cause));
                                    done.complete(null);
                                },
                                () -> done.complete(null));
                    } else {
                        errorConsumer.accept(toClientException("Failed to send streaming message request", throwable));
                        done.complete(null);
                    }
                });
        return done;
    }

    /**
     * Returns the agent's card, fetching it from the discovery endpoint on first use.
     *
     * @return the agent card
     * @throws A2AClientException if the card cannot be fetched or decoded
     */
    public AgentCard getAgentCard() throws A2AClientException {
        AgentCard card = agentCard;
        if (card == null) {
            String basePath = agentPath.endsWith(RPC_PATH)
                    ? agentPath.substring(0, agentPath.length() - RPC_PATH.length())
                    : agentPath;
            try {
                card = new A2ACardResolver(httpClient, basePath, headers).getAgentCard();
            } catch (A2AClientError e) {
                throw new A2AClientException("Failed to get agent card: " + e.getMessage(), e);
            }
            agentCard = card;
        }
        return card;
    }

    private CompletableFuture<String> sendPostRequest(A2ARequest<?> request) {
        return createPostBuilder(request)
                .send()
                .handle((response, throwable) -> {
                    if (throwable != null) {
                        throw toClientException("Failed to send " + request.getMethod() + " request", throwable);
                    }
                    return response;
                })
                .thenCompose((HttpResponse response) -> {
                    if (!response.success()) {
                        LOGGER.debug("Error on POST processing {} for request {}", request.getMethod(), request.getId());
                        return CompletableFuture.<String>failedFuture(
                                new A2AClientException("Request failed " + response.statusCode()));
                    }
                    return response.body();
                });
    }

    private HttpClient.PostRequestBuilder createPostBuilder(A2ARequest<?> request) {
        return httpClient.post(agentPath)
                .addHeader("Content-Type", "application/json")
                .addHeaders(headers)
                .body(Utils.toJsonString(request));
    }

    private static <T extends A2AResponse<?>> T unmarshalResponse(String response, TypeReference<T> typeReference)
            throws A2AClientException {
        T value;
        try {
            value = Utils.unmarshalFrom(response, typeReference);
        } catch (JsonProcessingException e) {
            throw new A2AClientException("Failed to decode response: " + e.getOriginalMessage(), e);
        }
        A2AError error = value.getError();
        if (error != null) {
            throw new A2AClientException(error.getMessage() + (error.getData() != null ? ": " + error.getData() : ""), error);
        }
        return value;
    }

    private static A2AClientException toClientException(String message, Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof A2AClientException clientException) {
            return clientException;
        }
        return new A2AClientException(message + ": " + cause.getMessage(), cause);
    }
}
