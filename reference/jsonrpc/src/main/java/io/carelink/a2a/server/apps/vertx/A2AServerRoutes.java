package io.carelink.a2a.server.apps.vertx;

import static io.vertx.core.http.HttpHeaders.CONTENT_TYPE;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.JsonNode;
import io.carelink.a2a.jsonrpc.common.json.JSONRPCUtils;
import io.carelink.a2a.jsonrpc.common.wrappers.A2ARequest;
import io.carelink.a2a.jsonrpc.common.wrappers.A2AResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageResponse;
import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.transport.jsonrpc.handler.JSONRPCHandler;
import io.carelink.a2a.util.Assert;
import io.carelink.a2a.util.Utils;
import io.vertx.core.MultiMap;
import io.vertx.core.WorkerExecutor;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x Web routes of one agent.
 *
 * <h2>Request Flow</h2>
 * <pre>
 * HTTP POST /a2a/v1 → invokeJSONRPCHandler()
 *     ↓
 * Parse the body, run the interceptors, validate the envelope
 *     ↓
 * message/send → JSON response, message/stream → SSE stream
 * </pre>
 *
 * <p>JSON-RPC requests run on the worker pool passed to {@link #register(Router, WorkerExecutor)},
 * never on the event loop. Every answer to {@code POST /a2a/v1} is an HTTP 200, errors included; the error is
 * carried in the JSON-RPC envelope. The agent card is served, without authentication, at
 * {@value #AGENT_CARD_PATH} and {@value #AGENT_CARD_ALIAS_PATH}.
 *
 * <h2>Streaming</h2>
 * <p>Each event is written as one SSE frame ({@code id: <n>} then {@code data: <json>}). The
 * next event is requested from the agent only once the previous frame has been written, and
 * the stream is cancelled when the client goes away.
 */
public class A2AServerRoutes {

    private static final Logger LOGGER = LoggerFactory.getLogger(A2AServerRoutes.class);

    public static final String RPC_PATH = "/a2a/v1";
    public static final String AGENT_CARD_PATH = "/.well-known/agent.json";
    public static final String AGENT_CARD_ALIAS_PATH = "/.well-known/agent-card.json";

    static final String APPLICATION_JSON = "application/json";
    static final String SERVER_SENT_EVENTS = "text/event-stream";

    private final JSONRPCHandler jsonRpcHandler;
    private final CallContextFactory callContextFactory;
    private final String agentCardJson;

    public A2AServerRoutes(JSONRPCHandler jsonRpcHandler) {
        this(jsonRpcHandler, null);
    }

    public A2AServerRoutes(JSONRPCHandler jsonRpcHandler, @Nullable CallContextFactory callContextFactory) {
        this.jsonRpcHandler = Assert.checkNotNullParam("jsonRpcHandler", jsonRpcHandler);
        this.callContextFactory = callContextFactory != null ? callContextFactory : A2AServerRoutes::createCallContext;
        this.agentCardJson = Utils.toJsonString(jsonRpcHandler.getAgentCard());
    }

    /**
     * Adds the agent's routes to a router.
     *
     * @param router the router
     * @param workerExecutor runs the JSON-RPC requests
     */
    public void register(Router router, WorkerExecutor workerExecutor) {
        Assert.checkNotNullParam("workerExecutor", workerExecutor);
        router.get(AGENT_CARD_PATH).handler(this::getAgentCard);
        router.get(AGENT_CARD_ALIAS_PATH).handler(this::getAgentCard);
        router.post(RPC_PATH)
                .handler(BodyHandler.create())
                .handler(rc -> workerExecutor.executeBlocking(() -> {
                            invokeJSONRPCHandler(rc);
                            return null;
                        }, false)
                        .onFailure(rc::fail));
    }

    void getAgentCard(RoutingContext rc) {
        rc.response()
                .setStatusCode(200)
                .putHeader(CONTENT_TYPE, APPLICATION_JSON)
                .end(agentCardJson);
    }

    void invokeJSONRPCHandler(RoutingContext rc) {
        ServerCallContext context = callContextFactory.build(rc);
        String body = rc.body() == null ? null : rc.body().asString();
        @Nullable Object id = null;
        A2AResponse<?> response;
        try {
            JsonNode tree = JSONRPCUtils.readTree(body == null ? "" : body);
            id = JSONRPCUtils.peekId(tree);
            jsonRpcHandler.checkAccess(context);
            A2ARequest<?> request = JSONRPCUtils.parseRequest(tree);
            LOGGER.debug("Dispatching {} request {}", request.getMethod(), id);
            if (request instanceof SendStreamingMessageRequest streamingRequest) {
                Flow.Publisher<SendStreamingMessageResponse> publisher =
                        jsonRpcHandler.onMessageSendStream(streamingRequest, context);
                SseSupport.writeSse(publisher, rc);
                return;
            }
            response = jsonRpcHandler.onMessageSend((SendMessageRequest) request, context);
        } catch (Throwable t) {
            response = JSONRPCHandler.toErrorResponse(id, t);
        }
        rc.response()
                .setStatusCode(200)
                .putHeader(CONTENT_TYPE, APPLICATION_JSON)
                .end(JSONRPCUtils.toJson(response));
    }

    private static ServerCallContext createCallContext(RoutingContext rc) {
        Map<String, String> headers = new HashMap<>();
        rc.request().headers().names().forEach(name -> headers.put(name, rc.request().getHeader(name)));
        Map<String, Object> state = new HashMap<>();
        state.put("remoteAddress", String.valueOf(rc.request().remoteAddress()));
        return new ServerCallContext(headers, state);
    }

    /**
     * Writes a stream of responses as server-sent events.
     */
    private static class SseSupport {

        private SseSupport() {
            // Avoid direct instantiation.
        }

        static void writeSse(Flow.Publisher<SendStreamingMessageResponse> publisher, RoutingContext rc) {
            HttpServerResponse response = rc.response();
            AtomicLong eventIdCounter = new AtomicLong(0);

            publisher.subscribe(new Flow.Subscriber<SendStreamingMessageResponse>() {
                private volatile Flow.@Nullable Subscription upstream;

                @Override
                public void onSubscribe(Flow.Subscription subscription) {
                    this.upstream = subscription;
                    response.closeHandler(v -> {
                        LOGGER.debug("SSE connection closed by client, cancelling stream");
                        subscription.cancel();
                    });
                    subscription.request(1);
                }

                @Override
                public void onNext(SendStreamingMessageResponse item) {
                    if (response.bytesWritten() == 0 && !response.headWritten()) {
                        MultiMap headers = response.headers();
                        if (headers.get(CONTENT_TYPE) == null) {
                            headers.set(CONTENT_TYPE, SERVER_SENT_EVENTS);
                        }
                        response.setChunked(true);
                    }

                    String frame = JSONRPCUtils.formatAsSse(item, eventIdCounter.getAndIncrement());
                    response.write(Buffer.buffer(frame)).onComplete(ar -> {
                        Flow.Subscription subscription = upstream;
                        if (subscription == null) {
                            return;
                        }
                        if (ar.failed()) {
                            LOGGER.debug("SSE write failed, cancelling stream", ar.cause());
                            subscription.cancel();
                            rc.fail(ar.cause());
                        } else {
                            subscription.request(1);
                        }
                    });
                }

                @Override
                public void onError(Throwable throwable) {
                    LOGGER.warn("Stream failed", throwable);
                    Flow.Subscription subscription = upstream;
                    if (subscription != null) {
                        subscription.cancel();
                    }
                    rc.fail(throwable);
                }

                @Override
                public void onComplete() {
                    if (!response.headWritten()) {
                        MultiMap headers = response.headers();
                        if (headers.get(CONTENT_TYPE) == null) {
                            headers.set(CONTENT_TYPE, SERVER_SENT_EVENTS);
                        }
                    }
                    if (!response.ended()) {
                        response.end();
                    }
                }
            });
        }
    }
}
