package io.carelink.a2a.transport.jsonrpc.handler;

import java.util.List;
import java.util.concurrent.Flow;

import io.carelink.a2a.jsonrpc.common.json.JsonMappingException;
import io.carelink.a2a.jsonrpc.common.wrappers.A2AErrorResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendMessageResponse;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageRequest;
import io.carelink.a2a.jsonrpc.common.wrappers.SendStreamingMessageResponse;
import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.server.auth.RequestInterceptor;
import io.carelink.a2a.server.requesthandlers.RequestHandler;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.AgentCard;
import io.carelink.a2a.spec.InternalError;
import io.carelink.a2a.spec.MethodNotFoundError;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Assert;
import mutiny.zero.BackpressureStrategy;
import mutiny.zero.TubeConfiguration;
import mutiny.zero.ZeroPublisher;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 handler for one agent.
 *
 * <p>Requests flow through this handler to the underlying {@link RequestHandler}:
 * <pre>
 * JSON-RPC Request → interceptors → JSONRPCHandler → RequestHandler → AgentExecutor
 * </pre>
 *
 * <p>The transport is expected to call {@link #checkAccess(ServerCallContext)} before it
 * validates the request envelope, so that unauthenticated callers learn nothing about the
 * methods the agent supports. Every response carries the id of the request it answers.
 *
 * <h2>Error Handling</h2>
 * <p>Protocol errors ({@link A2AError}) become error responses. Any other failure is logged
 * and reported as an {@link InternalError}, so a request never takes the server down. Failures
 * of the agent itself are not errors at this level: they produce a failed {@link Task} in a
 * successful response.
 *
 * <h2>Streaming Support</h2>
 * <p>{@code message/stream} returns a {@link Flow.Publisher} of responses that forwards the
 * subscriber's demand to the agent, so events are only produced as fast as the transport
 * writes them. Agents whose card does not advertise streaming answer it with
 * {@link MethodNotFoundError}.
 */
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    private static final int STREAM_BUFFER_SIZE = 16;

    private final AgentCard agentCard;
    private final RequestHandler requestHandler;
    private final List<RequestInterceptor> interceptors;

    public JSONRPCHandler(AgentCard agentCard, RequestHandler requestHandler) {
        this(agentCard, requestHandler, List.of());
    }

    /**
     * @param agentCard the card published by the agent
     * @param requestHandler the handler for the agent's requests
     * @param interceptors run in order before each request is dispatched
     */
    public JSONRPCHandler(AgentCard agentCard, RequestHandler requestHandler, List<RequestInterceptor> interceptors) {
        this.agentCard = Assert.checkNotNullParam("agentCard", agentCard);
        this.requestHandler = Assert.checkNotNullParam("requestHandler", requestHandler);
        this.interceptors = List.copyOf(Assert.checkNotNullParam("interceptors", interceptors));
    }

    public AgentCard getAgentCard() {
        return agentCard;
    }

    /**
     * Runs the interceptors against the call.
     *
     * @param context the call context
     * @throws A2AError if an interceptor rejects the call
     */
    public void checkAccess(ServerCallContext context) {
        for (RequestInterceptor interceptor : interceptors) {
            interceptor.intercept(context);
        }
    }

    /**
     * Handles {@code message/send}.
     *
     * @param request the request
     * @param context the call context
     * @return the response holding the terminal task, or an error
     */
    public SendMessageResponse onMessageSend(SendMessageRequest request, ServerCallContext context) {
        try {
            Task task = requestHandler.onMessageSend(request.getParams(), context);
            return new SendMessageResponse(request.getId(), task);
        } catch (A2AError e) {
            return new SendMessageResponse(request.getId(), e);
        } catch (Throwable t) {
            LOGGER.error("message/send {} failed", request.getId(), t);
            return new SendMessageResponse(request.getId(), new InternalError(t.getMessage()));
        }
    }

    /**
     * Handles {@code message/stream}.
     *
     * @param request the request
     * @param context the call context
     * @return the publisher of the stream's responses
     * @throws MethodNotFoundError if the agent does not stream
     */
    public Flow.Publisher<SendStreamingMessageResponse> onMessageSendStream(
            SendStreamingMessageRequest request, ServerCallContext context) {
        if (!agentCard.capabilities().streaming()) {
            throw new MethodNotFoundError();
        }

        try {
            Flow.Publisher<StreamingEventKind> publisher =
                    requestHandler.onMessageSendStream(request.getParams(), context);
            return convertToSendStreamingMessageResponse(request.getId(), publisher);
        } catch (A2AError e) {
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), e));
        } catch (Throwable t) {
            LOGGER.error("message/stream {} failed", request.getId(), t);
            return ZeroPublisher.fromItems(new SendStreamingMessageResponse(request.getId(), new InternalError(t.getMessage())));
        }
    }

    /**
     * Converts a failure raised while reading or dispatching a request into the response for it.
     *
     * @param id the id of the request if it could be read, else {@code null}
     * @param t the failure
     * @return the error response
     */
    public static A2AErrorResponse toErrorResponse(@Nullable Object id, Throwable t) {
        if (t instanceof A2AError error) {
            return new A2AErrorResponse(id, error);
        }
        if (t instanceof JsonMappingException mappingException) {
            Object errorId = mappingException.getId() != null ? mappingException.getId() : id;
            LOGGER.debug("Rejected request {}: {}", errorId, t.getMessage());
            return new A2AErrorResponse(errorId, mappingException.toError());
        }
        LOGGER.error("Unexpected error handling request {}", id, t);
        return new A2AErrorResponse(id, new InternalError(t.getMessage()));
    }

    private Flow.Publisher<SendStreamingMessageResponse> convertToSendStreamingMessageResponse(
            Object requestId,
            Flow.Publisher<StreamingEventKind> publisher) {
        // Errors of the source are sent as a response item rather than through onError()
        return ZeroPublisher.create(createTubeConfig(), tube ->
                publisher.subscribe(new Flow.Subscriber<StreamingEventKind>() {
                    @Override
                    public void onSubscribe(Flow.Subscription subscription) {
                        tube.whenCancelled(subscription::cancel);
                        tube.whenRequested(subscription::request);
                        long outstanding = tube.outstandingRequests();
                        if (outstanding > 0) {
                            subscription.request(outstanding);
                        }
                    }

                    @Override
                    public void onNext(StreamingEventKind item) {
                        tube.send(new SendStreamingMessageResponse(requestId, item));
                    }

                    @Override
                    public void onError(Throwable throwable) {
                        if (throwable instanceof A2AError error) {
                            tube.send(new SendStreamingMessageResponse(requestId, error));
                        } else {
                            LOGGER.warn("Stream {} failed", requestId, throwable);
                            tube.send(new SendStreamingMessageResponse(requestId, new InternalError(throwable.getMessage())));
                        }
                        tube.complete();
                    }

                    @Override
                    public void onComplete() {
                        tube.complete();
                    }
                }));
    }

    private static TubeConfiguration createTubeConfig() {
        return new TubeConfiguration()
                .withBackpressureStrategy(BackpressureStrategy.BUFFER)
                .withBufferSize(STREAM_BUFFER_SIZE);
    }
}
