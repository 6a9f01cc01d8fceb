package io.carelink.a2a.client.transport.jsonrpc.sse;

import static io.carelink.a2a.util.Utils.OBJECT_MAPPER;

import java.util.function.Consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.carelink.a2a.client.http.sse.DataEvent;
import io.carelink.a2a.client.http.sse.Event;
import io.carelink.a2a.spec.A2AClientException;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.StreamingEventKind;
import io.carelink.a2a.spec.TaskStatusUpdateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes the data of each server-sent event as a response envelope. Once the final status
 * update has been delivered, anything else the server sends is ignored.
 */
public class SSEEventListener {
    private static final Logger LOGGER = LoggerFactory.getLogger(SSEEventListener.class);

    private final Consumer<StreamingEventKind> eventHandler;
    private final Consumer<Throwable> errorHandler;
    private volatile boolean finished;

    public SSEEventListener(Consumer<StreamingEventKind> eventHandler,
                            Consumer<Throwable> errorHandler) {
        this.eventHandler = eventHandler;
        this.errorHandler = errorHandler;
    }

    public void onMessage(Event event) {
        LOGGER.debug("Streaming message received: {}", event);
        if (finished || !(event instanceof DataEvent dataEvent)) {
            return;
        }
        try {
            handleMessage(OBJECT_MAPPER.readTree(dataEvent.getData()));
        } catch (JsonProcessingException e) {
            LOGGER.warn("Failed to parse streaming message: {}", dataEvent.getData(), e);
            onError(new A2AClientException("Failed to parse streaming message", e));
        }
    }

    public void onError(Throwable throwable) {
        if (finished) {
            return;
        }
        finished = true;
        errorHandler.accept(throwable);
    }

    public boolean isFinished() {
        return finished;
    }

    private void handleMessage(JsonNode jsonNode) throws JsonProcessingException {
        if (jsonNode.hasNonNull("error")) {
            A2AError error = OBJECT_MAPPER.treeToValue(jsonNode.get("error"), A2AError.class);
            onError(new A2AClientException(error.getMessage(), error));
        } else if (jsonNode.has("result")) {
            StreamingEventKind event = OBJECT_MAPPER.treeToValue(jsonNode.get("result"), StreamingEventKind.class);
            eventHandler.accept(event);
            if (event instanceof TaskStatusUpdateEvent update && update.isFinal()) {
                finished = true;
            }
        } else {
            onError(new A2AClientException("Streaming message is neither a result nor an error"));
        }
    }
}
