package io.carelink.a2a.client.http.jdk.sse;

import java.util.concurrent.Flow;
import java.util.function.Consumer;

import io.carelink.a2a.client.http.sse.CommentEvent;
import io.carelink.a2a.client.http.sse.DataEvent;
import io.carelink.a2a.client.http.sse.Event;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the lines of an {@code text/event-stream} body into {@link Event}s. Lines are requested
 * one at a time, so a slow consumer slows the reader down instead of buffering.
 */
public class SSEHandler implements Flow.Subscriber<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SSEHandler.class);

    private static final String UTF8_BOM = "\uFEFF";

    private static final String DEFAULT_EVENT_NAME = "message";

    private final Consumer<Event> eventConsumer;
    private final Consumer<Throwable> errorConsumer;
    private final Runnable completeRunnable;

    private Flow.@Nullable Subscription subscription;
    private String currentEventName = DEFAULT_EVENT_NAME;
    private final StringBuilder dataBuffer = new StringBuilder();
    private String lastEventId = "";
    private boolean firstLine = true;

    public SSEHandler(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer, Runnable completeRunnable) {
        this.eventConsumer = eventConsumer;
        this.errorConsumer = errorConsumer;
        this.completeRunnable = completeRunnable;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        subscription.request(1);
    }

    @Override
    public void onNext(String item) {
        try {
            handleLine(item);
        } catch (RuntimeException e) {
            LOGGER.warn("Event consumer failed, closing stream", e);
            cancel();
            errorConsumer.accept(e);
            return;
        }
        if (subscription != null) {
            subscription.request(1);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        errorConsumer.accept(throwable);
    }

    @Override
    public void onComplete() {
        // a stream may end without the blank line closing its last event
        dispatch();
        completeRunnable.run();
    }

    /**
     * Stops reading the stream.
     */
    public void cancel() {
        if (subscription != null) {
            subscription.cancel();
        }
    }

    private void handleLine(String input) {
        String line = input;
        if (firstLine) {
            firstLine = false;
            if (line.startsWith(UTF8_BOM)) {
                line = line.substring(UTF8_BOM.length());
            }
        }
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        LOGGER.debug("got line `{}`", line);

        if (line.isEmpty()) {
            dispatch();
        } else if (line.startsWith(":")) {
            eventConsumer.accept(new CommentEvent(line.substring(1).trim()));
        } else {
            int colon = line.indexOf(':');
            if (colon == -1) {
                handleFieldValue(line, "");
            } else {
                handleFieldValue(line.substring(0, colon), stripLeadingSpaceIfPresent(line.substring(colon + 1)));
            }
        }
    }

    private void handleFieldValue(String fieldName, String value) {
        switch (fieldName) {
            case "event":
                currentEventName = value;
                break;
            case "data":
                dataBuffer.append(value).append("\n");
                break;
            case "id":
                if (!value.contains("\0")) {
                    lastEventId = value;
                }
                break;
            default:
                // retry and unknown fields are ignored
                break;
        }
    }

    private void dispatch() {
        if (dataBuffer.length() > 0) {
            dataBuffer.setLength(dataBuffer.length() - 1);
            LOGGER.debug("broadcasting new event named {} lastEventId is {}", currentEventName, lastEventId);
            eventConsumer.accept(new DataEvent(currentEventName, dataBuffer.toString(), lastEventId));
        }
        dataBuffer.setLength(0);
        currentEventName = DEFAULT_EVENT_NAME;
    }

    private static String stripLeadingSpaceIfPresent(String field) {
        if (!field.isEmpty() && field.charAt(0) == ' ') {
            return field.substring(1);
        }
        return field;
    }
}
