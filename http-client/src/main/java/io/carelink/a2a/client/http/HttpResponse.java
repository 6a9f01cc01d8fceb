package io.carelink.a2a.client.http;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import io.carelink.a2a.client.http.sse.Event;

public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    CompletableFuture<String> body();

    /**
     * Reads the body as a stream of server-sent events. Events are delivered one at a time;
     * the next line is not read before the consumer returns.
     *
     * @param eventConsumer receives each event
     * @param errorConsumer receives a read failure, or a non-stream response
     * @param completeRunnable runs once the server closed the stream
     */
    void bodyAsSse(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer, Runnable completeRunnable);
}
