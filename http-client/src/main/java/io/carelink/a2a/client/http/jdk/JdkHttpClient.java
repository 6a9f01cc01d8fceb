package io.carelink.a2a.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.net.URLConnection;
import java.net.URLStreamHandler;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscribers;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.util.function.Consumer;
import java.util.function.Function;

import io.carelink.a2a.client.http.A2AErrorMessages;
import io.carelink.a2a.client.http.HttpClient;
import io.carelink.a2a.client.http.HttpResponse;
import io.carelink.a2a.client.http.jdk.sse.SSEHandler;
import io.carelink.a2a.client.http.sse.Event;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this.httpClient = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build();

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        @Override
        protected @Nullable URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();

        JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().GET().build();
            LOGGER.debug("GET {}", request.uri());
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenCompose(RESPONSE_MAPPER);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        private String body = "";

        JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            final HttpRequest request = super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();

            final BodyHandler<?> bodyHandler;

            final String acceptHeader = this.headers.get("Accept");
            if ("text/event-stream".equalsIgnoreCase(acceptHeader)) {
                bodyHandler = BodyHandlers.ofPublisher();
            } else {
                bodyHandler = BodyHandlers.ofString(StandardCharsets.UTF_8);
            }

            LOGGER.debug("POST {}", request.uri());
            return httpClient.sendAsync(request, bodyHandler).thenCompose(RESPONSE_MAPPER);
        }
    }

    private static final Function<java.net.http.HttpResponse<?>, CompletionStage<HttpResponse>> RESPONSE_MAPPER = response -> {
        if (response.statusCode() == HTTP_UNAUTHORIZED) {
            return CompletableFuture.failedStage(new IOException(A2AErrorMessages.AUTHENTICATION_FAILED));
        } else if (response.statusCode() == HTTP_FORBIDDEN) {
            return CompletableFuture.failedStage(new IOException(A2AErrorMessages.AUTHORIZATION_FAILED));
        }

        return CompletableFuture.completedFuture(new JdkHttpResponse(response));
    };

    private record JdkHttpResponse(java.net.http.HttpResponse<?> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public CompletableFuture<String> body() {
            if (response.body() instanceof String body) {
                return CompletableFuture.completedFuture(body);
            }
            return CompletableFuture.failedFuture(new IllegalStateException("Response body was requested as an event stream"));
        }

        @Override
        @SuppressWarnings("unchecked")
        public void bodyAsSse(Consumer<Event> eventConsumer, Consumer<Throwable> errorConsumer, Runnable completeRunnable) {
            if (!success()) {
                errorConsumer.accept(new IOException("Request failed: status[" + response.statusCode() + "]"));
                return;
            }
            Optional<String> contentTypeOpt = response.headers().firstValue("Content-Type");
            if (contentTypeOpt.isEmpty() || !contentTypeOpt.get().toLowerCase().startsWith("text/event-stream")) {
                errorConsumer.accept(new IOException("Response is not an event-stream response: Content-Type["
                        + contentTypeOpt.orElse("unknown") + "]"));
                return;
            }
            if (!(response.body() instanceof Flow.Publisher<?>)) {
                errorConsumer.accept(new IllegalStateException("Response body was not requested as an event stream"));
                return;
            }
            Flow.Publisher<List<ByteBuffer>> publisher = (Flow.Publisher<List<ByteBuffer>>) response.body();
            SSEHandler sseHandler = new SSEHandler(eventConsumer, errorConsumer, completeRunnable);
            publisher.subscribe(BodySubscribers.fromLineSubscriber(sseHandler));
        }
    }
}
