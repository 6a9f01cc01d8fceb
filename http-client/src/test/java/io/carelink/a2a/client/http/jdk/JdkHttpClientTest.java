package io.carelink.a2a.client.http.jdk;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.givenThat;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.status;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.carelink.a2a.client.http.A2AErrorMessages;
import io.carelink.a2a.client.http.HttpResponse;
import io.carelink.a2a.client.http.sse.DataEvent;
import io.carelink.a2a.client.http.sse.Event;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JdkHttpClientTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    public void testBaseUrlNormalization() {
        String baseUrl = "http://localhost:8080";

        JdkHttpClient client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals(baseUrl, client.getBaseUrl());

        client = new JdkHttpClient("http://localhost");
        Assertions.assertEquals("http://localhost", client.getBaseUrl());

        client = new JdkHttpClient("https://localhost:443");
        Assertions.assertEquals("https://localhost:443", client.getBaseUrl());

        client = new JdkHttpClient("http://localhost:8001/a2a/v1");
        Assertions.assertEquals("http://localhost:8001", client.getBaseUrl());
    }

    @Test
    public void testPostSendsBodyAndHeaders() throws Exception {
        givenThat(post(urlEqualTo("/a2a/v1"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody("{\"ok\":true}")));

        JdkHttpClient client = new JdkHttpClient("http://localhost:" + server.port());
        HttpResponse response = client.post("/a2a/v1")
                .addHeader("Content-Type", "application/json")
                .send("{\"jsonrpc\":\"2.0\"}")
                .get(5, TimeUnit.SECONDS);

        assertTrue(response.success());
        assertEquals("{\"ok\":true}", response.body().get());
        verify(postRequestedFor(urlEqualTo("/a2a/v1"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withRequestBody(equalTo("{\"jsonrpc\":\"2.0\"}")));
    }

    @Test
    public void testUnauthorizedFailsTheFuture() {
        givenThat(post(urlEqualTo("/a2a/v1")).willReturn(status(401)));

        JdkHttpClient client = new JdkHttpClient("http://localhost:" + server.port());
        CompletableFuture<HttpResponse> future = client.post("/a2a/v1").send("{}");

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, e.getCause());
        assertEquals(A2AErrorMessages.AUTHENTICATION_FAILED, e.getCause().getMessage());
    }

    @Test
    public void testEventStreamIsParsedInOrder() throws Exception {
        String stream = "id: 0\ndata: {\"n\":1}\n\n: keep-alive\n\nid: 1\ndata: {\"n\":2}\n\n";
        givenThat(post(urlEqualTo("/a2a/v1"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "text/event-stream").withBody(stream)));

        JdkHttpClient client = new JdkHttpClient("http://localhost:" + server.port());
        HttpResponse response = client.post("/a2a/v1").asSSE().send("{}").get(5, TimeUnit.SECONDS);

        List<Event> events = new CopyOnWriteArrayList<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        response.bodyAsSse(events::add, done::completeExceptionally, () -> done.complete(null));
        done.get(5, TimeUnit.SECONDS);

        List<DataEvent> data = events.stream()
                .filter(DataEvent.class::isInstance)
                .map(DataEvent.class::cast)
                .toList();
        assertEquals(2, data.size());
        assertEquals("{\"n\":1}", data.get(0).getData());
        assertEquals("0", data.get(0).getId());
        assertEquals("{\"n\":2}", data.get(1).getData());
        assertEquals(3, events.size());
    }

    @Test
    public void testNonStreamResponseIsReportedAsError() throws Exception {
        givenThat(post(urlEqualTo("/a2a/v1"))
                .willReturn(aResponse().withStatus(200).withHeader("Content-Type", "application/json").withBody("{}")));

        JdkHttpClient client = new JdkHttpClient("http://localhost:" + server.port());
        HttpResponse response = client.post("/a2a/v1").asSSE().send("{}").get(5, TimeUnit.SECONDS);

        CompletableFuture<Throwable> error = new CompletableFuture<>();
        response.bodyAsSse(event -> { }, error::complete, () -> error.complete(null));

        Throwable cause = error.get(5, TimeUnit.SECONDS);
        assertInstanceOf(IOException.class, cause);
        assertTrue(cause.getMessage().contains("application/json"));
    }
}
