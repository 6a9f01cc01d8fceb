package io.carelink.a2a.client.http;

import static io.carelink.a2a.util.Utils.unmarshalFrom;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.carelink.a2a.spec.A2AClientError;
import io.carelink.a2a.spec.A2AClientJSONError;
import io.carelink.a2a.spec.AgentCard;
import org.jspecify.annotations.Nullable;

/**
 * Fetches the {@link AgentCard} an agent publishes at its discovery endpoint.
 */
public class A2ACardResolver {
    public static final String DEFAULT_AGENT_CARD_PATH = "/.well-known/agent.json";

    private static final TypeReference<AgentCard> AGENT_CARD_TYPE_REFERENCE = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final @Nullable Map<String, String> authHeaders;
    private final String agentCardPath;

    /**
     * Get the agent card for an agent.
     * The default {@code HttpClient} will be used to fetch the agent card.
     *
     * @param baseUrl the base URL for the agent whose agent card we want to retrieve
     * @throws A2AClientError if the URL for the agent is invalid
     */
    public A2ACardResolver(String baseUrl) throws A2AClientError {
        this.authHeaders = null;
        try {
            this.agentCardPath = cardPath(new URI(baseUrl).getPath());
            this.httpClient = HttpClient.createHttpClient(baseUrl);
        } catch (URISyntaxException | IllegalArgumentException e) {
            throw new A2AClientError("Invalid agent URL", e);
        }
    }

    /**
     * @param httpClient the http client to use
     * @param agentCardPath optional path to the agent card endpoint relative to the base
     *                      agent URL, defaults to "/.well-known/agent.json"
     * @param authHeaders the HTTP authentication headers to use. May be {@code null}
     */
    public A2ACardResolver(HttpClient httpClient, @Nullable String agentCardPath,
                           @Nullable Map<String, String> authHeaders) {
        this.httpClient = httpClient;
        this.agentCardPath = cardPath(agentCardPath);
        this.authHeaders = authHeaders;
    }

    private static String cardPath(@Nullable String path) {
        if (path == null || path.isEmpty() || "/".equals(path)) {
            return DEFAULT_AGENT_CARD_PATH;
        }
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.endsWith(DEFAULT_AGENT_CARD_PATH)) {
            return path;
        }
        return path + DEFAULT_AGENT_CARD_PATH;
    }

    String getAgentCardPath() {
        return agentCardPath;
    }

    /**
     * Get the agent card for the configured agent.
     *
     * @return the agent card
     * @throws A2AClientError If an HTTP error occurs fetching the card
     * @throws A2AClientJSONError if the response body cannot be decoded as an AgentCard
     */
    public AgentCard getAgentCard() throws A2AClientError, A2AClientJSONError {
        HttpClient.GetRequestBuilder builder = httpClient.get(agentCardPath)
                .addHeader("Accept", "application/json")
                .addHeaders(authHeaders);

        String body;
        try {
            HttpResponse response = builder.send().get();
            if (!response.success()) {
                throw new A2AClientError("Failed to obtain agent card: " + response.statusCode());
            }
            body = response.body().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new A2AClientError("Interrupted while obtaining agent card", e);
        } catch (ExecutionException e) {
            throw new A2AClientError("Failed to obtain agent card", e.getCause());
        }

        try {
            return unmarshalFrom(body, AGENT_CARD_TYPE_REFERENCE);
        } catch (JsonProcessingException e) {
            throw new A2AClientJSONError("Could not unmarshal agent card response", e);
        }
    }
}
