package io.carelink.a2a.server.http;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.carelink.a2a.client.http.HttpClient;
import io.carelink.a2a.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shares one outbound {@link HttpClient} per remote endpoint (host and port) so that agents
 * calling the same peer repeatedly reuse its connections.
 */
public class HttpClientManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpClientManager.class);

    private final Map<Endpoint, HttpClient> clients = new ConcurrentHashMap<>();

    /**
     * Returns the client for the endpoint of the given URL, creating it on first use.
     *
     * @param url an absolute http or https URL
     * @return the client
     * @throws IllegalArgumentException if the URL is malformed
     */
    public HttpClient getOrCreate(String url) {
        Assert.checkNotNullParam("url", url);
        Endpoint endpoint = Endpoint.from(url);
        return clients.computeIfAbsent(endpoint, e -> {
            LOGGER.debug("Creating HTTP client for {}:{}", e.host(), e.port());
            return HttpClient.createHttpClient(url);
        });
    }

    public int size() {
        return clients.size();
    }

    private record Endpoint(String host, int port) {

        static Endpoint from(String url) {
            URL parsed;
            try {
                parsed = URI.create(url).toURL();
            } catch (IllegalArgumentException | MalformedURLException e) {
                throw new IllegalArgumentException("URL is malformed: [" + url + "]", e);
            }
            if (parsed.getHost() == null || parsed.getHost().isEmpty()) {
                throw new IllegalArgumentException("URL is malformed: [" + url + "]");
            }
            int port = parsed.getPort() != -1 ? parsed.getPort() : parsed.getDefaultPort();
            return new Endpoint(parsed.getHost().toLowerCase(Locale.ROOT), port);
        }
    }
}
