package io.carelink.a2a.server;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jspecify.annotations.Nullable;

/**
 * Per-request context handed to interceptors and agent executors. Header names are matched
 * case-insensitively. The state map may be used by interceptors to pass information, such
 * as an authenticated principal, to the executor handling the same request.
 */
public class ServerCallContext {

    private final Map<String, String> headers;
    private final Map<String, Object> state;

    public ServerCallContext(Map<String, String> headers) {
        this(headers, Map.of());
    }

    public ServerCallContext(Map<String, String> headers, Map<String, Object> state) {
        Map<String, String> normalized = new ConcurrentHashMap<>();
        headers.forEach((name, value) -> normalized.put(name.toLowerCase(Locale.ROOT), value));
        this.headers = Map.copyOf(normalized);
        this.state = new ConcurrentHashMap<>(state);
    }

    public static ServerCallContext empty() {
        return new ServerCallContext(Map.of());
    }

    public @Nullable String getHeader(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Returns the request headers keyed by lower case name.
     *
     * @return the headers
     */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public Map<String, Object> getState() {
        return state;
    }
}
