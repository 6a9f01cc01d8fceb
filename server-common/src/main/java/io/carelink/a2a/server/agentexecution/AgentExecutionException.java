package io.carelink.a2a.server.agentexecution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Thrown by an {@link AgentExecutor} that could not handle a request. The message becomes the
 * text of the failed task's reply; the details, when present, are attached as a data part.
 */
public class AgentExecutionException extends Exception {

    @Nullable
    private final Map<String, Object> details;

    public AgentExecutionException(String message) {
        this(message, (Map<String, Object>) null);
    }

    public AgentExecutionException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AgentExecutionException(String message, @Nullable Map<String, Object> details) {
        super(message);
        this.details = copy(details);
    }

    public AgentExecutionException(String message, @Nullable Map<String, Object> details, @Nullable Throwable cause) {
        super(message, cause);
        this.details = copy(details);
    }

    @Nullable
    public Map<String, Object> getDetails() {
        return details;
    }

    private static @Nullable Map<String, Object> copy(@Nullable Map<String, Object> details) {
        return details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }
}
