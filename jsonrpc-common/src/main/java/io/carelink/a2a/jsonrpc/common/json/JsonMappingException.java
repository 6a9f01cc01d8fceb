package io.carelink.a2a.jsonrpc.common.json;

import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.InternalError;
import org.jspecify.annotations.Nullable;

/**
 * A request body could not be turned into a request envelope. Carries whatever request id
 * could be read so that the error response still correlates.
 */
public class JsonMappingException extends RuntimeException {

    private final @Nullable Object id;

    public JsonMappingException(String message, @Nullable Object id) {
        super(message);
        this.id = id;
    }

    public JsonMappingException(String message, @Nullable Object id, Throwable cause) {
        super(message, cause);
        this.id = id;
    }

    public @Nullable Object getId() {
        return id;
    }

    /**
     * Returns the wire error this failure is reported as.
     *
     * @return the error
     */
    public A2AError toError() {
        return new InternalError(getMessage());
    }
}
