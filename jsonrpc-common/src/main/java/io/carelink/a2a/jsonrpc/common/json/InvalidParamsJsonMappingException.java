package io.carelink.a2a.jsonrpc.common.json;

import org.jspecify.annotations.Nullable;

/**
 * The {@code params} member could not be bound to the parameters of the requested method.
 */
public class InvalidParamsJsonMappingException extends JsonMappingException {

    public InvalidParamsJsonMappingException(String message, @Nullable Object id, Throwable cause) {
        super(message, id, cause);
    }
}
