package io.carelink.a2a.jsonrpc.common.json;

import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.MethodNotFoundError;
import org.jspecify.annotations.Nullable;

/**
 * The envelope was well formed but named a method this agent does not offer.
 */
public class MethodNotFoundJsonMappingException extends JsonMappingException {

    private final String method;

    public MethodNotFoundJsonMappingException(String method, @Nullable Object id) {
        super("Unsupported method '" + method + "'", id);
        this.method = method;
    }

    public String getMethod() {
        return method;
    }

    @Override
    public A2AError toError() {
        return new MethodNotFoundError();
    }
}
