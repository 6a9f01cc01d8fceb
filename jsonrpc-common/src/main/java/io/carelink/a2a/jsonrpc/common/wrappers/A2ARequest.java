package io.carelink.a2a.jsonrpc.common.wrappers;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.carelink.a2a.util.Assert;
import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the request envelopes this agent understands.
 *
 * @param <T> the type of the {@code params} member
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public abstract sealed class A2ARequest<T> implements JSONRPCMessage
        permits SendMessageRequest, SendStreamingMessageRequest {

    private final String jsonrpc;
    private final Object id;
    private final String method;
    private final T params;

    protected A2ARequest(@Nullable String jsonrpc, Object id, String method, T params) {
        this.jsonrpc = Utils.defaultIfNull(jsonrpc, JSONRPC_VERSION);
        this.id = Assert.checkNotNullParam("id", id);
        this.method = Assert.checkNotBlankParam("method", method);
        this.params = Assert.checkNotNullParam("params", params);
    }

    @Override
    @JsonProperty("jsonrpc")
    public String getJsonrpc() {
        return jsonrpc;
    }

    @Override
    @JsonProperty("id")
    public Object getId() {
        return id;
    }

    @JsonProperty("method")
    public String getMethod() {
        return method;
    }

    @JsonProperty("params")
    public T getParams() {
        return params;
    }
}
