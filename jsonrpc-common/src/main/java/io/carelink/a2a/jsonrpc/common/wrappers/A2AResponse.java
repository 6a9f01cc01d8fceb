package io.carelink.a2a.jsonrpc.common.wrappers;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Base class of the response envelopes.
 * <p>
 * A response carries exactly one of {@code result} and {@code error}; constructing one with
 * both or neither fails. The {@code id} member is always written, as {@code null} when the
 * request's id could not be determined.
 *
 * @param <T> the type of the {@code result} member
 */
@JsonInclude(JsonInclude.Include.NON_ABSENT)
public abstract class A2AResponse<T> implements JSONRPCMessage {

    private final String jsonrpc;
    private final @Nullable Object id;
    private final @Nullable T result;
    private final @Nullable A2AError error;

    protected A2AResponse(@Nullable String jsonrpc, @Nullable Object id, @Nullable T result, @Nullable A2AError error) {
        if ((result == null) == (error == null)) {
            throw new IllegalArgumentException("A response must carry exactly one of 'result' and 'error'");
        }
        this.jsonrpc = Utils.defaultIfNull(jsonrpc, JSONRPC_VERSION);
        this.id = id;
        this.result = result;
        this.error = error;
    }

    @Override
    @JsonProperty("jsonrpc")
    public String getJsonrpc() {
        return jsonrpc;
    }

    @Override
    @JsonProperty("id")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public @Nullable Object getId() {
        return id;
    }

    @JsonProperty("result")
    public @Nullable T getResult() {
        return result;
    }

    @JsonProperty("error")
    public @Nullable A2AError getError() {
        return error;
    }
}
