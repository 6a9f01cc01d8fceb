package io.carelink.a2a.jsonrpc.common.wrappers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * An error envelope that is not tied to any particular method, used when the request could
 * not be decoded or was rejected before dispatch.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class A2AErrorResponse extends A2AResponse<Void> {

    @JsonCreator
    public A2AErrorResponse(@JsonProperty("jsonrpc") @Nullable String jsonrpc,
                            @JsonProperty("id") @Nullable Object id,
                            @JsonProperty("error") A2AError error) {
        super(jsonrpc, id, null, Assert.checkNotNullParam("error", error));
    }

    public A2AErrorResponse(@Nullable Object id, A2AError error) {
        this(null, id, error);
    }

    public A2AErrorResponse(A2AError error) {
        this(null, null, error);
    }
}
