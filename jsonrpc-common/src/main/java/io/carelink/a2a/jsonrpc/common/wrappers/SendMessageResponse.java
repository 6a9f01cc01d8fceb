package io.carelink.a2a.jsonrpc.common.wrappers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.Task;
import org.jspecify.annotations.Nullable;

/**
 * The response to {@code message/send}: the task created for the message, whatever its
 * terminal state, or an envelope error.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SendMessageResponse extends A2AResponse<Task> {

    @JsonCreator
    public SendMessageResponse(@JsonProperty("jsonrpc") @Nullable String jsonrpc,
                               @JsonProperty("id") @Nullable Object id,
                               @JsonProperty("result") @Nullable Task result,
                               @JsonProperty("error") @Nullable A2AError error) {
        super(jsonrpc, id, result, error);
    }

    public SendMessageResponse(@Nullable Object id, Task result) {
        this(null, id, result, null);
    }

    public SendMessageResponse(@Nullable Object id, A2AError error) {
        this(null, id, null, error);
    }
}
