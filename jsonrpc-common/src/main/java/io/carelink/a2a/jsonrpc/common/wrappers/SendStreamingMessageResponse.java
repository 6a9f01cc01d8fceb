package io.carelink.a2a.jsonrpc.common.wrappers;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.carelink.a2a.spec.A2AError;
import io.carelink.a2a.spec.StreamingEventKind;
import org.jspecify.annotations.Nullable;

/**
 * One event of a {@code message/stream} response, sent as one server-sent event.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SendStreamingMessageResponse extends A2AResponse<StreamingEventKind> {

    @JsonCreator
    public SendStreamingMessageResponse(@JsonProperty("jsonrpc") @Nullable String jsonrpc,
                                        @JsonProperty("id") @Nullable Object id,
                                        @JsonProperty("result") @Nullable StreamingEventKind result,
                                        @JsonProperty("error") @Nullable A2AError error) {
        super(jsonrpc, id, result, error);
    }

    public SendStreamingMessageResponse(@Nullable Object id, StreamingEventKind result) {
        this(null, id, result, null);
    }

    public SendStreamingMessageResponse(@Nullable Object id, A2AError error) {
        this(null, id, null, error);
    }
}
