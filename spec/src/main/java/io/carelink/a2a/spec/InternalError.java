package io.carelink.a2a.spec;

import static io.carelink.a2a.spec.A2AErrorCodes.INTERNAL_ERROR_CODE;

import io.carelink.a2a.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Malformed envelopes and unexpected failures while handling a request.
 */
public class InternalError extends A2AError {

    public static final String MESSAGE_PREFIX = "Internal error: ";

    public InternalError(@Nullable String detail) {
        this(detail, null);
    }

    public InternalError(@Nullable String detail, @Nullable Object data) {
        super(INTERNAL_ERROR_CODE, MESSAGE_PREFIX + Utils.defaultIfNull(detail, "unknown"), data);
    }
}
