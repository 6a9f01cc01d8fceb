package io.carelink.a2a.jsonrpc.common.wrappers;

import org.jspecify.annotations.Nullable;

/**
 * Members shared by every JSON-RPC 2.0 request and response envelope.
 */
public interface JSONRPCMessage {

    String JSONRPC_VERSION = "2.0";

    String getJsonrpc();

    /**
     * Returns the correlation token of the exchange. Requests always carry one; responses
     * carry {@code null} only when the request's id could not be read.
     *
     * @return a {@link String} or {@link Number}, or {@code null}
     */
    @Nullable Object getId();
}
