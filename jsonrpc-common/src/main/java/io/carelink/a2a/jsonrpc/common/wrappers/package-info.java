/**
 * JSON-RPC 2.0 request and response envelopes for the {@code message/send} and
 * {@code message/stream} methods.
 */
@NullMarked
package io.carelink.a2a.jsonrpc.common.wrappers;

import org.jspecify.annotations.NullMarked;
