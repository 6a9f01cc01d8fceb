/**
 * Vert.x HTTP server for A2A agents: the JSON-RPC endpoint, the agent card and the
 * server-sent event stream of {@code message/stream}.
 */
@NullMarked
package io.carelink.a2a.server.apps.vertx;

import org.jspecify.annotations.NullMarked;
