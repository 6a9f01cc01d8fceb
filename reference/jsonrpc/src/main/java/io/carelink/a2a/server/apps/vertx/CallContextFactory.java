package io.carelink.a2a.server.apps.vertx;

import io.carelink.a2a.server.ServerCallContext;
import io.vertx.ext.web.RoutingContext;

/**
 * Builds the {@link ServerCallContext} of an HTTP request. Agents that need more than the
 * request headers in their context, such as a principal established by a Vert.x auth
 * handler, register their own factory with the {@link A2AServer}.
 */
@FunctionalInterface
public interface CallContextFactory {

    ServerCallContext build(RoutingContext rc);
}
