package io.carelink.a2a.server.auth;

import io.carelink.a2a.server.ServerCallContext;

/**
 * Hook that runs before a request is dispatched to an agent. An interceptor rejects a request
 * by throwing an {@link io.carelink.a2a.spec.A2AError}, typically an
 * {@link io.carelink.a2a.spec.AuthenticationRequiredError}; the error is returned to the caller
 * and no task is created.
 */
@FunctionalInterface
public interface RequestInterceptor {

    void intercept(ServerCallContext context);
}
