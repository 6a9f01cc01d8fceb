package io.carelink.a2a.examples.hospital;

import java.util.List;

import io.carelink.a2a.server.ServerCallContext;
import io.carelink.a2a.server.auth.RequestInterceptor;
import io.carelink.a2a.spec.AuthenticationRequiredError;
import io.carelink.a2a.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo credentials check: accepts an {@code X-API-Key} starting with {@code hospital_} or a
 * bearer token containing {@code valid}. Neither is verified against an issuer.
 */
public class HospitalCredentialsInterceptor implements RequestInterceptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(HospitalCredentialsInterceptor.class);

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String AUTHORIZATION_HEADER = "Authorization";

    static final String API_KEY_PREFIX = "hospital_";
    static final String BEARER_PREFIX = "Bearer ";

    private final List<String> schemeNames;

    /**
     * @param schemeNames the security schemes the agent's card advertises, reported to
     *                    rejected callers
     */
    public HospitalCredentialsInterceptor(List<String> schemeNames) {
        this.schemeNames = List.copyOf(Assert.checkNotNullParam("schemeNames", schemeNames));
    }

    @Override
    public void intercept(ServerCallContext context) {
        String apiKey = context.getHeader(API_KEY_HEADER);
        if (apiKey != null && apiKey.startsWith(API_KEY_PREFIX)) {
            return;
        }
        String authorization = context.getHeader(AUTHORIZATION_HEADER);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)
                && authorization.substring(BEARER_PREFIX.length()).contains("valid")) {
            return;
        }
        LOGGER.debug("Rejecting request without acceptable credentials from {}", context.getState().get("remoteAddress"));
        throw new AuthenticationRequiredError(schemeNames);
    }
}
