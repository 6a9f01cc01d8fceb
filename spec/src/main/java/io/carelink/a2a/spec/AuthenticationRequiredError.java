package io.carelink.a2a.spec;

import static io.carelink.a2a.spec.A2AErrorCodes.AUTHENTICATION_REQUIRED_ERROR_CODE;

import java.util.List;
import java.util.Map;

/**
 * Raised by a request interceptor when the caller did not present acceptable credentials.
 * The error data lists the names of the schemes the agent accepts.
 */
public class AuthenticationRequiredError extends A2AError {

    public static final String REQUIRED_AUTH = "required_auth";

    public AuthenticationRequiredError(List<String> schemeNames) {
        super(AUTHENTICATION_REQUIRED_ERROR_CODE, "Authentication required",
                Map.of(REQUIRED_AUTH, List.copyOf(schemeNames)));
    }
}
