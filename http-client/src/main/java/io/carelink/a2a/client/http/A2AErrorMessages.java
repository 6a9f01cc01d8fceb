package io.carelink.a2a.client.http;

/**
 * Messages of the failures raised for HTTP level authentication problems.
 */
public final class A2AErrorMessages {

    public static final String AUTHENTICATION_FAILED = "Authentication failed: agent rejected the supplied credentials (401)";
    public static final String AUTHORIZATION_FAILED = "Authorization failed: the caller may not use this agent (403)";

    private A2AErrorMessages() {
    }
}
