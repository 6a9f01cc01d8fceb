package io.carelink.a2a.spec;

/**
 * Checked failure raised while resolving an agent card over HTTP.
 */
public class A2AClientError extends Exception {

    public A2AClientError(String message) {
        super(message);
    }

    public A2AClientError(String message, Throwable cause) {
        super(message, cause);
    }
}
