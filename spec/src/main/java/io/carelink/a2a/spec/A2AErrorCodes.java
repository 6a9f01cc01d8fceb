package io.carelink.a2a.spec;

/**
 * All the error codes for A2A errors.
 */
public interface A2AErrorCodes {
    final int INTERNAL_ERROR_CODE = -32603;
    final int METHOD_NOT_FOUND_ERROR_CODE = -32601;
    final int AUTHENTICATION_REQUIRED_ERROR_CODE = -32001;
}
