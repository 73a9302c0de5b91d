package org.ruuvigateway.model;

/**
 * Classification of a failed poll cycle, as surfaced to the host.
 */
public enum FailureKind {
    /** HTTP 401: the gateway rejected the bearer token. */
    INVALID_AUTH,
    /** Non-200 status, timeout, connection failure or unparsable JSON. */
    CANNOT_CONNECT,
    /** Well-formed JSON that is missing or mistyping a required field. */
    DECODE_ERROR
}
