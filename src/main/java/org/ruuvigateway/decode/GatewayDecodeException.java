package org.ruuvigateway.decode;

/**
 * Raised when a well-formed JSON history document does not match the expected schema.
 */
public class GatewayDecodeException extends Exception {
    public GatewayDecodeException(String message) {
        super(message);
    }

    public GatewayDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
