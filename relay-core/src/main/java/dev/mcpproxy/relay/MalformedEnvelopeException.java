package dev.mcpproxy.relay;

import java.io.IOException;

/**
 * Raised when a payload is not a JSON-RPC 2.0 envelope.
 */
public class MalformedEnvelopeException extends IOException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
