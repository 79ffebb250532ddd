package dev.mcpproxy.relay;

/**
 * Self-reported readiness of a remote channel. Mirrors the four WebSocket ready states.
 */
public enum Readiness {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    public boolean isClosingOrClosed() {
        return this == CLOSING || this == CLOSED;
    }
}
