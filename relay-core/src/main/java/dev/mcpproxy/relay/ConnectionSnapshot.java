package dev.mcpproxy.relay;

import java.time.Instant;

/**
 * Point-in-time view of the remote connection for health checks and troubleshooting.
 * @param attached whether a handle is currently held
 * @param declaredConnected the tracked "we believe this is open" flag
 * @param readiness the handle's self-reported readiness, or {@code null} when detached
 * @param attachedAt when the current handle was attached, or {@code null} if never attached
 * @param millisSinceAttached elapsed time since {@code attachedAt}, or {@code -1}
 * @param connected the result of the liveness check
 */
public record ConnectionSnapshot(
    boolean attached,
    boolean declaredConnected,
    Readiness readiness,
    Instant attachedAt,
    long millisSinceAttached,
    boolean connected
) {
}
