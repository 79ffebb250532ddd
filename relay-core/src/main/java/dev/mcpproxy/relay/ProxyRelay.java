package dev.mcpproxy.relay;

import java.time.Clock;

/**
 * Bridges the active protocol session with a remote worker connection.
 *
 * <p>The dialing side calls {@link #setConnection(RemoteConnection)} and feeds received frames to
 * {@link #forwardToLocal(String)}; the accepting side calls {@link #connect(LocalTransport)} for
 * each new session. Messages the session emits are sent to the worker while
 * {@link #isConnected()} holds, and dropped with a warning otherwise. None of the entry points
 * throw.
 */
public class ProxyRelay {

    private final ConnectionStateTracker tracker;
    private final SessionManager sessions;
    private final MessageRouter router;

    public ProxyRelay(EnvelopeCodec codec) {
        this(codec, Clock.systemUTC(), Payloads.DEFAULT_PREVIEW_LENGTH);
    }

    public ProxyRelay(EnvelopeCodec codec, Clock clock, int previewLength) {
        this.tracker = new ConnectionStateTracker(clock);
        this.sessions = new SessionManager(this::forwardToRemote);
        this.router = new MessageRouter(tracker, sessions, codec, previewLength);
    }

    public void setConnection(RemoteConnection connection) {
        tracker.setConnection(connection);
    }

    /**
     * The one place that decides whether the remote worker can be sent to.
     */
    public boolean isConnected() {
        return tracker.isConnected();
    }

    public ConnectionSnapshot connectionState() {
        return tracker.snapshot();
    }

    public void logConnectionState() {
        tracker.logState();
    }

    public void connect(LocalTransport transport) {
        sessions.connect(transport);
    }

    public void disconnect(LocalTransport transport) {
        sessions.disconnect(transport);
    }

    public LocalTransport currentSession() {
        return sessions.current();
    }

    public void forwardToLocal(String raw) {
        router.forwardToLocal(raw);
    }

    public void forwardToLocal(byte[] raw) {
        router.forwardToLocal(raw);
    }

    public void forwardToRemote(String payload) {
        router.forwardToRemote(payload);
    }

    public void forwardToRemote(byte[] payload) {
        router.forwardToRemote(payload);
    }

    public void forwardToRemote(Envelope envelope) {
        router.forwardToRemote(envelope);
    }
}
