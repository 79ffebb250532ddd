package dev.mcpproxy.relay;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Holds the single local transport that receives remote traffic. A newly connecting transport
 * takes over from the current one, which is told it was cancelled and asked to close.
 */
public class SessionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionManager.class);

    static final String SUPERSEDED_REASON = "New client connected, previous connection terminated";

    private final Consumer<Envelope> outboundSink;
    private final ReentrantLock lock = new ReentrantLock();

    private LocalTransport current;

    /**
     * @param outboundSink receives every message emitted by the current transport
     */
    public SessionManager(Consumer<Envelope> outboundSink) {
        this.outboundSink = Objects.requireNonNull(outboundSink, "outboundSink");
    }

    public void connect(LocalTransport transport) {
        Objects.requireNonNull(transport, "transport");
        lock.lock();
        try {
            LocalTransport previous = current;
            if (previous != null && previous != transport) {
                LOGGER.info("Session {} connecting, retiring previous session {}", transport.id(), previous.id());
                retire(previous);
            }
            current = transport;
            LOGGER.info("Session {} is now active", transport.id());
        } finally {
            lock.unlock();
        }
        try {
            transport.setMessageHandler(message -> routeOutbound(transport, message));
        } catch (RuntimeException e) {
            LOGGER.error("Failed to install message handler on session {}", transport.id(), e);
        }
    }

    /**
     * Release {@code transport} if it is still the current one. Called when a session goes away on
     * its own.
     */
    public void disconnect(LocalTransport transport) {
        lock.lock();
        try {
            if (transport != null && current == transport) {
                LOGGER.info("Session {} disconnected", transport.id());
                current = null;
            }
        } finally {
            lock.unlock();
        }
    }

    public LocalTransport current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    private void routeOutbound(LocalTransport source, Envelope message) {
        if (current() != source) {
            LOGGER.warn("Dropping message from superseded session {}: {}", source.id(), message.method());
            return;
        }
        outboundSink.accept(message);
    }

    // Notify then close; each step fails on its own without holding up the swap.
    private void retire(LocalTransport previous) {
        Envelope notice = Envelope.cancelled(SUPERSEDED_REASON);
        Mono.defer(() -> previous.sendMessage(notice))
            .doOnError(e -> LOGGER.warn("Failed to notify superseded session {}", previous.id(), e))
            .onErrorResume(e -> Mono.empty())
            .then(Mono.defer(previous::closeGracefully))
            .doOnError(e -> LOGGER.warn("Failed to close superseded session {}", previous.id(), e))
            .onErrorResume(e -> Mono.empty())
            .subscribe();
    }
}
