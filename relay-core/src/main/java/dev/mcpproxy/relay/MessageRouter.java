package dev.mcpproxy.relay;

import java.io.IOException;
import java.util.Objects;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Moves messages between the remote connection and the current local session. Every failure is
 * contained to the message that caused it.
 */
public class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    private final ConnectionStateTracker tracker;
    private final SessionManager sessions;
    private final EnvelopeCodec codec;
    private final int previewLength;

    public MessageRouter(ConnectionStateTracker tracker, SessionManager sessions, EnvelopeCodec codec,
                         int previewLength) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.previewLength = previewLength > 0 ? previewLength : Payloads.DEFAULT_PREVIEW_LENGTH;
    }

    public void forwardToLocal(byte[] raw) {
        if (raw == null) {
            LOGGER.warn("Dropping empty binary message from remote worker");
            return;
        }
        forwardToLocal(Payloads.decode(raw));
    }

    public void forwardToLocal(String raw) {
        Envelope envelope;
        try {
            envelope = codec.decode(raw);
        } catch (MalformedEnvelopeException e) {
            LOGGER.warn("Dropping malformed message from remote worker: {}", Payloads.preview(raw, previewLength), e);
            return;
        }
        LocalTransport transport = sessions.current();
        if (transport == null) {
            LOGGER.warn("No active session, dropping message from remote worker: {}",
                Payloads.preview(raw, previewLength));
            return;
        }
        LOGGER.debug("RX session={} method={} id={}", transport.id(), envelope.method(), envelope.id());
        Mono.defer(() -> transport.sendMessage(envelope))
            .doOnError(e -> LOGGER.error("Error forwarding message to session {}", transport.id(), e))
            .onErrorResume(e -> Mono.empty())
            .subscribe();
    }

    public void forwardToRemote(Envelope envelope) {
        String payload;
        try {
            payload = codec.encode(envelope);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialise message {} for remote worker", envelope.method(), e);
            return;
        }
        forwardToRemote(payload);
    }

    public void forwardToRemote(String payload) {
        if (payload == null) {
            LOGGER.warn("Dropping null message for remote worker");
            return;
        }
        RemoteConnection connection = tracker.usableConnection();
        if (connection == null) {
            LOGGER.warn("Cannot forward message, remote worker not connected: {}",
                Payloads.preview(payload, previewLength));
            return;
        }
        try {
            LOGGER.debug("TX conn={} json={}", connection.id(), Payloads.preview(payload, previewLength));
            connection.sendText(payload);
        } catch (IOException | RuntimeException e) {
            tracker.markDisconnected(connection);
            LOGGER.error("Error sending message to remote worker {}", connection.id(), e);
        }
    }

    public void forwardToRemote(byte[] payload) {
        if (payload == null) {
            LOGGER.warn("Dropping null binary message for remote worker");
            return;
        }
        RemoteConnection connection = tracker.usableConnection();
        if (connection == null) {
            LOGGER.warn("Cannot forward message, remote worker not connected: {}", Payloads.preview(payload));
            return;
        }
        try {
            LOGGER.debug("TX conn={} {}", connection.id(), Payloads.preview(payload));
            connection.sendBinary(payload);
        } catch (IOException | RuntimeException e) {
            tracker.markDisconnected(connection);
            LOGGER.error("Error sending message to remote worker {}", connection.id(), e);
        }
    }
}
