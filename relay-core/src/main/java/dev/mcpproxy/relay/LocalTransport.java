package dev.mcpproxy.relay;

import java.util.function.Consumer;

import reactor.core.publisher.Mono;

/**
 * Duplex channel to a protocol session consumer. The relay delivers remote messages through
 * {@link #sendMessage(Envelope)} and captures session-originated messages through the handler it
 * installs with {@link #setMessageHandler(Consumer)}.
 */
public interface LocalTransport {

    String id();

    /**
     * Deliver a message to the session.
     * @param message envelope to write
     * @return completes once the message has been written, or errors if it could not be
     */
    Mono<Void> sendMessage(Envelope message);

    /**
     * Close the session. The relay only requests this; how the close happens is up to the
     * transport.
     * @return completes once the close has been issued
     */
    Mono<Void> closeGracefully();

    /**
     * Replace the handler receiving messages the session emits. Only one handler is held at a
     * time.
     * @param handler consumer of session-originated envelopes
     */
    void setMessageHandler(Consumer<Envelope> handler);
}
