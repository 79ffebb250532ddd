package dev.mcpproxy.server.session;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import dev.mcpproxy.relay.Envelope;
import dev.mcpproxy.relay.EnvelopeCodec;
import dev.mcpproxy.relay.LocalTransport;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link LocalTransport} backed by a server-side WebSocket session. Writes happen on a
 * single-threaded scheduler owned by the session so messages leave in the order they were
 * handed over.
 */
public class WebSocketLocalTransport implements LocalTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketLocalTransport.class);

	private final WebSocketSession session;

	private final EnvelopeCodec codec;

	private final Scheduler scheduler;

	private final ReentrantLock sendLock = new ReentrantLock();

	private volatile Consumer<Envelope> messageHandler;

	/**
	 * Wrap an established WebSocket session.
	 * @param session accepted WebSocket session
	 * @param codec codec used to serialise outgoing envelopes
	 */
	public WebSocketLocalTransport(WebSocketSession session, EnvelopeCodec codec) {
		this.session = Objects.requireNonNull(session, "session");
		this.codec = Objects.requireNonNull(codec, "codec");
		this.scheduler = Schedulers.newSingle("mcp-session-" + session.getId(), true);
	}

	@Override
	public String id() {
		return this.session.getId();
	}

	@Override
	public Mono<Void> sendMessage(Envelope message) {
		return Mono.fromCallable(() -> {
			if (!this.session.isOpen()) {
				throw new IllegalStateException("WebSocket session " + id() + " is closed");
			}
			String payload = this.codec.encode(message);
			this.sendLock.lock();
			try {
				this.session.sendMessage(new TextMessage(payload));
			}
			finally {
				this.sendLock.unlock();
			}
			logger.debug("Sent message on session {}: {}", id(), payload);
			return payload;
		}).subscribeOn(this.scheduler).then();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.<Void>fromCallable(() -> {
			this.sendLock.lock();
			try {
				if (this.session.isOpen()) {
					logger.info("Closing session {}", id());
					this.session.close(CloseStatus.NORMAL);
				}
			}
			finally {
				this.sendLock.unlock();
			}
			return null;
		}).subscribeOn(this.scheduler);
	}

	@Override
	public void setMessageHandler(Consumer<Envelope> handler) {
		this.messageHandler = Objects.requireNonNull(handler, "handler");
	}

	/**
	 * Hand a message received from the session to the installed handler.
	 * @param message parsed envelope received on the WebSocket
	 */
	void dispatch(Envelope message) {
		Consumer<Envelope> handler = this.messageHandler;
		if (handler == null) {
			logger.warn("No handler installed on session {}, dropping {}", id(), message.method());
			return;
		}
		handler.accept(message);
	}

	/**
	 * Release the write scheduler once the session is gone.
	 */
	void dispose() {
		this.scheduler.dispose();
	}

}
