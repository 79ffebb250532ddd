package dev.mcpproxy.server.session;

import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import dev.mcpproxy.relay.Envelope;
import dev.mcpproxy.relay.EnvelopeCodec;
import dev.mcpproxy.relay.MalformedEnvelopeException;
import dev.mcpproxy.relay.Payloads;
import dev.mcpproxy.relay.ProxyRelay;
import reactor.core.publisher.Mono;

/**
 * Accepts MCP sessions over WebSocket and attaches each one to the relay. The most recent
 * session wins; the relay retires the previous one.
 */
public class SessionWebSocketHandler extends TextWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(SessionWebSocketHandler.class);

	private final ProxyRelay relay;

	private final EnvelopeCodec codec;

	private final int previewLength;

	private final ConcurrentHashMap<String, WebSocketLocalTransport> transports = new ConcurrentHashMap<>();

	/**
	 * Create a handler attaching sessions to the given relay.
	 * @param relay relay receiving accepted sessions
	 * @param codec codec for parsing and writing session messages
	 * @param previewLength number of payload characters to log for rejected messages
	 */
	public SessionWebSocketHandler(ProxyRelay relay, EnvelopeCodec codec, int previewLength) {
		this.relay = relay;
		this.codec = codec;
		this.previewLength = previewLength;
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		logger.info("Session WebSocket established: {}", session.getId());
		WebSocketLocalTransport transport = new WebSocketLocalTransport(session, this.codec);
		this.transports.put(session.getId(), transport);
		this.relay.connect(transport);
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		WebSocketLocalTransport transport = this.transports.get(session.getId());
		if (transport == null) {
			logger.warn("Message on unknown session {}, dropping", session.getId());
			return;
		}
		String payload = message.getPayload();
		Envelope envelope;
		try {
			envelope = this.codec.decode(payload);
		}
		catch (MalformedEnvelopeException ex) {
			logger.warn("Failed to parse message on session {}: {}", session.getId(),
					Payloads.preview(payload, this.previewLength), ex);
			transport.sendMessage(Envelope.error(null, Envelope.PARSE_ERROR, "Parse error"))
				.doOnError(err -> logger.warn("Failed to send parse error on session {}", session.getId(), err))
				.onErrorResume(err -> Mono.empty())
				.subscribe();
			return;
		}
		transport.dispatch(envelope);
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		logger.warn("Transport error detected on session {}", session.getId(), exception);
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		logger.info("Session WebSocket {} closed with status {}", session.getId(), status);
		WebSocketLocalTransport transport = this.transports.remove(session.getId());
		if (transport != null) {
			this.relay.disconnect(transport);
			transport.dispose();
		}
	}

	/**
	 * Number of sessions whose WebSocket is still open, including superseded ones that have not
	 * finished closing.
	 * @return open session count
	 */
	public int openSessions() {
		return this.transports.size();
	}

}
