package dev.mcpproxy.server.remote;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import dev.mcpproxy.relay.ProxyRelay;

/**
 * Keeps a WebSocket open to the remote worker and feeds it to the relay. Each established session
 * is handed to {@link ProxyRelay#setConnection}; frames received on it go to
 * {@link ProxyRelay#forwardToLocal}. When the session closes or a dial fails, the dialer tries again
 * after the configured delay until {@link #stop()} is called.
 */
public class RemoteWorkerDialer extends AbstractWebSocketHandler {

	private static final Logger logger = LoggerFactory.getLogger(RemoteWorkerDialer.class);

	private final WebSocketClient client;

	private final ProxyRelay relay;

	private final String url;

	private final Duration reconnectDelay;

	private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
		Thread t = new Thread(r, "remote-worker-dialer");
		t.setDaemon(true);
		return t;
	});

	private final ConcurrentHashMap<String, WebSocketRemoteConnection> connections = new ConcurrentHashMap<>();

	private final AtomicBoolean redialPending = new AtomicBoolean();

	private volatile boolean running;

	/**
	 * Create a dialer for the given worker URL.
	 * @param client WebSocket client used to dial
	 * @param relay relay receiving the connection and its frames
	 * @param url worker WebSocket URL; blank disables dialing
	 * @param reconnectDelay delay before re-dialing
	 */
	public RemoteWorkerDialer(WebSocketClient client, ProxyRelay relay, String url, Duration reconnectDelay) {
		this.client = Objects.requireNonNull(client, "client");
		this.relay = Objects.requireNonNull(relay, "relay");
		this.url = url;
		this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
	}

	public void start() {
		if (this.url == null || this.url.isBlank()) {
			logger.info("No remote worker URL configured, relay will stay disconnected");
			return;
		}
		if (this.running) {
			return;
		}
		this.running = true;
		dial();
	}

	public void stop() {
		this.running = false;
		this.scheduler.shutdownNow();
		this.relay.setConnection(null);
		for (WebSocketRemoteConnection connection : new ArrayList<>(this.connections.values())) {
			try {
				connection.close(CloseStatus.GOING_AWAY);
			}
			catch (IOException ex) {
				logger.warn("Error closing remote connection {}", connection.id(), ex);
			}
		}
		logger.info("Remote worker dialer stopped");
	}

	public boolean isRunning() {
		return this.running;
	}

	void dial() {
		this.redialPending.set(false);
		if (!this.running) {
			return;
		}
		logger.info("Dialing remote worker at {}", this.url);
		try {
			this.client.execute(this, this.url).whenComplete((session, ex) -> {
				if (ex != null) {
					logger.warn("Failed to connect to remote worker at {}", this.url, ex);
					scheduleRedial();
				}
			});
		}
		catch (RuntimeException ex) {
			logger.warn("Failed to dial remote worker at {}", this.url, ex);
			scheduleRedial();
		}
	}

	private void scheduleRedial() {
		if (!this.running || !this.redialPending.compareAndSet(false, true)) {
			return;
		}
		logger.info("Re-dialing remote worker in {}", this.reconnectDelay);
		try {
			this.scheduler.schedule(this::dial, this.reconnectDelay.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (RejectedExecutionException ex) {
			logger.debug("Dialer scheduler shut down, not re-dialing");
		}
	}

	@Override
	public void afterConnectionEstablished(WebSocketSession session) {
		logger.info("Connected to remote worker, session {}", session.getId());
		WebSocketRemoteConnection connection = new WebSocketRemoteConnection(session);
		this.connections.put(session.getId(), connection);
		this.relay.setConnection(connection);
	}

	@Override
	protected void handleTextMessage(WebSocketSession session, TextMessage message) {
		this.relay.forwardToLocal(message.getPayload());
	}

	@Override
	protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
		ByteBuffer payload = message.getPayload().duplicate();
		byte[] bytes = new byte[payload.remaining()];
		payload.get(bytes);
		this.relay.forwardToLocal(bytes);
	}

	@Override
	public void handleTransportError(WebSocketSession session, Throwable exception) {
		logger.warn("Transport error on remote worker session {}", session.getId(), exception);
		WebSocketRemoteConnection connection = this.connections.get(session.getId());
		if (connection != null) {
			connection.failed(exception);
		}
	}

	@Override
	public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
		logger.info("Remote worker session {} closed with status {}", session.getId(), status);
		WebSocketRemoteConnection connection = this.connections.remove(session.getId());
		if (connection != null) {
			connection.closed();
		}
		scheduleRedial();
	}

}
