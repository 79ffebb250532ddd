package dev.mcpproxy.server.remote;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import dev.mcpproxy.relay.Readiness;
import dev.mcpproxy.relay.RemoteConnection;

/**
 * {@link RemoteConnection} over a client-side WebSocket session to the remote worker. Readiness
 * consults {@link WebSocketSession#isOpen()} on every call, so a session the container has
 * already torn down reads as closed even if the close callback has not run yet.
 */
public class WebSocketRemoteConnection implements RemoteConnection {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketRemoteConnection.class);

	private final WebSocketSession session;

	private final ReentrantLock sendLock = new ReentrantLock();

	private final List<Runnable> closeListeners = new CopyOnWriteArrayList<>();

	private final List<Consumer<Throwable>> errorListeners = new CopyOnWriteArrayList<>();

	private volatile Readiness readiness = Readiness.OPEN;

	public WebSocketRemoteConnection(WebSocketSession session) {
		this.session = Objects.requireNonNull(session, "session");
	}

	@Override
	public String id() {
		return this.session.getId();
	}

	@Override
	public Readiness readiness() {
		if (this.readiness != Readiness.CLOSED && !this.session.isOpen()) {
			return Readiness.CLOSED;
		}
		return this.readiness;
	}

	@Override
	public void sendText(String payload) throws IOException {
		send(new TextMessage(payload));
	}

	@Override
	public void sendBinary(byte[] payload) throws IOException {
		send(new BinaryMessage(payload));
	}

	private void send(WebSocketMessage<?> message) throws IOException {
		this.sendLock.lock();
		try {
			if (!this.session.isOpen()) {
				throw new IOException("WebSocket session " + id() + " is closed");
			}
			this.session.sendMessage(message);
		}
		finally {
			this.sendLock.unlock();
		}
	}

	@Override
	public void onClose(Runnable listener) {
		this.closeListeners.add(Objects.requireNonNull(listener, "listener"));
	}

	@Override
	public void onError(Consumer<Throwable> listener) {
		this.errorListeners.add(Objects.requireNonNull(listener, "listener"));
	}

	/**
	 * Close the WebSocket from this side.
	 * @param status close status sent to the worker
	 * @throws IOException when the container fails to issue the close
	 */
	public void close(CloseStatus status) throws IOException {
		this.readiness = Readiness.CLOSING;
		this.sendLock.lock();
		try {
			if (this.session.isOpen()) {
				this.session.close(status);
			}
		}
		finally {
			this.sendLock.unlock();
		}
	}

	/**
	 * Record that the WebSocket closed and notify listeners.
	 */
	void closed() {
		this.readiness = Readiness.CLOSED;
		for (Runnable listener : this.closeListeners) {
			try {
				listener.run();
			}
			catch (RuntimeException ex) {
				logger.warn("Close listener failed on remote connection {}", id(), ex);
			}
		}
	}

	/**
	 * Notify listeners of a transport error.
	 * @param error the error reported by the container
	 */
	void failed(Throwable error) {
		for (Consumer<Throwable> listener : this.errorListeners) {
			try {
				listener.accept(error);
			}
			catch (RuntimeException ex) {
				logger.warn("Error listener failed on remote connection {}", id(), ex);
			}
		}
	}

}
