package dev.mcpproxy.relay;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the remote connection handle and answers whether it is usable for sending.
 *
 * <p>Liveness is derived on every read from the declared flag and the handle's readiness. The
 * readiness probe wins when it reports the channel closing or closed: the declared flag is
 * corrected on the spot, because close events are not guaranteed to arrive when the host has
 * paused the channel.
 */
public class ConnectionStateTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionStateTracker.class);

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private RemoteConnection connection;
    private boolean declaredConnected;
    private Instant attachedAt;

    public ConnectionStateTracker() {
        this(Clock.systemUTC());
    }

    public ConnectionStateTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Replace the remote handle. {@code null} detaches the current one.
     */
    public void setConnection(RemoteConnection connection) {
        lock.lock();
        try {
            if (connection == null) {
                LOGGER.info("Clearing remote connection");
                this.connection = null;
                this.declaredConnected = false;
                return;
            }
            LOGGER.info("Attaching remote connection {} (readiness {})", connection.id(), readinessOf(connection));
            this.connection = connection;
            this.declaredConnected = true;
            this.attachedAt = clock.instant();
        } finally {
            lock.unlock();
        }
        try {
            connection.onClose(() -> handleClose(connection));
            connection.onError(error -> handleError(connection, error));
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to register listeners on remote connection {}", connection.id(), e);
        }
    }

    public boolean isConnected() {
        lock.lock();
        try {
            if (connection == null) {
                LOGGER.debug("Connection check: no remote connection attached");
                return false;
            }
            Readiness readiness = readinessOf(connection);
            if (declaredConnected && readiness.isClosingOrClosed()) {
                LOGGER.info("Remote connection {} reports {}, marking it disconnected", connection.id(), readiness);
                declaredConnected = false;
            }
            boolean connected = declaredConnected && readiness != Readiness.CLOSED;
            if (!connected || readiness != Readiness.OPEN) {
                LOGGER.debug("Connection check: conn={} declared={} readiness={} attachedAt={} result={}",
                    connection.id(), declaredConnected, readiness, attachedAt, connected);
            }
            return connected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run the liveness check and return the handle it looked at, under one lock acquisition.
     * @return the handle when connected, otherwise {@code null}
     */
    RemoteConnection usableConnection() {
        lock.lock();
        try {
            return isConnected() ? connection : null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Flip the declared flag after a failed send. Ignored when {@code failed} has already been
     * replaced.
     */
    void markDisconnected(RemoteConnection failed) {
        lock.lock();
        try {
            if (connection == failed && declaredConnected) {
                LOGGER.info("Marking remote connection {} disconnected after send failure", failed.id());
                declaredConnected = false;
            }
        } finally {
            lock.unlock();
        }
    }

    RemoteConnection connection() {
        lock.lock();
        try {
            return connection;
        } finally {
            lock.unlock();
        }
    }

    public ConnectionSnapshot snapshot() {
        lock.lock();
        try {
            boolean connected = isConnected();
            long sinceAttached = attachedAt == null ? -1 : Duration.between(attachedAt, clock.instant()).toMillis();
            return new ConnectionSnapshot(
                connection != null,
                declaredConnected,
                connection == null ? null : readinessOf(connection),
                attachedAt,
                sinceAttached,
                connected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write the full connection state to the log regardless of level thresholds for the liveness
     * check itself.
     */
    public void logState() {
        LOGGER.info("Remote connection state: {}", snapshot());
    }

    private void handleClose(RemoteConnection closed) {
        lock.lock();
        try {
            if (connection != closed) {
                LOGGER.debug("Ignoring close of replaced remote connection {}", closed.id());
                return;
            }
            LOGGER.info("Remote connection {} closed", closed.id());
            declaredConnected = false;
            connection = null;
        } finally {
            lock.unlock();
        }
    }

    private void handleError(RemoteConnection failed, Throwable error) {
        lock.lock();
        try {
            if (connection != failed) {
                LOGGER.debug("Ignoring error on replaced remote connection {}", failed.id());
                return;
            }
            LOGGER.warn("Remote connection {} reported an error", failed.id(), error);
            declaredConnected = false;
        } finally {
            lock.unlock();
        }
    }

    private static Readiness readinessOf(RemoteConnection connection) {
        try {
            Readiness readiness = connection.readiness();
            return readiness == null ? Readiness.CLOSED : readiness;
        } catch (RuntimeException e) {
            LOGGER.debug("Readiness probe failed on remote connection {}", connection.id(), e);
            return Readiness.CLOSED;
        }
    }
}
