package dev.mcpproxy.relay;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Handle to a persistent duplex channel to the remote worker process. Instances are created by
 * whatever dials the worker and handed to {@link ProxyRelay#setConnection(RemoteConnection)}.
 *
 * <p>{@link #readiness()} may lag behind reality when the host pauses and resumes the channel,
 * so callers decide whether to send through {@link ProxyRelay#isConnected()} instead.
 */
public interface RemoteConnection {

    String id();

    Readiness readiness();

    void sendText(String payload) throws IOException;

    void sendBinary(byte[] payload) throws IOException;

    /**
     * Register a listener fired once the channel has closed.
     */
    void onClose(Runnable listener);

    /**
     * Register a listener fired when the channel reports a transport error.
     */
    void onError(Consumer<Throwable> listener);
}
