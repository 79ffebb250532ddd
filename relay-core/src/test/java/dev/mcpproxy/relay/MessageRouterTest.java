package dev.mcpproxy.relay;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageRouterTest {

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ConnectionStateTracker tracker = new ConnectionStateTracker();
    private final List<Envelope> outbound = new ArrayList<>();
    private final SessionManager sessions = new SessionManager(outbound::add);
    private final MessageRouter router = new MessageRouter(tracker, sessions, codec, 10);

    private FakeRemoteConnection remote;

    @BeforeEach
    void attachRemote() {
        remote = new FakeRemoteConnection("worker");
        tracker.setConnection(remote);
    }

    @Test
    void binaryInboundShouldBeDecodedAsUtf8() throws Exception {
        RecordingTransport a = new RecordingTransport("A");
        sessions.connect(a);
        String json = "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\",\"params\":{\"text\":\"hé\"}}";

        router.forwardToLocal(json.getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(codec.decode(json)), a.delivered);
    }

    @Test
    void inboundWithoutSessionShouldBeDropped() {
        assertDoesNotThrow(() -> router.forwardToLocal("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}"));
        assertDoesNotThrow(() -> router.forwardToLocal((byte[]) null));
    }

    @Test
    void inboundWithTrailingContentShouldBeDropped() {
        RecordingTransport a = new RecordingTransport("A");
        sessions.connect(a);

        router.forwardToLocal("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}} trailing garbage");
        router.forwardToLocal("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{}}");

        assertTrue(a.delivered.isEmpty());
        assertTrue(a.calls.isEmpty());
        assertTrue(tracker.isConnected());
    }

    @Test
    void deliveryFailureShouldNotDetachSessionOrConnection() {
        RecordingTransport a = new RecordingTransport("A");
        a.sendFailure = new IllegalStateException("sink closed");
        sessions.connect(a);

        router.forwardToLocal("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
        a.sendThrowsSynchronously = true;
        router.forwardToLocal("{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{}}");

        assertSame(a, sessions.current());
        assertTrue(tracker.isConnected());
        assertEquals(List.of("A:send", "A:send"), a.calls);
    }

    @Test
    void sendFailureShouldShortCircuitLaterMessages() {
        remote.sendFailure = new IOException("broken pipe");

        router.forwardToRemote("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");
        assertFalse(tracker.isConnected());

        remote.sendFailure = null;
        router.forwardToRemote("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"ping\"}");

        assertEquals(0, remote.sendAttempts());
    }

    @Test
    void binaryOutboundShouldBeSentAsIs() {
        byte[] payload = {7, 8, 9};

        router.forwardToRemote(payload);

        assertEquals(1, remote.sentBinary.size());
        assertArrayEquals(payload, remote.sentBinary.get(0));
    }

    @Test
    void outboundWhileDisconnectedShouldNeverTouchHandle() {
        remote.readiness = Readiness.CLOSED;

        assertDoesNotThrow(() -> router.forwardToRemote("a long payload that will be truncated in the log"));
        assertDoesNotThrow(() -> router.forwardToRemote(new byte[] {1}));

        assertEquals(0, remote.sendAttempts());
    }

    @Test
    void nullOutboundShouldBeDroppedWithoutDetaching() {
        assertDoesNotThrow(() -> router.forwardToRemote((String) null));
        assertDoesNotThrow(() -> router.forwardToRemote((byte[]) null));

        assertEquals(0, remote.sendAttempts());
        assertTrue(tracker.isConnected());

        router.forwardToRemote("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}");
        assertEquals(1, remote.sentText.size());
    }

    @Test
    void nonPositivePreviewLengthShouldFallBackToDefault() {
        MessageRouter unbounded = new MessageRouter(tracker, sessions, codec, -1);
        remote.readiness = Readiness.CLOSED;

        assertDoesNotThrow(() -> unbounded.forwardToRemote("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}"));
        assertDoesNotThrow(() -> unbounded.forwardToLocal("not json"));
        assertEquals(0, remote.sendAttempts());
    }

    @Test
    void envelopeOutboundShouldBeSerialisedCompactly() throws Exception {
        String json = "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/list\"}";

        router.forwardToRemote(codec.decode(json));

        assertEquals(List.of(json), remote.sentText);
    }

    @Test
    void messagesShouldBeForwardedInArrivalOrder() {
        for (int i = 0; i < 5; i++) {
            router.forwardToRemote("{\"jsonrpc\":\"2.0\",\"id\":" + i + ",\"method\":\"ping\"}");
        }

        assertEquals(5, remote.sentText.size());
        for (int i = 0; i < 5; i++) {
            assertTrue(remote.sentText.get(i).contains("\"id\":" + i + ","));
        }
    }
}
