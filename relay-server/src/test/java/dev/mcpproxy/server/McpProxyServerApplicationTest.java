package dev.mcpproxy.server;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
		properties = "mcp.proxy.remote.url=")
class McpProxyServerApplicationTest {

	@LocalServerPort
	private int port;

	@Autowired
	private TestRestTemplate restTemplate;

	@Test
	void statusShouldReportDisconnectedWithoutWorker() {
		@SuppressWarnings("unchecked")
		Map<String, Object> status = this.restTemplate.getForObject("/status", Map.class);

		assertNotNull(status);
		assertEquals(Boolean.FALSE, status.get("connected"));
		assertEquals(Boolean.FALSE, status.get("attached"));
	}

	@Test
	void newSessionShouldTakeOverFromPreviousOne() throws Exception {
		StandardWebSocketClient client = new StandardWebSocketClient();
		RecordingHandler first = new RecordingHandler();
		RecordingHandler second = new RecordingHandler();
		String url = "ws://localhost:" + this.port + "/mcp";

		WebSocketSession firstSession = client.execute(first, url).get(5, TimeUnit.SECONDS);
		WebSocketSession secondSession = client.execute(second, url).get(5, TimeUnit.SECONDS);

		String notice = first.messages.poll(5, TimeUnit.SECONDS);
		assertNotNull(notice);
		assertTrue(notice.contains("notifications/cancelled"));
		assertNotNull(first.closed.get(5, TimeUnit.SECONDS));
		assertTrue(secondSession.isOpen());

		secondSession.sendMessage(new TextMessage("not json"));
		String reply = second.messages.poll(5, TimeUnit.SECONDS);
		assertNotNull(reply);
		assertTrue(reply.contains("-32700"));

		secondSession.close();
		if (firstSession.isOpen()) {
			firstSession.close();
		}
	}

	private static final class RecordingHandler extends TextWebSocketHandler {

		private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();

		private final CompletableFuture<CloseStatus> closed = new CompletableFuture<>();

		@Override
		protected void handleTextMessage(WebSocketSession session, TextMessage message) {
			this.messages.add(message.getPayload());
		}

		@Override
		public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
			this.closed.complete(status);
		}

	}

}
