package dev.mcpproxy.server.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import dev.mcpproxy.server.session.SessionWebSocketHandler;
import lombok.RequiredArgsConstructor;

/**
 * Registers the session handler with the servlet container at the configured endpoint.
 */
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketRelayRegistration implements WebSocketConfigurer {

	private final SessionWebSocketHandler sessionWebSocketHandler;

	private final RelayProperties relayProperties;

	@Override
	public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
		registry.addHandler(this.sessionWebSocketHandler, this.relayProperties.getEndpoint())
			.setAllowedOrigins(this.relayProperties.getAllowedOrigins());
	}

}
