package dev.mcpproxy.server.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerResponse;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.mcpproxy.relay.EnvelopeCodec;
import dev.mcpproxy.relay.ProxyRelay;
import dev.mcpproxy.server.remote.RemoteWorkerDialer;
import dev.mcpproxy.server.session.SessionWebSocketHandler;

/**
 * Spring configuration that assembles the relay together with its two collaborators: the session
 * handler accepting local MCP clients and the dialer connecting to the remote worker.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {

	private static final Logger logger = LoggerFactory.getLogger(RelayConfig.class);

	@Bean
	public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
		return new EnvelopeCodec(objectMapper);
	}

	/**
	 * Build the relay instance shared by the session handler and the dialer.
	 * @param codec envelope codec
	 * @param properties relay configuration
	 * @return the relay
	 */
	@Bean
	public ProxyRelay proxyRelay(EnvelopeCodec codec, RelayProperties properties) {
		return new ProxyRelay(codec, Clock.systemUTC(), properties.getPreviewLength());
	}

	@Bean
	public SessionWebSocketHandler sessionWebSocketHandler(ProxyRelay relay, EnvelopeCodec codec,
			RelayProperties properties) {
		return new SessionWebSocketHandler(relay, codec, properties.getPreviewLength());
	}

	/**
	 * Create the dialer that keeps the relay attached to the remote worker.
	 * @param relay relay receiving the worker connection
	 * @param properties relay configuration holding the worker URL and reconnect delay
	 * @return dialer started with the application context
	 */
	@Bean(initMethod = "start", destroyMethod = "stop")
	public RemoteWorkerDialer remoteWorkerDialer(ProxyRelay relay, RelayProperties properties) {
		RelayProperties.Remote remote = properties.getRemote();
		if (remote.isEnabled()) {
			logger.info("Relay will dial remote worker at {} (reconnect delay {})", remote.getUrl(),
					remote.getReconnectDelay());
		}
		return new RemoteWorkerDialer(new StandardWebSocketClient(), relay, remote.getUrl(),
				remote.getReconnectDelay());
	}

	/**
	 * Expose the relay's connection state for health checks.
	 * @param relay relay to report on
	 * @param properties relay configuration holding the status path
	 * @return router serving the status endpoint
	 */
	@Bean
	public RouterFunction<ServerResponse> relayStatusRouter(ProxyRelay relay, RelayProperties properties) {
		return RouterFunctions.route()
			.GET(properties.getStatusEndpoint(), request -> ServerResponse.ok().body(relay.connectionState()))
			.build();
	}

}
