package dev.mcpproxy.server.config;

import java.time.Duration;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import dev.mcpproxy.relay.Payloads;

/**
 * Configuration properties for the relay: where local sessions connect, where the remote worker
 * lives, and how noisy the relay's logs are about dropped payloads.
 */
@ConfigurationProperties(prefix = "mcp.proxy")
public class RelayProperties {

	/**
	 * WebSocket path local MCP sessions connect to. Defaults to {@code /mcp}.
	 */
	private String endpoint = "/mcp";

	/**
	 * Origins allowed to open a session WebSocket.
	 */
	private String[] allowedOrigins = { "*" };

	/**
	 * HTTP path serving the connection status as JSON.
	 */
	private String statusEndpoint = "/status";

	/**
	 * Number of payload characters included when a dropped message is logged.
	 */
	private int previewLength = Payloads.DEFAULT_PREVIEW_LENGTH;

	private final Remote remote = new Remote();

	public String getEndpoint() {
		return endpoint;
	}

	public void setEndpoint(String endpoint) {
		this.endpoint = endpoint;
	}

	public String[] getAllowedOrigins() {
		return allowedOrigins;
	}

	public void setAllowedOrigins(String[] allowedOrigins) {
		this.allowedOrigins = allowedOrigins;
	}

	public String getStatusEndpoint() {
		return statusEndpoint;
	}

	public void setStatusEndpoint(String statusEndpoint) {
		this.statusEndpoint = statusEndpoint;
	}

	public int getPreviewLength() {
		return previewLength;
	}

	/**
	 * Update the preview length. Values below one fall back to the default.
	 * @param previewLength number of characters to keep
	 */
	public void setPreviewLength(int previewLength) {
		this.previewLength = previewLength > 0 ? previewLength : Payloads.DEFAULT_PREVIEW_LENGTH;
	}

	public Remote getRemote() {
		return remote;
	}

	/**
	 * Settings for the outbound connection to the remote worker.
	 */
	public static class Remote {

		/**
		 * WebSocket URL of the remote worker, e.g. {@code ws://localhost:8787/ws}. Dialing is
		 * disabled when blank.
		 */
		private String url;

		/**
		 * Delay before dialing again after the worker connection closes or a dial fails.
		 */
		private Duration reconnectDelay = Duration.ofSeconds(5);

		public String getUrl() {
			return url;
		}

		public void setUrl(String url) {
			this.url = url;
		}

		/**
		 * Determine whether a worker URL has been configured.
		 * @return {@code true} when the dialer should connect
		 */
		public boolean isEnabled() {
			return StringUtils.hasText(this.url);
		}

		public Duration getReconnectDelay() {
			return reconnectDelay;
		}

		public void setReconnectDelay(Duration reconnectDelay) {
			this.reconnectDelay = Objects.requireNonNullElse(reconnectDelay, Duration.ofSeconds(5));
		}

	}

}
