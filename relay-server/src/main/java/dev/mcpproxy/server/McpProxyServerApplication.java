package dev.mcpproxy.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the MCP proxy relay Spring Boot application.
 */
@SpringBootApplication
public class McpProxyServerApplication {

	/**
	 * Bootstrap the Spring Boot application.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication.run(McpProxyServerApplication.class, args);
	}

}
