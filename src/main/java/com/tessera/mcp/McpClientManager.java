package com.tessera.mcp;

import com.tessera.core.knowledge.KnowledgeProperties;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Owns the MCP sync client for the knowledge server.
 * <p>
 * The client is created on first use and cached. A failed connection attempt is not
 * cached, so the next query tries again.
 */
@Component
public class McpClientManager {

    private static final Logger log = LoggerFactory.getLogger(McpClientManager.class);

    private final KnowledgeProperties props;
    private volatile McpSyncClient client;

    public McpClientManager(KnowledgeProperties props) {
        this.props = props;
    }

    public boolean isConfigured() {
        return props.isConfigured();
    }

    public boolean hasClient() {
        return client != null;
    }

    /**
     * Returns the connected client, connecting if needed.
     *
     * @return the client, or empty when not configured or the server cannot be reached
     */
    public Optional<McpSyncClient> getClient() {
        if (!props.isConfigured()) {
            return Optional.empty();
        }
        McpSyncClient current = client;
        if (current != null) {
            return Optional.of(current);
        }
        synchronized (this) {
            if (client == null) {
                client = connect();
            }
            return Optional.ofNullable(client);
        }
    }

    private McpSyncClient connect() {
        var config = props.getMcp();
        try {
            var transportBuilder = HttpClientStreamableHttpTransport.builder(config.getUrl());
            String token = config.getToken();
            if (token != null && !token.isBlank()) {
                transportBuilder.customizeRequest(req -> req.header("Authorization", "Bearer " + token));
            }
            var created = McpClient.sync(transportBuilder.build())
                    .requestTimeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                    .build();
            created.initialize();
            log.info("MCP knowledge client connected to {}", config.getUrl());
            return created;
        } catch (Exception e) {
            log.warn("Failed to connect MCP knowledge client to {}: {}", config.getUrl(), e.getMessage());
            return null;
        }
    }

    /** Drops the cached client so the next call reconnects. */
    public synchronized void reset() {
        closeQuietly();
    }

    @PreDestroy
    synchronized void shutdown() {
        closeQuietly();
    }

    private void closeQuietly() {
        if (client != null) {
            try {
                client.close();
                log.info("MCP knowledge client disconnected");
            } catch (Exception e) {
                log.debug("Error closing MCP client: {}", e.getMessage());
            }
            client = null;
        }
    }
}
