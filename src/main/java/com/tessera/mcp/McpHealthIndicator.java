package com.tessera.mcp;

import com.tessera.core.knowledge.KnowledgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health for the knowledge server. A failed ping drops the cached client so
 * the next knowledge lookup reconnects.
 */
@Component("knowledge")
@ConditionalOnProperty(prefix = "tessera.knowledge", name = "enabled", havingValue = "true")
public class McpHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(McpHealthIndicator.class);

    private final McpClientManager clientManager;
    private final KnowledgeProperties properties;

    public McpHealthIndicator(McpClientManager clientManager, KnowledgeProperties properties) {
        this.clientManager = clientManager;
        this.properties = properties;
    }

    @Override
    public Health health() {
        if (!clientManager.isConfigured()) {
            return Health.unknown().withDetail("reason", "tessera.knowledge.mcp.url is not set").build();
        }
        Health.Builder details = new Health.Builder()
                .withDetail("url", properties.getMcp().getUrl())
                .withDetail("tool", properties.getMcp().getToolName());
        if (!clientManager.hasClient()) {
            return details.up().withDetail("connection", "not connected yet").build();
        }
        try {
            clientManager.getClient().ifPresent(client -> client.ping());
            return details.up().withDetail("connection", "connected").build();
        } catch (RuntimeException e) {
            log.warn("Knowledge server ping failed: {}", e.getMessage());
            clientManager.reset();
            // Lookups are optional: report degraded, never down
            return details.status("DEGRADED").withDetail("connection", "ping failed: " + e.getMessage()).build();
        }
    }
}
