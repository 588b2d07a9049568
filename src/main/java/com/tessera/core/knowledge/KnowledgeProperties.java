package com.tessera.core.knowledge;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Knowledge service settings.
 *
 * <pre>
 * tessera:
 *   knowledge:
 *     enabled: true
 *     query-timeout-seconds: 5
 *     max-snippets: 8
 *     mcp:
 *       url: https://knowledge.example.com/mcp
 *       token: secret
 *       tool-name: search_knowledge
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "tessera.knowledge")
public class KnowledgeProperties {

    private boolean enabled = false;
    private int queryTimeoutSeconds = 5;
    private int maxSnippets = 8;
    private Mcp mcp = new Mcp();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
    public int getMaxSnippets() { return maxSnippets; }
    public void setMaxSnippets(int maxSnippets) { this.maxSnippets = maxSnippets; }
    public Mcp getMcp() { return mcp; }
    public void setMcp(Mcp mcp) { this.mcp = mcp; }

    /** True when enabled and an MCP server URL is set. */
    public boolean isConfigured() {
        return enabled && mcp.getUrl() != null && !mcp.getUrl().isBlank();
    }

    public static class Mcp {
        private String url = "";
        private String token = "";
        private String toolName = "search_knowledge";
        private int requestTimeoutSeconds = 30;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getToolName() { return toolName; }
        public void setToolName(String toolName) { this.toolName = toolName; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }
}
