package com.tessera.core.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tessera.core.model.KnowledgeSnippet;
import com.tessera.mcp.McpClientManager;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Queries a knowledge tool on an MCP server.
 * <p>
 * The tool receives {@code terms}, {@code paths}, {@code root} and {@code limit}
 * and answers with JSON text: either an array of snippets or an object with a
 * {@code snippets} array. Each snippet has {@code text}, {@code provenance}
 * (or {@code source}) and an optional {@code score}.
 */
@Service
public class McpKnowledgeService implements KnowledgeService {

    private static final Logger log = LoggerFactory.getLogger(McpKnowledgeService.class);

    private final McpClientManager clientManager;
    private final KnowledgeProperties properties;
    private final ObjectMapper objectMapper;

    public McpKnowledgeService(McpClientManager clientManager, KnowledgeProperties properties,
                               ObjectMapper objectMapper) {
        this.clientManager = clientManager;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isAvailable() {
        return clientManager.isConfigured();
    }

    @Override
    public List<KnowledgeSnippet> query(List<String> terms, KnowledgeScope scope) {
        McpSyncClient client = clientManager.getClient()
                .orElseThrow(() -> new KnowledgeUnavailableException(
                        clientManager.isConfigured() ? "Knowledge server unreachable" : "Knowledge server not configured"));

        var arguments = new LinkedHashMap<String, Object>();
        arguments.put("terms", terms);
        arguments.put("paths", scope.paths());
        arguments.put("root", scope.workspaceRoot());
        arguments.put("limit", properties.getMaxSnippets());

        McpSchema.CallToolResult result;
        try {
            result = client.callTool(new McpSchema.CallToolRequest(properties.getMcp().getToolName(), arguments));
        } catch (Exception e) {
            clientManager.reset();
            throw new KnowledgeUnavailableException("Knowledge query failed: " + e.getMessage(), e);
        }

        String text = textOf(result);
        if (Boolean.TRUE.equals(result.isError())) {
            throw new KnowledgeUnavailableException("Knowledge tool reported an error: " + text);
        }
        List<KnowledgeSnippet> snippets = parseSnippets(text);
        log.debug("Knowledge query {} returned {} snippet(s)", terms, snippets.size());
        return snippets;
    }

    List<KnowledgeSnippet> parseSnippets(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new KnowledgeUnavailableException("Knowledge tool returned invalid JSON: " + e.getOriginalMessage(), e);
        }
        JsonNode items = root.isArray() ? root : root.path("snippets");
        var snippets = new ArrayList<KnowledgeSnippet>();
        for (JsonNode item : items) {
            String snippetText = item.path("text").asText("");
            if (snippetText.isBlank()) {
                continue;
            }
            String provenance = item.hasNonNull("provenance")
                    ? item.get("provenance").asText()
                    : item.path("source").asText("unknown");
            snippets.add(new KnowledgeSnippet(snippetText, provenance, item.path("score").asDouble(0.0)));
        }
        return snippets;
    }

    private static String textOf(McpSchema.CallToolResult result) {
        if (result.content() == null) {
            return "";
        }
        var sb = new StringBuilder();
        for (McpSchema.Content content : result.content()) {
            if (content instanceof McpSchema.TextContent textContent) {
                sb.append(textContent.text());
            }
        }
        return sb.toString();
    }
}
