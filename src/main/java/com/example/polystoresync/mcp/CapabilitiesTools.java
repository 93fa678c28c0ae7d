package com.example.polystoresync.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class CapabilitiesTools {

    @Tool(description = "List available tool names and counts for introspection")
    public Map<String, Object> capabilities_list() {
        List<String> tools = List.of(
                "sync_store_document", "sync_update_document", "sync_delete_document",
                "sync_retrieve_document", "sync_validate_consistency", "sync_health",
                "sync_search_similar", "sync_related_documents", "capabilities_list");
        return Map.of(
                "server", Map.of("name", "polystore-sync", "version", "0.1.0"),
                "tools", tools,
                "toolCount", tools.size(),
                "stores", Map.of(
                        "critical", List.of("relational", "vector"),
                        "optional", List.of("graph", "cache")
                )
        );
    }
}
