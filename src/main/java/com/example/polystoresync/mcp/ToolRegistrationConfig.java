package com.example.polystoresync.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final SyncTools syncTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(SyncTools syncTools, CapabilitiesTools capTools) {
        this.syncTools = syncTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(syncTools, capTools)
                .build();
    }
}
