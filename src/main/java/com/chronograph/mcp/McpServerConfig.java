package com.chronograph.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link PipelineTools} with the MCP server auto-configuration.
 */
@Configuration
public class McpServerConfig {

    @Bean
    public ToolCallbackProvider pipelineToolCallbacks(PipelineTools pipelineTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(pipelineTools)
                .build();
    }
}
