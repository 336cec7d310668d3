package com.example.diversifier.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final RecommendationTools recommendationTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(RecommendationTools recommendationTools, CapabilitiesTools capTools) {
        this.recommendationTools = recommendationTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(recommendationTools, capTools)
                .build();
    }
}
