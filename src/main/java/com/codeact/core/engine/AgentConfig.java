package com.codeact.core.engine;

import com.codeact.sandbox.ExecutionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AgentConfig {

    @Bean
    public AgentRunConfig defaultRunConfig(AgentProperties agentProperties, ExecutionProperties executionProperties) {
        return AgentRunConfig.from(agentProperties, executionProperties);
    }
}
