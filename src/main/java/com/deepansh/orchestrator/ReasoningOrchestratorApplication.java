package com.deepansh.orchestrator;

import com.deepansh.orchestrator.config.AgentProperties;
import com.deepansh.orchestrator.config.ToolProperties;
import com.deepansh.orchestrator.llm.LlmProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties({AgentProperties.class, ToolProperties.class, LlmProperties.class})
public class ReasoningOrchestratorApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReasoningOrchestratorApplication.class, args);
    }
}
