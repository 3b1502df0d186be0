package com.pulsewatch.agent;

import com.pulsewatch.agent.config.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
@EnableScheduling
public class MetricsAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricsAgentApplication.class, args);
    }
}
