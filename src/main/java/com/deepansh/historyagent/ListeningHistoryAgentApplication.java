package com.deepansh.historyagent;

import com.deepansh.historyagent.config.AgentProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(AgentProperties.class)
public class ListeningHistoryAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(ListeningHistoryAgentApplication.class, args);
    }
}
