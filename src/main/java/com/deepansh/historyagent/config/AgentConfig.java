package com.deepansh.historyagent.config;

import com.deepansh.historyagent.history.InMemoryListeningHistory;
import com.deepansh.historyagent.history.ListeningHistoryLoader;
import com.deepansh.historyagent.history.ListeningHistoryQueryService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the collaborators the pipeline depends on but does not own.
 */
@Configuration
public class AgentConfig {

    /** Date arithmetic (relative time ranges, "current date" in prompts) goes through this clock */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock(AgentProperties properties) {
        return Clock.system(ZoneId.of(properties.getHistory().getZone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ListeningHistoryQueryService listeningHistoryQueryService(AgentProperties properties,
                                                                     ObjectMapper objectMapper) {
        AgentProperties.History history = properties.getHistory();
        ListeningHistoryLoader loader = new ListeningHistoryLoader(objectMapper, ZoneId.of(history.getZone()));
        return new InMemoryListeningHistory(
                loader.load(Path.of(history.getDataDirectory()), history.getFilePattern()));
    }
}
