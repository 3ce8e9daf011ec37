package com.deepansh.historyagent.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for the data-fetch stage.
 *
 * Two pools so a worker waiting on a timed attempt never competes with that
 * attempt for a thread:
 * - fetchWorkerExecutor: one task per planned tool call, bounded by fetch-parallelism
 * - collaboratorCallExecutor: one task per timed attempt against the query service or
 *   the generation client; cached, since attempts are short-lived and cancelled on timeout
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "fetchWorkerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchWorkerExecutor(AgentProperties properties) {
        return Executors.newFixedThreadPool(
                Math.max(1, properties.getFetchParallelism()),
                new CustomizableThreadFactory("fetch-worker-"));
    }

    @Bean(name = "collaboratorCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService collaboratorCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("collaborator-call-"));
    }
}
