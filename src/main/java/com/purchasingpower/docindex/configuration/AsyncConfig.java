package com.purchasingpower.docindex.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for the filesystem watcher.
 *
 * A single worker thread consumes filesystem events, so watch-triggered indexing
 * never blocks the thread that runs the initial pass.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "watchExecutor")
    public ThreadPoolTaskExecutor watchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        // One event loop per process
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);

        executor.setThreadNamePrefix("doc-watch-");

        // Let the in-flight file finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Watch executor configured: core={}, max={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize());

        return executor;
    }
}
