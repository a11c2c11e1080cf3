package com.architecture.memory.codegraph.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool used by the parser coordinator. One language parser runs per task.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "parserExecutor")
    public ThreadPoolTaskExecutor parserExecutor(CodeGraphProperties properties) {
        int poolSize = properties.getParser().resolvePoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        // Unbounded queue: work is bounded by the number of languages per scan
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("ckg-parser-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("[ckg-coordinator] Parser pool initialized with {} threads", poolSize);
        return executor;
    }
}
