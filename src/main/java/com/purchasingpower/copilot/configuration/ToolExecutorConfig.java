package com.purchasingpower.copilot.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for source tool fan-out.
 *
 * Every query submits up to four tool invocations here and waits for all of them
 * before fusing, so the pool bounds how many source calls are in flight at once.
 */
@Slf4j
@Configuration
public class ToolExecutorConfig {

    @Bean(name = "toolExecutor")
    public ThreadPoolTaskExecutor toolExecutor(AdvisorProperties properties) {
        ToolExecutorProperties settings = properties.getToolExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(settings.getCorePoolSize(), settings.getMaxPoolSize()));
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadNamePrefix());

        // In-flight source calls finish before the context closes
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(settings.getAwaitTerminationSeconds());

        executor.initialize();

        log.info("Tool executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                executor.getQueueCapacity());

        return executor;
    }
}
