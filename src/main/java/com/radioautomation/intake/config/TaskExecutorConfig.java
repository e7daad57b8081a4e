package com.radioautomation.intake.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Configures the thread pool that runs the per-show watcher workers, and the clock used for
 * stability checks and output naming.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Each watched show keeps one worker busy for as long as it is watched, so the pool hands every
     * task its own thread instead of queueing it behind another show's worker.
     *
     * @return The executor running the watcher workers.
     */
    @Bean("watcherTaskExecutor")
    public TaskExecutor watcherTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("show-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
