package com.starscape.thumbnailer.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;

/**
 * Provides the bounded pool that runs the per-option work of every thumbnail job.
 * The pool size is the cap on options generated and saved at the same time.
 *
 * <p>When every worker is busy and the queue is full, the submitting thread runs the task
 * itself, which slows dispatch down instead of failing the option. Tasks submitted after
 * shutdown are rejected.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "thumbnailTaskExecutor")
    public ThreadPoolTaskExecutor thumbnailTaskExecutor(ThumbnailerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getMaxConcurrency());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(0, properties.getQueueCapacity()));
        executor.setThreadNamePrefix("thumb-");
        executor.setRejectedExecutionHandler((task, pool) -> {
            if (pool.isShutdown()) {
                throw new RejectedExecutionException("Thumbnail executor is shut down");
            }
            task.run();
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
