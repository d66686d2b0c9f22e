package com.deepansh.collab.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Thread pools for everything that runs off the inbound WebSocket thread.
 *
 * - fanoutTaskExecutor drains per-connection outbound queues, so a slow
 *   recipient only ever occupies one pool thread
 * - voiceTaskExecutor runs media-service handshakes
 * - collabTaskScheduler fires grace timers, cursor flushes and typing expiry
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "fanoutTaskExecutor")
    public Executor fanoutTaskExecutor(CollabProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getFanout().getCorePoolSize());
        executor.setMaxPoolSize(properties.getFanout().getMaxPoolSize());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("fanout-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean(name = "voiceTaskExecutor")
    public Executor voiceTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("voice-async-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "collabTaskScheduler")
    public TaskScheduler collabTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("collab-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
