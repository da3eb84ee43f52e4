package com.zecinsight.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Named thread pools: resync worker loop, task monitoring and batch scoring fan-out.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RESYNC_EXECUTOR = "resync-executor";
    public static final String MONITORING_EXECUTOR = "monitoring-executor";
    public static final String BATCH_EXECUTOR = "batch-executor";

    /**
     * Two threads: one for the worker loop draining the resync queue, one for the time-bounded resync it
     * hands off.
     */
    @Bean(name = RESYNC_EXECUTOR)
    public ThreadPoolTaskExecutor resyncExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("resync-");
        e.initialize();
        return e;
    }

    @Bean(name = MONITORING_EXECUTOR)
    public Executor monitoringExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setThreadNamePrefix("monitoring-");
        e.initialize();
        return e;
    }

    /**
     * Shared by batch scoring and dashboard fan-out. A saturated pool runs the task on the submitting thread
     * instead of rejecting it.
     */
    @Bean(name = BATCH_EXECUTOR)
    public Executor batchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(8);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("batch-");
        e.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        e.initialize();
        return e;
    }
}
