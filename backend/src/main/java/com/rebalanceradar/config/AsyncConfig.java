package com.rebalanceradar.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: backfill scans, queue consumer loops, change notification fan-out.
 * The ingestion pool waits for in-flight items on shutdown so a handler is never cut mid-mutation.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String BACKFILL_EXECUTOR = "backfill-executor";
    public static final String INGESTION_EXECUTOR = "ingestion-executor";
    public static final String NOTIFIER_EXECUTOR = "notifier-executor";

    /** One thread per chain is enough; a chain never runs two scans at once. */
    @Bean(name = BACKFILL_EXECUTOR)
    public Executor backfillExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(3);
        e.setMaxPoolSize(6);
        e.setThreadNamePrefix("backfill-");
        e.initialize();
        return e;
    }

    /** Hosts the long-running partition consumer loops; core size must cover ingestion.queue.partitions. */
    @Bean(name = INGESTION_EXECUTOR)
    public Executor ingestionExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(16);
        e.setThreadNamePrefix("ingest-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }

    @Bean(name = NOTIFIER_EXECUTOR)
    public Executor notifierExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(4);
        e.setQueueCapacity(10_000);
        e.setThreadNamePrefix("notify-");
        e.initialize();
        return e;
    }
}
