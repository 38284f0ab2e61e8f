package com.exohunt.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Application-wide Spring configuration.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Pool shared by all BLS searches for scoring trial periods in parallel.
     * A parallelism of 0 uses one thread per available processor.
     */
    @Bean(destroyMethod = "shutdown")
    public ForkJoinPool transitSearchPool(@Value("${exohunt.transit.parallelism:0}") int parallelism) {
        int threads = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        return new ForkJoinPool(threads);
    }

    /**
     * Bounded executor for batch analysis. Callers that overflow the queue run the work themselves.
     */
    @Bean
    public ThreadPoolTaskExecutor analysisExecutor(
            @Value("${exohunt.batch.pool-size:4}") int poolSize,
            @Value("${exohunt.batch.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("exohunt-batch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    /**
     * Scheduler for {@code @Scheduled} housekeeping (cache sweep).
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("exohunt-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        return scheduler;
    }
}
