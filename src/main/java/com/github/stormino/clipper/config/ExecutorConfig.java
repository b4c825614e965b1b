package com.github.stormino.clipper.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
@RequiredArgsConstructor
public class ExecutorConfig {

    private final ClipperProperties properties;

    /**
     * One long-running loop per worker; the pool size is the global job concurrency.
     */
    @Bean(name = "workerExecutor")
    public ThreadPoolTaskExecutor workerExecutor() {
        int workers = properties.getWorker().getPoolSize();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("clip-worker-");
        // Workers block on the job queue; shutdown must interrupt them
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Drains stdout/stderr of external processes. Two streams per worker at most.
     */
    @Bean(name = "processOutputExecutor")
    public ThreadPoolTaskExecutor processOutputExecutor() {
        int readers = properties.getWorker().getPoolSize() * 2 + 2;

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(readers);
        executor.setMaxPoolSize(readers);
        executor.setQueueCapacity(readers);
        executor.setThreadNamePrefix("process-output-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * Fires overall job deadlines.
     */
    @Bean(name = "jobWatchdogScheduler")
    public ThreadPoolTaskScheduler jobWatchdogScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("job-watchdog-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Runs {@code @Scheduled} maintenance so it never delays a deadline.
     */
    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("maintenance-");
        scheduler.initialize();
        return scheduler;
    }
}
