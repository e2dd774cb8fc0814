package com.lendguard.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Schedulers: a single-thread monitor scheduler (cycles never overlap) and a small pool for @Scheduled jobs
 * (pool refresh, liquidation scan).
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String MONITOR_SCHEDULER = "monitor-scheduler";
    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = MONITOR_SCHEDULER)
    public ThreadPoolTaskScheduler monitorScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("monitor-");
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(30);
        s.initialize();
        return s;
    }

    @Bean(name = {SCHEDULER_POOL, "taskScheduler"})
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }
}
