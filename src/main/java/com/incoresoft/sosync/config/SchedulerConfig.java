package com.incoresoft.sosync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import java.time.Clock;

@Slf4j(topic = "com.incoresoft.sosync.scheduler")
@Configuration
public class SchedulerConfig implements SchedulingConfigurer {

    @Bean(name = "taskScheduler")
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("status-reset-");
        // global error handler for delayed status resets
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed: {}", t.getMessage(), t));
        scheduler.initialize();
        return scheduler;
    }

    /** Wall clock for cooldowns, cancel gates and reset windows. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.setTaskScheduler(taskScheduler());
    }
}
