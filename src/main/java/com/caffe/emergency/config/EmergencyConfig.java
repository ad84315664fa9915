package com.caffe.emergency.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Infrastructure beans for the alert engine: time source, escalation timers,
 * notification fan-out pool and the HTTP client for SMS/voice providers.
 */
@Slf4j
@Configuration
public class EmergencyConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Escalation timers only wait; the work they trigger is short.
     */
    @Bean(name = "escalationTaskScheduler")
    public TaskScheduler escalationTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("escalation-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for notification fan-out. A full queue rejects the delivery,
     * which the dispatcher records as failed.
     */
    @Bean(name = "notificationExecutor")
    public Executor notificationExecutor(EmergencyProperties properties) {
        EmergencyProperties.Dispatcher config = properties.getDispatcher();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("notify-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("✅ Notification executor: core={}, max={}, queue={}",
                config.getCorePoolSize(), config.getMaxPoolSize(), config.getQueueCapacity());
        return executor;
    }

    @Bean
    public RestTemplate restTemplate() {
        return new RestTemplate();
    }
}
