package com.fieldservice.bookingbackend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableAsync
@EnableConfigurationProperties(TrackingProperties.class)
public class TrackingConfig {

    /**
     * Runs realtime mirroring and subscriber fanout off the request thread.
     * When the queue is full the caller runs the task itself rather than dropping it.
     */
    @Bean(name = "trackingExecutor")
    public ThreadPoolTaskExecutor trackingExecutor(TrackingProperties properties) {
        return buildExecutor(properties.getExecutor(), "tracking-");
    }

    /**
     * Per-subscriber push dispatch. Must not be trackingExecutor: fanout tasks
     * running there wait on these dispatches.
     */
    @Bean(name = "fanoutExecutor")
    public ThreadPoolTaskExecutor fanoutExecutor(TrackingProperties properties) {
        return buildExecutor(properties.getFanoutExecutor(), "fanout-");
    }

    private ThreadPoolTaskExecutor buildExecutor(TrackingProperties.Executor settings, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
