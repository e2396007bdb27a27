package com.booking.lifecycle.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Shared infrastructure beans for the lifecycle handlers and the deadline monitor.
 */
@Configuration
@EnableConfigurationProperties(BookingProperties.class)
public class EngineConfig {

    public static final String REFUND_EXECUTOR = "deadlineRefundExecutor";
    public static final String GATEWAY_EXECUTOR = "gatewayCallExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs refunds triggered by expiry outside the sweep thread so one slow gateway call
     * cannot stall a sweep cycle.
     */
    @Bean(name = REFUND_EXECUTOR)
    public ThreadPoolTaskExecutor deadlineRefundExecutor(BookingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDeadlineMonitor().getRefundThreads());
        executor.setMaxPoolSize(properties.getDeadlineMonitor().getRefundThreads());
        executor.setQueueCapacity(1_000);
        executor.setThreadNamePrefix("expiry-refund-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /**
     * Threads that carry gateway calls so the caller can stop waiting at the configured timeout.
     * Queued time counts against that timeout; a rejected call is retried by the client.
     */
    @Bean(name = GATEWAY_EXECUTOR)
    public ThreadPoolTaskExecutor gatewayCallExecutor(BookingProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getGateway().getCallThreads());
        executor.setMaxPoolSize(properties.getGateway().getCallThreads());
        executor.setQueueCapacity(properties.getGateway().getCallQueueCapacity());
        executor.setThreadNamePrefix("gateway-call-");
        executor.initialize();
        return executor;
    }
}
