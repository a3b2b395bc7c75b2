package com.labframe.notifications.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Change streams hold a thread for their whole lifetime, so their sessions run
 * on a dedicated, bounded executor instead of the shared task pool.
 */
@Configuration
@EnableConfigurationProperties(NotificationProperties.class)
@RequiredArgsConstructor
public class StreamingConfig {

    private final NotificationProperties properties;

    @Bean
    public ThreadPoolTaskExecutor streamTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getMaxConcurrentStreams());
        executor.setMaxPoolSize(properties.getMaxConcurrentStreams());
        executor.setQueueCapacity(0); // reject instead of parking a stream behind others
        executor.setThreadNamePrefix("change-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false); // interrupts open streams on shutdown
        return executor;
    }
}
