package com.qbyte.gl_data.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.servlet.config.annotation.AsyncSupportConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

/**
 * Threading and time configuration for the stream endpoint.
 *
 * Each attached consumer occupies one thread of the streaming executor for
 * as long as it stays connected, so the pool size bounds concurrent
 * sessions. Async requests never time out: a healthy stream ends only when
 * the consumer disconnects or the application shuts down.
 */
@Configuration
@Slf4j
public class StreamingConfig implements WebMvcConfigurer {

    private final int corePoolSize;
    private final int maxPoolSize;

    public StreamingConfig(@Value("${gl.stream.executor.core-pool-size:8}") int corePoolSize,
                           @Value("${gl.stream.executor.max-pool-size:256}") int maxPoolSize) {
        this.corePoolSize = corePoolSize;
        this.maxPoolSize = maxPoolSize;
    }

    @Bean
    public ThreadPoolTaskExecutor streamSessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("gl-stream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        // Sessions never finish on their own; interrupt them as soon as the context starts closing
        executor.setStrictEarlyShutdown(true);
        log.info("Stream session executor configured: corePoolSize={}, maxPoolSize={}", corePoolSize, maxPoolSize);
        return executor;
    }

    @Override
    public void configureAsyncSupport(AsyncSupportConfigurer configurer) {
        configurer.setTaskExecutor(streamSessionExecutor());
        configurer.setDefaultTimeout(-1);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
