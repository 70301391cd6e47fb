package com.nbastats.updater.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class UpdaterConfig {

    @Bean
    public RestTemplate statsRestTemplate(RestTemplateBuilder builder, StatsUpdaterProperties properties) {
        StatsUpdaterProperties.Api api = properties.getApi();
        return builder
                .setConnectTimeout(Duration.ofMillis(api.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(api.getReadTimeoutMs()))
                .build();
    }

    /**
     * Worker pool for blocking provider calls, so the pipeline thread only ever
     * waits on a future with a timeout.
     */
    @Bean("statsFetchExecutor")
    public AsyncTaskExecutor statsFetchExecutor(StatsUpdaterProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getApi().getFetchPoolSize());
        executor.setMaxPoolSize(properties.getApi().getFetchPoolSize());
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("stats-fetch-");
        executor.initialize();
        return executor;
    }

    @Bean("updateTaskExecutor")
    public AsyncTaskExecutor updateTaskExecutor(StatsUpdaterProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTasks().getPoolSize());
        executor.setMaxPoolSize(properties.getTasks().getPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("update-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
