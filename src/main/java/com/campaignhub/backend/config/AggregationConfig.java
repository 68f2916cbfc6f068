package com.campaignhub.backend.config;

import com.campaignhub.backend.enums.Platform;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;

@Configuration
@EnableConfigurationProperties(AggregationConfig.AggregationProperties.class)
public class AggregationConfig {

    /**
     * Worker pool for the per-source fetches of an aggregation.
     * Rejected submissions surface as a failure of that one source.
     */
    @Bean
    public ThreadPoolTaskExecutor campaignFetchExecutor(AggregationProperties aggregationProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aggregationProperties.maxConcurrency());
        executor.setMaxPoolSize(aggregationProperties.maxConcurrency());
        executor.setQueueCapacity(aggregationProperties.queueCapacity());
        executor.setThreadNamePrefix("campaign-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    /**
     * @param timeout        shared deadline for all sources of one aggregation
     * @param sources        enabled platforms, in registration order
     * @param maxConcurrency worker threads available to source fetches
     * @param queueCapacity  fetches allowed to wait for a worker
     */
    @ConfigurationProperties(prefix = "aggregation")
    public record AggregationProperties(
            @DefaultValue("5s") Duration timeout,
            @DefaultValue({"google", "meta"}) List<Platform> sources,
            @DefaultValue("16") int maxConcurrency,
            @DefaultValue("100") int queueCapacity
    ) {
    }
}
