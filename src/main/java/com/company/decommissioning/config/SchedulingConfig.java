package com.company.decommissioning.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs per-database evaluation cycles.
     */
    @Bean
    public ThreadPoolTaskExecutor evaluationExecutor(DecommissioningProperties properties) {
        DecommissioningProperties.Evaluation evaluation = properties.getEvaluation();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(evaluation.getConcurrency());
        executor.setMaxPoolSize(evaluation.getConcurrency());
        executor.setQueueCapacity(evaluation.getQueueCapacity());
        executor.setThreadNamePrefix("db-eval-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Evaluation executor configured with {} threads", evaluation.getConcurrency());
        return executor;
    }

    /**
     * Runs metric-source calls under the metric fetch time limiter.
     */
    @Bean
    public ThreadPoolTaskExecutor metricFetchExecutor(DecommissioningProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getEvaluation().getConcurrency());
        executor.setMaxPoolSize(properties.getEvaluation().getConcurrency() * 2);
        executor.setQueueCapacity(properties.getEvaluation().getQueueCapacity());
        executor.setThreadNamePrefix("metric-fetch-");
        executor.initialize();
        return executor;
    }
}
