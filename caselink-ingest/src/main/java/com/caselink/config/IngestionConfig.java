package com.caselink.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableAsync
public class IngestionConfig {

    private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Used for retry backoff and for inter-page pacing in adapters.
     */
    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public RestClientCustomizer sourceTimeouts() {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
            .withConnectTimeout(Duration.ofSeconds(10))
            .withReadTimeout(Duration.ofSeconds(30));
        return builder -> builder.requestFactory(ClientHttpRequestFactories.get(settings));
    }

    @Bean(name = "ingestionTaskScheduler")
    public ThreadPoolTaskScheduler ingestionTaskScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(2);
        s.setRemoveOnCancelPolicy(true);
        s.setThreadNamePrefix("ingestion-schedule-");
        return s;
    }

    @Bean(name = "auditExecutor")
    public ThreadPoolTaskExecutor auditExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("audit-");
        // Drop when saturated; the run must not wait on the audit trail
        executor.setRejectedExecutionHandler((task, pool) ->
            log.warn("Audit executor saturated, dropping audit event"));
        return executor;
    }
}
