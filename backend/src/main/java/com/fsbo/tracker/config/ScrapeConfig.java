package com.fsbo.tracker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fsbo.tracker.scrape.http.RequestThrottler;
import com.fsbo.tracker.scrape.http.RetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScrapeConfig {

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getSourceParallelism());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getSourceParallelism() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RequestThrottler requestThrottler(ScraperProperties properties, Clock clock) {
        return new RequestThrottler(properties.getMaxRequestsPerMinute(), clock);
    }

    @Bean
    public RetryPolicy retryPolicy(ScraperProperties properties) {
        ScraperProperties.Retry retry = properties.getRetry();
        return new RetryPolicy(
            retry.getMaxRetries(),
            retry.getBackoffFactor(),
            Set.copyOf(retry.getRetryableStatusCodes()),
            RetryPolicy.THREAD_SLEEPER
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
