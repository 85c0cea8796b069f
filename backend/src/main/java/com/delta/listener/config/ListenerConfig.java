package com.delta.listener.config;

import com.delta.listener.signal.http.ProxyRotator;
import com.delta.listener.signal.http.TokenBucketRateLimiter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ListenerConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ListenerProperties properties) {
        int size = Math.max(4, properties.getHn().getFetchConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "sourceExecutor", destroyMethod = "shutdown")
    public ExecutorService sourceExecutor(ListenerProperties properties) {
        int size = Math.max(
            properties.getHn().getFetchConcurrency(),
            Math.max(properties.getHn().getUserConcurrency(), properties.getRss().getFeeds().size())
        );
        return Executors.newFixedThreadPool(Math.max(2, size));
    }

    @Bean(name = "scanExecutor", destroyMethod = "shutdown")
    public ExecutorService scanExecutor() {
        return Executors.newFixedThreadPool(3);
    }

    @Bean
    public TokenBucketRateLimiter tokenBucketRateLimiter(ListenerProperties properties) {
        ListenerProperties.RateLimit rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(
            rateLimit.getCapacity(),
            rateLimit.getRefillPerSecond(),
            Duration.ofMillis(rateLimit.getMinDelayMs())
        );
    }

    @Bean
    public ProxyRotator proxyRotator(ListenerProperties properties) {
        return new ProxyRotator(
            properties.getProxy().getUrls(),
            Duration.ofMinutes(properties.getProxy().getQuarantineMinutes())
        );
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
