package com.fundermatch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fundermatch.grants.http.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class FunderMatchConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean(name = "matchingExecutor", destroyMethod = "shutdown")
    public ExecutorService matchingExecutor(FunderMatchProperties properties) {
        return Executors.newFixedThreadPool(properties.getMatching().getConcurrency());
    }

    /**
     * The only limiter for the grant-data API; every remote call in the process goes through it.
     */
    @Bean(destroyMethod = "shutdown")
    public RateLimiter grantDataRateLimiter(FunderMatchProperties properties) {
        return new RateLimiter("grant-data-api", Duration.ofMillis(properties.getApi().getRateLimitDelayMs()));
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
