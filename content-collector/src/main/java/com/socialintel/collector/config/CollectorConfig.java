package com.socialintel.collector.config;

import com.socialintel.collector.client.RateLimiter;
import com.socialintel.collector.client.TokenBucketRateLimiter;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Process-wide collaborators. There is exactly one rate limiter; every API call in the process,
 * whichever job or phase it belongs to, goes through it.
 */
@Configuration
public class CollectorConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CollectorProperties properties) {
        return builder
                .setConnectTimeout(properties.getApi().getConnectTimeout())
                .setReadTimeout(properties.getApi().getReadTimeout())
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter rateLimiter(CollectorProperties properties) {
        return new TokenBucketRateLimiter(properties.getRateLimit().getRequestsPerSecond());
    }

    /** Runs whole jobs, one thread per job. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService workerExecutor(CollectorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorker().getConcurrency(),
                new CustomizableThreadFactory("collector-worker-"));
    }

    /** Runs the items of all phases of all jobs. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService phaseExecutor(CollectorProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorker().getPhaseConcurrency(),
                new CustomizableThreadFactory("collector-phase-"));
    }
}
