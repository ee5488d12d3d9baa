package ch.sbb.federation.gateway.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for subgraph HTTP clients, retry logic and the fetch executor.
 */
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class RestClientConfig {

    private static final Logger log = LoggerFactory.getLogger(RestClientConfig.class);

    private final GatewayProperties properties;

    public RestClientConfig(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * RestTemplate used for subgraph fetches.
     */
    @Bean
    @Primary
    public RestTemplate restTemplate() {
        Duration connect = properties.getRouting().getTimeout().getConnect();
        Duration read = fetchReadTimeout();

        log.info("Created RestTemplate with connect timeout: {}, read timeout: {}", connect, read);

        return new RestTemplate(requestFactory(connect, read));
    }

    /**
     * Read timeout of subgraph fetches, capped at the fetch timeout so a fetch abandoned by
     * the executor does not hold its pool thread longer than the fetch itself may take.
     */
    Duration fetchReadTimeout() {
        Duration read = properties.getRouting().getTimeout().getRead();
        Duration fetchTimeout = properties.getExecution().getFetchTimeout();
        return read.compareTo(fetchTimeout) > 0 ? fetchTimeout : read;
    }

    /**
     * RestTemplate used for health probes, bounded by the health timeout.
     */
    @Bean
    public RestTemplate healthRestTemplate() {
        Duration timeout = properties.getHealth().getTimeout();

        log.info("Created health RestTemplate with timeout: {}", timeout);

        return new RestTemplate(requestFactory(timeout, timeout));
    }

    /**
     * RetryTemplate with exponential backoff. Only I/O failures are retried.
     */
    @Bean
    public RetryTemplate retryTemplate() {
        RetryTemplate retryTemplate = new RetryTemplate();

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(
            properties.getRouting().getRetry().getMaxAttempts(),
            Map.<Class<? extends Throwable>, Boolean>of(ResourceAccessException.class, true));
        retryTemplate.setRetryPolicy(retryPolicy);

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(properties.getRouting().getRetry().getBackoffDelay().toMillis());
        backOffPolicy.setMultiplier(properties.getRouting().getRetry().getBackoffMultiplier());
        retryTemplate.setBackOffPolicy(backOffPolicy);

        log.info("Created RetryTemplate with max attempts: {}, backoff delay: {}, multiplier: {}",
            properties.getRouting().getRetry().getMaxAttempts(),
            properties.getRouting().getRetry().getBackoffDelay(),
            properties.getRouting().getRetry().getBackoffMultiplier());

        return retryTemplate;
    }

    /**
     * Bounded pool running fetch tasks of federated requests.
     */
    @Bean
    public ThreadPoolTaskExecutor fetchExecutor() {
        int maxConcurrency = properties.getExecution().getMaxConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(maxConcurrency);
        executor.setMaxPoolSize(maxConcurrency);
        executor.setQueueCapacity(maxConcurrency * 16);
        executor.setThreadNamePrefix("fetch-");

        log.info("Created fetch executor with max concurrency: {}", maxConcurrency);

        return executor;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connect, Duration read) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) connect.toMillis());
        factory.setReadTimeout((int) read.toMillis());
        return factory;
    }
}
